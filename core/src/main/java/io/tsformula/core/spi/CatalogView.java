package io.tsformula.core.spi;

import io.tsformula.core.model.SeriesMetadata;
import java.util.Collection;
import java.util.Optional;

/**
 * Read-only view over both series kinds, handed to operator hooks that inspect the catalog at
 * registration or evaluation time.
 */
public interface CatalogView {

    boolean isPrimary(String name);

    boolean isFormula(String name);

    default boolean exists(String name) {
        return isPrimary(name) || isFormula(name);
    }

    /** Core metadata of a primary, or the derived core metadata of a formula. */
    Optional<SeriesMetadata> metadata(String name);

    /** Names of all series, primaries and formulas, sorted. */
    Collection<String> names();
}
