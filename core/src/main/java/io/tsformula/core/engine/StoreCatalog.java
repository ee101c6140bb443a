package io.tsformula.core.engine;

import io.tsformula.core.model.Formula;
import io.tsformula.core.model.SeriesMetadata;
import io.tsformula.core.spi.CatalogView;
import io.tsformula.core.spi.FormulaStore;
import io.tsformula.core.spi.SeriesStore;
import java.util.Collection;
import java.util.Optional;
import java.util.TreeSet;

/** {@link CatalogView} over a primary store and a formula store. Primaries take precedence. */
final class StoreCatalog implements CatalogView {

    private final SeriesStore series;
    private final FormulaStore formulas;

    StoreCatalog(SeriesStore series, FormulaStore formulas) {
        this.series = series;
        this.formulas = formulas;
    }

    @Override
    public boolean isPrimary(String name) {
        return series.exists(name);
    }

    @Override
    public boolean isFormula(String name) {
        return !series.exists(name) && formulas.find(name).isPresent();
    }

    @Override
    public Optional<SeriesMetadata> metadata(String name) {
        if (series.exists(name)) {
            return series.metadata(name);
        }
        return formulas.find(name).map(Formula::coreMetadata);
    }

    @Override
    public Collection<String> names() {
        TreeSet<String> names = new TreeSet<>(series.catalog());
        names.addAll(formulas.names());
        return names;
    }
}
