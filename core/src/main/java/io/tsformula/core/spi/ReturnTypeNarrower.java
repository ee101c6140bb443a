package io.tsformula.core.spi;

import io.tsformula.core.types.FormulaType;
import java.util.Map;

/** Replaces a generic declared return type with a concrete one, given the argument types. */
@FunctionalInterface
public interface ReturnTypeNarrower {

    /**
     * @param declared      the declared return type
     * @param argumentTypes inferred type per bound parameter name
     * @return the narrowed type
     */
    FormulaType narrow(FormulaType declared, Map<String, FormulaType> argumentTypes);
}
