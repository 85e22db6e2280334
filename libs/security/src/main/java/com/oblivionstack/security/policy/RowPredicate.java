package com.oblivionstack.security.policy;

/**
 * Boolean row filter evaluated for one caller and one row.
 */
@FunctionalInterface
public interface RowPredicate {

    boolean test(EvaluationContext context, ResourceRow row);

    default RowPredicate and(RowPredicate other) {
        return (context, row) -> test(context, row) && other.test(context, row);
    }

    default RowPredicate or(RowPredicate other) {
        return (context, row) -> test(context, row) || other.test(context, row);
    }

    static RowPredicate always() {
        return (context, row) -> true;
    }
}
