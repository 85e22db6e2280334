package com.oblivionstack.security.policy;

import com.oblivionstack.security.RequestContext;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Data-access helper that applies {@link PolicyAuthorizer} to batches of rows, so that rows the
 * caller may not reach are simply absent from the result. All rows of one call share a single
 * evaluation scope.
 */
public class RowLevelGuard {

    private final PolicyAuthorizer authorizer;

    public RowLevelGuard(PolicyAuthorizer authorizer) {
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer must not be null");
        }
        this.authorizer = authorizer;
    }

    /** The subset of {@code rows} the caller may select, in the original order. */
    public <T> List<T> visibleRows(RequestContext context, ProtectedResource resource,
                                   List<T> rows, Function<T, ResourceRow> toRow) {
        return permittedRows(context, resource, Operation.SELECT, rows, toRow);
    }

    /**
     * The subset of {@code rows} the caller may apply {@code operation} to. For UPDATE this
     * checks the current row only; use {@link #updatableRows} to check the new values too.
     */
    public <T> List<T> permittedRows(RequestContext context, ProtectedResource resource, Operation operation,
                                     List<T> rows, Function<T, ResourceRow> toRow) {
        EvaluationContext evaluation = authorizer.newEvaluation(context);
        List<T> result = new ArrayList<>(rows.size());
        for (T row : rows) {
            if (authorizer.authorize(evaluation, resource, toRow.apply(row), operation).allowed()) {
                result.add(row);
            }
        }
        return result;
    }

    /**
     * Applies {@code change} to each row the caller may update both before and after the change,
     * and returns the changed rows. Rows failing either check are left out. The existing row is
     * captured before {@code change} runs, so a change that mutates its argument is still checked
     * against the original values.
     */
    public <T> List<T> updatableRows(RequestContext context, ProtectedResource resource, List<T> rows,
                                     Function<T, ResourceRow> toRow, UnaryOperator<T> change) {
        EvaluationContext evaluation = authorizer.newEvaluation(context);
        List<T> result = new ArrayList<>(rows.size());
        for (T row : rows) {
            ResourceRow existing = toRow.apply(row);
            T changed = change.apply(row);
            if (authorizer.authorizeUpdate(evaluation, resource, existing, toRow.apply(changed)).allowed()) {
                result.add(changed);
            }
        }
        return result;
    }

    /** Number of rows a write would affect; zero when the caller may touch none of them. */
    public <T> int affectedCount(RequestContext context, ProtectedResource resource, Operation operation,
                                 List<T> rows, Function<T, ResourceRow> toRow) {
        return permittedRows(context, resource, operation, rows, toRow).size();
    }

    public boolean canInsert(RequestContext context, ProtectedResource resource, ResourceRow row) {
        return authorizer.authorize(context, resource, row, Operation.INSERT).allowed();
    }
}
