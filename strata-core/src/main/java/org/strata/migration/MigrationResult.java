package org.strata.migration;

import org.strata.migration.operation.MigrationOperation;
import org.strata.migration.spi.SqlExecutor;
import org.strata.model.DiffResult;

import java.sql.SQLException;
import java.util.List;

/**
 * A planned migration bound to the executor that can apply it.
 */
public class MigrationResult {

    /**
     * Columns to add to one existing table.
     */
    public record PendingColumns(String table, List<String> fields) {
    }

    private final DiffResult diff;
    private final MigrationPlan plan;
    private final MigrationExecutor executor;
    private final SqlExecutor sqlExecutor;

    public MigrationResult(DiffResult diff, MigrationPlan plan, MigrationExecutor executor, SqlExecutor sqlExecutor) {
        this.diff = diff;
        this.plan = plan;
        this.executor = executor;
        this.sqlExecutor = sqlExecutor;
    }

    /** Names of the tables that will be created, in creation order. */
    public List<String> getToBeCreated() {
        return plan.createTableOperations().stream().map(MigrationOperation::table).toList();
    }

    public List<PendingColumns> getToBeAdded() {
        return plan.addColumnsOperations().stream()
                .map(op -> new PendingColumns(op.table(), op.columnNames()))
                .toList();
    }

    public List<MigrationOperation> getOperations() {
        return plan.operations();
    }

    public MigrationPlan getPlan() {
        return plan;
    }

    public DiffResult getDiff() {
        return diff;
    }

    public DatabaseType getDatabaseType() {
        return plan.databaseType();
    }

    public boolean isUpToDate() {
        return plan.isEmpty();
    }

    public String compile() {
        return executor.compile(plan.operations());
    }

    public void run() throws SQLException {
        if (sqlExecutor == null) {
            throw new MigrationCapabilityException("No SQL executor available to run the migration");
        }
        executor.run(plan.operations(), sqlExecutor);
    }
}
