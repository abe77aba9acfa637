package org.strata.migration;

import lombok.extern.slf4j.Slf4j;
import org.strata.migration.dialect.Dialects;
import org.strata.migration.operation.MigrationOperation;
import org.strata.migration.spi.SqlExecutor;
import org.strata.migration.spi.dialect.DdlDialect;

import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compiles operations to SQL and runs them, strictly one after another.
 * <p>
 * There is no rollback: a failure leaves earlier statements applied. Wrapping the run in a
 * transaction, where the database supports transactional DDL, is up to the caller.
 */
@Slf4j
public class MigrationExecutor {
    private final DdlOperationVisitor visitor;

    public MigrationExecutor(DatabaseType databaseType) {
        this(Dialects.of(databaseType));
    }

    public MigrationExecutor(DdlDialect dialect) {
        this.visitor = new DdlOperationVisitor(dialect);
    }

    /**
     * Statements of one operation, without trailing ';'.
     */
    public List<String> compileOperation(MigrationOperation operation) {
        return operation.accept(visitor);
    }

    /**
     * The whole plan as one SQL document. Empty for an empty plan.
     */
    public String compile(List<MigrationOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            return "";
        }
        return operations.stream()
                .map(op -> String.join(";\n", compileOperation(op)))
                .collect(Collectors.joining(";\n\n")) + ";";
    }

    /**
     * Executes every statement in plan order. The first failure is logged with the SQL that
     * caused it and rethrown as is; later statements are not attempted.
     */
    public void run(List<MigrationOperation> operations, SqlExecutor executor) throws SQLException {
        if (operations == null) {
            return;
        }
        int executed = 0;
        for (MigrationOperation op : operations) {
            for (String sql : compileOperation(op)) {
                try {
                    log.debug("Executing:\n{}", sql);
                    executor.execute(sql);
                    executed++;
                } catch (SQLException e) {
                    log.error("Migration failed! SQL:\n{}", sql);
                    throw e;
                }
            }
        }
        log.info("Migration applied: {} statement(s)", executed);
    }
}
