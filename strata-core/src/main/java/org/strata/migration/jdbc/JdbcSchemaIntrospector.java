package org.strata.migration.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.strata.migration.spi.SchemaIntrospector;
import org.strata.model.LiveColumnMetadata;
import org.strata.model.LiveTableMetadata;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads base tables and their columns of the connection's current catalog and schema through
 * {@link DatabaseMetaData}. Views are not reported.
 */
@Slf4j
public class JdbcSchemaIntrospector implements SchemaIntrospector {

    private static final String[] TABLE_TYPES = {"TABLE"};

    @Override
    public List<LiveTableMetadata> introspect(Connection conn) throws SQLException {
        DatabaseMetaData metaData = conn.getMetaData();
        String catalog = conn.getCatalog();
        String schema = currentSchema(conn);

        List<String> tableNames = new ArrayList<>();
        try (ResultSet rs = metaData.getTables(catalog, schema, "%", TABLE_TYPES)) {
            while (rs.next()) {
                tableNames.add(rs.getString("TABLE_NAME"));
            }
        }

        List<LiveTableMetadata> tables = new ArrayList<>();
        for (String table : tableNames) {
            List<LiveColumnMetadata> columns = new ArrayList<>();
            try (ResultSet rs = metaData.getColumns(catalog, schema, table, "%")) {
                while (rs.next()) {
                    // table name is a LIKE pattern; '_' may match other tables
                    if (!table.equals(rs.getString("TABLE_NAME"))) continue;
                    columns.add(new LiveColumnMetadata(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME")));
                }
            }
            tables.add(new LiveTableMetadata(table, columns));
        }
        log.debug("Introspected {} table(s) (catalog={}, schema={})", tables.size(), catalog, schema);
        return tables;
    }

    // Older drivers predate Connection#getSchema.
    private String currentSchema(Connection conn) {
        try {
            return conn.getSchema();
        } catch (SQLException | AbstractMethodError e) {
            log.debug("Current schema unavailable, searching all schemas: {}", e.toString());
            return null;
        }
    }
}
