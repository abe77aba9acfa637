package org.strata.migration.differs;

import lombok.extern.slf4j.Slf4j;
import org.strata.migration.CreationOrder;
import org.strata.migration.DatabaseType;
import org.strata.migration.dialect.Dialects;
import org.strata.migration.spi.FieldTypeMapper;
import org.strata.model.CanonicalSchema;
import org.strata.model.DiffResult;
import org.strata.model.FieldModel;
import org.strata.model.LiveTableMetadata;
import org.strata.model.TableDefinition;
import org.strata.schema.FieldBagValidator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares the desired schema with introspected tables. Pure: no I/O, no shared state.
 * <p>
 * Tables are matched by exact name. Live tables unknown to the schema are left alone.
 * Tables to create are listed in {@link CreationOrder}.
 */
@Slf4j
public class SchemaDiffer {

    private final DatabaseType databaseType;
    private final ColumnDiffer columnDiffer;

    public SchemaDiffer(DatabaseType databaseType) {
        this(databaseType, Dialects.of(databaseType).getFieldTypeMapper());
    }

    public SchemaDiffer(DatabaseType databaseType, FieldTypeMapper typeMapper) {
        this.databaseType = Objects.requireNonNull(databaseType, "databaseType must not be null");
        this.columnDiffer = new ColumnDiffer(Objects.requireNonNull(typeMapper, "typeMapper must not be null"));
    }

    public DiffResult diff(CanonicalSchema schema, List<LiveTableMetadata> liveTables) {
        Objects.requireNonNull(schema, "schema must not be null");

        Map<String, LiveTableMetadata> liveByName = new HashMap<>();
        if (liveTables != null) {
            for (LiveTableMetadata t : liveTables) {
                liveByName.putIfAbsent(t.name(), t);
            }
        }

        DiffResult result = DiffResult.builder().build();
        for (TableDefinition table : schema.getTables().values()) {
            diffTableSafely(table, liveByName.get(table.getTableName()), result);
        }
        List<DiffResult.TableToCreate> ordered = CreationOrder.sort(result.getTablesToCreate(),
                DiffResult.TableToCreate::getOrder, DiffResult.TableToCreate::getTable, SchemaDiffer::referencedTables);
        result.getTablesToCreate().clear();
        result.getTablesToCreate().addAll(ordered);
        log.debug("Diff on {}: {} table(s) to create, {} table(s) with columns to add",
                databaseType, result.getTablesToCreate().size(), result.getColumnsToAdd().size());
        return result;
    }

    private void diffTableSafely(TableDefinition table, LiveTableMetadata live, DiffResult result) {
        List<String> problems = FieldBagValidator.validate(table.getTableName(), table.getFields());
        if (!problems.isEmpty()) {
            String detail = String.join("; ", problems);
            log.error("Skipping malformed table {}: {}", table.getTableName(), detail);
            result.getWarnings().add("Skipping malformed table " + table.getTableName() + ": " + detail);
            return;
        }
        try {
            if (live == null) {
                result.getTablesToCreate().add(toCreate(table));
            } else {
                columnDiffer.diff(table, live, result);
            }
        } catch (RuntimeException e) {
            log.error("Table diff failed: {}", table.getTableName(), e);
            result.getWarnings().add("Table diff failed: " + table.getTableName()
                    + " (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")");
        }
    }

    private DiffResult.TableToCreate toCreate(TableDefinition table) {
        return DiffResult.TableToCreate.builder()
                .table(table.getTableName())
                .fields(new LinkedHashMap<>(table.getFields()))
                .order(table.getOrder())
                .uniqueConstraints(new ArrayList<>(table.getUniqueConstraints()))
                .indexes(new ArrayList<>(table.getIndexes()))
                .build();
    }

    private static Set<String> referencedTables(DiffResult.TableToCreate table) {
        return table.getFields().values().stream()
                .filter(FieldModel::hasReference)
                .map(f -> f.getReference().getTable())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
