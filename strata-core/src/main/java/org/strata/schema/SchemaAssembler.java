package org.strata.schema;

import lombok.extern.slf4j.Slf4j;
import org.strata.model.CanonicalSchema;
import org.strata.model.FieldModel;
import org.strata.model.ReferenceModel;
import org.strata.model.TableDefinition;
import org.strata.model.TableFragment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the canonical schema from table fragments.
 * <ol>
 *   <li>each fragment is validated; a malformed one is skipped with a warning</li>
 *   <li>fields are keyed by physical column name</li>
 *   <li>fragments for the same table are merged (last writer wins, smaller order kept)</li>
 *   <li>references are resolved to physical table names; dangling ones are dropped</li>
 * </ol>
 */
@Slf4j
public class SchemaAssembler {

    public CanonicalSchema assemble(List<TableFragment> fragments) {
        Map<String, TableDefinition> tables = new LinkedHashMap<>();
        Map<String, String> tableByKey = new HashMap<>();

        if (fragments != null) {
            for (TableFragment fragment : fragments) {
                if (fragment == null) {
                    log.warn("Skipping null schema fragment");
                    continue;
                }
                String tableName = fragment.resolvedTableName();
                if (tableName == null || tableName.isBlank()) {
                    log.warn("Skipping schema fragment without key or entity name");
                    continue;
                }
                List<String> problems = FieldBagValidator.validate(tableName, fragment.getFields());
                if (!problems.isEmpty()) {
                    log.warn("Skipping malformed fragment '{}' for table {}: {}",
                            fragment.getKey(), tableName, String.join("; ", problems));
                    continue;
                }

                TableDefinition incoming = toDefinition(tableName, fragment);
                tables.merge(tableName, incoming, SchemaAssembler::merge);
                if (fragment.getKey() != null) {
                    tableByKey.put(fragment.getKey(), tableName);
                }
            }
        }

        for (TableDefinition table : tables.values()) {
            resolveReferences(table, tables, tableByKey);
        }
        for (TableDefinition table : tables.values()) {
            checkOrder(table, tables);
        }
        return new CanonicalSchema(tables);
    }

    /**
     * Union of two definitions of the same table. On a column name collision {@code overlay}
     * wins; the column keeps its original position. The smaller order is kept.
     */
    public static TableDefinition merge(TableDefinition base, TableDefinition overlay) {
        if (!base.getTableName().equals(overlay.getTableName())) {
            throw new IllegalArgumentException("Cannot merge " + base.getTableName() + " with " + overlay.getTableName());
        }
        LinkedHashMap<String, FieldModel> fields = new LinkedHashMap<>(base.getFields());
        fields.putAll(overlay.getFields());

        TableDefinition merged = TableDefinition.builder()
                .tableName(base.getTableName())
                .fields(fields)
                .order(Math.min(base.getOrder(), overlay.getOrder()))
                .build();
        merged.getUniqueConstraints().addAll(base.getUniqueConstraints());
        merged.getUniqueConstraints().addAll(overlay.getUniqueConstraints());
        merged.getIndexes().addAll(base.getIndexes());
        merged.getIndexes().addAll(overlay.getIndexes());
        return merged;
    }

    private TableDefinition toDefinition(String tableName, TableFragment fragment) {
        LinkedHashMap<String, FieldModel> fields = new LinkedHashMap<>();
        fragment.getFields().forEach((key, field) -> fields.put(field.columnName(key), field));
        return TableDefinition.builder()
                .tableName(tableName)
                .fields(fields)
                .order(fragment.getOrder() == null ? TableDefinition.UNORDERED : fragment.getOrder())
                .uniqueConstraints(fragment.getUniqueConstraints() == null
                        ? new ArrayList<>() : new ArrayList<>(fragment.getUniqueConstraints()))
                .indexes(fragment.getIndexes() == null
                        ? new ArrayList<>() : new ArrayList<>(fragment.getIndexes()))
                .build();
    }

    private void resolveReferences(TableDefinition table,
                                   Map<String, TableDefinition> tables,
                                   Map<String, String> tableByKey) {
        for (Map.Entry<String, FieldModel> e : table.getFields().entrySet()) {
            FieldModel field = e.getValue();
            if (field.getReference() == null) {
                continue;
            }
            ReferenceModel ref = field.getReference();
            String target = ref.getTable() == null ? null : tableByKey.getOrDefault(ref.getTable(), ref.getTable());
            if (target == null || !tables.containsKey(target)) {
                log.warn("Referenced table '{}' not found for field {}.{}; the reference is removed",
                        ref.getTable(), table.getTableName(), e.getKey());
                e.setValue(field.toBuilder().reference(null).build());
                continue;
            }
            if (!target.equals(ref.getTable())) {
                e.setValue(field.toBuilder().reference(ref.toBuilder().table(target).build()).build());
            }
        }
    }

    private void checkOrder(TableDefinition table, Map<String, TableDefinition> tables) {
        for (Map.Entry<String, FieldModel> e : table.getFields().entrySet()) {
            if (!e.getValue().hasReference()) {
                continue;
            }
            TableDefinition target = tables.get(e.getValue().getReference().getTable());
            if (target != null && target.getOrder() > table.getOrder()) {
                log.warn("Table {} (order {}) references {} (order {}); the referenced table should not be created later",
                        table.getTableName(), table.getOrder(), target.getTableName(), target.getOrder());
            }
        }
    }
}
