package org.strata.migration;

import lombok.extern.slf4j.Slf4j;
import org.strata.migration.dialect.Dialects;
import org.strata.migration.operation.AddColumnsOperation;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.operation.CreateTableOperation;
import org.strata.migration.operation.IndexDefinition;
import org.strata.migration.operation.MigrationOperation;
import org.strata.migration.operation.UniqueConstraintDefinition;
import org.strata.migration.spi.dialect.DdlDialect;
import org.strata.model.DiffResult;
import org.strata.model.FieldModel;
import org.strata.model.IndexModel;
import org.strata.model.ReferenceModel;
import org.strata.model.UniqueConstraintModel;
import org.strata.naming.DefaultNaming;
import org.strata.naming.Naming;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a diff into an ordered list of operations for one dialect.
 * <p>
 * All column additions come before all table creations. Additions are sorted by order, then by
 * table name; creations follow {@link CreationOrder}. Every created table gets a synthetic
 * {@code id} primary key as first column.
 * <p>
 * A key (index or unique constraint) over a column the dialect cannot key is left out with a
 * warning.
 */
@Slf4j
public class MigrationPlanBuilder {
    public static final String ID_COLUMN = "id";

    private static final Comparator<MigrationOperation> BY_ORDER =
            Comparator.comparingInt(MigrationOperation::order)
                    .thenComparing(MigrationOperation::table);

    private final DdlDialect dialect;
    private final Naming naming;

    public MigrationPlanBuilder(DatabaseType databaseType) {
        this(databaseType, new DefaultNaming());
    }

    public MigrationPlanBuilder(DatabaseType databaseType, Naming naming) {
        this.dialect = Dialects.of(Objects.requireNonNull(databaseType, "databaseType must not be null"));
        this.naming = Objects.requireNonNull(naming, "naming must not be null");
    }

    public MigrationPlan build(DiffResult diff) {
        return build(diff.getTablesToCreate(), diff.getColumnsToAdd());
    }

    /**
     * @throws IdColumnConflictException when a table to create declares an {@code id} column;
     *                                    nothing is built in that case
     */
    public MigrationPlan build(List<DiffResult.TableToCreate> toCreate, List<DiffResult.ColumnsToAdd> toAdd) {
        List<DiffResult.TableToCreate> creates = toCreate == null ? List.of() : toCreate;
        List<DiffResult.ColumnsToAdd> adds = toAdd == null ? List.of() : toAdd;

        for (DiffResult.TableToCreate table : creates) {
            validateNoIdField(table);
        }

        List<MigrationOperation> addOps = new ArrayList<>();
        for (DiffResult.ColumnsToAdd table : adds) {
            if (!table.getFields().isEmpty()) {
                addOps.add(addColumns(table));
            }
        }
        addOps.sort(BY_ORDER);

        List<CreateTableOperation> createOps = new ArrayList<>();
        for (DiffResult.TableToCreate table : creates) {
            createOps.add(createTable(table));
        }
        createOps = CreationOrder.sort(createOps, CreateTableOperation::order, CreateTableOperation::table,
                MigrationPlanBuilder::referencedTables);

        List<MigrationOperation> operations = new ArrayList<>(addOps);
        operations.addAll(createOps);
        return new MigrationPlan(dialect.getDatabaseType(), operations);
    }

    private void validateNoIdField(DiffResult.TableToCreate table) {
        for (String column : table.getFields().keySet()) {
            if (ID_COLUMN.equalsIgnoreCase(column)) {
                throw new IdColumnConflictException(table.getTable());
            }
        }
    }

    private AddColumnsOperation addColumns(DiffResult.ColumnsToAdd table) {
        List<ColumnDefinition> columns = new ArrayList<>();
        List<IndexDefinition> indexes = new ArrayList<>();
        for (Map.Entry<String, FieldModel> e : table.getFields().entrySet()) {
            ColumnDefinition column = column(e.getKey(), e.getValue());
            log.info("Adding column {}.{} ({})", table.getTable(), column.getName(), column.getSqlType());
            if (column.isUnique() && !dialect.supportsUniqueOnAddColumn()) {
                column = column.withoutUnique();
                indexes.add(new IndexDefinition(
                        naming.uqName(table.getTable(), List.of(e.getKey())), List.of(e.getKey()), true));
            }
            columns.add(column);
            if (e.getValue().isIndexed()) {
                indexes.add(fieldIndex(table.getTable(), e.getKey()));
            }
        }
        Map<String, String> types = columnTypes(columns);
        indexes.removeIf(ix -> !keyable(table.getTable(), ix.name(), ix.columns(), types));
        return new AddColumnsOperation(table.getTable(), columns, indexes, table.getOrder());
    }

    private CreateTableOperation createTable(DiffResult.TableToCreate table) {
        log.info("Creating table {} with {} field(s)", table.getTable(), table.getFields().size());

        Set<String> keyed = keyedColumns(table);
        List<ColumnDefinition> columns = new ArrayList<>();
        columns.add(primaryKey());
        List<IndexDefinition> indexes = new ArrayList<>();
        for (Map.Entry<String, FieldModel> e : table.getFields().entrySet()) {
            FieldModel field = e.getValue();
            // a string covered by a table-level key is typed like an indexed one
            if (keyed.contains(e.getKey()) && !field.isIndexed()) {
                field = field.toBuilder().indexed(true).build();
            }
            columns.add(column(e.getKey(), field));
            if (e.getValue().isIndexed()) {
                indexes.add(fieldIndex(table.getTable(), e.getKey()));
            }
        }

        List<UniqueConstraintDefinition> uniques = new ArrayList<>();
        for (UniqueConstraintModel uc : table.getUniqueConstraints()) {
            if (uc.getColumnNames() == null || uc.getColumnNames().isEmpty()) {
                log.warn("Ignoring unique constraint without columns on {}", table.getTable());
                continue;
            }
            String name = isBlank(uc.getName()) ? naming.uqName(table.getTable(), uc.getColumnNames()) : uc.getName();
            uniques.add(new UniqueConstraintDefinition(name, uc.getColumnNames()));
        }
        for (IndexModel idx : table.getIndexes()) {
            if (idx.getColumnNames() == null || idx.getColumnNames().isEmpty()) {
                log.warn("Ignoring index without columns on {}", table.getTable());
                continue;
            }
            String name = isBlank(idx.getIndexName()) ? naming.ixName(table.getTable(), idx.getColumnNames()) : idx.getIndexName();
            indexes.add(new IndexDefinition(name, idx.getColumnNames(), false));
        }

        Map<String, String> types = columnTypes(columns);
        uniques.removeIf(uc -> !keyable(table.getTable(), uc.name(), uc.columns(), types));
        indexes.removeIf(ix -> !keyable(table.getTable(), ix.name(), ix.columns(), types));
        return new CreateTableOperation(table.getTable(), columns, uniques, indexes, table.getOrder());
    }

    private static Set<String> keyedColumns(DiffResult.TableToCreate table) {
        Set<String> keyed = new HashSet<>();
        table.getUniqueConstraints().stream()
                .filter(uc -> uc.getColumnNames() != null)
                .forEach(uc -> keyed.addAll(uc.getColumnNames()));
        table.getIndexes().stream()
                .filter(idx -> idx.getColumnNames() != null)
                .forEach(idx -> keyed.addAll(idx.getColumnNames()));
        return keyed;
    }

    private static Map<String, String> columnTypes(List<ColumnDefinition> columns) {
        Map<String, String> types = new HashMap<>();
        for (ColumnDefinition c : columns) {
            types.put(c.getName(), c.getSqlType());
        }
        return types;
    }

    private boolean keyable(String table, String keyName, List<String> keyColumns, Map<String, String> types) {
        List<String> rejected = keyColumns.stream()
                .filter(c -> !dialect.supportsKeyOn(types.get(c)))
                .toList();
        if (rejected.isEmpty()) {
            return true;
        }
        log.warn("Skipping key {} on {}: {} cannot key column(s) {}",
                keyName, table, dialect.getDatabaseType(), rejected);
        return false;
    }

    private static Set<String> referencedTables(CreateTableOperation op) {
        return op.columns().stream()
                .filter(ColumnDefinition::hasReference)
                .map(ColumnDefinition::getReferencedTable)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private ColumnDefinition primaryKey() {
        return ColumnDefinition.builder()
                .name(ID_COLUMN)
                .sqlType(idType())
                .primaryKey(true)
                .notNull(true)
                .build();
    }

    private String idType() {
        return switch (dialect.getDatabaseType()) {
            case MYSQL, MSSQL -> "varchar(36)";
            case POSTGRES, SQLITE -> "text";
        };
    }

    private ColumnDefinition column(String name, FieldModel field) {
        ColumnDefinition.ColumnDefinitionBuilder b = ColumnDefinition.builder()
                .name(name)
                .sqlType(dialect.getFieldTypeMapper().resolveColumnType(field))
                .notNull(!field.isOptional())
                .unique(field.isUnique());
        if (field.hasReference()) {
            ReferenceModel ref = field.getReference();
            b.referencedTable(ref.getTable())
                    .referencedColumn(isBlank(ref.getField()) ? ID_COLUMN : ref.getField())
                    .onDelete(ref.getOnDelete());
        }
        return b.build();
    }

    private IndexDefinition fieldIndex(String table, String column) {
        return new IndexDefinition(naming.ixName(table, List.of(column)), List.of(column), false);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
