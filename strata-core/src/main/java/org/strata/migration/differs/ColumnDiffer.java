package org.strata.migration.differs;

import lombok.extern.slf4j.Slf4j;
import org.strata.migration.spi.FieldTypeMapper;
import org.strata.model.DiffResult;
import org.strata.model.FieldModel;
import org.strata.model.LiveColumnMetadata;
import org.strata.model.LiveTableMetadata;
import org.strata.model.TableDefinition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Compares the fields of one desired table with the columns of its live counterpart.
 * Missing columns become additions; present columns are only type-checked.
 */
@Slf4j
class ColumnDiffer {
    private final FieldTypeMapper typeMapper;

    ColumnDiffer(FieldTypeMapper typeMapper) {
        this.typeMapper = typeMapper;
    }

    void diff(TableDefinition table, LiveTableMetadata live, DiffResult result) {
        LinkedHashMap<String, FieldModel> missing = new LinkedHashMap<>();

        for (Map.Entry<String, FieldModel> e : table.getFields().entrySet()) {
            String column = e.getKey();
            FieldModel field = e.getValue();
            Optional<LiveColumnMetadata> liveColumn = live.findColumn(column);
            if (liveColumn.isEmpty()) {
                missing.put(column, field);
                continue;
            }
            String actual = liveColumn.get().dataType();
            if (!typeMapper.typesAreEquivalent(actual, field)) {
                String expected = field.getType().wireName();
                log.warn("Type mismatch on {}.{}: expected {}, found {}", table.getTableName(), column, expected, actual);
                result.getWarnings().add("Type mismatch on " + table.getTableName() + "." + column
                        + ": expected " + expected + ", found " + actual);
                result.getTypeMismatches().add(DiffResult.TypeMismatch.builder()
                        .table(table.getTableName())
                        .column(column)
                        .expected(field.getType())
                        .actual(actual)
                        .build());
            }
        }

        if (!missing.isEmpty()) {
            result.getColumnsToAdd().add(DiffResult.ColumnsToAdd.builder()
                    .table(table.getTableName())
                    .fields(missing)
                    .order(table.getOrder())
                    .build());
        }
    }
}
