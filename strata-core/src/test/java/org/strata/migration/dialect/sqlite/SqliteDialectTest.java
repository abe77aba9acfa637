package org.strata.migration.dialect.sqlite;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.strata.migration.MigrationExecutor;
import org.strata.migration.operation.AddColumnsOperation;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteDialectTest {

    private final SqliteDialect dialect = new SqliteDialect();

    @Test
    @DisplayName("One ALTER TABLE per added column")
    void addColumnsSplit() {
        AddColumnsOperation op = new AddColumnsOperation("subject", List.of(
                ColumnDefinition.builder().name("a").sqlType("text").notNull(true).build(),
                ColumnDefinition.builder().name("b").sqlType("integer").build()
        ), 1);

        assertThat(new MigrationExecutor(dialect).compileOperation(op)).containsExactly(
                "ALTER TABLE \"subject\" ADD COLUMN \"a\" text NOT NULL",
                "ALTER TABLE \"subject\" ADD COLUMN \"b\" integer");
    }

    @Test
    @DisplayName("UNIQUE is not accepted on added columns")
    void noUniqueOnAdd() {
        assertThat(dialect.supportsUniqueOnAddColumn()).isFalse();
    }

    @Test
    @DisplayName("Booleans and JSON fall back to integer and text")
    void storageClasses() {
        SqliteFieldTypeMapper mapper = new SqliteFieldTypeMapper();
        assertThat(mapper.resolveColumnType(FieldModel.of(FieldType.BOOLEAN))).isEqualTo("integer");
        assertThat(mapper.resolveColumnType(FieldModel.of(FieldType.JSON))).isEqualTo("text");
        assertThat(mapper.resolveColumnType(FieldModel.of(FieldType.NUMBER_ARRAY))).isEqualTo("text");
        assertThat(mapper.resolveColumnType(FieldModel.of(FieldType.DATE))).isEqualTo("date");
        assertThat(mapper.typesAreEquivalent("INTEGER", FieldModel.of(FieldType.DATE))).isTrue();
    }
}
