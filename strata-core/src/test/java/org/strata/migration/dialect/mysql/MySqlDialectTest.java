package org.strata.migration.dialect.mysql;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.strata.migration.MigrationExecutor;
import org.strata.migration.operation.AddColumnsOperation;
import org.strata.migration.operation.ColumnDefinition;
import org.strata.migration.operation.CreateTableOperation;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;
import org.strata.model.ReferenceModel;
import org.strata.model.ReferentialAction;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MySqlDialectTest {

    private final MySqlDialect dialect = new MySqlDialect();
    private final MigrationExecutor executor = new MigrationExecutor(dialect);

    private static ColumnDefinition subjectRef() {
        return ColumnDefinition.builder()
                .name("subjectId").sqlType("varchar(36)").notNull(true)
                .referencedTable("subject").referencedColumn("id").onDelete(ReferentialAction.SET_NULL)
                .build();
    }

    @Test
    @DisplayName("Backtick quoting")
    void quoting() {
        assertThat(dialect.quoteIdentifier("consent")).isEqualTo("`consent`");
        assertThat(dialect.quoteIdentifier("a`b")).isEqualTo("`a``b`");
    }

    @Test
    @DisplayName("Foreign keys are table-level clauses, InnoDB table options appended")
    void createTableWithForeignKey() {
        ColumnDefinition id = ColumnDefinition.builder().name("id").sqlType("varchar(36)").primaryKey(true).notNull(true).build();
        CreateTableOperation op = new CreateTableOperation("consent", List.of(id, subjectRef()), 2);

        assertThat(executor.compileOperation(op)).containsExactly(
                "CREATE TABLE `consent` (\n"
                        + "  `id` varchar(36) NOT NULL PRIMARY KEY,\n"
                        + "  `subjectId` varchar(36) NOT NULL,\n"
                        + "  FOREIGN KEY (`subjectId`) REFERENCES `subject`(`id`) ON DELETE SET NULL\n"
                        + ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4");
    }

    @Test
    @DisplayName("ADD COLUMN clauses first, then ADD FOREIGN KEY, in a single ALTER TABLE")
    void addColumnsWithForeignKey() {
        AddColumnsOperation op = new AddColumnsOperation("consent", List.of(
                ColumnDefinition.builder().name("note").sqlType("text").build(),
                subjectRef()
        ), 2);

        assertThat(executor.compileOperation(op)).containsExactly(
                "ALTER TABLE `consent` ADD COLUMN `note` text, ADD COLUMN `subjectId` varchar(36) NOT NULL, "
                        + "ADD FOREIGN KEY (`subjectId`) REFERENCES `subject`(`id`) ON DELETE SET NULL");
    }

    @Test
    @DisplayName("Indexed strings are varchar(255); TEXT and JSON columns cannot be keyed")
    void keyableTypes() {
        assertThat(new MySqlFieldTypeMapper().resolveColumnType(
                FieldModel.builder().type(FieldType.STRING).indexed(true).build())).isEqualTo("varchar(255)");
        assertThat(new MySqlFieldTypeMapper().resolveColumnType(
                FieldModel.builder().type(FieldType.STRING).indexed(true)
                        .reference(ReferenceModel.to("subject", "id")).build())).isEqualTo("varchar(36)");
        assertThat(dialect.supportsKeyOn("text")).isFalse();
        assertThat(dialect.supportsKeyOn("json")).isFalse();
        assertThat(dialect.supportsKeyOn("varchar(255)")).isTrue();
        assertThat(dialect.supportsKeyOn("integer")).isTrue();
    }
}
