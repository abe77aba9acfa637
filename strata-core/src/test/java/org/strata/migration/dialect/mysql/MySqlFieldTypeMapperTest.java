package org.strata.migration.dialect.mysql;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;
import org.strata.model.ReferenceModel;

import static org.assertj.core.api.Assertions.assertThat;

class MySqlFieldTypeMapperTest {

    private final MySqlFieldTypeMapper mapper = new MySqlFieldTypeMapper();

    @Nested
    @DisplayName("String columns")
    class Strings {

        @Test
        @DisplayName("plain string → text")
        void plain() {
            assertThat(mapper.resolveColumnType(FieldModel.of(FieldType.STRING))).isEqualTo("text");
        }

        @Test
        @DisplayName("unique string → varchar(255) so it can be indexed")
        void unique() {
            FieldModel f = FieldModel.builder().type(FieldType.STRING).unique(true).build();
            assertThat(mapper.resolveColumnType(f)).isEqualTo("varchar(255)");
        }

        @Test
        @DisplayName("reference → varchar(36)")
        void reference() {
            FieldModel f = FieldModel.builder().type(FieldType.STRING).reference(ReferenceModel.to("subject", "id")).build();
            assertThat(mapper.resolveColumnType(f)).isEqualTo("varchar(36)");
        }

        @Test
        @DisplayName("unique wins over reference")
        void uniqueReference() {
            FieldModel f = FieldModel.builder().type(FieldType.STRING).unique(true)
                    .reference(ReferenceModel.to("subject", "id")).build();
            assertThat(mapper.resolveColumnType(f)).isEqualTo("varchar(255)");
        }
    }

    @Test
    @DisplayName("bigint flag selects bigint")
    void bigint() {
        assertThat(mapper.resolveColumnType(FieldModel.of(FieldType.NUMBER))).isEqualTo("integer");
        assertThat(mapper.resolveColumnType(FieldModel.builder().type(FieldType.NUMBER).bigint(true).build()))
                .isEqualTo("bigint");
    }

    @Test
    @DisplayName("Connector/J spellings of boolean are accepted")
    void booleanSpellings() {
        FieldModel b = FieldModel.of(FieldType.BOOLEAN);
        assertThat(mapper.typesAreEquivalent("BIT", b)).isTrue();
        assertThat(mapper.typesAreEquivalent("TINYINT", b)).isTrue();
        assertThat(mapper.typesAreEquivalent("tinyint(1)", b)).isTrue();
        assertThat(mapper.typesAreEquivalent("varchar", b)).isFalse();
    }

    @Test
    @DisplayName("VARCHAR without length matches string and timezone")
    void varcharWithoutLength() {
        assertThat(mapper.typesAreEquivalent("VARCHAR", FieldModel.of(FieldType.STRING))).isTrue();
        assertThat(mapper.typesAreEquivalent("VARCHAR", FieldModel.of(FieldType.TIMEZONE))).isTrue();
    }
}
