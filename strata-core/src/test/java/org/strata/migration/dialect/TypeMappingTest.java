package org.strata.migration.dialect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.strata.migration.DatabaseType;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;
import org.strata.model.ReferenceModel;

import static org.assertj.core.api.Assertions.assertThat;

class TypeMappingTest {

    @ParameterizedTest
    @EnumSource(DatabaseType.class)
    @DisplayName("Every logical type accepts the column type it is created with")
    void resolvedTypeIsAlwaysEquivalent(DatabaseType db) {
        for (FieldType type : FieldType.values()) {
            for (FieldModel field : variants(type)) {
                String resolved = TypeMapping.resolveColumnType(field, db);
                assertThat(TypeMapping.typesAreEquivalent(resolved, field, db))
                        .as("%s on %s resolved to %s", type, db, resolved)
                        .isTrue();
                assertThat(TypeMapping.typesAreEquivalent(resolved.toUpperCase(), field, db))
                        .as("upper-case %s on %s", resolved, db)
                        .isTrue();
            }
        }
    }

    private static FieldModel[] variants(FieldType type) {
        return new FieldModel[]{
                FieldModel.of(type),
                FieldModel.builder().type(type).unique(true).build(),
                FieldModel.builder().type(type).bigint(true).build(),
                FieldModel.builder().type(type).reference(ReferenceModel.to("subject", "id")).build()
        };
    }

    @Test
    @DisplayName("Type table per dialect")
    void resolvesDocumentedTypes() {
        FieldModel json = FieldModel.of(FieldType.JSON);
        assertThat(TypeMapping.resolveColumnType(json, DatabaseType.POSTGRES)).isEqualTo("jsonb");
        assertThat(TypeMapping.resolveColumnType(json, DatabaseType.MYSQL)).isEqualTo("json");
        assertThat(TypeMapping.resolveColumnType(json, DatabaseType.SQLITE)).isEqualTo("text");
        assertThat(TypeMapping.resolveColumnType(json, DatabaseType.MSSQL)).isEqualTo("nvarchar(max)");

        FieldModel date = FieldModel.of(FieldType.DATE);
        assertThat(TypeMapping.resolveColumnType(date, DatabaseType.POSTGRES)).isEqualTo("timestamp");
        assertThat(TypeMapping.resolveColumnType(date, DatabaseType.MYSQL)).isEqualTo("datetime");
        assertThat(TypeMapping.resolveColumnType(date, DatabaseType.SQLITE)).isEqualTo("date");
        assertThat(TypeMapping.resolveColumnType(date, DatabaseType.MSSQL)).isEqualTo("datetime");

        FieldModel tz = FieldModel.of(FieldType.TIMEZONE);
        assertThat(TypeMapping.resolveColumnType(tz, DatabaseType.MYSQL)).isEqualTo("varchar(50)");
        assertThat(TypeMapping.resolveColumnType(tz, DatabaseType.MSSQL)).isEqualTo("nvarchar(50)");
    }

    @Test
    @DisplayName("Arrays match any live type containing json")
    void arraysMatchJsonSpellings() {
        FieldModel tags = FieldModel.of(FieldType.STRING_ARRAY);
        assertThat(TypeMapping.typesAreEquivalent("JSONB", tags, DatabaseType.POSTGRES)).isTrue();
        assertThat(TypeMapping.typesAreEquivalent("json", tags, DatabaseType.POSTGRES)).isTrue();
        assertThat(TypeMapping.typesAreEquivalent("text", tags, DatabaseType.SQLITE)).isTrue();
        assertThat(TypeMapping.typesAreEquivalent("nvarchar", tags, DatabaseType.MSSQL)).isTrue();
        assertThat(TypeMapping.typesAreEquivalent("text[]", tags, DatabaseType.POSTGRES)).isFalse();
    }

    @Test
    @DisplayName("Number synonyms are accepted, text is not")
    void numberSynonyms() {
        FieldModel n = FieldModel.of(FieldType.NUMBER);
        assertThat(TypeMapping.typesAreEquivalent("int4", n, DatabaseType.POSTGRES)).isTrue();
        assertThat(TypeMapping.typesAreEquivalent("int8", n, DatabaseType.POSTGRES)).isTrue();
        assertThat(TypeMapping.typesAreEquivalent(" INT ", n, DatabaseType.MYSQL)).isTrue();
        assertThat(TypeMapping.typesAreEquivalent("text", n, DatabaseType.POSTGRES)).isFalse();
        assertThat(TypeMapping.typesAreEquivalent(null, n, DatabaseType.POSTGRES)).isFalse();
    }
}
