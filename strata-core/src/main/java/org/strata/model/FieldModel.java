package org.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contract of one column, independent of any dialect.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldModel {
    private FieldType type;

    @Builder.Default
    @JsonProperty("required")
    private boolean required = true;

    @Builder.Default
    private DefaultValuePolicy defaultValue = DefaultValuePolicy.none();

    @Builder.Default
    @JsonProperty("unique")
    private boolean unique = false;

    @Builder.Default
    @JsonProperty("bigint")
    private boolean bigint = false;

    @Builder.Default
    @JsonProperty("indexed")
    private boolean indexed = false;

    /** Physical column name; the field key is used when absent. */
    @Builder.Default
    private String fieldName = null;

    @Builder.Default
    private ReferenceModel reference = null;

    public static FieldModel of(FieldType type) {
        return FieldModel.builder().type(type).build();
    }

    @JsonIgnore
    public String columnName(String key) {
        return (fieldName == null || fieldName.isBlank()) ? key : fieldName.trim();
    }

    @JsonIgnore
    public boolean hasReference() {
        return reference != null && reference.getTable() != null && !reference.getTable().isBlank();
    }

    @JsonIgnore
    public boolean isOptional() {
        return !required;
    }
}
