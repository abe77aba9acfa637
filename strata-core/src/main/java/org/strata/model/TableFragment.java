package org.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One contribution to a logical table: the core definition or fields added by a plugin.
 * Several fragments may target the same table; they are merged by the assembler.
 * <p>
 * {@code fields} may be {@code null} or hold {@code null} entries when the source document was
 * malformed; the assembler rejects such fragments.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableFragment {
    private String key;

    @Builder.Default
    private String entityName = null;

    @Builder.Default
    private Map<String, FieldModel> fields = new LinkedHashMap<>();

    @Builder.Default
    private Integer order = null;

    @Builder.Default
    private List<UniqueConstraintModel> uniqueConstraints = new ArrayList<>();

    @Builder.Default
    private List<IndexModel> indexes = new ArrayList<>();

    @JsonIgnore
    public String resolvedTableName() {
        return (entityName == null || entityName.isBlank()) ? key : entityName.trim();
    }
}
