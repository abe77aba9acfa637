package org.strata.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Foreign key target of a field: {@code table(field)}.
 * The table may name either a physical table or the logical key of another fragment
 * until the schema is assembled.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReferenceModel {
    @JsonAlias({"model", "entity"})
    private String table;

    @Builder.Default
    private String field = "id";

    @Builder.Default
    private ReferentialAction onDelete = null;

    public static ReferenceModel to(String table, String field) {
        return ReferenceModel.builder().table(table).field(field).build();
    }
}
