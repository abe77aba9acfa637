package org.strata.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.strata.model.FieldModel;
import org.strata.model.FieldType;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FieldBagValidatorTest {

    @Test
    @DisplayName("Well-formed bag, including an empty one, has no problems")
    void valid() {
        assertThat(FieldBagValidator.validate("t", Map.of("a", FieldModel.of(FieldType.JSON)))).isEmpty();
        assertThat(FieldBagValidator.isValid("t", Map.of())).isTrue();
    }

    @Test
    @DisplayName("Missing bag, null entry and missing type are reported")
    void problems() {
        Map<String, FieldModel> bag = new HashMap<>();
        bag.put("a", null);
        bag.put("b", new FieldModel());

        assertThat(FieldBagValidator.validate("t", null)).containsExactly("t: field bag is missing");
        assertThat(FieldBagValidator.validate("t", bag))
                .containsExactlyInAnyOrder("t.a: field definition is null", "t.b: field type is missing");
    }

    @Test
    @DisplayName("Two keys resolving to one column name are reported")
    void columnNameCollision() {
        Map<String, FieldModel> bag = new LinkedHashMap<>();
        bag.put("externalId", FieldModel.builder().type(FieldType.STRING).fieldName("external_id").build());
        bag.put("external_id", FieldModel.of(FieldType.STRING));

        assertThat(FieldBagValidator.validate("subject", bag)).containsExactly(
                "subject.external_id: column name 'external_id' already used by field externalId");
    }
}
