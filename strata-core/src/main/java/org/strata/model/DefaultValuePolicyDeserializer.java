package org.strata.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.Locale;

/**
 * Reads {@code defaultValue} from schema documents.
 * <ul>
 *   <li>scalar / array / object without {@code computed} → {@link DefaultValuePolicy.Static}</li>
 *   <li>{@code {computed: now}} → {@link DefaultValuePolicy.Computed}</li>
 *   <li>{@code null} → {@link DefaultValuePolicy.None}</li>
 * </ul>
 */
class DefaultValuePolicyDeserializer extends StdDeserializer<DefaultValuePolicy> {

    DefaultValuePolicyDeserializer() {
        super(DefaultValuePolicy.class);
    }

    @Override
    public DefaultValuePolicy deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return DefaultValuePolicy.none();
        }
        if (node.isObject() && node.has("computed")) {
            String kind = node.get("computed").asText().trim().toUpperCase(Locale.ROOT);
            try {
                return DefaultValuePolicy.computed(ComputedDefault.valueOf(kind));
            } catch (IllegalArgumentException e) {
                return (DefaultValuePolicy) ctxt.handleWeirdStringValue(DefaultValuePolicy.class, kind,
                        "unknown computed default");
            }
        }
        if (node.isTextual()) return DefaultValuePolicy.of(node.asText());
        if (node.isBoolean()) return DefaultValuePolicy.of(node.asBoolean());
        if (node.isIntegralNumber()) return DefaultValuePolicy.of(node.numberValue());
        if (node.isNumber()) return DefaultValuePolicy.of(node.decimalValue());
        return DefaultValuePolicy.of(node.toString());
    }

    @Override
    public DefaultValuePolicy getNullValue(DeserializationContext ctxt) {
        return DefaultValuePolicy.none();
    }
}
