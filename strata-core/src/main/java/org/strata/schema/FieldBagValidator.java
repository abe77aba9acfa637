package org.strata.schema;

import org.strata.model.FieldModel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural checks on a field bag. A bag with any problem must not contribute to the schema.
 * Two keys resolving to the same column name are a problem too.
 */
public final class FieldBagValidator {

    private FieldBagValidator() {
    }

    /**
     * @return human-readable problems, empty when the bag is well-formed
     */
    public static List<String> validate(String owner, Map<String, FieldModel> fields) {
        List<String> problems = new ArrayList<>();
        Map<String, String> keyByColumn = new HashMap<>();
        if (fields == null) {
            problems.add(owner + ": field bag is missing");
            return problems;
        }
        for (Map.Entry<String, FieldModel> e : fields.entrySet()) {
            String key = e.getKey();
            FieldModel field = e.getValue();
            if (key == null || key.isBlank()) {
                problems.add(owner + ": field with blank name");
            } else if (field == null) {
                problems.add(owner + "." + key + ": field definition is null");
            } else if (field.getType() == null) {
                problems.add(owner + "." + key + ": field type is missing");
            } else if (field.getDefaultValue() == null) {
                problems.add(owner + "." + key + ": default value policy is null");
            } else {
                String column = field.columnName(key);
                String other = keyByColumn.putIfAbsent(column, key);
                if (other != null) {
                    problems.add(owner + "." + key + ": column name '" + column + "' already used by field " + other);
                }
            }
        }
        return problems;
    }

    public static boolean isValid(String owner, Map<String, FieldModel> fields) {
        return validate(owner, fields).isEmpty();
    }
}
