package org.strata.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.strata.model.FieldModel;
import org.strata.model.IndexModel;
import org.strata.model.TableFragment;
import org.strata.model.UniqueConstraintModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads table fragments from JSON or YAML documents.
 * <p>
 * A document is either a single fragment or an object with a {@code tables} map, keyed by the
 * fragment key. A field that cannot be read is kept as a {@code null} entry so the assembler
 * rejects its fragment instead of silently creating a partial table.
 */
@Slf4j
public class SchemaFragmentReader {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public SchemaFragmentReader() {
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static boolean isSchemaFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || name.endsWith(".yaml") || name.endsWith(".yml");
    }

    /**
     * All fragments from the schema files directly inside {@code dir}, in file name order.
     */
    public List<TableFragment> readDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("Schema directory not found: " + dir);
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(SchemaFragmentReader::isSchemaFile)
                    .sorted()
                    .toList();
        }
        List<TableFragment> fragments = new ArrayList<>();
        for (Path file : files) {
            fragments.addAll(readFile(file));
        }
        log.debug("Read {} fragment(s) from {} file(s) in {}", fragments.size(), files.size(), dir);
        return fragments;
    }

    public List<TableFragment> readFile(Path file) throws IOException {
        String name = file.getFileName().toString();
        ObjectMapper mapper = name.toLowerCase(Locale.ROOT).endsWith(".json") ? jsonMapper : yamlMapper;
        JsonNode root = mapper.readTree(file.toFile());
        String defaultKey = name.contains(".") ? name.substring(0, name.lastIndexOf('.')) : name;
        return readTree(root, defaultKey, mapper);
    }

    public List<TableFragment> readJson(String json, String defaultKey) throws IOException {
        return readTree(jsonMapper.readTree(json), defaultKey, jsonMapper);
    }

    public List<TableFragment> readYaml(String yaml, String defaultKey) throws IOException {
        return readTree(yamlMapper.readTree(yaml), defaultKey, yamlMapper);
    }

    private List<TableFragment> readTree(JsonNode root, String defaultKey, ObjectMapper mapper) throws IOException {
        List<TableFragment> fragments = new ArrayList<>();
        if (root == null || !root.isObject()) {
            throw new IOException("Schema document '" + defaultKey + "' must be an object");
        }
        JsonNode tables = root.get("tables");
        if (tables != null && tables.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = tables.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!e.getValue().isObject()) {
                    log.warn("Ignoring table '{}' in '{}': not an object", e.getKey(), defaultKey);
                    continue;
                }
                fragments.add(toFragment(e.getKey(), (ObjectNode) e.getValue(), mapper));
            }
        } else {
            String key = root.hasNonNull("key") ? root.get("key").asText() : defaultKey;
            fragments.add(toFragment(key, (ObjectNode) root, mapper));
        }
        return fragments;
    }

    private TableFragment toFragment(String key, ObjectNode node, ObjectMapper mapper) throws IOException {
        return TableFragment.builder()
                .key(key)
                .entityName(node.hasNonNull("entityName") ? node.get("entityName").asText() : null)
                .order(node.hasNonNull("order") ? node.get("order").asInt() : null)
                .fields(readFields(key, node.get("fields"), mapper))
                .uniqueConstraints(readList(node.get("uniqueConstraints"), UniqueConstraintModel.class, mapper))
                .indexes(readList(node.get("indexes"), IndexModel.class, mapper))
                .build();
    }

    private Map<String, FieldModel> readFields(String key, JsonNode node, ObjectMapper mapper) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, FieldModel> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            fields.put(e.getKey(), readField(key, e.getKey(), e.getValue(), mapper));
        }
        return fields;
    }

    private FieldModel readField(String table, String name, JsonNode node, ObjectMapper mapper) {
        if (node == null || !node.isObject()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, FieldModel.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Unreadable field {}.{}: {}", table, name, e.getMessage());
            return null;
        }
    }

    private <T> List<T> readList(JsonNode node, Class<T> type, ObjectMapper mapper) throws IOException {
        List<T> items = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return items;
        }
        for (JsonNode item : node) {
            items.add(mapper.treeToValue(item, type));
        }
        return items;
    }
}
