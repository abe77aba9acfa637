package org.strata.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

/**
 * Shape of {@code strata.yaml}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StrataConfiguration {

    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {
        private NamingConfiguration naming;
        private DatabaseConfiguration database;
        private SchemaConfiguration schema;
        private OutputConfiguration output;
    }

    @Data
    public static class NamingConfiguration {
        private Integer maxLength;
    }

    @Data
    public static class DatabaseConfiguration {
        private String dialect;
        private String url;
        private String username;

        @ToString.Exclude
        private String password;
    }

    @Data
    public static class SchemaConfiguration {
        private String directory;
    }

    @Data
    public static class OutputConfiguration {
        private String directory;
    }
}
