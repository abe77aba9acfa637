package org.strata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.strata.options.StrataOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loads {@code strata.yaml}, searched from the start directory upwards, and flattens the active
 * profile into {@link StrataOptions} keys.
 * <p>
 * Profile precedence: explicit argument, then {@code STRATA_PROFILE}, then {@code dev}.
 */
@Slf4j
public class ConfigurationLoader {

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<StrataConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }
        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.isBlank()) {
            return cliProfile.trim();
        }
        String envProfile = environment.apply(StrataOptions.Profile.ENV_VAR);
        if (envProfile != null && !envProfile.isBlank()) {
            return envProfile.trim();
        }
        return StrataOptions.Profile.DEFAULT;
    }

    private Optional<StrataConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;
        while (currentDir != null) {
            Path configFile = currentDir.resolve(StrataOptions.Profile.CONFIG_FILE);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), StrataConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }
        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(StrataConfiguration config, String profile) {
        var profileConfig = config.getProfiles() == null ? null : config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        Map<String, String> configMap = new HashMap<>(createDefaultConfiguration());

        if (profileConfig.getNaming() != null && profileConfig.getNaming().getMaxLength() != null) {
            configMap.put(StrataOptions.Naming.MAX_LENGTH_KEY, String.valueOf(profileConfig.getNaming().getMaxLength()));
        }
        var db = profileConfig.getDatabase();
        if (db != null) {
            putIfPresent(configMap, StrataOptions.Database.DIALECT_KEY, db.getDialect());
            putIfPresent(configMap, StrataOptions.Database.URL_KEY, db.getUrl());
            putIfPresent(configMap, StrataOptions.Database.USERNAME_KEY, db.getUsername());
            putIfPresent(configMap, StrataOptions.Database.PASSWORD_KEY, db.getPassword());
        }
        if (profileConfig.getSchema() != null) {
            putIfPresent(configMap, StrataOptions.Schema.DIRECTORY_KEY, profileConfig.getSchema().getDirectory());
        }
        if (profileConfig.getOutput() != null) {
            putIfPresent(configMap, StrataOptions.Output.DIRECTORY_KEY, profileConfig.getOutput().getDirectory());
        }
        return configMap;
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                StrataOptions.Naming.MAX_LENGTH_KEY, String.valueOf(StrataOptions.Naming.MAX_LENGTH_DEFAULT),
                StrataOptions.Schema.DIRECTORY_KEY, StrataOptions.Schema.DIRECTORY_DEFAULT,
                StrataOptions.Output.DIRECTORY_KEY, StrataOptions.Output.DIRECTORY_DEFAULT
        );
    }
}
