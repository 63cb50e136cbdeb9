package org.dxworks.pgshape;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.pgshape.model.Identifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class PgShapeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "pgshape-config.yml";
    private static final boolean DEFAULT_INCLUDE_JSON_SHAPES = true;

    private final String defaultSchema;
    private final int maxFileLines;
    private final List<String> internalRoutinePrefixes;
    private final boolean includeJsonShapes;

    private PgShapeConfig(String defaultSchema, int maxFileLines, List<String> internalRoutinePrefixes,
                          boolean includeJsonShapes) {
        this.defaultSchema = defaultSchema;
        this.maxFileLines = maxFileLines;
        this.internalRoutinePrefixes = List.copyOf(internalRoutinePrefixes);
        this.includeJsonShapes = includeJsonShapes;
    }

    public String getDefaultSchema() {
        return defaultSchema;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public List<String> getInternalRoutinePrefixes() {
        return internalRoutinePrefixes;
    }

    public boolean isIncludeJsonShapes() {
        return includeJsonShapes;
    }

    public static PgShapeConfig defaults() {
        return new PgShapeConfig(Identifier.DEFAULT_SCHEMA, DEFAULT_MAX_FILE_LINES, List.of(), DEFAULT_INCLUDE_JSON_SHAPES);
    }

    public static PgShapeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static PgShapeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(yamlConfig.defaultSchema,
                        yamlConfig.maxFileLines != null ? yamlConfig.maxFileLines : DEFAULT_MAX_FILE_LINES,
                        yamlConfig.internalRoutinePrefixes,
                        yamlConfig.includeJsonShapes != null ? yamlConfig.includeJsonShapes : DEFAULT_INCLUDE_JSON_SHAPES);
            }
        } catch (IOException e) {
            System.err.println("[PgShapeConfig] Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static PgShapeConfig with(String defaultSchema, int maxFileLines, List<String> internalRoutinePrefixes,
                                     boolean includeJsonShapes) {
        String effectiveSchema = defaultSchema != null && !defaultSchema.isBlank()
                ? defaultSchema.trim()
                : Identifier.DEFAULT_SCHEMA;
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        List<String> prefixes = internalRoutinePrefixes != null ? internalRoutinePrefixes : List.of();
        return new PgShapeConfig(effectiveSchema, effectiveMaxFileLines, prefixes, includeJsonShapes);
    }

    private static class YamlConfig {
        public String defaultSchema;
        public Integer maxFileLines;
        public List<String> internalRoutinePrefixes;
        public Boolean includeJsonShapes;
    }
}
