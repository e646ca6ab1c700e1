package xyz.firestige.coordinator.config.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.coordinator.config.ConfigDocumentReader;
import xyz.firestige.coordinator.config.exception.ConfigurationException;

import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * 从 YAML/JSON 文档构建 {@link ConfigSchema}
 * <p>
 * 文档格式：
 * <pre>
 * deployment:
 *   timeout:     { type: integer, default: 300, min: 1 }
 *   strategy:    { type: string, allowed: [blue-green, rolling] }
 * database:
 *   password:    { type: string, sensitive: true }
 * </pre>
 */
public class ConfigSchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigSchemaLoader.class);

    private final ConfigDocumentReader reader;

    public ConfigSchemaLoader() {
        this(new ConfigDocumentReader());
    }

    public ConfigSchemaLoader(ConfigDocumentReader reader) {
        this.reader = reader;
    }

    public ConfigSchema load(InputStream in, String name) {
        Map<String, Object> document = reader.read(in, name);
        ConfigSchema schema = fromDocument(document);
        log.info("Config schema loaded from {}: sections={}", name, schema.sectionNames());
        return schema;
    }

    public ConfigSchema fromDocument(Map<String, Object> document) {
        ConfigSchema.Builder builder = ConfigSchema.builder();
        document.forEach((section, fields) -> {
            if (!(fields instanceof Map<?, ?> fieldMap)) {
                throw new ConfigurationException(section, "Invalid schema: section '" + section + "' must be an object");
            }
            builder.section(section);
            fieldMap.forEach((field, definition) -> {
                String path = section + "." + field;
                if (!(definition instanceof Map<?, ?> ruleMap)) {
                    throw new ConfigurationException(path, "Invalid schema: rule for '" + path + "' must be an object");
                }
                builder.field(section, String.valueOf(field), toRule(path, ruleMap));
            });
        });
        return builder.build();
    }

    private FieldRule toRule(String path, Map<?, ?> definition) {
        FieldType type;
        try {
            type = FieldType.fromName(definition.get("type") == null ? null : String.valueOf(definition.get("type")));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(path, "Invalid schema for " + path + ": " + e.getMessage(), e);
        }
        FieldRule.Builder rule = FieldRule.builder(type)
                .required(Boolean.TRUE.equals(definition.get("required")))
                .sensitive(Boolean.TRUE.equals(definition.get("sensitive")));
        if (definition.containsKey("default")) {
            rule.defaultValue(definition.get("default"));
        }
        rule.min(number(path, "min", definition.get("min")));
        rule.max(number(path, "max", definition.get("max")));
        Object allowed = definition.get("allowed");
        if (allowed instanceof Collection<?> values) {
            rule.allowed(new LinkedHashSet<>(values));
        } else if (allowed != null) {
            throw new ConfigurationException(path, "Invalid schema for " + path + ": 'allowed' must be a list");
        }
        try {
            return rule.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(path, "Invalid schema for " + path + ": " + e.getMessage(), e);
        }
    }

    private Number number(String path, String key, Object value) {
        if (value == null || value instanceof Number) {
            return (Number) value;
        }
        throw new ConfigurationException(path, "Invalid schema for " + path + ": '" + key + "' must be a number");
    }
}
