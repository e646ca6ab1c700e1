package xyz.firestige.coordinator.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import xyz.firestige.coordinator.config.exception.ConfigSourceNotFoundException;
import xyz.firestige.coordinator.config.exception.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 配置文档解析器
 * <p>
 * 根节点必须是对象（section -> fields），更深层结构原样保留；空文档视为空树。
 * 按扩展名选择格式：.yml/.yaml 走 YAML，其余按 JSON 处理。
 */
public class ConfigDocumentReader {

    private static final TypeReference<LinkedHashMap<String, Object>> TREE_TYPE = new TypeReference<>() {};

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ConfigDocumentReader() {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * 读取文件
     *
     * @throws ConfigSourceNotFoundException 文件不存在
     * @throws ConfigurationException        无法解析
     */
    public Map<String, Object> read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigSourceNotFoundException(String.valueOf(path));
        }
        ObjectMapper mapper = mapperFor(path.getFileName().toString());
        try (InputStream in = Files.newInputStream(path)) {
            return parse(mapper, in, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration file: " + path, e);
        }
    }

    /**
     * 从流读取，{@code name} 用于判断格式和错误信息
     */
    public Map<String, Object> read(InputStream in, String name) {
        try {
            return parse(mapperFor(name), in, name);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration document: " + name, e);
        }
    }

    private Map<String, Object> parse(ObjectMapper mapper, InputStream in, String name) throws IOException {
        try {
            JsonNode root = mapper.readTree(in);
            // 空文档或只有注释
            if (root == null || root.isMissingNode() || root.isNull()) {
                return new LinkedHashMap<>();
            }
            if (!root.isObject()) {
                throw new ConfigurationException("Invalid " + formatName(mapper) + " in configuration file "
                        + name + ": root must be an object, got " + root.getNodeType());
            }
            return mapper.convertValue(root, TREE_TYPE);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid " + formatName(mapper) + " in configuration file "
                    + name + ": " + e.getOriginalMessage(), e);
        }
    }

    private ObjectMapper mapperFor(String name) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml") ? yamlMapper : jsonMapper;
    }

    private String formatName(ObjectMapper mapper) {
        return mapper == yamlMapper ? "YAML" : "JSON";
    }
}
