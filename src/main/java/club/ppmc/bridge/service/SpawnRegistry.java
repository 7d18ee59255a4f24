/**
 * SpawnRegistry.java
 *
 * 进程级只读注册表：工具服务器名称 -> SpawnSpec。
 * 在 Spring 上下文启动时，根据 {@code bridge.servers-file} 指向的 JSON 文档构建一次。
 * 文档缺失或无法解析不会导致启动失败，此时注册表为空，/health 照常可用。
 * 构建完成后不再写入，因此查询无需同步。
 */
package club.ppmc.bridge.service;

import club.ppmc.bridge.model.ServerConfig;
import club.ppmc.bridge.model.SpawnSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SpawnRegistry {

    /** 能够出现在 {@code /mcp/<name>} 最后一段的名称。 */
    public static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private final Map<String, SpawnSpec> specs;

    @Autowired
    public SpawnRegistry(
            @Value("${bridge.servers-file:file:./servers.json}") Resource serversFile,
            Validator validator) {
        this(load(serversFile, newObjectMapper(), validator));
    }

    public SpawnRegistry(Map<String, SpawnSpec> specs) {
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
    }

    public Optional<SpawnSpec> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(specs.get(name));
    }

    /** 按声明顺序返回已注册的名称。 */
    public List<String> names() {
        return List.copyOf(specs.keySet());
    }

    public Collection<SpawnSpec> specs() {
        return specs.values();
    }

    public int size() {
        return specs.size();
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    /**
     * 读取并校验服务器配置文档。
     *
     * <p><b>设计思路</b>:
     * 1. 文档先读成 {@link JsonNode} 树，再逐个条目转换，这样单个坏条目只会被跳过，不会拖垮整个文件。
     * 2. 名称必须能被路由匹配，否则该条目永远无法连接，直接跳过。
     * 3. 条目内容交给 Bean Validation 校验（command 非空白，args/env 不含 null），
     *    所有问题都通过同一条警告日志报告。
     * </p>
     *
     * @return 文档顺序的有效条目，永不为 null。
     */
    static Map<String, SpawnSpec> load(Resource serversFile, ObjectMapper objectMapper, Validator validator) {
        if (serversFile == null || !serversFile.exists()) {
            log.warn("Config file not found at {}. Starting with an empty server registry.", describe(serversFile));
            return Map.of();
        }

        JsonNode root;
        try (InputStream in = serversFile.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            log.warn("Failed to load {}: {}. Starting with an empty server registry.", describe(serversFile), e.getMessage());
            return Map.of();
        }
        if (root == null || !root.isObject()) {
            log.warn("{} must contain a JSON object keyed by server name. Starting with an empty server registry.",
                    describe(serversFile));
            return Map.of();
        }

        Map<String, SpawnSpec> loaded = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            toSpec(field.getKey(), field.getValue(), objectMapper, validator)
                    .ifPresent(spec -> loaded.put(spec.name(), spec));
        }
        log.info("Loaded {} server definition(s) from {}", loaded.size(), describe(serversFile));
        return loaded;
    }

    private static Optional<SpawnSpec> toSpec(
            String name, JsonNode node, ObjectMapper objectMapper, Validator validator) {
        if (!NAME_PATTERN.matcher(name).matches()) {
            log.warn("Skipping server '{}': name must match {}", name, NAME_PATTERN.pattern());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("Skipping server '{}': definition must be a JSON object", name);
            return Optional.empty();
        }

        ServerConfig config;
        try {
            config = objectMapper.treeToValue(node, ServerConfig.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping server '{}': {}", name, e.getMessage());
            return Optional.empty();
        }

        Set<ConstraintViolation<ServerConfig>> violations = validator.validate(config);
        if (!violations.isEmpty()) {
            String problems = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(", "));
            log.warn("Skipping server '{}': {}", name, problems);
            return Optional.empty();
        }

        return Optional.of(SpawnSpec.of(name, config));
    }

    static ObjectMapper newObjectMapper() {
        return new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static String describe(Resource resource) {
        return resource == null ? "<unset>" : resource.getDescription();
    }
}
