package com.keyforge.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keyforge.core.error.ConfigurationException;
import com.keyforge.core.error.KeyforgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Loads {@link KeyforgeConfig} from YAML.
 * <p>
 * The document only needs the keys it overrides; everything else falls back to
 * {@link KeyforgeConfig#defaults(String)}. Durations use ISO-8601 ({@code PT30S}) or
 * plain seconds.
 *
 * <pre>
 * nodeId: node-a
 * pool:
 *   poolSize: 8
 * consensus:
 *   quorumRatio: 0.75
 *   proposalTimeout: PT10S
 * </pre>
 */
public final class KeyforgeConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(KeyforgeConfigLoader.class);
    private static final String CLASSPATH_RESOURCE = "keyforge.yml";

    private final ObjectMapper mapper;

    public KeyforgeConfigLoader() {
        this.mapper = YAMLMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Loads {@code keyforge.yml} from the classpath, or the defaults when it is absent.
     */
    public KeyforgeConfig loadFromClasspath() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", CLASSPATH_RESOURCE);
                return KeyforgeConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + CLASSPATH_RESOURCE, e);
        }
    }

    public KeyforgeConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path, e);
        }
    }

    public KeyforgeConfig load(InputStream in) {
        try {
            JsonNode overrides = mapper.readTree(in);
            String nodeId = overrides != null && overrides.hasNonNull("nodeId")
                    ? overrides.get("nodeId").asText()
                    : KeyforgeConfig.defaults().nodeId();
            ObjectNode merged = mapper.valueToTree(KeyforgeConfig.defaults(nodeId));
            if (overrides != null && overrides.isObject()) {
                merge(merged, (ObjectNode) overrides);
            }
            KeyforgeConfig config = mapper.treeToValue(merged, KeyforgeConfig.class);
            log.debug("Loaded configuration for node {}", config.nodeId());
            return config;
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof KeyforgeException keyforge) {
                throw new ConfigurationException(keyforge.getMessage(), e);
            }
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration", e);
        }
    }

    private static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue() instanceof ObjectNode incoming) {
                merge(existingObject, incoming);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
