package com.kiisha.ai.gateway.routing;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kiisha.ai.common.AiGatewayConstants;
import com.kiisha.ai.common.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the routing table from JSON. A missing, unreadable or invalid document never stops
 * startup: the loader logs a warning and hands back {@link GlobalRoutingConfig#defaults()}.
 */
public final class RoutingConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(RoutingConfigLoader.class);

    private final ObjectMapper mapper;

    public RoutingConfigLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads the given file when a path is set, otherwise the bundled classpath resource.
     */
    public GlobalRoutingConfig load(String configPath) {
        if (configPath != null && !configPath.isBlank()) {
            return loadFile(Path.of(configPath));
        }
        return loadResource(AiGatewayConstants.DEFAULT_ROUTING_RESOURCE);
    }

    public GlobalRoutingConfig loadFile(Path path) {
        if (!Files.isRegularFile(path)) {
            logger.warn("Routing config {} not found, using built-in defaults", path);
            return GlobalRoutingConfig.defaults();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parseOrDefaults(in, path.toString());
        } catch (IOException e) {
            logger.warn("Failed to read routing config {}, using built-in defaults: {}", path, e.getMessage());
            return GlobalRoutingConfig.defaults();
        }
    }

    public GlobalRoutingConfig loadResource(String resourceName) {
        InputStream in = RoutingConfigLoader.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            logger.warn("Routing resource {} not on classpath, using built-in defaults", resourceName);
            return GlobalRoutingConfig.defaults();
        }
        try (InputStream stream = in) {
            return parseOrDefaults(stream, "classpath:" + resourceName);
        } catch (IOException e) {
            logger.warn("Failed to read routing resource {}, using built-in defaults: {}", resourceName, e.getMessage());
            return GlobalRoutingConfig.defaults();
        }
    }

    /**
     * Parses a routing document without any fallback.
     *
     * @throws IOException if the document is malformed
     */
    public GlobalRoutingConfig parse(InputStream in) throws IOException {
        return mapper.readValue(in, GlobalRoutingConfig.class);
    }

    private GlobalRoutingConfig parseOrDefaults(InputStream in, String source) {
        GlobalRoutingConfig config;
        try {
            config = parse(in);
        } catch (IOException e) {
            logger.warn("Malformed routing config {}, using built-in defaults: {}", source, e.getMessage());
            return GlobalRoutingConfig.defaults();
        }

        ValidationResult validation = config.validate();
        if (!validation.isValid()) {
            logger.warn("Routing config {} rejected, using built-in defaults: {}", source, validation.getErrorSummary());
            return GlobalRoutingConfig.defaults();
        }
        for (String warning : validation.getWarnings()) {
            logger.warn("Routing config {}: {}", source, warning);
        }
        logger.info("Loaded routing config from {}: {}", source, config);
        return config;
    }
}
