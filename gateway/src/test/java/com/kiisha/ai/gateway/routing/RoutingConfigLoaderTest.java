package com.kiisha.ai.gateway.routing;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.gateway.providers.ProviderId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RoutingConfigLoaderTest {

    private final RoutingConfigLoader loader = new RoutingConfigLoader();

    @Test
    void testLoad_bundledResourceMatchesDefaults() {
        GlobalRoutingConfig config = loader.load(null);
        GlobalRoutingConfig defaults = GlobalRoutingConfig.defaults();

        assertEquals(defaults.getDefaultProvider(), config.getDefaultProvider());
        assertEquals(defaults.getDefaultModel(), config.getDefaultModel());
        assertEquals(defaults.getFallbackChain(), config.getFallbackChain());
        assertEquals(defaults.getTaskRoutes().keySet(), config.getTaskRoutes().keySet());
        assertEquals(defaults.getTaskRouting(AiTask.DOC_EXTRACT_FIELDS).orElseThrow().getRoutes(),
                config.getTaskRouting(AiTask.DOC_EXTRACT_FIELDS).orElseThrow().getRoutes());
        assertEquals(3, config.getRetryConfig().getMaxRetries());
    }

    @Test
    void testLoadFile_customConfig(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("routing.json");
        Files.writeString(file, "{"
                + "\"defaultProvider\":\"anthropic\",\"defaultModel\":\"claude-3-5-haiku-20241022\","
                + "\"taskRoutes\":{\"GEO_PARSE\":{\"task\":\"GEO_PARSE\",\"fallbackEnabled\":false,"
                + "\"routes\":[{\"provider\":\"deepseek\",\"model\":\"deepseek-chat\",\"priority\":1}]}},"
                + "\"fallbackChain\":[\"anthropic\",\"openai\"],"
                + "\"retryConfig\":{\"maxRetries\":1,\"initialDelayMs\":10,\"maxDelayMs\":20,\"backoffMultiplier\":2.0}}");

        GlobalRoutingConfig config = loader.load(file.toString());

        assertEquals(ProviderId.ANTHROPIC, config.getDefaultProvider());
        TaskRoutingConfig geo = config.getTaskRouting(AiTask.GEO_PARSE).orElseThrow();
        assertFalse(geo.isFallbackEnabled());
        assertEquals(ProviderId.DEEPSEEK, geo.getRoutes().get(0).getProvider());
        assertEquals(1, config.getRetryConfig().getMaxRetries());
    }

    @Test
    void testLoadFile_missingFileFallsBackToDefaults(@TempDir Path dir) {
        GlobalRoutingConfig config = loader.loadFile(dir.resolve("absent.json"));
        assertEquals(ProviderId.FORGE, config.getDefaultProvider());
    }

    @Test
    void testLoadFile_malformedFallsBackToDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");
        assertEquals(ProviderId.FORGE, loader.loadFile(file).getDefaultProvider());
    }

    @Test
    void testLoadFile_invalidConfigFallsBackToDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("invalid.json");
        Files.writeString(file, "{\"defaultProvider\":\"openai\",\"defaultModel\":\"gpt-4o\","
                + "\"fallbackChain\":[\"openai\",\"openai\"]}");
        GlobalRoutingConfig config = loader.loadFile(file);
        assertEquals(ProviderId.FORGE, config.getDefaultProvider());
    }

    @Test
    void testParse_unknownProviderIsIoException() {
        String json = "{\"defaultProvider\":\"mystery\",\"defaultModel\":\"m\"}";
        assertThrows(IOException.class,
                () -> loader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))));
    }
}
