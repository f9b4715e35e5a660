package im.arun.tokenmap.config;

import im.arun.tokenmap.model.ModelConfig;
import im.arun.tokenmap.model.TokenizerType;
import im.arun.tokenmap.model.TransformOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReadBundledDefaults() {
        // Act
        TokenMapConfig config = new ConfigLoader().load();

        // Assert
        assertThat(config.getModel()).isEqualTo("gpt-4o-128k");
        assertThat(config.getBasis()).isEqualTo("tokens");
        assertThat(config.getAggregationThreshold()).isEqualTo(0.0075);
        assertThat(config.getMaxVisibleNodes()).isEqualTo(2000);
        assertThat(config.getStreamingThresholdChars()).isEqualTo(2 * 1024 * 1024);
        assertThat(config.getModels()).extracting(ModelConfig::getId)
            .contains("gpt-4-128k", "gpt-4o-128k", "claude-3-opus-200k", "gemini-1.5-pro-1m");
        assertThat(config.getModels()).filteredOn(m -> m.getId().equals("gpt-4o-128k"))
            .singleElement().extracting(ModelConfig::getTokenizer).isEqualTo(TokenizerType.O200K_BASE);
    }

    @Test
    void load_shouldPreferAnExplicitFile() throws Exception {
        // Arrange
        Path file = tempDir.resolve("tokenmap.yaml");
        Files.writeString(file, "model: \"local\"\n"
            + "basis: \"chars\"\n"
            + "max_visible_nodes: 50\n"
            + "some_future_key: true\n"
            + "models:\n"
            + "  - id: \"local\"\n"
            + "    name: \"Local model\"\n"
            + "    context_limit: 8192\n"
            + "    tokenizer: \"custom\"\n"
            + "    overhead_tokens: 200\n");

        // Act
        TokenMapConfig config = new ConfigLoader(file.toString()).load();

        // Assert
        assertThat(config.getModel()).isEqualTo("local");
        assertThat(config.getBasis()).isEqualTo("chars");
        assertThat(config.getMaxVisibleNodes()).isEqualTo(50);
        assertThat(config.getPreviewLength()).isEqualTo(TransformOptions.DEFAULT_PREVIEW_LENGTH);
        assertThat(config.getModels()).singleElement().satisfies(model -> {
            assertThat(model.getContextLimit()).isEqualTo(8192);
            assertThat(model.getTokenizer()).isEqualTo(TokenizerType.CUSTOM);
            assertThat(model.getOverheadTokens()).isEqualTo(200);
        });
    }

    @Test
    void load_shouldFillInBuiltInModelsWhenFileListsNone() throws Exception {
        Path file = tempDir.resolve("bare.yaml");
        Files.writeString(file, "model: \"gpt-4-128k\"\n");

        TokenMapConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getModels()).hasSize(5);
    }

    @Test
    void load_shouldFallBackToClasspathWhenFileIsMissing() {
        TokenMapConfig config = new ConfigLoader(tempDir.resolve("missing.yaml").toString()).load();

        assertThat(config.getModel()).isEqualTo("gpt-4o-128k");
    }

    @Test
    void load_shouldApplyOverridesInEitherKeyStyle() {
        // Arrange
        ConfigLoader loader = new ConfigLoader();
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("model", "gpt-4-128k");
        overrides.put("aggregation_threshold", 0.02);
        overrides.put("maxVisibleNodes", 300);
        overrides.put("max_depth", 4);
        overrides.put("retain_text", "no");
        overrides.put("runLog", "yes");
        overrides.put("unknown", 1);

        // Act
        TokenMapConfig config = loader.load(overrides);

        // Assert
        assertThat(config.getModel()).isEqualTo("gpt-4-128k");
        assertThat(config.getAggregationThreshold()).isEqualTo(0.02);
        assertThat(config.getMaxVisibleNodes()).isEqualTo(300);
        assertThat(config.isRetainText()).isFalse();
        assertThat(config.isRunLog()).isTrue();
        assertThat(config.toTransformOptions().getMaxDepth()).isEqualTo(4);
        assertThat(config.toParseOptions().isRetainText()).isFalse();
    }

    @Test
    void load_shouldNotLeakOverridesIntoLaterLoads() {
        ConfigLoader loader = new ConfigLoader();
        loader.load(Map.of("model", "gpt-4-128k", "max_visible_nodes", 10));

        TokenMapConfig fresh = loader.load();

        assertThat(fresh.getModel()).isEqualTo("gpt-4o-128k");
        assertThat(fresh.getMaxVisibleNodes()).isEqualTo(2000);
    }

    @Test
    void toTransformOptions_shouldTreatZeroDepthAsUnbounded() {
        TokenMapConfig config = new TokenMapConfig();

        assertThat(config.toTransformOptions().getMaxDepth()).isEqualTo(TransformOptions.UNBOUNDED_DEPTH);
    }
}
