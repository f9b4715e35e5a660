package im.arun.tokenmap.token;

import im.arun.tokenmap.model.ModelConfig;
import im.arun.tokenmap.model.TokenizerType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenizerRegistryTest {

    @Test
    void adapterFor_shouldShareOneAdapterPerTokenizerFamily() {
        // Arrange
        AtomicInteger created = new AtomicInteger();
        TokenizerRegistry registry = new TokenizerRegistry(ModelCatalog.defaults(), type -> {
            created.incrementAndGet();
            return new CountingTokenizerAdapter();
        });

        // Act
        TokenizerAdapter opus = registry.adapterFor("claude-3-opus-200k");
        TokenizerAdapter sonnet = registry.adapterFor("claude-3.5-sonnet-200k");
        TokenizerAdapter gpt = registry.adapterFor("gpt-4o-128k");

        // Assert
        assertThat(opus).isSameAs(sonnet);
        assertThat(gpt).isNotSameAs(opus);
        assertThat(created).hasValue(2);
    }

    @Test
    void adapterFor_shouldFailFastForUnknownModels() {
        TokenizerRegistry registry = new TokenizerRegistry(ModelCatalog.defaults());

        assertThatThrownBy(() -> registry.adapterFor("gpt-unknown"))
            .isInstanceOf(UnknownModelException.class)
            .hasMessageContaining("gpt-unknown")
            .hasMessageContaining("gpt-4o-128k");
    }

    @Test
    void defaultAdapters_shouldUseJTokkitForOpenAiFamiliesOnly() {
        TokenizerRegistry registry = new TokenizerRegistry(ModelCatalog.defaults());

        assertThat(registry.adapterForType(TokenizerType.CL100K_BASE)).isInstanceOf(JTokkitTokenizerAdapter.class);
        assertThat(registry.adapterForType(TokenizerType.O200K_BASE)).isInstanceOf(JTokkitTokenizerAdapter.class);
        assertThat(registry.adapterForType(TokenizerType.GEMINI)).isInstanceOf(HeuristicTokenizerAdapter.class);
    }

    @Test
    void get_shouldReadThroughToTheModelsAdapterCache() {
        // Arrange
        TokenizerRegistry registry = new TokenizerRegistry(ModelCatalog.defaults(), type -> new CountingTokenizerAdapter());
        registry.adapterFor("gpt-4-128k").cacheSet("h", "gpt-4-128k", 12);

        // Act & Assert
        assertThat(registry.get("h", "gpt-4-128k")).hasValue(12);
        assertThat(registry.get("h", "gpt-4o-128k")).isEmpty();
        assertThat(registry.get("h", "no-such-model")).isEmpty();
    }

    @Test
    void catalog_shouldRejectDuplicateIds() {
        ModelConfig model = new ModelConfig("m", "M", 1000, TokenizerType.CUSTOM, 0);

        assertThatThrownBy(() -> new ModelCatalog(List.of(model, model)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate");
    }

    @Test
    void jtokkitAdapter_shouldCountExactly() {
        // Arrange
        JTokkitTokenizerAdapter adapter = JTokkitTokenizerAdapter.forType(TokenizerType.CL100K_BASE);

        // Act
        int tokens = adapter.countText("hello world");

        // Assert
        assertThat(tokens).isEqualTo(2);
        assertThat(adapter.countText("")).isZero();
        assertThat(adapter.isExact()).isTrue();
    }
}
