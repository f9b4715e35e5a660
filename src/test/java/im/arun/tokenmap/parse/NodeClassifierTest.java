package im.arun.tokenmap.parse;

import im.arun.tokenmap.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NodeClassifierTest {

    @Test
    void classify_shouldPreferTextForLeavesWithContent() {
        assertThat(NodeClassifier.classify("b", "hi", 0)).isEqualTo(NodeKind.TEXT);
        assertThat(NodeClassifier.classify("script", "x = 1", 0)).isEqualTo(NodeKind.TEXT);
    }

    @Test
    void classify_shouldRecognizeCodeAndMetadataTags() {
        assertThat(NodeClassifier.classify("script", "", 0)).isEqualTo(NodeKind.CODE);
        assertThat(NodeClassifier.classify("sourceCode", null, 3)).isEqualTo(NodeKind.CODE);
        assertThat(NodeClassifier.classify("head", null, 2)).isEqualTo(NodeKind.METADATA);
        assertThat(NodeClassifier.classify("file_metadata", "  ", 0)).isEqualTo(NodeKind.METADATA);
    }

    @Test
    void classify_shouldFallBackToContainerOrOther() {
        assertThat(NodeClassifier.classify("div", "\n  ", 2)).isEqualTo(NodeKind.CONTAINER);
        assertThat(NodeClassifier.classify("br", "", 0)).isEqualTo(NodeKind.OTHER);
    }
}
