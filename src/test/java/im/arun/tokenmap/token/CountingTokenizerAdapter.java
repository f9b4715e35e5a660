package im.arun.tokenmap.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exact adapter for tests: one token per whitespace-separated word, recording every
 * text it is asked to encode. Optionally fails on the n-th encode.
 */
class CountingTokenizerAdapter extends AbstractTokenizerAdapter {
    private final List<String> encoded = Collections.synchronizedList(new ArrayList<>());
    private final int failOnCall;

    CountingTokenizerAdapter() {
        this(-1);
    }

    CountingTokenizerAdapter(int failOnCall) {
        this.failOnCall = failOnCall;
    }

    @Override
    public boolean isExact() {
        return true;
    }

    @Override
    public int countText(String text) {
        if (encoded.size() + 1 == failOnCall) {
            throw new IllegalStateException("encoder crashed");
        }
        encoded.add(text);
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    List<String> encoded() {
        return encoded;
    }

    long encodeCount(String text) {
        return encoded.stream().filter(text::equals).count();
    }
}
