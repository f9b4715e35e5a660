package im.arun.tokenmap.token;

/**
 * Character-ratio estimate for model families without an open tokenizer (Claude,
 * Gemini, custom). Its "exact" path is the same heuristic, so every count it returns
 * is flagged approximate.
 */
public class HeuristicTokenizerAdapter extends AbstractTokenizerAdapter {

    public HeuristicTokenizerAdapter() {
        super(DEFAULT_CHARS_PER_TOKEN);
    }

    public HeuristicTokenizerAdapter(int charsPerToken) {
        super(charsPerToken);
    }

    @Override
    public boolean isExact() {
        return false;
    }

    @Override
    public int countText(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return approximateFromChars(text.length());
    }
}
