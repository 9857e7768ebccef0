package domain.format;

/**
 * Immutable formatter settings.
 */
public final class FormatterOptions {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 200;

    private static final FormatterOptions DEFAULTS = new FormatterOptions(KeywordCase.UPPER, DEFAULT_MAX_NESTING_DEPTH);

    private final KeywordCase keywordCase;
    private final int maxNestingDepth;

    public FormatterOptions(KeywordCase keywordCase, int maxNestingDepth) {
        this.keywordCase = keywordCase == null ? KeywordCase.UPPER : keywordCase;
        this.maxNestingDepth = maxNestingDepth <= 0 ? DEFAULT_MAX_NESTING_DEPTH : maxNestingDepth;
    }

    public static FormatterOptions defaults() {
        return DEFAULTS;
    }

    public FormatterOptions withKeywordCase(KeywordCase kc) {
        return new FormatterOptions(kc, maxNestingDepth);
    }

    public FormatterOptions withMaxNestingDepth(int depth) {
        return new FormatterOptions(keywordCase, depth);
    }

    public KeywordCase getKeywordCase() {
        return keywordCase;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }
}
