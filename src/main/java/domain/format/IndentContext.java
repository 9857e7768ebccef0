package domain.format;

/**
 * Immutable position record threaded through every render call.
 *
 * <p>{@code baseKeywordWidth} is fixed per statement group: a main query and all of its CTE
 * bodies share one value, which is what lines their keywords up in one gutter. Only
 * {@link #deriveSubquery(int)} replaces it.</p>
 *
 * <p>The parent link is read-only and used for closing-delimiter columns only.</p>
 */
public final class IndentContext {

    private final int nestLevel;
    private final ContextKind kind;
    private final int baseKeywordWidth;
    private final IndentContext parent;
    private final boolean firstSelect;

    private IndentContext(int nestLevel, ContextKind kind, int baseKeywordWidth, IndentContext parent, boolean firstSelect) {
        this.nestLevel = Math.max(0, nestLevel);
        this.kind = kind == null ? ContextKind.MAIN : kind;
        this.baseKeywordWidth = Math.max(0, baseKeywordWidth);
        this.parent = parent;
        this.firstSelect = firstSelect;
    }

    /** Root context of a statement: nest 0, MAIN, no parent. */
    public static IndentContext root(int baseKeywordWidth) {
        return new IndentContext(0, ContextKind.MAIN, baseKeywordWidth, null, true);
    }

    /** One level deeper, same width (function argument, CASE branch). */
    public IndentContext deriveChild(ContextKind k) {
        return new IndentContext(nestLevel + 1, k, baseKeywordWidth, this, false);
    }

    /** Same level, new role (clause to the expression directly inside it). */
    public IndentContext deriveSibling(ContextKind k) {
        return new IndentContext(nestLevel, k, baseKeywordWidth, parent, false);
    }

    /** Embedded SELECT with its own keyword width. */
    public IndentContext deriveSubquery(int newWidth) {
        return new IndentContext(nestLevel + 1, ContextKind.SUBQUERY, newWidth, this, false);
    }

    /**
     * Column at which content of this context starts.
     * <p>nest 0: width; deeper: width + 2 per level; plus the kind adjustment in both cases.</p>
     */
    public int indentWidth() {
        int base = nestLevel == 0 ? baseKeywordWidth : baseKeywordWidth + nestLevel * 2;
        return base + kind.adjustment();
    }

    /** Column for the delimiter that closes this context's construct. */
    public int closingIndentWidth() {
        if (parent == null) return baseKeywordWidth;
        if (kind == ContextKind.SUBQUERY) return parent.indentWidth() + 1;
        return parent.indentWidth();
    }

    public String indentString() {
        return TextLayout.spaces(indentWidth());
    }

    public String closingIndentString() {
        return TextLayout.spaces(closingIndentWidth());
    }

    /** WHERE or JOIN ... ON condition: compact subquery and vertical IN-list layouts apply. */
    public boolean isConditionContext() {
        return kind == ContextKind.WHERE_CLAUSE || kind == ContextKind.JOIN_CONDITION;
    }

    public int getNestLevel() {
        return nestLevel;
    }

    public ContextKind getKind() {
        return kind;
    }

    public int getBaseKeywordWidth() {
        return baseKeywordWidth;
    }

    public IndentContext getParent() {
        return parent;
    }

    public boolean isFirstSelect() {
        return firstSelect;
    }

    @Override
    public String toString() {
        return "IndentContext{nest=" + nestLevel + ", kind=" + kind + ", width=" + baseKeywordWidth + "}";
    }
}
