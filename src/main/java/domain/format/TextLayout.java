package domain.format;

/**
 * Column arithmetic over rendered text blocks.
 */
public final class TextLayout {

    private TextLayout() {}

    public static String spaces(int n) {
        if (n <= 0) return "";
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) sb.append(' ');
        return sb.toString();
    }

    /** Right-aligns {@code s} in a field of {@code width}; longer text is returned as-is. */
    public static String padStart(String s, int width) {
        String t = s == null ? "" : s;
        return spaces(width - t.length()) + t;
    }

    public static boolean containsNewline(String s) {
        if (s == null || s.isEmpty()) return false;
        return s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0;
    }

    public static int lastLineLen(String s) {
        if (s == null) return 0;
        int n = s.length();
        int p = Math.max(s.lastIndexOf('\n'), s.lastIndexOf('\r'));
        return (p < 0) ? n : (n - (p + 1));
    }

    /**
     * Column after the last character of {@code text} when its first line starts at {@code startCol}.
     * Continuation lines already carry absolute indentation.
     */
    public static int endColumn(String text, int startCol) {
        if (containsNewline(text)) return lastLineLen(text);
        return startCol + (text == null ? 0 : text.length());
    }

    /** Prefixes every non-blank line; blank lines become empty. */
    public static String indentLines(String block, String prefix) {
        if (block == null || block.isEmpty()) return "";
        String[] lines = block.split("\n", -1);
        StringBuilder sb = new StringBuilder(block.length() + lines.length * prefix.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            if (!lines[i].isBlank()) sb.append(prefix).append(lines[i]);
        }
        return sb.toString();
    }
}
