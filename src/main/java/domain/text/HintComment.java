package domain.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves an optimizer hint / tag block comment that sits right after the first keyword
 * out of the text before parsing, and back in after rendering.
 *
 * <p>Parsers drop comments, so without this the hint would be lost.</p>
 */
public final class HintComment {

    private static final Pattern HINT_AFTER_FIRST_WORD =
            Pattern.compile("^(\\s*)(\\w+)(\\s*)(/\\*.*?\\*/)(.*)$", Pattern.DOTALL);

    private static final Pattern FIRST_WORD = Pattern.compile("^(\\s*)(\\w+)(\\s+)");

    private HintComment() {}

    /**
     * @return the extraction; {@link Extraction#hint()} is null when no hint is present
     */
    public static Extraction extract(String sql) {
        if (sql == null) return new Extraction("", null);
        Matcher m = HINT_AFTER_FIRST_WORD.matcher(sql);
        if (!m.matches()) return new Extraction(sql, null);
        String cleaned = m.group(1) + m.group(2) + " " + m.group(5);
        return new Extraction(cleaned, m.group(4));
    }

    /**
     * Inserts the hint right after the first word of the rendered text. Text with no leading
     * word followed by whitespace is returned unchanged.
     */
    public static String restore(String rendered, String hint) {
        if (rendered == null || hint == null || hint.isEmpty()) return rendered;
        Matcher m = FIRST_WORD.matcher(rendered);
        if (!m.find()) return rendered;
        return m.group(1) + m.group(2) + " " + hint + m.group(3) + rendered.substring(m.end());
    }

    public record Extraction(String sql, String hint) {
    }
}
