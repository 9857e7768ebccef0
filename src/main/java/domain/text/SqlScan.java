package domain.text;

/**
 * Character cursor over raw SQL text that knows how to step over comments and quoted tokens.
 */
final class SqlScan {
    final String s;
    int pos = 0;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    String readWord() {
        int start = pos;
        while (pos < s.length() && isWordChar(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    String readSpaces() {
        int start = pos;
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    boolean peekIsSingleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '\'';
    }

    boolean peekIsDoubleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '"';
    }

    boolean peekIsBacktickQuoted() {
        return pos < s.length() && s.charAt(pos) == '`';
    }

    String readLineComment() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\n') break;
        }
        return s.substring(start, pos);
    }

    String readBlockComment() {
        int start = pos;
        pos += 2; // /*
        while (pos + 1 < s.length()) {
            if (s.charAt(pos) == '*' && s.charAt(pos + 1) == '/') {
                pos += 2;
                return s.substring(start, pos);
            }
            pos++;
        }
        pos = s.length();
        return s.substring(start, pos);
    }

    String readSingleQuotedString() {
        int start = pos;
        pos++; // '
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\'') {
                // escaped ''
                if (pos < s.length() && s.charAt(pos) == '\'') {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }

    String readDoubleQuotedString() {
        return readQuoted('"');
    }

    String readBacktickQuoted() {
        return readQuoted('`');
    }

    private String readQuoted(char q) {
        int start = pos;
        pos++;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == q) break;
        }
        return s.substring(start, pos);
    }

    /**
     * Reads whatever atomic token starts at the cursor (comment, quoted string/identifier).
     *
     * @return the token, or null when the cursor is on a plain character
     */
    String readAtomic() {
        if (peekIsLineComment()) return readLineComment();
        if (peekIsBlockComment()) return readBlockComment();
        if (peekIsSingleQuotedString()) return readSingleQuotedString();
        if (peekIsDoubleQuotedString()) return readDoubleQuotedString();
        if (peekIsBacktickQuoted()) return readBacktickQuoted();
        return null;
    }

    /** Skips whitespace and comments. */
    void skipTrivia() {
        while (hasNext()) {
            if (Character.isWhitespace(peek())) {
                readSpaces();
                continue;
            }
            if (peekIsLineComment()) {
                readLineComment();
                continue;
            }
            if (peekIsBlockComment()) {
                readBlockComment();
                continue;
            }
            break;
        }
    }
}
