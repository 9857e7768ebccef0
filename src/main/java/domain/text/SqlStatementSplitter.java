package domain.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Splits a script into statements at top-level semicolons, ignoring strings/comments. */
public final class SqlStatementSplitter {
    private SqlStatementSplitter() {}

    /**
     * @return trimmed statement texts without their terminators; blank pieces are dropped
     */
    public static List<String> split(String script) {
        List<String> out = new ArrayList<>();
        if (script == null || script.isEmpty()) return out;

        StringBuilder cur = new StringBuilder();
        SqlScan st = new SqlScan(script);
        int depth = 0;

        while (st.hasNext()) {
            String atomic = st.readAtomic();
            if (atomic != null) {
                cur.append(atomic);
                continue;
            }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);

            if (ch == ';' && depth == 0) {
                addIfMeaningful(out, cur);
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        addIfMeaningful(out, cur);
        return out;
    }

    /**
     * First word of the text after leading whitespace/comments, upper-cased; "" if none.
     * A leading '(' yields "(".
     */
    public static String leadingKeyword(String sql) {
        SqlScan st = new SqlScan(sql);
        st.skipTrivia();
        if (st.peek() == '(') return "(";
        return st.readWord().toUpperCase(Locale.ROOT);
    }

    private static void addIfMeaningful(List<String> out, StringBuilder cur) {
        String t = cur.toString().trim();
        if (t.isEmpty()) return;
        // comment-only tail (e.g. "-- end") is not a statement
        if (!hasCode(t)) return;
        out.add(t);
    }

    private static boolean hasCode(String t) {
        SqlScan st = new SqlScan(t);
        st.skipTrivia();
        return st.hasNext();
    }
}
