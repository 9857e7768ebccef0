package domain.ast;

/**
 * One ORDER BY entry (statement level or inside a window spec).
 *
 * @param direction null when the source did not spell ASC/DESC
 */
public record OrderItem(SqlExpr expr, Direction direction) {

    public enum Direction {
        ASC, DESC;

        /** Lenient parse: anything other than asc/desc (case-insensitive) yields null. */
        public static Direction parse(String s) {
            if (s == null) return null;
            String t = s.trim();
            if (t.equalsIgnoreCase("ASC")) return ASC;
            if (t.equalsIgnoreCase("DESC")) return DESC;
            return null;
        }
    }
}
