package infra.ast;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Name lookups over the loosely shaped name nodes of the external AST.
 *
 * <p>Every method returns null when the node matches none of the known shapes; callers
 * substitute their sentinel.</p>
 */
final class AstNames {

    static final String UNKNOWN_FUNCTION = "unknown_function";
    static final String UNKNOWN_COLUMN = "unknown_column";
    static final String UNNAMED_CTE = "unnamed_cte";
    static final String UNKNOWN_TABLE = "unknown_table";

    private AstNames() {
    }

    /** {@code "fn"}, {@code {name:[{value:"schema"},{value:"fn"}]}} or {@code {value:"fn"}}. */
    static String functionName(JsonNode name) {
        if (name == null || name.isNull()) return null;
        if (name.isTextual()) return blankToNull(name.asText());
        JsonNode parts = name.get("name");
        if (parts != null && parts.isArray() && parts.size() > 0) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode p : parts) {
                String v = p.isTextual() ? p.asText() : textOrNull(p.get("value"));
                if (v == null) continue;
                if (sb.length() > 0) sb.append('.');
                sb.append(v);
            }
            return blankToNull(sb.toString());
        }
        return blankToNull(textOrNull(name.get("value")));
    }

    /** {@code "col"}, {@code {expr:{value:"col"}}} or {@code {value:"col"}}. */
    static String columnName(JsonNode column) {
        if (column == null || column.isNull()) return null;
        if (column.isTextual()) return blankToNull(column.asText());
        JsonNode expr = column.get("expr");
        if (expr != null && expr.isObject()) {
            String v = textOrNull(expr.get("value"));
            if (v != null) return blankToNull(v);
        }
        return blankToNull(textOrNull(column.get("value")));
    }

    /** {@code {value:"name"}} or {@code "name"}. */
    static String cteName(JsonNode name) {
        if (name == null || name.isNull()) return null;
        if (name.isTextual()) return blankToNull(name.asText());
        return blankToNull(textOrNull(name.get("value")));
    }

    /** {@code db.table} from a from-entry; null when {@code table} is absent. */
    static String tableName(JsonNode from) {
        if (from == null || !from.isObject()) return null;
        String table = plainText(from.get("table"));
        if (table == null) return null;
        String db = plainText(from.get("db"));
        return db == null ? table : db + "." + table;
    }

    /** Alias text; node-sql-parser writes it as a string or as {@code {value}}. */
    static String alias(JsonNode as) {
        return plainText(as);
    }

    static String plainText(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isValueNode()) return blankToNull(n.asText());
        return blankToNull(textOrNull(n.get("value")));
    }

    static String textOrNull(JsonNode n) {
        if (n == null || n.isNull() || !n.isValueNode()) return null;
        return n.asText();
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        return s.isBlank() ? null : s;
    }
}
