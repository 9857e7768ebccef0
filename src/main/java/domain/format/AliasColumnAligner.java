package domain.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Pads aliased select-list expressions so every {@code AS} starts in the same column.
 */
final class AliasColumnAligner {

    private AliasColumnAligner() {}

    /**
     * @param exprs       rendered expressions, one per column
     * @param aliases     alias per column (null = none)
     * @param startCols   column at which each expression's first line starts
     * @param asKeyword   cased AS keyword
     * @return column texts with " AS alias" appended where an alias exists
     */
    static List<String> align(List<String> exprs, List<String> aliases, List<Integer> startCols, String asKeyword) {
        int target = -1;
        for (int i = 0; i < exprs.size(); i++) {
            if (!hasAlias(aliases.get(i))) continue;
            target = Math.max(target, TextLayout.endColumn(exprs.get(i), startCols.get(i)));
        }

        List<String> out = new ArrayList<>(exprs.size());
        for (int i = 0; i < exprs.size(); i++) {
            String e = exprs.get(i);
            String alias = aliases.get(i);
            if (!hasAlias(alias)) {
                out.add(e);
                continue;
            }
            int pad = target - TextLayout.endColumn(e, startCols.get(i));
            out.add(e + TextLayout.spaces(pad) + " " + asKeyword + " " + alias);
        }
        return out;
    }

    private static boolean hasAlias(String alias) {
        return alias != null && !alias.isBlank();
    }
}
