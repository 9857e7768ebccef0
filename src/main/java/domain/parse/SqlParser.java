package domain.parse;

import domain.ast.SqlStatement;

import java.util.List;

/**
 * Port to an external SQL parser.
 */
public interface SqlParser {

    /**
     * @param sql one statement without its terminator
     * @throws SqlParseException when the text is not valid SQL for the parser
     */
    List<SqlStatement> parse(String sql);
}
