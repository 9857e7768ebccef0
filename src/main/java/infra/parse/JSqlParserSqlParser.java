package infra.parse;

import domain.ast.SqlStatement;
import domain.parse.SqlParseException;
import domain.parse.SqlParser;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link SqlParser} backed by JSqlParser.
 */
public final class JSqlParserSqlParser implements SqlParser {

    private static final Logger log = LoggerFactory.getLogger(JSqlParserSqlParser.class);

    @Override
    public List<SqlStatement> parse(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new SqlParseException("empty SQL text");
        }
        Statement stmt;
        try {
            stmt = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException e) {
            log.debug("JSqlParser rejected statement: {}", e.getMessage());
            throw new SqlParseException(firstLine(e.getMessage()), e);
        } catch (RuntimeException e) {
            throw new SqlParseException("parser failure: " + e, e);
        }
        return List.of(new JSqlStatementConverter().convert(stmt));
    }

    private static String firstLine(String message) {
        if (message == null) return "parse failed";
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
