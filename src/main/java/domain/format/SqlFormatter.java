package domain.format;

import domain.ast.SqlStatement;
import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.WarningCode;
import domain.parse.SqlParseException;
import domain.parse.SqlParser;
import domain.text.HintComment;
import domain.text.SqlStatementSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Text in, formatted text out.
 * <pre>
 * 1) pull the hint comment after the first keyword
 * 2) split at top-level ';' and parse each statement
 * 3) render each statement (layout picked from its own text)
 * 4) join with ";\n\n", put the hint back, make sure the text ends with ';'
 * </pre>
 * Parse failures and unsupported statement kinds never escape: the original text is returned.
 */
public final class SqlFormatter {

    private static final Logger log = LoggerFactory.getLogger(SqlFormatter.class);

    private final SqlParser parser;
    private final StatementRenderer renderer;

    public SqlFormatter(SqlParser parser, FormatterOptions options) {
        if (parser == null) throw new IllegalArgumentException("parser is null");
        this.parser = parser;
        this.renderer = new StatementRenderer(options);
    }

    public String format(String sql) {
        return formatDetailed(sql, FormatWarningSink.none()).text();
    }

    public String format(String sql, FormatWarningSink warnings) {
        return formatDetailed(sql, warnings).text();
    }

    public FormattedSql formatDetailed(String sql, FormatWarningSink warnings) {
        FormatWarningSink sink = warnings == null ? FormatWarningSink.none() : warnings;
        if (sql == null || sql.isBlank()) {
            return FormattedSql.unchanged(sql, "SQL text is empty");
        }
        try {
            HintComment.Extraction hint = HintComment.extract(sql);
            List<String> texts = SqlStatementSplitter.split(hint.sql());
            if (texts.isEmpty()) throw new SqlParseException("No valid SQL statements found");

            List<String> blocks = new ArrayList<>(texts.size());
            for (String text : texts) {
                SelectLayout layout = SelectLayout.detect(text);
                for (SqlStatement stmt : parser.parse(text)) {
                    blocks.add(renderer.render(stmt, layout, sink));
                }
                log.debug("formatted statement ({} chars, layout={})", text.length(), layout);
            }
            String result = terminate(String.join(";\n\n", blocks));
            if (hint.hint() != null) result = HintComment.restore(result, hint.hint());
            return FormattedSql.ok(result);
        } catch (SqlParseException e) {
            log.warn("SQL parse failed, keeping original text: {}", e.getMessage());
            sink.warn(new FormatWarning(WarningCode.PARSE_FAILED, null, "parse failed", e.getMessage()));
            return FormattedSql.unchanged(sql, e.getMessage());
        } catch (UnsupportedStatementException e) {
            log.warn("{}; keeping original text", e.getMessage());
            sink.warn(new FormatWarning(WarningCode.UNSUPPORTED_STATEMENT, null, e.getMessage(), e.getStatementKind()));
            return FormattedSql.unchanged(sql, e.getMessage());
        }
    }

    /**
     * Renders statements that were parsed elsewhere (e.g. read from AST JSON). Layout follows
     * each statement's own WITH clause.
     */
    public FormattedSql formatStatements(List<SqlStatement> statements, FormatWarningSink warnings) {
        FormatWarningSink sink = warnings == null ? FormatWarningSink.none() : warnings;
        if (statements == null || statements.isEmpty()) {
            return FormattedSql.unchanged("", "no statements");
        }
        try {
            List<String> blocks = new ArrayList<>(statements.size());
            for (SqlStatement stmt : statements) {
                blocks.add(renderer.render(stmt, SelectLayout.of(stmt), sink));
            }
            return FormattedSql.ok(terminate(String.join(";\n\n", blocks)));
        } catch (UnsupportedStatementException e) {
            log.warn("{}; nothing rendered", e.getMessage());
            sink.warn(new FormatWarning(WarningCode.UNSUPPORTED_STATEMENT, null, e.getMessage(), e.getStatementKind()));
            return FormattedSql.unchanged("", e.getMessage());
        }
    }

    private static String terminate(String s) {
        return s.endsWith(";") ? s : s + ";";
    }
}
