package app;

import domain.format.FormatterOptions;
import domain.format.SqlFormatter;
import domain.model.FormatWarningSink;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.text.SqlSourceKind;
import domain.text.SqlSourceLoader;
import infra.ast.JsonAstReader;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.XlsxResultWriter;
import infra.parse.JSqlParserSqlParser;
import infra.text.AstJsonSourceLoader;
import infra.text.CsvSqlSourceLoader;
import infra.text.SqlFileSourceLoader;

/**
 * Object-assembly factory for {@link SqlFormatCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; disabled outputs get no-op writers.
 */
final class SqlFormatComponentsFactory {

    SqlSourceLoader createSourceLoader(SqlSourceKind kind) {
        if (kind == null) kind = SqlSourceKind.FILE;

        return switch (kind) {
            case FILE -> new SqlFileSourceLoader();
            case CSV -> new CsvSqlSourceLoader();
            case AST_JSON -> new AstJsonSourceLoader();
        };
    }

    SqlFormatter createFormatter(FormatterOptions options) {
        return new SqlFormatter(new JSqlParserSqlParser(), options);
    }

    JsonAstReader createAstReader(FormatWarningSink sink) {
        return new JsonAstReader(sink);
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter();
    }
}
