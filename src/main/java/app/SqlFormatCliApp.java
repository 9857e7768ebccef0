package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.SqlFormatCli;
import domain.ast.SqlStatement;
import domain.format.FormattedSql;
import domain.format.FormatterOptions;
import domain.format.KeywordCase;
import domain.format.SqlFormatter;
import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.ListFormatWarningSink;
import domain.model.SourceWarningSink;
import domain.model.WarningCode;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.parse.SqlParseException;
import domain.text.SqlSource;
import domain.text.SqlSourceKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Batch formatting run (invoked by {@link SqlFormatCli}). */
public final class SqlFormatCliApp {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_BAD_ARGS = 2;

    private static final String DEFAULT_OUT = "output/formatted";
    private static final String DEFAULT_RESULT = "output/format-result.xlsx";

    private SqlFormatCliApp() {}

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    /**
     * @return {@link #EXIT_OK}, {@link #EXIT_FAILED} when --failFast stopped the run, or
     *         {@link #EXIT_BAD_ARGS} for missing/invalid input options
     */
    public static int run(String[] args) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        // ------------------------------------------------------------
        // input (exactly one of --in / --csv / --ast)
        // ------------------------------------------------------------
        String inRaw = CliArgParser.option(argv, "in", null);
        String csvRaw = CliArgParser.option(argv, "csv", null);
        String astRaw = CliArgParser.option(argv, "ast", null);

        int given = (inRaw != null ? 1 : 0) + (csvRaw != null ? 1 : 0) + (astRaw != null ? 1 : 0);
        if (given != 1) {
            System.out.println("[ERROR] specify exactly one input: --in=<.sql file|dir> | --csv=<file.csv> | --ast=<.json file|dir>");
            return EXIT_BAD_ARGS;
        }

        SqlSourceKind kind;
        String inputRaw;
        if (inRaw != null) {
            kind = SqlSourceKind.FILE;
            inputRaw = inRaw;
        } else if (csvRaw != null) {
            kind = SqlSourceKind.CSV;
            inputRaw = csvRaw;
        } else {
            kind = SqlSourceKind.AST_JSON;
            inputRaw = astRaw;
        }
        Path input = CliPathResolver.resolvePath(baseDir, inputRaw);

        Path outputSqlDir = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "out", DEFAULT_OUT));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "result", DEFAULT_RESULT));

        KeywordCase keywordCase = KeywordCase.parse(CliArgParser.option(argv, "keywordCase", "upper"));
        int maxDepth = CliArgParser.parseInt(CliArgParser.option(argv, "maxDepth", null),
                FormatterOptions.DEFAULT_MAX_NESTING_DEPTH);
        int max = CliArgParser.parseInt(CliArgParser.option(argv, "max", null), -1);
        int logEvery = Math.max(1, CliArgParser.parseInt(CliArgParser.option(argv, "logEvery", null), 100));
        long slowMs = CliArgParser.parseLong(CliArgParser.option(argv, "slowMs", null), 500L);

        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean noSqlOut = CliArgParser.flag(argv, "noSqlOut") || CliArgParser.flag(argv, "noOut");
        boolean noResult = CliArgParser.flag(argv, "noResult") || CliArgParser.flag(argv, "noXlsx");

        FormatterOptions options = FormatterOptions.defaults()
                .withKeywordCase(keywordCase)
                .withMaxNestingDepth(maxDepth);

        System.out.println("==================================================");
        System.out.println("[START] SQL gutter formatting");
        System.out.println("[CONF] baseDir      = " + baseDir);
        System.out.println("[CONF] input        = " + input + " (" + kind + ")");
        System.out.println("[CONF] out          = " + outputSqlDir);
        System.out.println("[CONF] result       = " + resultXlsx);
        System.out.println("[CONF] keywordCase  = " + keywordCase);
        System.out.println("[CONF] maxDepth     = " + maxDepth);
        System.out.println("[CONF] max          = " + max);
        System.out.println("[CONF] logEvery     = " + logEvery);
        System.out.println("[CONF] slowMs       = " + slowMs);
        System.out.println("[CONF] failFast     = " + failFast);
        System.out.println("[CONF] enableSqlOut = " + (!noSqlOut) + " (use --noSqlOut)");
        System.out.println("[CONF] enableResult = " + (!noResult) + " (use --noResult)");
        System.out.println("==================================================");

        SqlFormatComponentsFactory factory = new SqlFormatComponentsFactory();

        List<SqlSource> sources;
        try {
            CliPathResolver.validateExists(input, "input");
            long tLoad0 = System.nanoTime();
            sources = factory.createSourceLoader(kind).load(input);
            System.out.println("[LOAD] sources=" + sources.size() + ", elapsed=" + ms(tLoad0) + "ms");
        } catch (IllegalArgumentException e) {
            System.out.println("[ERROR] " + e.getMessage());
            return EXIT_BAD_ARGS;
        }

        if (max > 0 && sources.size() > max) {
            sources = sources.subList(0, max);
            System.out.println("[LOAD] apply max => truncated to " + sources.size());
        }

        if (!noSqlOut) CliPathResolver.mkdirs(outputSqlDir);
        if (!noResult && resultXlsx.getParent() != null) CliPathResolver.mkdirs(resultXlsx.getParent());

        List<FormatWarning> warnings = new ArrayList<>(128);
        ListFormatWarningSink warningSink = new ListFormatWarningSink(warnings);

        SqlFormatter formatter = factory.createFormatter(options);
        SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(!noSqlOut);
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        int total = sources.size();
        CliProgressMonitor progress = CliProgressMonitor.start(total);

        long tLoop0 = System.nanoTime();
        System.out.println("[STEP] formatting start. total=" + total);

        List<FormatResult> results = new ArrayList<>(Math.max(16, total));
        int formattedCount = 0;
        int unchanged = 0;
        int skip = 0;
        boolean stopped = false;

        try {
            for (int i = 0; i < total; i++) {
                SqlSource src = sources.get(i);
                String key = src.getId();
                progress.setCurrent(key, i + 1);

                SourceWarningSink sink = new SourceWarningSink(warningSink, src.getId());
                long one0 = System.nanoTime();

                if (src.isBlank()) {
                    skip++;
                    sink.warn(FormatWarning.of(WarningCode.SQL_TEXT_EMPTY, src.getId(), "SQL text empty"));
                    results.add(result(FormatResult.STATUS_SKIP, src, "SQL_TEXT_EMPTY", sink, one0, null));
                    logProgressIfDue(progress, i, total, logEvery, formattedCount, unchanged, skip);
                    continue;
                }

                String status;
                try {
                    FormattedSql out = formatOne(factory, formatter, src, sink);
                    if (out.formatted()) {
                        formattedCount++;
                        status = FormatResult.STATUS_FORMATTED;
                        results.add(result(status, src, "", sink, one0, null));
                    } else {
                        unchanged++;
                        status = FormatResult.STATUS_UNCHANGED;
                        results.add(result(status, src, "kept original text", sink, one0, out.failureReason()));
                    }
                    if (out.text() != null && !out.text().isBlank()) {
                        sqlOutputWriter.write(outputSqlDir, src.getId(), out.text());
                    }
                } catch (RuntimeException e) {
                    skip++;
                    status = FormatResult.STATUS_ERROR;
                    sink.warn(new FormatWarning(WarningCode.FORMAT_ERROR, src.getId(),
                            e.getClass().getSimpleName(), safe(e.getMessage())));
                    results.add(result(status, src, e.getClass().getSimpleName(), sink, one0, e.getMessage()));

                    System.out.println("[ERROR] format/write failed: " + key);
                    System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
                }

                long oneMs = ms(one0);
                if (oneMs >= slowMs) {
                    System.out.println("[SLOW] " + oneMs + "ms : " + key);
                    sink.warn(new FormatWarning(WarningCode.SLOW_SQL, src.getId(),
                            "slowMs=" + slowMs + ", actualMs=" + oneMs, ""));
                }

                logProgressIfDue(progress, i, total, logEvery, formattedCount, unchanged, skip);

                if (failFast && !FormatResult.STATUS_FORMATTED.equals(status)) {
                    System.out.println("[FAILFAST] stop on first source that did not format: " + key);
                    stopped = true;
                    break;
                }
            }
        } finally {
            progress.close();
        }

        System.out.println("[STEP] formatting done. elapsed=" + ms(tLoop0) + "ms");
        System.out.println("[STAT] formatted=" + formattedCount + ", unchanged=" + unchanged + ", skip=" + skip);
        System.out.println("[STAT] warnings=" + warnings.size() + " " + warningSink.countsByCode());
        for (FormatWarning w : warnings) {
            if (w.getCode() == WarningCode.PARSE_FAILED || w.getCode() == WarningCode.FORMAT_ERROR) {
                System.out.println("[WARN] " + w.getCode() + " " + w.getSourceId() + " : " + w.getDetail());
            }
        }

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP] writing result xlsx... rows=" + results.size());
            resultWriter.write(resultXlsx, results, warnings);
            System.out.println("[STEP] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            System.out.println("[STEP] result xlsx skipped (--noResult). rows=" + results.size());
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return stopped ? EXIT_FAILED : EXIT_OK;
    }

    private static FormattedSql formatOne(SqlFormatComponentsFactory factory, SqlFormatter formatter,
                                          SqlSource src, FormatWarningSink sink) {
        if (src.getKind() != SqlSourceKind.AST_JSON) {
            return formatter.formatDetailed(src.getText(), sink);
        }
        List<SqlStatement> statements;
        try {
            statements = factory.createAstReader(sink).read(src.getText());
        } catch (SqlParseException e) {
            sink.warn(new FormatWarning(WarningCode.PARSE_FAILED, src.getId(), "AST JSON rejected", e.getMessage()));
            return new FormattedSql("", false, e.getMessage());
        }
        return formatter.formatStatements(statements, sink);
    }

    private static FormatResult result(String status, SqlSource src, String message,
                                       SourceWarningSink sink, long startNs, String detail) {
        return new FormatResult(status, src.getId(), src.getKind().name(), src.getOrigin(), message,
                sink.getCount(), ms(startNs), detail);
    }

    private static void logProgressIfDue(CliProgressMonitor progress, int i, int total, int logEvery,
                                         int formatted, int unchanged, int skip) {
        if ((i + 1) % logEvery == 0 || (i + 1) == total) {
            progress.logProgress(i + 1, formatted, unchanged, skip);
        }
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
