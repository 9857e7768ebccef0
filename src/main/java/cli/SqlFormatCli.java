package cli;

import app.SqlFormatCliApp;

/**
 * CLI entrypoint facade. The orchestration lives in {@link SqlFormatCliApp}.
 *
 * <pre>
 * java -jar sql-gutter-formatter.jar --in=sql/ --out=output/formatted --result=output/format-result.xlsx
 * java -jar sql-gutter-formatter.jar --csv=queries.csv --keywordCase=lower --noResult
 * java -jar sql-gutter-formatter.jar --ast=ast/ --failFast
 * </pre>
 */
public class SqlFormatCli {

    public static void main(String[] args) {
        int code = SqlFormatCliApp.run(args);
        if (code != 0) System.exit(code);
    }
}
