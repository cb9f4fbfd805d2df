package db.embed.cli;

import java.io.PrintStream;
import java.util.List;

import db.embed.query.ExecResult;
import db.embed.storage.Record;

/**
 * Simple ASCII table printer for query result rows.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(ExecResult.RowSet rs) {
        print(rs, System.out);
    }

    public static void print(ExecResult.RowSet rs, PrintStream out) {
        if (rs.rows().isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        List<String> headers = rs.columns();
        int colCount = headers.size();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (Record r : rs.rows()) {
            for (int i = 0; i < colCount; i++) {
                String s = r.get(i).display();
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths));
        out.println(divLine);
        for (Record r : rs.rows()) {
            out.println(buildLine(r.getValues().stream().map(v -> v.display()).toList(), widths));
        }
        out.println(divLine);
        out.println("(" + rs.rows().size() + " row(s))");
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(cells.get(i), widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
