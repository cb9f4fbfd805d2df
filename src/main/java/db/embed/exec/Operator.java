package db.embed.exec;

import java.util.List;

/**
 * Minimal physical operator interface
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /**
     * Output column labels, in row order. Available before {@link #open()}.
     */
    List<String> columns();
}
