package db.embed.query;

import java.util.List;

import db.embed.storage.Record;

/**
 * Outcome of one successfully executed statement.
 */
public sealed interface ExecResult permits ExecResult.TableCreated, ExecResult.RowInserted, ExecResult.RowSet {

    /** One-line summary for shells and logs. */
    String message();

    record TableCreated(String table) implements ExecResult {
        @Override
        public String message() { return "Table '" + table + "' created"; }
    }

    record RowInserted(String table) implements ExecResult {
        @Override
        public String message() { return "1 row inserted."; }
    }

    /** Projected rows in result order; {@code columns} labels each position. */
    record RowSet(List<String> columns, List<Record> rows) implements ExecResult {
        public RowSet {
            columns = List.copyOf(columns);
            rows = List.copyOf(rows);
        }

        public int size() { return rows.size(); }

        @Override
        public String message() { return "(" + rows.size() + " row(s))"; }
    }
}
