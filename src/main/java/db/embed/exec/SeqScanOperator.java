package db.embed.exec;

import java.util.Iterator;
import java.util.List;

import db.embed.storage.Record;
import db.embed.storage.Table;

/**
 * Physical operator that performs a full table scan in insertion order.
 * When {@code qualified} is set the output labels are {@code table.column}, which is how
 * joined tables keep same-named columns apart.
 */
public class SeqScanOperator implements Operator {
    private final Table table;
    private final List<String> columns;

    private Iterator<Record> cursor;
    private boolean opened;

    public SeqScanOperator(Table table) {
        this(table, false);
    }

    public SeqScanOperator(Table table, boolean qualified) {
        this.table = table;
        this.columns = qualified
            ? table.schema().columnNames().stream().map(c -> table.name() + "." + c).toList()
            : table.schema().columnNames();
    }

    @Override
    public void open() {
        cursor = table.rows().iterator();
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened || !cursor.hasNext()) return null;
        return Row.of(cursor.next(), columns);
    }

    @Override
    public void close() {
        opened = false;
        cursor = null;
    }

    @Override
    public List<String> columns() { return columns; }
}
