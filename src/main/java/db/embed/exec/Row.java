package db.embed.exec;

import java.util.List;

import db.embed.storage.Record;
import db.embed.storage.Value;

/**
 * Row is an execution pipeline unit: the values plus the column labels they line up with.
 */
public class Row {
    private final Record record;
    private final List<String> columns;

    public static Row of(Record record, List<String> columns) { return new Row(record, columns); }

    public Row(Record record, List<String> columns) {
        this.record = record;
        this.columns = columns;
    }

    public Record record() { return record; }
    public List<Value> values() { return record.getValues(); }
    public List<String> columns() { return columns; }

    @Override
    public String toString() {
        return "Row" + values();
    }
}
