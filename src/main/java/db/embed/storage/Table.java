package db.embed.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import db.embed.catalog.ColumnSchema;
import db.embed.catalog.TableSchema;
import db.embed.error.ConstraintViolationException;
import db.embed.error.DbException;
import db.embed.index.UniqueIndex;

/**
 * In-memory row store for one table: rows in insertion order plus one {@link UniqueIndex}
 * per PRIMARY/UNIQUE column. The indexes always hold exactly the values present in the rows.
 */
public class Table {
    private final TableSchema schema;
    private final List<Record> rows = new ArrayList<>();
    private final List<UniqueIndex> indexes = new ArrayList<>();

    public Table(TableSchema schema) {
        this.schema = schema;
        List<ColumnSchema> cols = schema.columns();
        for (int i = 0; i < cols.size(); i++) {
            if (cols.get(i).constrained()) indexes.add(new UniqueIndex(cols.get(i).name(), i));
        }
    }

    public String name() { return schema.name(); }

    public TableSchema schema() { return schema; }

    public List<Record> rows() { return Collections.unmodifiableList(rows); }

    public int rowCount() { return rows.size(); }

    public List<UniqueIndex> indexes() { return Collections.unmodifiableList(indexes); }

    /**
     * Validates and appends a row. Either the row and all its index entries are added, or
     * nothing changes.
     */
    public void insert(Record record) {
        checkShape(record);
        for (UniqueIndex index : indexes) {
            Value v = record.get(index.columnIndex());
            if (index.contains(v)) throw new ConstraintViolationException(index.columnName(), v);
        }
        for (UniqueIndex index : indexes) {
            index.add(record.get(index.columnIndex()));
        }
        rows.add(record);
    }

    /**
     * Undoes the most recent {@link #insert(Record)} after a failed persistence write.
     */
    public void rollbackInsert(Record record) {
        if (rows.isEmpty() || !rows.get(rows.size() - 1).equals(record)) {
            throw new IllegalStateException("Rollback target is not the last row of table " + name());
        }
        rows.remove(rows.size() - 1);
        for (UniqueIndex index : indexes) {
            index.remove(record.get(index.columnIndex()));
        }
    }

    /**
     * Repopulates every index with one scan over the rows. This is the only path that fills an
     * index from existing data. Fails if the rows themselves violate a constraint.
     */
    public void rebuildIndexes() {
        for (UniqueIndex index : indexes) index.clear();
        for (Record row : rows) {
            for (UniqueIndex index : indexes) {
                Value v = row.get(index.columnIndex());
                if (!index.add(v)) throw new ConstraintViolationException(index.columnName(), v);
            }
        }
    }

    /** Appends a row read from storage without touching indexes; call {@link #rebuildIndexes()} afterwards. */
    void loadRow(Record record) {
        checkShape(record);
        rows.add(record);
    }

    private void checkShape(Record record) {
        List<ColumnSchema> cols = schema.columns();
        if (record.size() != cols.size()) {
            throw DbException.arityMismatch(name(), cols.size(), record.size());
        }
        for (int i = 0; i < cols.size(); i++) {
            ColumnSchema col = cols.get(i);
            Value v = record.get(i);
            if (v.type() != col.type()) throw DbException.typeMismatch(col.name(), col.type(), v.type());
        }
    }
}
