package db.embed.exec;

import java.util.ArrayList;
import java.util.List;

import db.embed.error.DbException;
import db.embed.error.ErrorKind;
import db.embed.storage.Record;
import db.embed.storage.Value;

/**
 * Projection operator: selects a subset of columns from child rows, in the requested order.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final int[] columnIndexes; // indices to keep in output order
    private final List<String> projectedColumns;

    public ProjectionOperator(Operator child, int[] columnIndexes) {
        this.child = child;
        this.columnIndexes = columnIndexes;
        List<String> childCols = child.columns();
        List<String> cols = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) cols.add(childCols.get(idx));
        this.projectedColumns = List.copyOf(cols);
    }

    /**
     * Build a ProjectionOperator by resolving column names against the child's labels.
     * A name matches a label exactly, or the part after the dot of a qualified label; a bare
     * name that matches more than one qualified label is ambiguous.
     */
    public static ProjectionOperator forColumnNames(Operator child, List<String> columnNames) {
        if (columnNames == null || columnNames.isEmpty()) throw new IllegalArgumentException("columnNames must be non-empty");
        List<String> childCols = child.columns();
        int[] idxs = new int[columnNames.size()];
        for (int i = 0; i < columnNames.size(); i++) {
            idxs[i] = resolve(childCols, columnNames.get(i));
        }
        return new ProjectionOperator(child, idxs);
    }

    static int resolve(List<String> labels, String name) {
        int exact = labels.indexOf(name);
        if (exact >= 0) return exact;
        int found = -1;
        for (int j = 0; j < labels.size(); j++) {
            String label = labels.get(j);
            int dot = label.lastIndexOf('.');
            if (dot >= 0 && label.substring(dot + 1).equals(name)) {
                if (found >= 0) {
                    throw new DbException(ErrorKind.UNKNOWN_COLUMN, "Column '" + name + "' is ambiguous; qualify it as table.column");
                }
                found = j;
            }
        }
        if (found < 0) throw DbException.unknownColumn(name);
        return found;
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        List<Value> src = r.values();
        List<Value> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) {
            projected.add(src.get(idx));
        }
        return Row.of(new Record(projected), projectedColumns);
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<String> columns() { return projectedColumns; }
}
