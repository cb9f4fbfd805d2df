package db.embed.catalog;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import db.embed.error.DbException;

// Immutable data carrier for a table schema. Column order is the row layout.
public record TableSchema(String name, List<ColumnSchema> columns) {

    public TableSchema {
        columns = List.copyOf(columns);
    }

    /**
     * Checks column-name uniqueness and the single-primary-key rule.
     */
    public void validate() {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table '" + name + "' must declare at least one column");
        }
        Set<String> seen = new HashSet<>();
        int primaries = 0;
        for (ColumnSchema col : columns) {
            if (!seen.add(col.name())) throw DbException.duplicateColumn(name, col.name());
            if (col.primaryKey()) primaries++;
        }
        if (primaries > 1) throw DbException.multiplePrimaryKeys(name);
    }

    /** Position of the named column or -1. */
    public int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) return i;
        }
        return -1;
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSchema::name).toList();
    }
}
