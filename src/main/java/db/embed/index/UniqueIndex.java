package db.embed.index;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import db.embed.storage.Value;

/**
 * Set of values already used in one PRIMARY/UNIQUE column. Purely a membership cache over the
 * table rows: it is rebuilt from rows on load and never written to disk.
 */
public class UniqueIndex {
    private final String columnName;
    private final int columnIndex;
    private final Set<Value> values = new HashSet<>();

    public UniqueIndex(String columnName, int columnIndex) {
        this.columnName = columnName;
        this.columnIndex = columnIndex;
    }

    public String columnName() { return columnName; }

    public int columnIndex() { return columnIndex; }

    public boolean contains(Value value) {
        return values.contains(value);
    }

    // Returns false if the value was already present.
    public boolean add(Value value) {
        return values.add(value);
    }

    public void remove(Value value) {
        values.remove(value);
    }

    public void clear() {
        values.clear();
    }

    public int size() {
        return values.size();
    }

    public Set<Value> values() {
        return Collections.unmodifiableSet(values);
    }
}
