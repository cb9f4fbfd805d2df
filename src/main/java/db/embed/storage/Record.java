package db.embed.storage;

import java.util.List;

/**
 * Immutable row payload: values positionally aligned with the owning table's columns.
 */
public final class Record {
    private final List<Value> values;

    public Record(List<Value> values) {
        this.values = List.copyOf(values);
    }

    public static Record of(Value... values) {
        return new Record(List.of(values));
    }

    public List<Value> getValues() {
        return values;
    }

    public Value get(int position) {
        return values.get(position);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
