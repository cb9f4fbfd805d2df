package db.embed.catalog;

// Immutable data carrier for a table column.
// primaryKey implies uniqueness; a column is "constrained" when either flag is set.
public record ColumnSchema(String name, DataType type, boolean primaryKey, boolean unique) {

    public static ColumnSchema of(String name, DataType type) {
        return new ColumnSchema(name, type, false, false);
    }

    public boolean constrained() {
        return primaryKey || unique;
    }
}
