package db.embed.storage;

import java.util.Objects;

import db.embed.catalog.DataType;

public record TextValue(String value) implements Value {

    public TextValue {
        Objects.requireNonNull(value, "text value");
    }

    @Override
    public DataType type() { return DataType.TEXT; }

    @Override
    public String display() { return value; }

    // SQL literal form, quotes doubled
    @Override
    public String toString() { return "'" + value.replace("'", "''") + "'"; }
}
