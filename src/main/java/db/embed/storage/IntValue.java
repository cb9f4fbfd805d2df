package db.embed.storage;

import db.embed.catalog.DataType;

public record IntValue(long value) implements Value {

    @Override
    public DataType type() { return DataType.INT; }

    @Override
    public String display() { return Long.toString(value); }

    @Override
    public String toString() { return Long.toString(value); }
}
