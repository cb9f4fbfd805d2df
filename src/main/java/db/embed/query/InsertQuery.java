package db.embed.query;

import java.util.List;

import db.embed.storage.Value;

/** Logical representation of an INSERT statement; values are in schema order. */
public record InsertQuery(String tableName, List<Value> values) implements Statement {

    public InsertQuery {
        values = List.copyOf(values);
    }

    @Override
    public boolean mutates() { return true; }
}
