package db.embed.query;

import db.embed.catalog.ColumnSchema;
import db.embed.catalog.DataType;

/** One column clause of CREATE TABLE. */
public record ColumnDefinition(String name, DataType type, boolean primaryKey, boolean unique) {

    public ColumnSchema toSchema() {
        return new ColumnSchema(name, type, primaryKey, unique);
    }
}
