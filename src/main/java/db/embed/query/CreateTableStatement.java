package db.embed.query;

import java.util.List;

import db.embed.catalog.TableSchema;

/** Logical representation of CREATE TABLE. */
public record CreateTableStatement(String tableName, List<ColumnDefinition> columns) implements Statement {

    public CreateTableStatement {
        columns = List.copyOf(columns);
    }

    public TableSchema toSchema() {
        return new TableSchema(tableName, columns.stream().map(ColumnDefinition::toSchema).toList());
    }

    @Override
    public boolean mutates() { return true; }
}
