package db.embed.query;

import java.util.List;

/**
 * Logical SELECT query representation.
 * columns: empty list means SELECT *; entries may be qualified as table.column.
 * join: null when there is no JOIN clause.
 */
public record SelectQuery(String tableName, List<String> columns, JoinSpec join) implements Statement {

    public SelectQuery {
        columns = List.copyOf(columns);
    }

    public boolean isStar() { return columns.isEmpty(); }

    @Override
    public boolean mutates() { return false; }
}
