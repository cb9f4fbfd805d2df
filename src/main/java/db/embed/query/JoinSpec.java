package db.embed.query;

/**
 * Logical INNER JOIN clause: left table is SelectQuery.tableName, right table defined here.
 * Supports single equality predicate: leftColumn (in the left table) = rightColumn (in the right table).
 */
public record JoinSpec(String rightTable, String leftColumn, String rightColumn) {}
