package db.embed.query;

/**
 * Parsed statement. Exactly one of the three supported forms.
 */
public sealed interface Statement permits CreateTableStatement, InsertQuery, SelectQuery {

    /** Whether executing this statement changes the catalog (and needs the write lock). */
    boolean mutates();
}
