package db.embed.error;

/**
 * Base failure raised by the engine. Every statement either completes or throws one of these;
 * the kind tells callers (shell, HTTP layer) how to react without parsing the message.
 */
public class DbException extends RuntimeException {
    private final ErrorKind kind;

    public DbException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DbException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    public static DbException unknownTable(String name) {
        return new DbException(ErrorKind.UNKNOWN_TABLE, "Table '" + name + "' not found");
    }

    public static DbException unknownColumn(String name) {
        return new DbException(ErrorKind.UNKNOWN_COLUMN, "Column '" + name + "' not found");
    }

    public static DbException duplicateTable(String name) {
        return new DbException(ErrorKind.DUPLICATE_TABLE, "Table '" + name + "' already exists");
    }

    public static DbException duplicateColumn(String table, String column) {
        return new DbException(ErrorKind.DUPLICATE_COLUMN,
            "Column '" + column + "' defined more than once in table '" + table + "'");
    }

    public static DbException multiplePrimaryKeys(String table) {
        return new DbException(ErrorKind.MULTIPLE_PRIMARY_KEYS,
            "Table '" + table + "' declares more than one PRIMARY column");
    }

    public static DbException arityMismatch(String table, int expected, int actual) {
        return new DbException(ErrorKind.ARITY_MISMATCH,
            "Arity mismatch for table '" + table + "': expected " + expected + " values, got " + actual);
    }

    public static DbException typeMismatch(String column, Object expected, Object actual) {
        return new DbException(ErrorKind.TYPE_MISMATCH,
            "Type mismatch for column '" + column + "' expected " + expected + ", got " + actual);
    }

    public static DbException io(String message, Throwable cause) {
        return new DbException(ErrorKind.IO_ERROR, message, cause);
    }

    public static DbException format(String message) {
        return new DbException(ErrorKind.FORMAT_ERROR, message);
    }

    public static DbException format(String message, Throwable cause) {
        return new DbException(ErrorKind.FORMAT_ERROR, message, cause);
    }
}
