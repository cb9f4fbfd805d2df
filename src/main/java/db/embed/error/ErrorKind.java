package db.embed.error;

/**
 * Categories of failure reported at the statement boundary.
 */
public enum ErrorKind {
    LEX_ERROR,
    PARSE_ERROR,
    UNKNOWN_TABLE,
    UNKNOWN_COLUMN,
    DUPLICATE_TABLE,
    DUPLICATE_COLUMN,
    MULTIPLE_PRIMARY_KEYS,
    ARITY_MISMATCH,
    TYPE_MISMATCH,
    CONSTRAINT_VIOLATION,
    IO_ERROR,
    FORMAT_ERROR;
}
