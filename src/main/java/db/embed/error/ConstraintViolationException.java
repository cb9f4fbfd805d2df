package db.embed.error;

import db.embed.storage.Value;

public class ConstraintViolationException extends DbException {
    private final String column;
    private final Value value;

    public ConstraintViolationException(String column, Value value) {
        super(ErrorKind.CONSTRAINT_VIOLATION,
            "Unique constraint violation on column '" + column + "' for value " + value);
        this.column = column;
        this.value = value;
    }

    public String column() { return column; }
    public Value value() { return value; }
}
