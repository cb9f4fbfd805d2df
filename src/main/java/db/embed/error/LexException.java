package db.embed.error;

/** Raised by the lexer on an unterminated string, bad integer or unrecognized character. */
public class LexException extends DbException {
    private final int position;
    private final String found;

    public LexException(int position, String found, String detail) {
        super(ErrorKind.LEX_ERROR, detail + " '" + found + "' at position " + position);
        this.position = position;
        this.found = found;
    }

    public int position() { return position; }
    public String found() { return found; }
}
