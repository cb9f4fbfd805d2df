package db.embed.error;

/**
 * First grammar mismatch found by the parser. {@code expected} names a token category
 * (e.g. "TABLE", "identifier", "'('"), {@code found} is the offending lexeme.
 */
public class ParseException extends DbException {
    private final String expected;
    private final String found;
    private final int position;

    public ParseException(String expected, String found, int position, String message) {
        super(ErrorKind.PARSE_ERROR, message);
        this.expected = expected;
        this.found = found;
        this.position = position;
    }

    public String expected() { return expected; }
    public String found() { return found; }
    public int position() { return position; }
}
