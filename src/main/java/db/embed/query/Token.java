package db.embed.query;

/**
 * One lexeme. {@code position} is the 0-based character offset into the statement text;
 * {@code literal} is the decoded value for integer and string literals, otherwise null.
 */
public record Token(TokenType type, String text, int position, Object literal) {

    public Token(TokenType type, String text, int position) {
        this(type, text, position, null);
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "<EOF>" : type + "(" + text + ")@" + position;
    }
}
