package db.embed.query;

/**
 * Token categories produced by {@link Lexer}.
 */
public enum TokenType {
    // keywords
    CREATE, TABLE, INSERT, INTO, VALUES, SELECT, FROM, JOIN, ON,
    INT, TEXT, PRIMARY, UNIQUE,

    IDENTIFIER,
    INTEGER_LITERAL,
    STRING_LITERAL,

    // punctuation
    LPAREN, RPAREN, COMMA, STAR, EQUALS, DOT,

    EOF;

    public boolean isKeyword() {
        return ordinal() <= UNIQUE.ordinal();
    }

    /** Human-readable name used in parse error messages. */
    public String describe() {
        return switch (this) {
            case IDENTIFIER -> "identifier";
            case INTEGER_LITERAL -> "integer literal";
            case STRING_LITERAL -> "string literal";
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            case COMMA -> "','";
            case STAR -> "'*'";
            case EQUALS -> "'='";
            case DOT -> "'.'";
            case EOF -> "end of statement";
            default -> name();
        };
    }
}
