package db.embed.query;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import db.embed.error.LexException;

/**
 * Splits statement text into tokens. Whitespace is discarded, keywords are matched
 * case-insensitively, and the result always ends with an EOF token.
 */
public final class Lexer {
    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();
    static {
        for (TokenType t : TokenType.values()) {
            if (t.isKeyword()) KEYWORDS.put(t.name(), t);
        }
    }

    private final String input;
    private int pos;

    private Lexer(String input) {
        this.input = input;
    }

    public static List<Token> tokenize(String input) {
        if (input == null) throw new LexException(0, "null", "Missing statement text");
        return new Lexer(input).run();
    }

    private List<Token> run() {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                out.add(new Token(TokenType.EOF, "", pos));
                return out;
            }
            char ch = input.charAt(pos);
            int start = pos;
            switch (ch) {
                case '(' -> out.add(single(TokenType.LPAREN, start));
                case ')' -> out.add(single(TokenType.RPAREN, start));
                case ',' -> out.add(single(TokenType.COMMA, start));
                case '*' -> out.add(single(TokenType.STAR, start));
                case '=' -> out.add(single(TokenType.EQUALS, start));
                case '.' -> out.add(single(TokenType.DOT, start));
                case '\'' -> out.add(readString());
                default -> {
                    if (isIdentStart(ch)) {
                        out.add(readWord());
                    } else if (isDigit(ch) || (ch == '-' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
                        out.add(readInteger());
                    } else {
                        throw new LexException(start, String.valueOf(ch), "Unrecognized character");
                    }
                }
            }
        }
    }

    private Token single(TokenType type, int start) {
        pos++;
        return new Token(type, input.substring(start, pos), start);
    }

    private Token readWord() {
        int start = pos;
        while (pos < input.length() && isIdentPart(input.charAt(pos))) pos++;
        String word = input.substring(start, pos);
        TokenType kw = KEYWORDS.get(word.toUpperCase(Locale.ROOT));
        return new Token(kw != null ? kw : TokenType.IDENTIFIER, word, start);
    }

    private Token readInteger() {
        int start = pos;
        if (input.charAt(pos) == '-') pos++;
        while (pos < input.length() && isDigit(input.charAt(pos))) pos++;
        // 12abc is not an integer followed by an identifier
        if (pos < input.length() && isIdentStart(input.charAt(pos))) {
            while (pos < input.length() && isIdentPart(input.charAt(pos))) pos++;
            throw new LexException(start, input.substring(start, pos), "Malformed integer literal");
        }
        String text = input.substring(start, pos);
        try {
            return new Token(TokenType.INTEGER_LITERAL, text, start, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new LexException(start, text, "Integer literal out of 64-bit range");
        }
    }

    // Single-quoted; a doubled quote ('') stands for one quote character.
    private Token readString() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            if (ch == '\'') {
                if (pos + 1 < input.length() && input.charAt(pos + 1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING_LITERAL, input.substring(start, pos), start, sb.toString());
            }
            if (Character.isHighSurrogate(ch) && pos + 1 < input.length() && Character.isLowSurrogate(input.charAt(pos + 1))) {
                sb.append(ch).append(input.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (Character.isSurrogate(ch)) {
                throw new LexException(pos, String.format("\\u%04X", (int) ch), "Unpaired surrogate in string literal");
            }
            sb.append(ch);
            pos++;
        }
        throw new LexException(start, input.substring(start), "Unterminated string literal");
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) pos++;
    }

    private static boolean isIdentStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    private static boolean isIdentPart(char ch) {
        return isIdentStart(ch) || isDigit(ch);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
