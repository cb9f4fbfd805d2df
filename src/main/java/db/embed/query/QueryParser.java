package db.embed.query;

import java.util.ArrayList;
import java.util.List;

import db.embed.catalog.DataType;
import db.embed.error.ParseException;
import db.embed.storage.IntValue;
import db.embed.storage.TextValue;
import db.embed.storage.Value;

/**
 * Recursive-descent parser for the supported statements:
 * <pre>
 *   CREATE TABLE name ( col INT|TEXT [PRIMARY [KEY] | UNIQUE] , ... )
 *   INSERT INTO name VALUES ( literal , ... )
 *   SELECT * | col[, ...] FROM name [JOIN other ON leftCol = rightCol]
 * </pre>
 * Stops at the first mismatch with a {@link ParseException}. No catalog lookups happen here;
 * arity, type and name resolution belong to the executor.
 */
public class QueryParser {

    public Statement parse(String sql) {
        return parse(Lexer.tokenize(sql));
    }

    public Statement parse(List<Token> tokens) {
        return new Cursor(tokens).statement();
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int i;

        Cursor(List<Token> tokens) {
            if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
                throw new IllegalArgumentException("token list must end with EOF");
            }
            this.tokens = tokens;
        }

        Statement statement() {
            Token first = peek();
            Statement stmt = switch (first.type()) {
                case CREATE -> createTable();
                case INSERT -> insert();
                case SELECT -> select();
                default -> throw error("CREATE, INSERT or SELECT", first, null);
            };
            expect(TokenType.EOF, null);
            return stmt;
        }

        // CREATE TABLE ident '(' ColumnDef (',' ColumnDef)* ')'
        private Statement createTable() {
            expect(TokenType.CREATE, null);
            expect(TokenType.TABLE, "CREATE");
            String name = identifier("TABLE");
            expect(TokenType.LPAREN, "table name");
            List<ColumnDefinition> columns = new ArrayList<>();
            columns.add(columnDef());
            while (accept(TokenType.COMMA)) {
                columns.add(columnDef());
            }
            expect(TokenType.RPAREN, "column definition");
            return new CreateTableStatement(name, columns);
        }

        private ColumnDefinition columnDef() {
            String name = identifier(null);
            DataType type;
            Token t = peek();
            if (t.is(TokenType.INT)) {
                type = DataType.INT;
            } else if (t.is(TokenType.TEXT)) {
                type = DataType.TEXT;
            } else {
                throw error("INT or TEXT", t, "column name");
            }
            advance();
            boolean primary = false;
            boolean unique = false;
            if (accept(TokenType.PRIMARY)) {
                primary = true;
                // KEY is only a keyword here, so a column may still be called key
                if (peek().is(TokenType.IDENTIFIER) && peek().text().equalsIgnoreCase("KEY")) advance();
            } else if (accept(TokenType.UNIQUE)) {
                unique = true;
            }
            return new ColumnDefinition(name, type, primary, unique);
        }

        // INSERT INTO ident VALUES '(' Literal (',' Literal)* ')'
        private Statement insert() {
            expect(TokenType.INSERT, null);
            expect(TokenType.INTO, "INSERT");
            String name = identifier("INTO");
            expect(TokenType.VALUES, "table name");
            expect(TokenType.LPAREN, "VALUES");
            List<Value> values = new ArrayList<>();
            values.add(literal());
            while (accept(TokenType.COMMA)) {
                values.add(literal());
            }
            expect(TokenType.RPAREN, "value");
            return new InsertQuery(name, values);
        }

        private Value literal() {
            Token t = peek();
            if (t.is(TokenType.INTEGER_LITERAL)) {
                advance();
                return new IntValue((Long) t.literal());
            }
            if (t.is(TokenType.STRING_LITERAL)) {
                advance();
                return new TextValue((String) t.literal());
            }
            throw error("integer or string literal", t, null);
        }

        // SELECT ('*' | ColumnRef (',' ColumnRef)*) FROM ident (JOIN ident ON ident '=' ident)?
        private Statement select() {
            expect(TokenType.SELECT, null);
            List<String> columns = new ArrayList<>();
            if (!accept(TokenType.STAR)) {
                columns.add(columnRef());
                while (accept(TokenType.COMMA)) {
                    columns.add(columnRef());
                }
            }
            expect(TokenType.FROM, columns.isEmpty() ? "'*'" : "column list");
            String table = identifier("FROM");
            JoinSpec join = null;
            if (accept(TokenType.JOIN)) {
                String right = identifier("JOIN");
                expect(TokenType.ON, "join table");
                String leftCol = identifier("ON");
                expect(TokenType.EQUALS, "join column");
                String rightCol = identifier("'='");
                join = new JoinSpec(right, leftCol, rightCol);
            }
            return new SelectQuery(table, columns, join);
        }

        private String columnRef() {
            String first = identifier(null);
            if (accept(TokenType.DOT)) {
                return first + "." + identifier("'.'");
            }
            return first;
        }

        private String identifier(String after) {
            Token t = peek();
            if (!t.is(TokenType.IDENTIFIER)) throw error("identifier", t, after);
            advance();
            return t.text();
        }

        private void expect(TokenType type, String after) {
            Token t = peek();
            if (!t.is(type)) throw error(type.describe(), t, after);
            advance();
        }

        private boolean accept(TokenType type) {
            if (peek().is(type)) {
                advance();
                return true;
            }
            return false;
        }

        private Token peek() {
            return tokens.get(i);
        }

        private void advance() {
            if (i < tokens.size() - 1) i++;
        }

        private ParseException error(String expected, Token found, String after) {
            String foundText = found.is(TokenType.EOF) ? "end of statement" : found.text();
            String message = "Expected " + expected
                + (after != null ? " after " + after : "")
                + " but found " + (found.is(TokenType.EOF) ? foundText : "'" + foundText + "'")
                + " at position " + found.position();
            return new ParseException(expected, foundText, found.position(), message);
        }
    }
}
