package com.questrail.plc.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * StLexer
 * -----------------------------------------------------------------------------
 * Splits Structured Text source into {@link Token}s.
 *
 * <p>Whitespace, {@code //} line comments and {@code (* *)} block comments are
 * dropped. Keywords are reserved and upper case; {@code fanSpeed} and
 * {@code FanSpeed} are distinct identifiers.</p>
 *
 * <p>Duration literals ({@code T#1s500ms}, {@code TIME#200ms}) are recognized
 * here so the parser sees them as a single {@link TokenType#DURATION} token.</p>
 */
public final class StLexer
{
    static final Set<String> KEYWORDS = Set.of(
            "PROGRAM", "END_PROGRAM",
            "VAR", "VAR_INPUT", "VAR_OUTPUT", "END_VAR",
            "BOOL", "INT", "REAL", "TIME",
            "IF", "THEN", "ELSIF", "ELSE", "END_IF",
            "AND", "OR", "NOT",
            "TRUE", "FALSE"
    );

    private final String source;
    private int pos;
    private int line = 1;
    private int column = 1;

    private StLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole source. The returned list always ends with an
     * {@link TokenType#EOF} token.
     */
    public static List<Token> tokenize(String source) throws StParseException {
        Objects.requireNonNull(source, "source");
        return new StLexer(source).run();
    }

    private List<Token> run() throws StParseException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipIgnorable();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", line, column));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipIgnorable() throws StParseException {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            }
            else if (c == '/' && peek(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
            }
            else if (c == '(' && peek(1) == '*') {
                int startLine = line;
                int startColumn = column;
                advance();
                advance();
                while (!(peek(0) == '*' && peek(1) == ')')) {
                    if (pos >= source.length()) {
                        throw new StParseException("Unterminated block comment", startLine, startColumn);
                    }
                    advance();
                }
                advance();
                advance();
            }
            else {
                return;
            }
        }
    }

    private Token next() throws StParseException {
        int startLine = line;
        int startColumn = column;
        char c = source.charAt(pos);

        if (isIdentifierStart(c)) {
            String word = readWhile(StLexer::isIdentifierPart);
            if ((word.equals("T") || word.equals("TIME")) && peek(0) == '#') {
                advance();
                String body = readWhile(ch -> Character.isLetterOrDigit(ch) || ch == '.' || ch == '_');
                String text = word + "#" + body;
                durationMillis(text, startLine, startColumn);
                return new Token(TokenType.DURATION, text, startLine, startColumn);
            }
            TokenType type = KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
            return new Token(type, word, startLine, startColumn);
        }

        if (Character.isDigit(c)) {
            String number = readWhile(Character::isDigit);
            if (peek(0) == '.' && Character.isDigit(peek(1))) {
                advance();
                number = number + "." + readWhile(Character::isDigit);
            }
            return new Token(TokenType.NUMBER, number, startLine, startColumn);
        }

        advance();
        return switch (c) {
            case ':' -> {
                if (peek(0) == '=') {
                    advance();
                    yield new Token(TokenType.ASSIGN, ":=", startLine, startColumn);
                }
                yield new Token(TokenType.COLON, ":", startLine, startColumn);
            }
            case ';' -> new Token(TokenType.SEMICOLON, ";", startLine, startColumn);
            case ',' -> new Token(TokenType.COMMA, ",", startLine, startColumn);
            case '(' -> new Token(TokenType.LPAREN, "(", startLine, startColumn);
            case ')' -> new Token(TokenType.RPAREN, ")", startLine, startColumn);
            case '+' -> new Token(TokenType.PLUS, "+", startLine, startColumn);
            case '-' -> new Token(TokenType.MINUS, "-", startLine, startColumn);
            case '*' -> new Token(TokenType.STAR, "*", startLine, startColumn);
            case '/' -> new Token(TokenType.SLASH, "/", startLine, startColumn);
            case '=' -> new Token(TokenType.EQUAL, "=", startLine, startColumn);
            case '>' -> {
                if (peek(0) == '=') {
                    advance();
                    yield new Token(TokenType.GREATER_EQUAL, ">=", startLine, startColumn);
                }
                yield new Token(TokenType.GREATER, ">", startLine, startColumn);
            }
            case '<' -> {
                if (peek(0) == '=') {
                    advance();
                    yield new Token(TokenType.LESS_EQUAL, "<=", startLine, startColumn);
                }
                if (peek(0) == '>') {
                    advance();
                    yield new Token(TokenType.NOT_EQUAL, "<>", startLine, startColumn);
                }
                yield new Token(TokenType.LESS, "<", startLine, startColumn);
            }
            default -> throw new StParseException("Unexpected character '" + c + "'", startLine, startColumn);
        };
    }

    /**
     * Converts a duration literal such as {@code T#1m30s} or {@code TIME#250ms}
     * into whole milliseconds. Units: {@code d}, {@code h}, {@code m},
     * {@code s}, {@code ms}; fractional amounts are allowed and truncated.
     */
    static long durationMillis(String literal, int line, int column) throws StParseException {
        int hash = literal.indexOf('#');
        String body = literal.substring(hash + 1).replace("_", "");
        if (body.isEmpty()) {
            throw new StParseException("Empty duration literal " + literal, line, column);
        }

        double total = 0;
        int i = 0;
        while (i < body.length()) {
            int start = i;
            while (i < body.length() && (Character.isDigit(body.charAt(i)) || body.charAt(i) == '.')) {
                i++;
            }
            if (start == i) {
                throw new StParseException("Malformed duration literal " + literal, line, column);
            }
            double amount;
            try {
                amount = Double.parseDouble(body.substring(start, i));
            } catch (NumberFormatException e) {
                throw new StParseException("Malformed duration literal " + literal, line, column);
            }

            int unitStart = i;
            while (i < body.length() && Character.isLetter(body.charAt(i))) {
                i++;
            }
            String unit = body.substring(unitStart, i).toLowerCase();
            long factor = switch (unit) {
                case "ms" -> 1L;
                case "s" -> 1_000L;
                case "m" -> 60_000L;
                case "h" -> 3_600_000L;
                case "d" -> 86_400_000L;
                default -> -1L;
            };
            if (factor < 0) {
                throw new StParseException("Unknown duration unit '" + unit + "' in " + literal, line, column);
            }
            total += amount * factor;
        }
        return (long) total;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private interface CharPredicate {
        boolean test(char c);
    }

    private String readWhile(CharPredicate predicate) {
        int start = pos;
        while (pos < source.length() && predicate.test(source.charAt(pos))) {
            advance();
        }
        return source.substring(start, pos);
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }
}
