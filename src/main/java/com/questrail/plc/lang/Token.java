package com.questrail.plc.lang;

import java.util.Objects;

/**
 * A lexical token with its 1-based source position.
 */
public record Token(TokenType type, String text, int line, int column)
{
    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public boolean isKeyword(String word) {
        return type == TokenType.KEYWORD && text.equals(word);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
