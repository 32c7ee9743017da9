package com.questrail.plc.lang;

/**
 * Lexical categories of Structured Text.
 */
public enum TokenType
{
    IDENTIFIER,
    KEYWORD,
    NUMBER,
    DURATION,

    ASSIGN,        // :=
    COLON,
    SEMICOLON,
    COMMA,
    LPAREN,
    RPAREN,

    PLUS,
    MINUS,
    STAR,
    SLASH,

    GREATER,
    LESS,
    GREATER_EQUAL,
    LESS_EQUAL,
    EQUAL,
    NOT_EQUAL,     // <>

    EOF
}
