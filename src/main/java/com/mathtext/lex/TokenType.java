package com.mathtext.lex;

public enum TokenType {
    COMMAND,
    ESCAPED_SYMBOL,
    LINE_BREAK,
    DANGLING_BACKSLASH,
    OPEN_BRACE,
    CLOSE_BRACE,
    TEXT
}
