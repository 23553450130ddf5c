package com.mathtext.lex;

public record LexToken(TokenType type, String value, int position) {

    /**
     * 对 COMMAND token 返回去掉反斜杠的命令名，其余类型返回空串。
     */
    public String commandName() {
        return type == TokenType.COMMAND ? value.substring(1) : "";
    }

    /**
     * 判断是否为指定字符的转义符号，例如 {@code \(}。
     */
    public boolean isEscaped(char symbol) {
        return type == TokenType.ESCAPED_SYMBOL && value.length() == 2 && value.charAt(1) == symbol;
    }
}
