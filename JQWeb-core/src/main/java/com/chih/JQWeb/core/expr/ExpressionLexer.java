package com.chih.JQWeb.core.expr;

import com.chih.JQWeb.core.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * 受限表达式语言的词法分析器
 * <p>
 * 支持 Python 风格的字面量（单/双/三引号字符串、r/u/b 前缀、十六进制与科学计数法数字）
 * 以及运算符与括号。f-string 不受支持。
 *
 * @author lizhiyuan
 * @since 2026/10/02
 */
public class ExpressionLexer {

    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=",
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", ":=", "->",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "&", "|", "^", "~", "<", ">", "@"
    };

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    public ExpressionLexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        return new ExpressionLexer(source).scanTokens();
    }

    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END, "", null, source.length()));
        return tokens;
    }

    private void scanToken() {
        char c = peek();
        switch (c) {
            case ' ':
            case '\t':
            case '\r':
            case '\n':
                advance();
                return;
            case '\\':
                // 续行符
                advance();
                if (peek() != '\n' && peek() != '\r') {
                    throw error("unexpected character after line continuation");
                }
                return;
            case '(':
                single(TokenType.LPAR);
                return;
            case ')':
                single(TokenType.RPAR);
                return;
            case '[':
                single(TokenType.LSQB);
                return;
            case ']':
                single(TokenType.RSQB);
                return;
            case '{':
                single(TokenType.LBRACE);
                return;
            case '}':
                single(TokenType.RBRACE);
                return;
            case ',':
                single(TokenType.COMMA);
                return;
            case '#':
                throw error("comments are not allowed");
            default:
                break;
        }
        if (c == '.' && !Character.isDigit(peekNext())) {
            single(TokenType.DOT);
            return;
        }
        if (c == '"' || c == '\'') {
            string("");
            return;
        }
        if (Character.isDigit(c) || c == '.') {
            number();
            return;
        }
        if (isIdentifierStart(c)) {
            identifier();
            return;
        }
        if (c == ':') {
            if (peekNext() == '=') {
                current += 2;
                addToken(TokenType.OPERATOR, null);
            } else {
                single(TokenType.COLON);
            }
            return;
        }
        if (c == '=' && peekNext() != '=') {
            single(TokenType.EQUAL);
            return;
        }
        for (String op : OPERATORS) {
            if (source.startsWith(op, current)) {
                current += op.length();
                addToken(TokenType.OPERATOR, null);
                return;
            }
        }
        throw error("unexpected character '" + c + "'");
    }

    private void identifier() {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String word = source.substring(start, current);
        if (!isAtEnd() && (peek() == '\'' || peek() == '"') && isStringPrefix(word)) {
            if (word.toLowerCase().contains("f")) {
                throw error("f-strings are not supported");
            }
            string(word.toLowerCase());
            return;
        }
        addToken(TokenType.NAME, null);
    }

    private static boolean isStringPrefix(String word) {
        String lower = word.toLowerCase();
        return lower.equals("r") || lower.equals("u") || lower.equals("b") || lower.equals("f")
                || lower.equals("rb") || lower.equals("br") || lower.equals("fr") || lower.equals("rf");
    }

    private void number() {
        if (peek() == '0' && (peekNext() == 'x' || peekNext() == 'X')) {
            current += 2;
            while (!isAtEnd() && (Character.digit(peek(), 16) >= 0 || peek() == '_')) {
                advance();
            }
            String digits = source.substring(start + 2, current).replace("_", "");
            addToken(TokenType.NUMBER, Long.parseLong(digits, 16));
            return;
        }
        boolean floating = false;
        consumeDigits();
        if (peek() == '.' && !isAtEnd()) {
            floating = true;
            advance();
            consumeDigits();
        }
        if (peek() == 'e' || peek() == 'E') {
            floating = true;
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            if (!Character.isDigit(peek())) {
                throw error("invalid number literal");
            }
            consumeDigits();
        }
        if (isIdentifierStart(peek())) {
            throw error("invalid number literal");
        }
        String text = source.substring(start, current).replace("_", "");
        try {
            addToken(TokenType.NUMBER, floating ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("invalid number literal '" + text + "'");
        }
    }

    private void consumeDigits() {
        while (!isAtEnd() && (Character.isDigit(peek()) || peek() == '_')) {
            advance();
        }
    }

    private void string(String prefix) {
        boolean raw = prefix.contains("r");
        char quote = advance();
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            current += 2;
        }
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("unterminated string literal");
            }
            char c = advance();
            if (c == quote) {
                if (!triple) {
                    break;
                }
                if (peek() == quote && peekNext() == quote) {
                    current += 2;
                    break;
                }
                value.append(c);
                continue;
            }
            if (c == '\n' && !triple) {
                throw error("unterminated string literal");
            }
            if (c == '\\' && !isAtEnd()) {
                if (raw) {
                    value.append(c).append(advance());
                } else {
                    escape(value);
                }
                continue;
            }
            value.append(c);
        }
        addToken(TokenType.STRING, value.toString());
    }

    private void escape(StringBuilder value) {
        char c = advance();
        switch (c) {
            case 'n':
                value.append('\n');
                break;
            case 't':
                value.append('\t');
                break;
            case 'r':
                value.append('\r');
                break;
            case '0':
                value.append('\0');
                break;
            case '\\':
            case '\'':
            case '"':
                value.append(c);
                break;
            case '\n':
                break;
            case 'x':
                value.append((char) hex(2));
                break;
            case 'u':
                value.append((char) hex(4));
                break;
            case 'U':
                value.appendCodePoint(hex(8));
                break;
            default:
                value.append('\\').append(c);
        }
    }

    private int hex(int length) {
        if (current + length > source.length()) {
            throw error("truncated escape sequence");
        }
        String digits = source.substring(current, current + length);
        current += length;
        try {
            return Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw error("invalid escape sequence \\" + digits);
        }
    }

    private void single(TokenType type) {
        advance();
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, start));
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private ExpressionSyntaxException error(String message) {
        return new ExpressionSyntaxException(message + " at position " + start, source);
    }
}
