package com.example.sclanalyzer.service.expression;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Лексер выражений SCL. Ключевые слова нечувствительны к регистру,
 * {@code "Name"} означает ссылку на тег, {@code 'text'} текстовый литерал.
 */
public class ExpressionLexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("TRUE", TokenType.TRUE);
        map.put("FALSE", TokenType.FALSE);
        map.put("AND", TokenType.AND);
        map.put("OR", TokenType.OR);
        map.put("XOR", TokenType.XOR);
        map.put("NOT", TokenType.NOT);
        map.put("MOD", TokenType.MOD);
        keywords = Collections.unmodifiableMap(map);
    }

    public ExpressionLexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '&': addToken(TokenType.AND); break;
            case '=': addToken(TokenType.EQUAL); break;
            case '<':
                if (match('>')) addToken(TokenType.NOT_EQUAL);
                else if (match('=')) addToken(TokenType.LESS_EQUAL);
                else addToken(TokenType.LESS);
                break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"':
                tagReference();
                break;
            case '\'':
                text();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        if (peek() == '#') {
            // T#5s, INT#10 и прочие типизированные литералы не поддерживаются
            throw error("Unsupported typed literal: " + source.substring(start, current) + "#");
        }
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text.toUpperCase(Locale.ROOT), TokenType.IDENTIFIER);
        addToken(type, type == TokenType.IDENTIFIER ? text : null);
    }

    private void number() {
        while (isDigit(peek()) || peek() == '_') advance();

        if (peek() == '#') {
            based();
            return;
        }

        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek()) || peek() == '_') advance();
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current).replace("_", "");
        addToken(TokenType.NUMBER, Double.parseDouble(text));
    }

    /**
     * Литералы с основанием: 2#1010, 8#17, 16#FF.
     */
    private void based() {
        String baseText = source.substring(start, current).replace("_", "");
        if (!baseText.equals("2") && !baseText.equals("8") && !baseText.equals("16")) {
            throw error("Unsupported radix: " + baseText);
        }
        int radix = Integer.parseInt(baseText);
        advance(); // '#'
        int digitsStart = current;
        while (Character.digit(peek(), radix) >= 0 || peek() == '_') advance();
        String digits = source.substring(digitsStart, current).replace("_", "");
        if (digits.isEmpty()) {
            throw error("Missing digits after " + radix + "#");
        }
        // LWORD 16#FFFF_FFFF_FFFF_FFFF не помещается в long
        addToken(TokenType.NUMBER, new BigInteger(digits, radix).doubleValue());
    }

    private void tagReference() {
        while (!isAtEnd() && peek() != '"') advance();
        if (isAtEnd()) throw error("Unterminated tag reference");
        advance();
        String name = source.substring(start + 1, current - 1);
        addToken(TokenType.TAG_REFERENCE, name);
    }

    private void text() {
        while (!isAtEnd() && peek() != '\'') advance();
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.TEXT, source.substring(start + 1, current - 1));
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return peekAt(0); }
    private char peekNext() { return peekAt(1); }
    private char peekAt(int offset) {
        return (current + offset >= source.length()) ? '\0' : source.charAt(current + offset);
    }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start));
    }

    private ExpressionException error(String msg) {
        return new ExpressionException("[col " + (start + 1) + "] " + msg);
    }
}
