package com.example.sclanalyzer.service.extraction;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Подготавливает исходный код SCL к анализу: удаляет комментарии и содержимое
 * строковых литералов. Имена тегов в двойных кавычках сохраняются.
 */
@Component
public class SclSourceCleaner {

    private static final Pattern LINE_COMMENT = Pattern.compile("//.*$", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("\\(\\*[\\s\\S]*?\\*\\)");
    private static final Pattern BRACE_COMMENT = Pattern.compile("\\{[\\s\\S]*?}");
    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'");

    /**
     * Возвращает код без комментариев {@code //}, {@code (* *)}, {@code { }};
     * строковые литералы заменяются пустыми {@code ''}.
     */
    public String clean(String code) {
        if (code == null || code.isEmpty()) {
            return "";
        }
        String result = LINE_COMMENT.matcher(code).replaceAll("");
        result = BLOCK_COMMENT.matcher(result).replaceAll("");
        result = BRACE_COMMENT.matcher(result).replaceAll("");
        return STRING_LITERAL.matcher(result).replaceAll("''");
    }
}
