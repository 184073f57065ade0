package com.example.sclanalyzer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация вывода отчётов.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "output")
public class OutputConfig {

    private MarkdownConfig markdown = new MarkdownConfig();

    @Data
    public static class MarkdownConfig {
        /**
         * Путь для сохранения Markdown отчётов
         */
        private String path = "./output";

        /**
         * Имя файла по умолчанию
         */
        private String defaultFilename = "SCL_ANALYSIS.md";
    }
}
