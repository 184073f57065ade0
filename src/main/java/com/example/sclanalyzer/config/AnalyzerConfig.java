package com.example.sclanalyzer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Конфигурация анализатора SCL.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerConfig {

    /**
     * Ожидаемое максимальное время одного анализа. Не прерывает анализ,
     * превышение только записывается в лог.
     */
    private Duration maxExecutionTime = Duration.ofSeconds(5);
}
