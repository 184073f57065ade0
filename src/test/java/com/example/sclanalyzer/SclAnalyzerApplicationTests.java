package com.example.sclanalyzer;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SclAnalyzerApplicationTests {

    @Test
    void contextLoads() {
    }
}
