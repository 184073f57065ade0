package com.example.sclanalyzer.cli;

import com.example.sclanalyzer.model.TagDataType;
import com.example.sclanalyzer.model.TagSnapshot;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import com.example.sclanalyzer.service.analysis.AnalysisResultMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineRunnerTest {

    @TempDir
    Path tempDir;

    private CommandLineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new CommandLineRunner(null, new AnalysisResultMapper(), null, new ObjectMapper());
    }

    @Test
    void shouldReadTagArray() throws Exception {
        // Given
        Path file = tempDir.resolve("tags.json");
        Files.writeString(file, """
                [
                  {"tag_name": "Sensor_1", "value": "TRUE", "data_type": "BOOL", "address": "%I0.0"},
                  {"tag_name": "Level", "value": "42.5", "data_type": "REAL"}
                ]
                """);

        // When
        TagSnapshotIndex snapshot = runner.readSnapshot(file);

        // Then
        assertEquals(2, snapshot.size());
        TagSnapshot sensor = snapshot.find("sensor_1").orElseThrow();
        assertEquals("Sensor_1", sensor.getName());
        assertEquals(TagDataType.BOOL, sensor.getDeclaredType());
        assertEquals("%I0.0", sensor.getAddress());
        assertEquals("42.5", snapshot.find("Level").orElseThrow().getRawValue());
    }

    @Test
    void shouldReadKeyedTagObject() throws Exception {
        // Given
        Path file = tempDir.resolve("tags.json");
        Files.writeString(file, """
                {
                  "Pump": {"tag_name": "Pump", "value": "1", "data_type": "BOOL"},
                  "PUMP": {"tag_name": "Pump", "value": "1", "data_type": "BOOL"},
                  "Speed": {"value": "1500", "data_type": "INT"}
                }
                """);

        // When
        TagSnapshotIndex snapshot = runner.readSnapshot(file);

        // Then
        assertEquals(2, snapshot.size());
        assertEquals("Pump", snapshot.find("PUMP").orElseThrow().getName());
        assertEquals("Speed", snapshot.find("Speed").orElseThrow().getName());
        assertEquals(TagDataType.INT, snapshot.find("Speed").orElseThrow().getDeclaredType());
    }
}
