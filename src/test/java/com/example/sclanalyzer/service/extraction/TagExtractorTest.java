package com.example.sclanalyzer.service.extraction;

import com.example.sclanalyzer.model.TagDataType;
import com.example.sclanalyzer.model.TagReference;
import com.example.sclanalyzer.model.TagSnapshot;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TagExtractorTest {

    private final TagExtractor extractor = new TagExtractor();

    @Test
    void shouldExtractTagsInFirstOccurrenceOrder() {
        // Given
        TagSnapshotIndex snapshot = TagSnapshotIndex.of(List.of(
                tag("Falha", "FALSE", TagDataType.BOOL),
                tag("Sensor_1", "TRUE", TagDataType.BOOL)));

        // When
        TagExtraction extraction = extractor.extract("Motor := Sensor_1 AND NOT Falha;", snapshot);

        // Then
        assertEquals(List.of("Sensor_1", "Falha"), names(extraction.getTags()));
        assertEquals(List.of("Motor"), extraction.getUnresolvedIdentifiers());
        TagReference sensor = extraction.getTags().get(0);
        assertEquals(TagDataType.BOOL, sensor.getDeclaredType());
        assertEquals("TRUE", sensor.getValue());
        assertTrue(sensor.isFoundInSnapshot());
    }

    @Test
    void shouldCollapseCaseVariantsIntoSingleRecord() {
        // Given
        TagSnapshot speed = tag("Motor_Speed", "1500", TagDataType.INT);
        Map<String, TagSnapshot> keys = new LinkedHashMap<>();
        keys.put("Motor_Speed", speed);
        keys.put("motor_speed", speed);
        TagSnapshotIndex snapshot = TagSnapshotIndex.ofKeys(keys);

        // When
        TagExtraction extraction = extractor.extract(
                "x := \"Motor_Speed\" + motor_speed + MOTOR_SPEED;", snapshot);

        // Then
        assertEquals(List.of("Motor_Speed"), names(extraction.getTags()));
    }

    @Test
    void shouldCollapseDistinctEntriesDifferingOnlyInCase() {
        // Given
        TagSnapshotIndex snapshot = TagSnapshotIndex.of(List.of(
                tag("Temp", "20", TagDataType.INT),
                tag("TEMP", "20", TagDataType.INT)));

        // When
        TagExtraction extraction = extractor.extract("Avg := (Temp + TEMP) / 2;", snapshot);

        // Then
        assertEquals(1, extraction.getTags().size());
    }

    @Test
    void shouldFilterKeywordsAndLiteralDigits() {
        // Given
        TagSnapshotIndex snapshot = TagSnapshotIndex.of(List.of(tag("Start", "TRUE", TagDataType.BOOL)));

        // When
        TagExtraction extraction = extractor.extract(
                "IF Start AND TRUE THEN Mask := 16#FF; END_IF;", snapshot);

        // Then
        assertEquals(List.of("Start"), names(extraction.getTags()));
        assertEquals(List.of("Mask"), extraction.getUnresolvedIdentifiers());
    }

    @Test
    void shouldNotSplitQuotedNamesWithSpaces() {
        // Given
        TagSnapshotIndex snapshot = TagSnapshotIndex.of(List.of(tag("Tank Level", "80.5", TagDataType.REAL)));

        // When
        TagExtraction extraction = extractor.extract("High := \"Tank Level\" > 50;", snapshot);

        // Then
        assertEquals(List.of("Tank Level"), names(extraction.getTags()));
        assertEquals(List.of("High"), extraction.getUnresolvedIdentifiers());
    }

    @Test
    void shouldReportUnresolvedIdentifiersOnceIgnoringCase() {
        // When
        TagExtraction extraction = extractor.extract("a := b; A := B;", TagSnapshotIndex.empty());

        // Then
        assertTrue(extraction.getTags().isEmpty());
        assertEquals(List.of("a", "b"), extraction.getUnresolvedIdentifiers());
    }

    private static TagSnapshot tag(String name, String value, TagDataType type) {
        return TagSnapshot.builder().name(name).rawValue(value).declaredType(type).build();
    }

    private static List<String> names(List<TagReference> tags) {
        return tags.stream().map(TagReference::getName).collect(Collectors.toList());
    }
}
