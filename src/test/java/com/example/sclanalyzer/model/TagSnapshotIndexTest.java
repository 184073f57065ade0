package com.example.sclanalyzer.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TagSnapshotIndexTest {

    @Test
    void shouldFindByExactLowerAndUpperCase() {
        // Given
        TagSnapshot sensor = TagSnapshot.builder().name("Sensor_1").rawValue("TRUE").build();
        TagSnapshot alarm = TagSnapshot.builder().name("ALARM").rawValue("FALSE").build();

        // When
        TagSnapshotIndex index = TagSnapshotIndex.of(List.of(sensor, alarm));

        // Then
        assertSame(sensor, index.find("Sensor_1").orElseThrow());
        assertSame(sensor, index.find("SENSOR_1").orElseThrow());
        assertSame(alarm, index.find("alarm").orElseThrow());
        assertTrue(index.find("Alarm_2").isEmpty());
        assertTrue(index.find(null).isEmpty());
        assertEquals(TagDataType.UNKNOWN, sensor.getDeclaredType());
    }

    @Test
    void shouldCountTagRegisteredUnderSeveralKeysOnce() {
        // Given
        TagSnapshot motor = TagSnapshot.builder().name("Motor").build();
        Map<String, TagSnapshot> keys = new LinkedHashMap<>();
        keys.put("Motor", motor);
        keys.put("motor", motor);
        keys.put("MOTOR", motor);

        // When
        TagSnapshotIndex index = TagSnapshotIndex.ofKeys(keys);

        // Then
        assertEquals(1, index.size());
        assertEquals(List.of(motor), index.distinctTags());
    }

    @Test
    void shouldSkipTagsWithoutName() {
        // When
        TagSnapshotIndex index = TagSnapshotIndex.of(List.of(TagSnapshot.builder().name(" ").build()));

        // Then
        assertEquals(0, index.size());
        assertEquals(0, TagSnapshotIndex.empty().size());
    }
}
