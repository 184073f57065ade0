package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.BindingOrigin;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.model.TagDataType;
import com.example.sclanalyzer.model.TagSnapshot;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalVariableEnvironmentTest {

    @Test
    void shouldSeedDecodedTagsFromSnapshot() {
        // Given
        TagSnapshotIndex snapshot = TagSnapshotIndex.of(List.of(
                TagSnapshot.builder().name("Sensor_1").rawValue("1").declaredType(TagDataType.BOOL).build(),
                TagSnapshot.builder().name("Speed").rawValue("1500").declaredType(TagDataType.INT).build()));

        // When
        LocalVariableEnvironment environment = LocalVariableEnvironment.seededFrom(snapshot);

        // Then
        assertEquals(SclValue.number(1500), environment.resolve("SPEED").orElseThrow().getValue());
        LocalBinding sensor = environment.resolve("sensor_1").orElseThrow();
        assertEquals("Sensor_1", sensor.getName());
        assertEquals(SclValue.bool(true), sensor.getValue());
        assertEquals(BindingOrigin.CACHE, sensor.getOrigin());
        assertTrue(environment.computedBindings().isEmpty());
    }

    @Test
    void shouldOverwriteCaseInsensitivelyAndKeepFirstAssignmentOrder() {
        // Given
        LocalVariableEnvironment environment = new LocalVariableEnvironment();

        // When
        environment.bind(computed("motor", SclValue.bool(false)));
        environment.bind(computed("Lamp", SclValue.bool(true)));
        environment.bind(computed("Motor", SclValue.bool(true)));

        // Then
        List<LocalBinding> computed = environment.computedBindings();
        assertEquals(2, computed.size());
        assertEquals("Motor", computed.get(0).getName());
        assertEquals(SclValue.bool(true), computed.get(0).getValue());
        assertEquals("Lamp", computed.get(1).getName());
    }

    @Test
    void shouldReplaceCachedTagWithComputedValue() {
        // Given
        LocalVariableEnvironment environment = LocalVariableEnvironment.seededFrom(TagSnapshotIndex.of(List.of(
                TagSnapshot.builder().name("Counter").rawValue("3").declaredType(TagDataType.INT).build())));

        // When
        environment.bind(computed("Counter", SclValue.number(4)));

        // Then
        assertTrue(environment.resolve("COUNTER").orElseThrow().isComputed());
        assertEquals(1, environment.computedBindings().size());
    }

    private static LocalBinding computed(String name, SclValue value) {
        return LocalBinding.builder()
                .name(name)
                .value(value)
                .declaredType(TagDataType.BOOL)
                .origin(BindingOrigin.COMPUTED)
                .build();
    }
}
