package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.TagDataType;
import com.example.sclanalyzer.model.TagSnapshot;
import com.example.sclanalyzer.model.TagSnapshotIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * Построение контекста выполнения для тестов исполнителей.
 */
final class ExecutorTestSupport {

    private ExecutorTestSupport() {
    }

    /**
     * @param tags тройки имя, значение, тип
     */
    static ExecutionContext context(String... tags) {
        List<TagSnapshot> snapshot = new ArrayList<>();
        for (int i = 0; i < tags.length; i += 3) {
            snapshot.add(TagSnapshot.builder()
                    .name(tags[i])
                    .rawValue(tags[i + 1])
                    .declaredType(TagDataType.fromName(tags[i + 2]))
                    .build());
        }
        return new ExecutionContext(LocalVariableEnvironment.seededFrom(TagSnapshotIndex.of(snapshot)));
    }
}
