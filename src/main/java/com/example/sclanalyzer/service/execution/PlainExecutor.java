package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.ConstructType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Последовательность присваиваний без управляющих конструкций.
 */
@Component
@RequiredArgsConstructor
public class PlainExecutor implements ConstructExecutor {

    private final AssignmentScanner assignmentScanner;

    @Override
    public Set<ConstructType> supportedTypes() {
        return Set.of(ConstructType.PLAIN);
    }

    @Override
    public void execute(ConstructType type, String cleanCode, ExecutionContext context) {
        assignmentScanner.execute(cleanCode, context);
    }
}
