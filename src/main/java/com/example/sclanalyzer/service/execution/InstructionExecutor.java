package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.ConstructType;
import com.example.sclanalyzer.service.extraction.SclInstruction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Вызовы таймеров (TON, TOF, TP, TONR) и счётчиков (CTU, CTD, CTUD):
 * фиксированное описание найденной инструкции, время и импульсы не моделируются.
 */
@Component
@RequiredArgsConstructor
public class InstructionExecutor implements ConstructExecutor {

    private final AssignmentScanner assignmentScanner;

    @Override
    public Set<ConstructType> supportedTypes() {
        return Set.of(ConstructType.TIMER, ConstructType.COUNTER);
    }

    @Override
    public void execute(ConstructType type, String cleanCode, ExecutionContext context) {
        String description = SclInstruction.detect(cleanCode, type)
                .map(SclInstruction::getDescription)
                .orElse(type == ConstructType.TIMER ? "Temporizador" : "Contador");
        context.addStep(description);
        assignmentScanner.execute(cleanCode, context);
    }
}
