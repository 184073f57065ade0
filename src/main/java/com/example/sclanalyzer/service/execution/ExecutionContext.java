package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.AssignmentResult;
import com.example.sclanalyzer.model.Diagnostic;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Изменяемое состояние одного вызова анализа: переменные, шаги трассировки,
 * диагностики и выполненные присваивания. Создаётся на каждый вызов и не разделяется.
 */
public class ExecutionContext {

    @Getter
    private final LocalVariableEnvironment environment;

    private final List<String> steps = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<AssignmentResult> assignments = new ArrayList<>();

    public ExecutionContext(LocalVariableEnvironment environment) {
        this.environment = environment;
    }

    public void addStep(String step) {
        steps.add(step);
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void recordAssignment(AssignmentResult assignment) {
        assignments.add(assignment);
    }

    public List<String> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<AssignmentResult> getAssignments() {
        return Collections.unmodifiableList(assignments);
    }
}
