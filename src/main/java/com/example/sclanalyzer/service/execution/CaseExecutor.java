package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.ConstructType;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.service.narrative.ValueFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Конструкция CASE: сообщает селектор и его текущее значение, ветви не выбираются,
 * все присваивания тела выполняются по порядку.
 */
@Component
@RequiredArgsConstructor
public class CaseExecutor implements ConstructExecutor {

    private static final Pattern CASE_HEADER =
            Pattern.compile("CASE\\s+[\"']?(\\w+)[\"']?\\s+OF", Pattern.CASE_INSENSITIVE);

    private final AssignmentScanner assignmentScanner;

    @Override
    public Set<ConstructType> supportedTypes() {
        return Set.of(ConstructType.CASE);
    }

    @Override
    public void execute(ConstructType type, String cleanCode, ExecutionContext context) {
        context.addStep(describe(cleanCode, context));
        assignmentScanner.execute(cleanCode, context);
    }

    private String describe(String cleanCode, ExecutionContext context) {
        Matcher matcher = CASE_HEADER.matcher(cleanCode);
        if (!matcher.find()) {
            return "Estrutura CASE";
        }
        String selector = matcher.group(1);
        Optional<LocalBinding> binding = context.getEnvironment().resolve(selector);
        String description = "Seletor: " + selector;
        if (binding.isPresent()) {
            description += " (valor atual: " + ValueFormatter.format(binding.get().getValue()) + ")";
        }
        return description;
    }
}
