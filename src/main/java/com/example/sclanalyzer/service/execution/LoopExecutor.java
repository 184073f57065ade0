package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.ConstructType;
import com.example.sclanalyzer.service.narrative.ValueFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Циклы FOR, WHILE и REPEAT.
 * <p>
 * Цикл не итерируется: по заголовку строится один описательный шаг, а тело
 * выполняется как обычная последовательность присваиваний ровно один раз.
 */
@Component
@RequiredArgsConstructor
public class LoopExecutor implements ConstructExecutor {

    static final String FALLBACK = "Estrutura de repetição";

    private static final Pattern FOR_HEADER = Pattern.compile(
            "FOR\\s+(\\w+)\\s*:=\\s*(\\d+)\\s+TO\\s+(\\d+)(?:\\s+BY\\s+(\\d+))?\\s+DO",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WHILE_HEADER =
            Pattern.compile("WHILE\\s+(.+?)\\s+DO\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPEAT_TERMINATOR =
            Pattern.compile("UNTIL\\s+(.+?)\\s*(?:;|\\bEND_REPEAT\\b)", Pattern.CASE_INSENSITIVE);

    private final AssignmentScanner assignmentScanner;

    @Override
    public Set<ConstructType> supportedTypes() {
        return Set.of(ConstructType.FOR, ConstructType.WHILE, ConstructType.REPEAT);
    }

    @Override
    public void execute(ConstructType type, String cleanCode, ExecutionContext context) {
        context.addStep(describe(type, cleanCode));
        assignmentScanner.execute(cleanCode, context);
    }

    String describe(ConstructType type, String cleanCode) {
        Matcher matcher;
        switch (type) {
            case FOR:
                matcher = FOR_HEADER.matcher(cleanCode);
                if (matcher.find()) {
                    String description = "Loop FOR: " + matcher.group(1)
                            + " de " + matcher.group(2) + " até " + matcher.group(3);
                    if (matcher.group(4) != null) {
                        description += " (passo " + matcher.group(4) + ")";
                    }
                    return description;
                }
                return FALLBACK;
            case WHILE:
                matcher = WHILE_HEADER.matcher(cleanCode);
                return matcher.find()
                        ? "Loop WHILE: executa enquanto " + ValueFormatter.display(matcher.group(1))
                        : FALLBACK;
            case REPEAT:
                matcher = REPEAT_TERMINATOR.matcher(cleanCode);
                return matcher.find()
                        ? "Loop REPEAT: executa até " + ValueFormatter.display(matcher.group(1))
                        : FALLBACK;
            default:
                return FALLBACK;
        }
    }
}
