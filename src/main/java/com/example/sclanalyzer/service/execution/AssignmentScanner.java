package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.AssignmentResult;
import com.example.sclanalyzer.model.BindingOrigin;
import com.example.sclanalyzer.model.Diagnostic;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.model.TagDataType;
import com.example.sclanalyzer.service.expression.ExpressionEvaluator;
import com.example.sclanalyzer.service.extraction.SclKeywords;
import com.example.sclanalyzer.service.narrative.ValueFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Выполняет последовательность присваиваний {@code target := expression;} в порядке текста.
 * <p>
 * Присваивание принимается только в начале оператора: в начале блока, после {@code ;},
 * после метки CASE {@code :} или после ключевого слова, открывающего/закрывающего блок.
 * Поэтому заголовок {@code FOR i := 1 TO 10 DO} и именованные параметры вызова
 * {@code T1(IN := Start, PT := T#5S)} не выполняются.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssignmentScanner {

    private static final Pattern ASSIGNMENT =
            Pattern.compile("(?<![\\w\"])\"?([A-Za-z_]\\w*)\"?\\s*:=\\s*([^;]+);");

    private static final Set<String> STATEMENT_OPENERS = Set.of(
            "THEN", "ELSE", "DO", "REPEAT", "OF", "BEGIN",
            "END_IF", "END_FOR", "END_WHILE", "END_CASE", "END_REPEAT", "END_VAR");

    private final ExpressionEvaluator expressionEvaluator;

    /**
     * Выполняет все присваивания блока, обновляя переменные контекста.
     *
     * @param block   фрагмент кода без комментариев
     * @param context контекст текущего анализа
     */
    public void execute(String block, ExecutionContext context) {
        if (block == null || block.isBlank()) {
            return;
        }
        Matcher matcher = ASSIGNMENT.matcher(block);
        int from = 0;
        while (from < block.length() && matcher.find(from)) {
            String target = matcher.group(1);
            if (!startsStatement(block, matcher.start()) || SclKeywords.isKeyword(target)) {
                from = matcher.start() + 1;
                continue;
            }
            executeAssignment(target, matcher.group(2).trim(), context);
            from = matcher.end();
        }
    }

    private void executeAssignment(String target, String expression, ExecutionContext context) {
        Optional<SclValue> evaluated = expressionEvaluator.evaluate(expression, context.getEnvironment());
        SclValue value = evaluated.orElse(null);
        TagDataType type = inferType(value);

        if (value != null && value.isInfinite()) {
            context.addDiagnostic(Diagnostic.builder()
                    .severity(Diagnostic.Severity.WARNING)
                    .type(Diagnostic.Type.DIVISION_BY_ZERO)
                    .message("Divisão por zero em: " + target)
                    .variableName(target)
                    .build());
        }
        if (value != null && value.isNaN()) {
            context.addDiagnostic(Diagnostic.builder()
                    .severity(Diagnostic.Severity.WARNING)
                    .type(Diagnostic.Type.NAN_RESULT)
                    .message("Resultado inválido (NaN) em: " + target + " - possível divisão por zero")
                    .variableName(target)
                    .build());
        }

        context.getEnvironment().bind(LocalBinding.builder()
                .name(target)
                .value(value)
                .declaredType(type)
                .origin(BindingOrigin.COMPUTED)
                .build());

        context.recordAssignment(AssignmentResult.builder()
                .variableName(target)
                .value(value)
                .inferredType(type)
                .sourceExpression(expression)
                .build());

        context.addStep(target + " := " + ValueFormatter.display(expression) + " → " + ValueFormatter.format(value));
        log.debug("Executed assignment {} := {} -> {}", target, expression, value);
    }

    /**
     * BOOL для логических, INT для целых, REAL для дробных, NaN и ±∞, иначе UNKNOWN.
     */
    static TagDataType inferType(SclValue value) {
        if (value == null) {
            return TagDataType.UNKNOWN;
        }
        switch (value.getKind()) {
            case BOOL:
                return TagDataType.BOOL;
            case NUMBER:
                return value.isIntegral() ? TagDataType.INT : TagDataType.REAL;
            default:
                return TagDataType.UNKNOWN;
        }
    }

    private boolean startsStatement(String block, int index) {
        int i = index - 1;
        while (i >= 0 && Character.isWhitespace(block.charAt(i))) {
            i--;
        }
        if (i < 0) {
            return true;
        }
        char previous = block.charAt(i);
        if (previous == ';' || previous == ':') {
            return true;
        }
        if (!isWordChar(previous)) {
            return false;
        }
        int end = i + 1;
        while (i >= 0 && isWordChar(block.charAt(i))) {
            i--;
        }
        String word = block.substring(i + 1, end).toUpperCase(Locale.ROOT);
        return STATEMENT_OPENERS.contains(word);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
