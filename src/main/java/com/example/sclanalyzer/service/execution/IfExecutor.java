package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.ConstructType;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.service.expression.ExpressionEvaluator;
import com.example.sclanalyzer.service.narrative.ValueFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Условная конструкция {@code IF cond THEN ... [ELSIF cond THEN ...] [ELSE ...] END_IF}.
 * <p>
 * Операторы перед IF выполняются до проверки условия, операторы после END_IF выполняются после
 * выбранной ветви. Вложенные IF в выбранной ветви и IF после END_IF вычисляются так же.
 * Без парного END_IF шаги не добавляются. Глубже {@link #MAX_NESTING} уровней вложенные
 * и последующие IF не разбираются: их присваивания выполняются как обычная последовательность.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IfExecutor implements ConstructExecutor {

    private static final Pattern IF_KEYWORDS =
            Pattern.compile("\\b(END_IF|ELSIF|ELSE|IF|THEN)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOGIC_OPERATORS =
            Pattern.compile("\\b(AND|OR|XOR|NOT)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPLIT_OPERATORS =
            Pattern.compile("\\b(AND|OR)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile("^\\s*;");

    static final int MAX_NESTING = 64;

    private final ExpressionEvaluator expressionEvaluator;
    private final AssignmentScanner assignmentScanner;

    @Override
    public Set<ConstructType> supportedTypes() {
        return Set.of(ConstructType.IF);
    }

    @Override
    public void execute(ConstructType type, String cleanCode, ExecutionContext context) {
        Optional<IfStatement> parsed = parse(cleanCode);
        if (parsed.isEmpty()) {
            log.debug("IF without matching END_IF, nothing to execute");
            return;
        }
        run(parsed.get(), context, 1);
    }

    private void run(IfStatement statement, ExecutionContext context, int level) {
        assignmentScanner.execute(statement.leading, context);

        boolean executed = false;
        for (int i = 0; i < statement.branches.size() && !executed; i++) {
            Branch branch = statement.branches.get(i);
            String keyword = i == 0 ? "IF" : "ELSIF";
            if (evaluateCondition(keyword, branch.condition, context)) {
                context.addStep("→ Executa bloco " + (i == 0 ? "THEN" : "ELSIF"));
                executeBlock(branch.body, context, level);
                executed = true;
            }
        }
        if (!executed) {
            if (statement.elseBody != null && !statement.elseBody.isBlank()) {
                context.addStep("→ Executa bloco ELSE");
                executeBlock(statement.elseBody, context, level);
            } else {
                context.addStep("→ Nenhum bloco executado");
            }
        }

        executeBlock(statement.trailing, context, level);
    }

    /**
     * Блок с вложенным (или следующим) IF разбирается рекурсивно, иначе выполняются присваивания.
     */
    private void executeBlock(String block, ExecutionContext context, int level) {
        if (level >= MAX_NESTING) {
            log.warn("IF nesting deeper than {} levels, remaining block executed as plain assignments", MAX_NESTING);
            assignmentScanner.execute(block, context);
            return;
        }
        Optional<IfStatement> nested = parse(block);
        if (nested.isPresent()) {
            run(nested.get(), context, level + 1);
        } else {
            assignmentScanner.execute(block, context);
        }
    }

    /**
     * Добавляет шаги условия (текст, текущие значения, разбор по AND/OR, вердикт)
     * и возвращает вердикт. Истиной считается только значение BOOL TRUE.
     */
    private boolean evaluateCondition(String keyword, String condition, ExecutionContext context) {
        context.addStep(keyword + " " + ValueFormatter.display(condition));

        String currentValues = describeCurrentValues(condition, context);
        if (!currentValues.isEmpty()) {
            context.addStep(currentValues);
        }

        if (LOGIC_OPERATORS.matcher(condition).find()) {
            List<String> parts = splitTopLevel(condition);
            if (parts.size() > 1) {
                StringBuilder breakdown = new StringBuilder("Avaliação:");
                for (String part : parts) {
                    Optional<SclValue> partValue = expressionEvaluator.evaluate(part, context.getEnvironment());
                    breakdown.append("\n  ").append(ValueFormatter.display(part))
                            .append(" → ").append(ValueFormatter.format(partValue.orElse(null)));
                }
                context.addStep(breakdown.toString());
            }
        }

        Optional<SclValue> result = expressionEvaluator.evaluate(condition, context.getEnvironment());
        boolean verdict = result.isPresent() && result.get().isBool() && result.get().asBool();
        context.addStep("Condição: " + (verdict ? "VERDADEIRA" : "FALSA"));
        return verdict;
    }

    private String describeCurrentValues(String condition, ExecutionContext context) {
        StringBuilder values = new StringBuilder();
        Set<String> listed = new HashSet<>();
        for (String name : expressionEvaluator.referencedNames(condition)) {
            Optional<LocalBinding> binding = context.getEnvironment().resolve(name);
            if (binding.isEmpty() || !listed.add(binding.get().getName().toLowerCase(Locale.ROOT))) {
                continue;
            }
            values.append("\n  ").append(binding.get().getName())
                    .append(" [").append(binding.get().getDeclaredType()).append("] = ")
                    .append(ValueFormatter.format(binding.get().getValue()));
        }
        return values.length() == 0 ? "" : "Valores atuais:" + values;
    }

    /**
     * Делит условие по AND/OR верхнего уровня (вне скобок и кавычек).
     */
    static List<String> splitTopLevel(String condition) {
        int[] depth = new int[condition.length() + 1];
        int level = 0;
        boolean quoted = false;
        for (int i = 0; i < condition.length(); i++) {
            depth[i] = quoted ? -1 : level;
            char c = condition.charAt(i);
            if (c == '"' || c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                level++;
            } else if (!quoted && c == ')') {
                level--;
            }
        }

        List<String> parts = new ArrayList<>();
        Matcher matcher = SPLIT_OPERATORS.matcher(condition);
        int from = 0;
        while (matcher.find()) {
            if (depth[matcher.start()] != 0) {
                continue;
            }
            addPart(parts, condition.substring(from, matcher.start()));
            from = matcher.end();
        }
        addPart(parts, condition.substring(from));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        if (!part.isBlank()) {
            parts.add(part.trim());
        }
    }

    /**
     * Разбирает внешний IF с учётом вложенности.
     */
    static Optional<IfStatement> parse(String code) {
        Matcher matcher = IF_KEYWORDS.matcher(code);

        int ifStart = -1;
        while (matcher.find()) {
            if (keyword(matcher).equals("IF")) {
                ifStart = matcher.start();
                break;
            }
        }
        if (ifStart < 0) {
            return Optional.empty();
        }

        IfStatement statement = new IfStatement();
        statement.leading = code.substring(0, ifStart);

        int depth = 0;
        int conditionStart = matcher.end();
        int bodyStart = -1;
        boolean inElse = false;

        while (matcher.find()) {
            String keyword = keyword(matcher);
            if (keyword.equals("IF")) {
                depth++;
                continue;
            }
            if (depth > 0) {
                if (keyword.equals("END_IF")) {
                    depth--;
                }
                continue;
            }
            switch (keyword) {
                case "THEN":
                    if (conditionStart >= 0) {
                        String condition = code.substring(conditionStart, matcher.start()).trim();
                        statement.branches.add(new Branch(condition));
                        conditionStart = -1;
                        bodyStart = matcher.end();
                    }
                    break;
                case "ELSIF":
                    if (bodyStart < 0 || inElse) {
                        return Optional.empty();
                    }
                    lastBranch(statement).body = code.substring(bodyStart, matcher.start());
                    conditionStart = matcher.end();
                    bodyStart = -1;
                    break;
                case "ELSE":
                    if (bodyStart < 0 || inElse) {
                        return Optional.empty();
                    }
                    lastBranch(statement).body = code.substring(bodyStart, matcher.start());
                    inElse = true;
                    bodyStart = matcher.end();
                    break;
                case "END_IF":
                    if (bodyStart < 0) {
                        return Optional.empty();
                    }
                    String body = code.substring(bodyStart, matcher.start());
                    if (inElse) {
                        statement.elseBody = body;
                    } else {
                        lastBranch(statement).body = body;
                    }
                    statement.trailing = TRAILING_SEMICOLON.matcher(code.substring(matcher.end())).replaceFirst("");
                    return Optional.of(statement);
                default:
                    break;
            }
        }
        return Optional.empty();
    }

    private static Branch lastBranch(IfStatement statement) {
        return statement.branches.get(statement.branches.size() - 1);
    }

    private static String keyword(Matcher matcher) {
        return matcher.group(1).toUpperCase(Locale.ROOT);
    }

    static final class IfStatement {
        String leading = "";
        final List<Branch> branches = new ArrayList<>();
        String elseBody;
        String trailing = "";
    }

    static final class Branch {
        final String condition;
        String body = "";

        Branch(String condition) {
            this.condition = condition;
        }
    }
}
