package com.example.sclanalyzer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Результат одного вызова анализа. Неизменяем после возврата.
 */
@Value
@Builder
public class AnalysisResult {
    /**
     * false только если анализ прервался непредвиденной ошибкой
     */
    boolean success;

    /**
     * Доминирующая конструкция кода
     */
    ConstructType classifiedType;

    /**
     * Краткое описание кода ("Código vazio", одна строка или "Lógica SCL com N linhas")
     */
    String summary;

    /**
     * Теги из снимка, на которые ссылается код, в порядке первого появления
     */
    @Singular("tagReferenced")
    List<TagReference> tagsReferenced;

    /**
     * Идентификаторы, не найденные в снимке (при вычислении равны 0)
     */
    @Singular
    List<String> unresolvedIdentifiers;

    /**
     * Выполненные присваивания в порядке выполнения
     */
    @Singular
    List<AssignmentResult> assignments;

    /**
     * Итоговые вычисленные переменные (origin = COMPUTED)
     */
    @Singular
    List<LocalBinding> computedBindings;

    /**
     * Шаги трассировки в порядке добавления
     */
    @Singular
    List<String> steps;

    /**
     * Текст объяснения: шаги, блок предупреждений и блок результатов
     */
    String narrative;

    @Singular
    List<Diagnostic> diagnostics;

    AnalysisStatistics statistics;

    /**
     * Последнее выполненное присваивание (итог фрагмента)
     */
    public Optional<AssignmentResult> getLastAssignment() {
        return assignments.isEmpty()
                ? Optional.empty()
                : Optional.of(assignments.get(assignments.size() - 1));
    }

    /**
     * Итоговое вычисленное значение переменной, если она была присвоена.
     */
    public Optional<LocalBinding> findComputed(String variableName) {
        return computedBindings.stream()
                .filter(b -> b.getName().equals(variableName))
                .findFirst();
    }
}
