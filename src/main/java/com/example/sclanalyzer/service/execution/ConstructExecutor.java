package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.ConstructType;

import java.util.Set;

/**
 * Поведение для одной или нескольких категорий конструкций SCL.
 */
public interface ConstructExecutor {

    /**
     * Категории, которые обрабатывает исполнитель.
     */
    Set<ConstructType> supportedTypes();

    /**
     * Описывает и выполняет фрагмент, добавляя шаги и присваивания в контекст.
     *
     * @param type      категория, определённая классификатором
     * @param cleanCode код без комментариев и строковых литералов
     * @param context   контекст текущего анализа
     */
    void execute(ConstructType type, String cleanCode, ExecutionContext context);
}
