package com.example.sclanalyzer.model;

/**
 * Доминирующая управляющая конструкция фрагмента SCL.
 * Порядок объявления совпадает с приоритетом классификации.
 */
public enum ConstructType {
    IF,
    FOR,
    WHILE,
    REPEAT,
    CASE,
    TIMER,
    COUNTER,

    /**
     * Последовательность простых присваиваний
     */
    PLAIN
}
