package com.example.sclanalyzer.model;

/**
 * Происхождение локальной переменной во время анализа.
 */
public enum BindingOrigin {
    /**
     * Загружена из снимка тегов в начале анализа
     */
    CACHE,

    /**
     * Создана или перезаписана выполненным присваиванием
     */
    COMPUTED
}
