package com.example.sclanalyzer.service.expression;

import com.example.sclanalyzer.model.LocalBinding;

import java.util.Optional;

/**
 * Источник значений переменных для вычислителя выражений.
 */
@FunctionalInterface
public interface VariableResolver {

    Optional<LocalBinding> resolve(String name);
}
