package com.example.sclanalyzer.service.extraction;

import com.example.sclanalyzer.model.TagReference;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Результат извлечения тегов из кода.
 */
@Value
@Builder
public class TagExtraction {

    /**
     * Теги, найденные в снимке, в порядке первого появления (без повторов)
     */
    @Singular("tag")
    List<TagReference> tags;

    /**
     * Идентификаторы, которых нет в снимке
     */
    @Singular
    List<String> unresolvedIdentifiers;
}
