package com.example.sclanalyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Тег, на который ссылается код и который найден в снимке.
 */
@Value
@Builder
public class TagReference {
    /**
     * Имя тега в снимке (не обязательно в том регистре, что в коде)
     */
    String name;

    TagDataType declaredType;

    /**
     * Значение из снимка в исходном текстовом виде
     */
    String value;

    boolean foundInSnapshot;

    String address;

    String quality;

    public static TagReference of(TagSnapshot tag) {
        return TagReference.builder()
                .name(tag.getName())
                .declaredType(tag.getDeclaredType())
                .value(tag.getRawValue())
                .foundInSnapshot(true)
                .address(tag.getAddress())
                .quality(tag.getQuality())
                .build();
    }
}
