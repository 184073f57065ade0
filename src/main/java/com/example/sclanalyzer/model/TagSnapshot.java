package com.example.sclanalyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Состояние одного тега PLC на момент снятия снимка.
 */
@Value
@Builder(toBuilder = true)
public class TagSnapshot {
    /**
     * Имя тега (например: Sensor_1)
     */
    String name;

    /**
     * Значение в текстовом виде, как его отдаёт backend ("TRUE", "1", "23.5")
     */
    String rawValue;

    /**
     * Объявленный тип данных
     */
    @Builder.Default
    TagDataType declaredType = TagDataType.UNKNOWN;

    /**
     * Адрес в PLC (опционально, например: DB1.DBX0.0)
     */
    String address;

    /**
     * Качество значения (опционально)
     */
    String quality;
}
