package com.example.sclanalyzer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Тег PLC в том виде, как его отдаёт backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagSnapshotDto {
    @NotBlank(message = "Tag name is required")
    @JsonProperty("tag_name")
    private String tagName;

    /**
     * Значение в текстовом виде ("TRUE", "1", "23.5")
     */
    private String value;

    /**
     * Тип данных (BOOL, INT, REAL, ...)
     */
    @JsonProperty("data_type")
    private String dataType;

    private String address;

    private String quality;
}
