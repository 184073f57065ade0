package com.example.sclanalyzer.service.analysis;

import com.example.sclanalyzer.dto.AnalysisRequest;
import com.example.sclanalyzer.dto.AnalysisResponse;
import com.example.sclanalyzer.dto.TagSnapshotDto;
import com.example.sclanalyzer.model.AnalysisResult;
import com.example.sclanalyzer.model.AnalysisStatistics;
import com.example.sclanalyzer.model.AssignmentResult;
import com.example.sclanalyzer.model.Diagnostic;
import com.example.sclanalyzer.model.TagDataType;
import com.example.sclanalyzer.model.TagReference;
import com.example.sclanalyzer.model.TagSnapshot;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import com.example.sclanalyzer.service.narrative.ValueFormatter;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Маппинг между DTO и доменной моделью.
 */
@Component
public class AnalysisResultMapper {

    public TagSnapshotIndex toSnapshot(AnalysisRequest request) {
        return toSnapshot(request.getTags());
    }

    /**
     * Список тегов: каждый доступен по имени и по имени в нижнем регистре.
     */
    public TagSnapshotIndex toSnapshot(List<TagSnapshotDto> tags) {
        if (tags == null) {
            return TagSnapshotIndex.empty();
        }
        return TagSnapshotIndex.of(tags.stream()
                .filter(Objects::nonNull)
                .map(this::toSnapshot)
                .collect(Collectors.toList()));
    }

    /**
     * Отображение ключ поиска → тег; пустое имя тега заменяется ключом.
     */
    public TagSnapshotIndex toSnapshot(Map<String, TagSnapshotDto> keyed) {
        if (keyed == null) {
            return TagSnapshotIndex.empty();
        }
        Map<String, TagSnapshot> keys = new LinkedHashMap<>();
        keyed.forEach((key, dto) -> {
            if (dto == null) {
                return;
            }
            TagSnapshot tag = toSnapshot(dto);
            if (tag.getName() == null || tag.getName().isBlank()) {
                tag = tag.toBuilder().name(key).build();
            }
            keys.put(key, tag);
        });
        return TagSnapshotIndex.ofKeys(keys);
    }

    public AnalysisResponse toDto(AnalysisResult result) {
        return AnalysisResponse.builder()
                .status(result.isSuccess()
                        ? AnalysisResponse.AnalysisStatus.COMPLETED
                        : AnalysisResponse.AnalysisStatus.FAILED)
                .classifiedType(result.getClassifiedType().name())
                .summary(result.getSummary())
                .narrative(result.getNarrative())
                .tagsReferenced(result.getTagsReferenced().stream()
                        .map(this::toDto)
                        .collect(Collectors.toList()))
                .unresolvedIdentifiers(result.getUnresolvedIdentifiers())
                .assignments(result.getAssignments().stream()
                        .map(this::toDto)
                        .collect(Collectors.toList()))
                .lastAssignment(result.getLastAssignment().map(this::toDto).orElse(null))
                .diagnostics(result.getDiagnostics().stream()
                        .map(this::toDto)
                        .collect(Collectors.toList()))
                .statistics(toDto(result.getStatistics()))
                .build();
    }

    private TagSnapshot toSnapshot(TagSnapshotDto dto) {
        return TagSnapshot.builder()
                .name(dto.getTagName())
                .rawValue(dto.getValue())
                .declaredType(TagDataType.fromName(dto.getDataType()))
                .address(dto.getAddress())
                .quality(dto.getQuality())
                .build();
    }

    private AnalysisResponse.TagReferenceDto toDto(TagReference tag) {
        return AnalysisResponse.TagReferenceDto.builder()
                .name(tag.getName())
                .declaredType(tag.getDeclaredType().name())
                .value(tag.getValue())
                .foundInSnapshot(tag.isFoundInSnapshot())
                .address(tag.getAddress())
                .quality(tag.getQuality())
                .build();
    }

    private AnalysisResponse.AssignmentDto toDto(AssignmentResult assignment) {
        return AnalysisResponse.AssignmentDto.builder()
                .variableName(assignment.getVariableName())
                .value(assignment.hasValue() ? assignment.getValue().toPlainObject() : null)
                .displayValue(ValueFormatter.format(assignment.getValue()))
                .inferredType(assignment.getInferredType().name())
                .sourceExpression(assignment.getSourceExpression())
                .build();
    }

    private AnalysisResponse.DiagnosticDto toDto(Diagnostic diagnostic) {
        return AnalysisResponse.DiagnosticDto.builder()
                .severity(diagnostic.getSeverity().name())
                .type(diagnostic.getType().name())
                .message(diagnostic.getMessage())
                .variableName(diagnostic.getVariableName())
                .build();
    }

    private AnalysisResponse.StatisticsDto toDto(AnalysisStatistics statistics) {
        if (statistics == null) {
            return null;
        }
        return AnalysisResponse.StatisticsDto.builder()
                .totalLines(statistics.getTotalLines())
                .codeLines(statistics.getCodeLines())
                .commentLines(statistics.getCommentLines())
                .emptyLines(statistics.getEmptyLines())
                .tagsFound(statistics.getTagsFound())
                .tagsInSnapshot(statistics.getTagsInSnapshot())
                .tagsNotInSnapshot(statistics.getTagsNotInSnapshot())
                .assignmentsExecuted(statistics.getAssignmentsExecuted())
                .build();
    }
}
