package com.record.merge.rest.dto;

import com.record.merge.preview.AttributeComparison;
import com.record.merge.preview.MergePreview;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Response DTO for a merge preview: the data behind the merge selection table.
 */
public record PreviewResponse(
        String recordType,
        String duplicateId,
        String masterId,
        List<Row> attributes,
        Map<String, List<Row>> customFields,
        Map<String, Integer> masterAssociations,
        Map<String, Integer> duplicateAssociations,
        List<String> masterTags,
        List<String> duplicateTags
) {
    /**
     * One attribute. {@code defaultChoice} is {@code "master"}, {@code "duplicate"} or null when both are blank.
     */
    public record Row(String name, String label, Object master, Object duplicate, String defaultChoice) {
        static Row from(AttributeComparison comparison) {
            return new Row(comparison.name(), comparison.label(),
                    comparison.masterValue(), comparison.duplicateValue(),
                    comparison.defaultSource() != null ? comparison.defaultSource().name().toLowerCase(Locale.ROOT) : null);
        }
    }

    public static PreviewResponse from(MergePreview preview) {
        Map<String, List<Row>> customFields = new LinkedHashMap<>();
        preview.customFields().forEach((group, rows) ->
                customFields.put(group, rows.stream().map(Row::from).toList()));
        Map<String, Integer> masterAssociations = new LinkedHashMap<>();
        preview.masterAssociations().forEach((a, count) -> masterAssociations.put(a.getLabel(), count));
        Map<String, Integer> duplicateAssociations = new LinkedHashMap<>();
        preview.duplicateAssociations().forEach((a, count) -> duplicateAssociations.put(a.getLabel(), count));

        return new PreviewResponse(
                preview.type().name(),
                preview.duplicateId(),
                preview.masterId(),
                preview.attributes().stream().map(Row::from).toList(),
                customFields,
                masterAssociations,
                duplicateAssociations,
                preview.masterTags().stream().sorted().toList(),
                preview.duplicateTags().stream().sorted().toList()
        );
    }
}
