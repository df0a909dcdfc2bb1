package com.record.merge.preview;

import com.record.merge.core.model.RecordType;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A named group of custom fields attached to one record type.
 */
public record FieldGroup(String name, String label, RecordType recordType, List<CustomField> fields) {

    public FieldGroup {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(recordType, "recordType is required");
        label = label != null ? label : name;
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    /**
     * Fields ordered by position, then name.
     */
    public List<CustomField> sortedFields() {
        return fields.stream()
                .sorted(Comparator.comparingInt(CustomField::position).thenComparing(CustomField::name))
                .toList();
    }
}
