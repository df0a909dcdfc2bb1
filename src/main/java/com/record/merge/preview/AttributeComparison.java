package com.record.merge.preview;

import com.record.merge.merge.AttributeSource;

import java.util.Objects;

/**
 * One row of the merge selection table.
 *
 * @param name           attribute name
 * @param label          display label
 * @param masterValue    master's value (rendered for custom fields)
 * @param duplicateValue duplicate's value (rendered for custom fields)
 * @param defaultSource  side selected by default, null when both values are blank
 */
public record AttributeComparison(
        String name,
        String label,
        Object masterValue,
        Object duplicateValue,
        AttributeSource defaultSource
) {
    public AttributeComparison {
        Objects.requireNonNull(name, "name is required");
        label = label != null ? label : name;
    }

    public boolean differs() {
        return !Objects.equals(masterValue, duplicateValue);
    }
}
