package com.record.merge.preview;

import com.record.merge.core.model.RecordType;

import java.util.Objects;

/**
 * A user-defined field stored on a record as a {@code cf_}-prefixed attribute.
 *
 * @param name     attribute name, always starting with {@code cf_}
 * @param label    display label
 * @param position sort key within its group
 * @param type     how the stored value is rendered
 */
public record CustomField(String name, String label, int position, FieldType type) {

    public CustomField {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        if (!name.startsWith(RecordType.CUSTOM_FIELD_PREFIX)) {
            throw new IllegalArgumentException("Custom field names start with '"
                    + RecordType.CUSTOM_FIELD_PREFIX + "': " + name);
        }
        label = label != null ? label : name.substring(RecordType.CUSTOM_FIELD_PREFIX.length());
    }

    public static CustomField of(String name, String label, int position, FieldType type) {
        return new CustomField(name, label, position, type);
    }

    /**
     * Kinds of custom field. Multiselect values are stored as one string separated by {@code |} or commas.
     */
    public enum FieldType {
        STRING,
        TEXT,
        NUMBER,
        SELECT,
        CHECKBOX,
        MULTISELECT,
        DATE,
        DATETIME
    }
}
