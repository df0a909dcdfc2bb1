package com.record.merge.preview;

import com.record.merge.core.model.CrmRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns stored custom-field values into display strings.
 */
public class CustomFieldRenderer {

    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    /**
     * Renders every field of a group for one record, in field order.
     */
    public Map<String, String> render(FieldGroup group, CrmRecord record) {
        Map<String, String> rendered = new LinkedHashMap<>();
        for (CustomField field : group.sortedFields()) {
            rendered.put(field.name(), render(field, record.get(field.name())));
        }
        return rendered;
    }

    public String render(CustomField field, Object value) {
        if (value == null) {
            return "";
        }
        return switch (field.type()) {
            case CHECKBOX -> isChecked(value) ? "Yes" : "No";
            case MULTISELECT -> renderMultiselect(value.toString());
            case DATE -> renderDate(value.toString());
            case DATETIME -> renderDateTime(value.toString());
            default -> value.toString();
        };
    }

    private static boolean isChecked(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        return !(text.isEmpty() || text.equals("0") || text.equals("false") || text.equals("no"));
    }

    private static String renderMultiselect(String value) {
        return Arrays.stream(value.split("[|,]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(", "));
    }

    private static String renderDate(String value) {
        String trimmed = value.trim();
        try {
            return LocalDate.parse(trimmed).toString();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(trimmed).toLocalDate().toString();
            } catch (DateTimeParseException ignored) {
                return trimmed;
            }
        }
    }

    private static String renderDateTime(String value) {
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed).format(DATETIME_FORMAT);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(trimmed).format(DATETIME_FORMAT);
            } catch (DateTimeParseException ignored) {
                return trimmed;
            }
        }
    }
}
