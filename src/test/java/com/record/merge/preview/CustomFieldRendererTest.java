package com.record.merge.preview;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;
import com.record.merge.preview.CustomField.FieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CustomFieldRenderer Tests")
class CustomFieldRendererTest {

    private final CustomFieldRenderer renderer = new CustomFieldRenderer();

    private static CustomField field(FieldType type) {
        return CustomField.of("cf_value", null, 0, type);
    }

    @Test
    @DisplayName("Null renders as empty text")
    void nullIsEmpty() {
        assertEquals("", renderer.render(field(FieldType.STRING), null));
    }

    @Test
    @DisplayName("Checkbox renders Yes/No")
    void checkbox() {
        CustomField checkbox = field(FieldType.CHECKBOX);
        assertEquals("Yes", renderer.render(checkbox, true));
        assertEquals("Yes", renderer.render(checkbox, "1"));
        assertEquals("No", renderer.render(checkbox, "0"));
        assertEquals("No", renderer.render(checkbox, false));
        assertEquals("No", renderer.render(checkbox, ""));
    }

    @Test
    @DisplayName("Multiselect joins options with commas")
    void multiselect() {
        assertEquals("Red, Green, Blue", renderer.render(field(FieldType.MULTISELECT), "Red|Green, Blue||"));
    }

    @Test
    @DisplayName("Dates and datetimes are normalised")
    void dates() {
        assertEquals("2024-03-05", renderer.render(field(FieldType.DATE), "2024-03-05"));
        assertEquals("2024-03-05", renderer.render(field(FieldType.DATE), "2024-03-05T10:15:00Z"));
        assertEquals("2024-03-05 10:15", renderer.render(field(FieldType.DATETIME), "2024-03-05T10:15:30+02:00"));
        assertEquals("2024-03-05 10:15", renderer.render(field(FieldType.DATETIME), "2024-03-05T10:15:30"));
        assertEquals("soon", renderer.render(field(FieldType.DATE), "soon"));
    }

    @Test
    @DisplayName("Group rendering follows field position")
    void groupOrder() {
        FieldGroup group = new FieldGroup("details", "Details", RecordType.ACCOUNT, List.of(
                CustomField.of("cf_b", "B", 2, FieldType.NUMBER),
                CustomField.of("cf_a", "A", 1, FieldType.STRING)));
        CrmRecord record = CrmRecord.builder().type(RecordType.ACCOUNT)
                .attribute("cf_a", "x").attribute("cf_b", 7).build();

        Map<String, String> rendered = renderer.render(group, record);

        assertEquals(List.of("cf_a", "cf_b"), List.copyOf(rendered.keySet()));
        assertEquals("7", rendered.get("cf_b"));
    }

    @Test
    @DisplayName("Custom field names must carry the prefix")
    void prefixRequired() {
        assertThrows(IllegalArgumentException.class, () -> CustomField.of("region", null, 0, FieldType.STRING));
        assertEquals("region", CustomField.of("cf_region", null, 0, FieldType.STRING).label());
    }
}
