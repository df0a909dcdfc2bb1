package com.record.merge.merge;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Requires a non-blank value for a fixed set of attributes per type.
 * Defaults: {@code name} on accounts, {@code first_name} and {@code last_name} on contacts.
 */
public class RequiredAttributesValidator implements RecordValidator {

    private final Map<RecordType, List<String>> required;

    public RequiredAttributesValidator() {
        this(Map.of(
                RecordType.ACCOUNT, List.of("name"),
                RecordType.CONTACT, List.of("first_name", "last_name")
        ));
    }

    public RequiredAttributesValidator(Map<RecordType, List<String>> required) {
        this.required = new EnumMap<>(RecordType.class);
        required.forEach((type, attributes) -> this.required.put(type, List.copyOf(attributes)));
    }

    @Override
    public List<String> validate(CrmRecord record) {
        List<String> violations = new ArrayList<>();
        for (String attribute : required.getOrDefault(record.getType(), List.of())) {
            if (Blank.isBlank(record.get(attribute))) {
                violations.add(attribute + " can't be blank");
            }
        }
        return violations;
    }
}
