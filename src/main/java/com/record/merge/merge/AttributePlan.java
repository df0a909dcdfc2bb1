package com.record.merge.merge;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved attribute precedence for one merge call.
 *
 * @param type       type of both records
 * @param precedence source of the final value for each planned attribute
 * @param excluded   every attribute the merge must not touch (permanent plus caller-ignored)
 */
public record AttributePlan(
        RecordType type,
        Map<String, AttributeSource> precedence,
        Set<String> excluded
) {
    public AttributePlan {
        Objects.requireNonNull(type, "type is required");
        precedence = Collections.unmodifiableMap(new LinkedHashMap<>(precedence));
        excluded = Set.copyOf(excluded);
    }

    public AttributeSource sourceOf(String attribute) {
        return precedence.get(attribute);
    }

    /**
     * Attributes whose value will be taken from the duplicate.
     */
    public List<String> duplicateAttributes() {
        List<String> attributes = new ArrayList<>();
        precedence.forEach((attribute, source) -> {
            if (source == AttributeSource.DUPLICATE && !excluded.contains(attribute)) {
                attributes.add(attribute);
            }
        });
        return attributes;
    }

    /**
     * Copies the duplicate-sourced values onto the master.
     *
     * @return names of the attributes whose value changed
     */
    public List<String> applyTo(CrmRecord master, CrmRecord duplicate) {
        List<String> copied = new ArrayList<>();
        for (String attribute : duplicateAttributes()) {
            Object value = duplicate.get(attribute);
            if (!Objects.equals(master.get(attribute), value)) {
                master.set(attribute, value);
                copied.add(attribute);
            }
        }
        return copied;
    }
}
