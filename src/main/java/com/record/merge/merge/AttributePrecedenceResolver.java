package com.record.merge.merge;

import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordType;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides, per attribute, whether the master keeps its value or takes the duplicate's.
 * The default rule favours the master: its value wins when present, otherwise a present
 * duplicate value fills the gap, otherwise the attribute is left alone.
 */
public class AttributePrecedenceResolver {

    /**
     * Default precedence for every attribute seen on either side, minus the permanently ignored ones.
     * Attributes blank on both sides are omitted.
     */
    public Map<String, AttributeSource> defaultPrecedence(Map<String, Object> duplicateAttributes,
                                                          Map<String, Object> masterAttributes) {
        Set<String> names = new LinkedHashSet<>(masterAttributes.keySet());
        names.addAll(duplicateAttributes.keySet());

        Map<String, AttributeSource> precedence = new LinkedHashMap<>();
        for (String name : names) {
            if (RecordType.PERMANENTLY_IGNORED.contains(name)) {
                continue;
            }
            if (Blank.isPresent(masterAttributes.get(name))) {
                precedence.put(name, AttributeSource.MASTER);
            } else if (Blank.isPresent(duplicateAttributes.get(name))) {
                precedence.put(name, AttributeSource.DUPLICATE);
            }
        }
        return precedence;
    }

    public AttributePlan plan(CrmRecord duplicate, CrmRecord master, Collection<String> ignoredAttributes) {
        return plan(duplicate, master, ignoredAttributes, Map.of());
    }

    /**
     * Builds the plan for one merge: default precedence, overridden by explicit choices,
     * with caller-ignored attributes pinned to the master.
     *
     * @throws IllegalArgumentException if a choice names an attribute neither record can carry
     */
    public AttributePlan plan(CrmRecord duplicate, CrmRecord master,
                              Collection<String> ignoredAttributes,
                              Map<String, AttributeSource> choices) {
        Objects.requireNonNull(duplicate, "duplicate is required");
        Objects.requireNonNull(master, "master is required");
        RecordType type = master.getType();

        Map<String, Object> duplicateAttributes = duplicate.getMergeAttributes();
        Map<String, Object> masterAttributes = master.getMergeAttributes();
        Map<String, AttributeSource> precedence = defaultPrecedence(duplicateAttributes, masterAttributes);

        if (choices != null) {
            choices.forEach((attribute, source) -> {
                Objects.requireNonNull(source, "choice for '" + attribute + "' is null");
                if (RecordType.PERMANENTLY_IGNORED.contains(attribute)) {
                    return;
                }
                if (!isMergeable(type, attribute, duplicateAttributes, masterAttributes)) {
                    throw new IllegalArgumentException("Unknown " + type.getLabel() + " attribute: " + attribute);
                }
                precedence.put(attribute, source);
            });
        }

        Set<String> excluded = new HashSet<>(RecordType.PERMANENTLY_IGNORED);
        if (ignoredAttributes != null) {
            for (String attribute : ignoredAttributes) {
                if (attribute == null || attribute.isBlank()) {
                    continue;
                }
                excluded.add(attribute);
                if (!RecordType.PERMANENTLY_IGNORED.contains(attribute)) {
                    precedence.put(attribute, AttributeSource.MASTER);
                }
            }
        }
        return new AttributePlan(type, precedence, excluded);
    }

    private static boolean isMergeable(RecordType type, String attribute,
                                       Map<String, Object> duplicateAttributes,
                                       Map<String, Object> masterAttributes) {
        return type.getAttributes().contains(attribute)
                || attribute.startsWith(RecordType.CUSTOM_FIELD_PREFIX)
                || duplicateAttributes.containsKey(attribute)
                || masterAttributes.containsKey(attribute);
    }
}
