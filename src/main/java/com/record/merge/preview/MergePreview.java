package com.record.merge.preview;

import com.record.merge.core.model.Association;
import com.record.merge.core.model.RecordType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Side-by-side view of two records about to be merged.
 *
 * @param customFields comparisons per field group label, fields in position order
 */
public record MergePreview(
        RecordType type,
        String duplicateId,
        String masterId,
        List<AttributeComparison> attributes,
        Map<String, List<AttributeComparison>> customFields,
        Map<Association, Integer> masterAssociations,
        Map<Association, Integer> duplicateAssociations,
        Set<String> masterTags,
        Set<String> duplicateTags
) {
    public MergePreview {
        attributes = List.copyOf(attributes);
        customFields = Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
        masterAssociations = Collections.unmodifiableMap(new LinkedHashMap<>(masterAssociations));
        duplicateAssociations = Collections.unmodifiableMap(new LinkedHashMap<>(duplicateAssociations));
        masterTags = Set.copyOf(masterTags);
        duplicateTags = Set.copyOf(duplicateTags);
    }
}
