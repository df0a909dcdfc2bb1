package com.record.merge.merge;

import com.record.merge.core.model.RecordType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A request to merge one record (the duplicate) into another (the master).
 *
 * @param type              type of the master
 * @param duplicateType     type of the duplicate; a merge across types is refused
 * @param duplicateId       record that will be merged away
 * @param masterId          record that survives
 * @param ignoredAttributes attributes the master keeps regardless of precedence
 * @param choices           explicit per-attribute precedence overrides
 * @param triggeredBy       actor recorded in the audit trail, or null for the configured default
 */
public record MergeRequest(
        RecordType type,
        RecordType duplicateType,
        String duplicateId,
        String masterId,
        Set<String> ignoredAttributes,
        Map<String, AttributeSource> choices,
        String triggeredBy
) {
    public MergeRequest {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(duplicateId, "duplicateId is required");
        Objects.requireNonNull(masterId, "masterId is required");
        duplicateType = duplicateType != null ? duplicateType : type;
        ignoredAttributes = ignoredAttributes != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(ignoredAttributes)) : Set.of();
        choices = choices != null ? Collections.unmodifiableMap(new LinkedHashMap<>(choices)) : Map.of();
    }

    public boolean isSelfMerge() {
        return duplicateId.equals(masterId) && duplicateType == type;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RecordType type;
        private RecordType duplicateType;
        private String duplicateId;
        private String masterId;
        private final Set<String> ignoredAttributes = new LinkedHashSet<>();
        private final Map<String, AttributeSource> choices = new LinkedHashMap<>();
        private String triggeredBy;

        public Builder type(RecordType type) {
            this.type = type;
            return this;
        }

        public Builder duplicateType(RecordType duplicateType) {
            this.duplicateType = duplicateType;
            return this;
        }

        public Builder duplicateId(String duplicateId) {
            this.duplicateId = duplicateId;
            return this;
        }

        public Builder masterId(String masterId) {
            this.masterId = masterId;
            return this;
        }

        public Builder ignore(String attribute) {
            this.ignoredAttributes.add(attribute);
            return this;
        }

        public Builder ignoredAttributes(Collection<String> attributes) {
            if (attributes != null) {
                this.ignoredAttributes.addAll(attributes);
            }
            return this;
        }

        public Builder choose(String attribute, AttributeSource source) {
            this.choices.put(attribute, source);
            return this;
        }

        public Builder choices(Map<String, AttributeSource> choices) {
            if (choices != null) {
                this.choices.putAll(choices);
            }
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public MergeRequest build() {
            return new MergeRequest(type, duplicateType, duplicateId, masterId,
                    ignoredAttributes, choices, triggeredBy);
        }
    }
}
