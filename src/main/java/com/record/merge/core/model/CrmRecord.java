package com.record.merge.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * A mergeable CRM record (Account or Contact).
 * Attribute values are limited to {@code String}, {@code Number}, {@code Boolean} or null;
 * dates are carried as ISO-8601 strings.
 */
public class CrmRecord {
    private final String id;
    private final RecordType type;
    private final Map<String, Object> attributes;
    private final Set<String> tags;
    private final Instant createdAt;
    private Instant updatedAt;

    private CrmRecord(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.type = builder.type;
        this.attributes = new LinkedHashMap<>(builder.attributes);
        this.tags = new TreeSet<>(builder.tags);
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public RecordType getType() {
        return type;
    }

    /**
     * Returns the value of an attribute, or null when unset.
     */
    public Object get(String attribute) {
        return attributes.get(attribute);
    }

    public String getString(String attribute) {
        Object value = attributes.get(attribute);
        return value != null ? value.toString() : null;
    }

    public void set(String attribute, Object value) {
        checkValue(attribute, value);
        attributes.put(attribute, value);
        this.updatedAt = Instant.now();
    }

    /**
     * Returns an unmodifiable view of all attributes, including nulls that were set explicitly.
     */
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Returns the attributes a merge may consider: every declared attribute of the type
     * plus any custom fields, minus the permanently ignored ones. Unset declared attributes map to null.
     */
    public Map<String, Object> getMergeAttributes() {
        Map<String, Object> merge = new LinkedHashMap<>();
        for (String attribute : type.getAttributes()) {
            merge.put(attribute, attributes.get(attribute));
        }
        attributes.forEach((key, value) -> {
            if (!merge.containsKey(key)) {
                merge.put(key, value);
            }
        });
        RecordType.PERMANENTLY_IGNORED.forEach(merge::remove);
        return merge;
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    public void addTags(Collection<String> newTags) {
        for (String tag : newTags) {
            if (tag != null && !tag.isBlank()) {
                tags.add(tag.trim());
            }
        }
        this.updatedAt = Instant.now();
    }

    public void setTags(Collection<String> newTags) {
        tags.clear();
        addTags(newTags);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Deep copy with the same id, attributes, tags and timestamps.
     */
    public CrmRecord copy() {
        return builder(this).build();
    }

    private static void checkValue(String attribute, Object value) {
        Objects.requireNonNull(attribute, "attribute is required");
        if (value != null && !(value instanceof String) && !(value instanceof Number)
                && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported value type for '" + attribute + "': "
                    + value.getClass().getName());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CrmRecord record = (CrmRecord) o;
        return Objects.equals(id, record.id) && type == record.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return "CrmRecord{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", attributes=" + attributes +
                ", tags=" + tags +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CrmRecord record) {
        return new Builder()
                .id(record.id)
                .type(record.type)
                .attributes(record.attributes)
                .tags(record.tags)
                .createdAt(record.createdAt)
                .updatedAt(record.updatedAt);
    }

    public static class Builder {
        private String id;
        private RecordType type;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Set<String> tags = new TreeSet<>();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(RecordType type) {
            this.type = type;
            return this;
        }

        public Builder attribute(String name, Object value) {
            checkValue(name, value);
            this.attributes.put(name, value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            attributes.forEach(this::attribute);
            return this;
        }

        public Builder tag(String tag) {
            if (tag != null && !tag.isBlank()) {
                this.tags.add(tag.trim());
            }
            return this;
        }

        public Builder tags(Collection<String> tags) {
            tags.forEach(this::tag);
            return this;
        }

        /**
         * Adds tags from a comma separated list, e.g. {@code "tag1, tag2"}.
         */
        public Builder tagList(String tagList) {
            if (tagList != null) {
                for (String tag : tagList.split(",")) {
                    tag(tag);
                }
            }
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CrmRecord build() {
            Objects.requireNonNull(type, "type is required");
            return new CrmRecord(this);
        }
    }
}
