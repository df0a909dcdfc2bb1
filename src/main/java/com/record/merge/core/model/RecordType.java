package com.record.merge.core.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Mergeable CRM record types with their attribute schema, permanent merge exclusions
 * and declared associations.
 */
public enum RecordType {
    ACCOUNT("Account",
            List.of("user_id", "assigned_to", "name", "access", "website", "toll_free_phone",
                    "phone", "fax", "email", "background_info", "rating", "category"),
            EnumSet.allOf(Association.class)),
    CONTACT("Contact",
            List.of("user_id", "lead_id", "account_id", "assigned_to", "reports_to",
                    "first_name", "last_name", "access", "title", "source", "email", "alt_email",
                    "phone", "mobile", "fax", "blog", "linkedin", "facebook", "twitter", "skype",
                    "department", "born_on", "do_not_call", "background_info"),
            EnumSet.complementOf(EnumSet.of(Association.CONTACTS)));

    /**
     * Attributes never considered during a merge, for every type.
     */
    public static final Set<String> PERMANENTLY_IGNORED = Set.of(
            "id", "created_at", "updated_at", "deleted_at", "subscribed_users");

    /**
     * Prefix of custom-field attribute names.
     */
    public static final String CUSTOM_FIELD_PREFIX = "cf_";

    /**
     * Attribute on a Contact that links it to its account.
     */
    public static final String ACCOUNT_REFERENCE = "account_id";

    private final String label;
    private final List<String> attributes;
    private final Set<Association> associations;

    RecordType(String label, List<String> attributes, Set<Association> associations) {
        this.label = label;
        this.attributes = attributes;
        this.associations = associations;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Declared attribute names in display order. Custom fields are not listed here.
     */
    public List<String> getAttributes() {
        return attributes;
    }

    public Set<Association> getAssociations() {
        return Set.copyOf(associations);
    }

    public boolean declares(Association association) {
        return associations.contains(association);
    }

    public boolean isPermanentlyIgnored(String attribute) {
        return PERMANENTLY_IGNORED.contains(attribute);
    }

    /**
     * Parses a type name case-insensitively, accepting either the enum name or the label.
     *
     * @throws IllegalArgumentException if the name matches no type
     */
    public static RecordType parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("record type is required");
        }
        String trimmed = name.trim();
        for (RecordType type : values()) {
            if (type.name().equalsIgnoreCase(trimmed) || type.label.equalsIgnoreCase(trimmed)
                    || (type.label + "s").equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown record type: " + name);
    }
}
