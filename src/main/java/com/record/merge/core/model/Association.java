package com.record.merge.core.model;

/**
 * Has-many associations a CRM record can own.
 * Every association except {@link #CONTACTS} is stored as {@link ChildRecord} rows keyed by owner;
 * contacts of an account are Contact records pointing at the account through {@code account_id}.
 */
public enum Association {
    EMAILS("emails"),
    COMMENTS("comments"),
    ADDRESSES("addresses"),
    TASKS("tasks"),
    OPPORTUNITIES("opportunities"),
    CONTACTS("contacts");

    private final String label;

    Association(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether the children of this association are CRM records rather than child rows.
     */
    public boolean isRecordReference() {
        return this == CONTACTS;
    }
}
