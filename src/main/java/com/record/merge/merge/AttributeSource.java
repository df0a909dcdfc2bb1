package com.record.merge.merge;

/**
 * Which side of a merge supplies an attribute's final value.
 */
public enum AttributeSource {
    MASTER,
    DUPLICATE
}
