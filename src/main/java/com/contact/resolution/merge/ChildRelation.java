package com.contact.resolution.merge;

/**
 * Child tables consolidated onto the primary contact during a merge.
 */
public enum ChildRelation {
    EMAILS,
    PHONES
}
