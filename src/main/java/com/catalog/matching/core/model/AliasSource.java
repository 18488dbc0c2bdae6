package com.catalog.matching.core.model;

/**
 * Origin of an alias record.
 */
public enum AliasSource {
    APPROVAL,
    MANUAL,
    IMPORT
}
