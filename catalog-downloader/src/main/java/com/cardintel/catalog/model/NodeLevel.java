package com.cardintel.catalog.model;

/**
 * Level of a node in the category → group → item catalog tree.
 */
public enum NodeLevel {
    CATEGORY, GROUP, ITEM
}
