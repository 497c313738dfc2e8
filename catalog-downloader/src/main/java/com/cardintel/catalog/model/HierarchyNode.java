package com.cardintel.catalog.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A category, group or item in the catalog tree.
 *
 * The key is the parent chain plus the node's own external id joined with ':',
 * e.g. "3" for a category, "3:2371" for one of its groups. It is the identifier
 * used in the checkpoint and never changes once the node has been discovered.
 */
public record HierarchyNode(NodeLevel level, String externalId, String name, List<String> parentChain) {

    private static final String SEPARATOR = ":";

    public HierarchyNode {
        parentChain = List.copyOf(parentChain);
    }

    public static HierarchyNode category(String categoryId, String name) {
        return new HierarchyNode(NodeLevel.CATEGORY, categoryId, name, List.of());
    }

    public static HierarchyNode group(HierarchyNode category, String groupId, String name) {
        return category.child(NodeLevel.GROUP, groupId, name);
    }

    public static HierarchyNode item(HierarchyNode group, String productId, String name) {
        return group.child(NodeLevel.ITEM, productId, name);
    }

    public String key() {
        if (parentChain.isEmpty()) return externalId;
        return String.join(SEPARATOR, parentChain) + SEPARATOR + externalId;
    }

    /** Key of the direct parent, or null for a category. */
    public String parentKey() {
        return parentChain.isEmpty() ? null : String.join(SEPARATOR, parentChain);
    }

    /** External id of the owning category (the node itself for a category). */
    public String categoryId() {
        return parentChain.isEmpty() ? externalId : parentChain.get(0);
    }

    private HierarchyNode child(NodeLevel childLevel, String childId, String childName) {
        List<String> chain = new ArrayList<>(parentChain);
        chain.add(externalId);
        return new HierarchyNode(childLevel, childId, childName, chain);
    }

    @Override
    public String toString() {
        return level + "[" + key() + (name != null ? " " + name : "") + "]";
    }
}
