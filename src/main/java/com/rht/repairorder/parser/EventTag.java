package com.rht.repairorder.parser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Element and attribute names of a repair-order event document.
 * Attributes ({@link #NAME}, {@link #QUANTITY}) appear as plain members of their element's node.
 */
public enum EventTag {
    EVENT("event"),
    ORDER_ID("order_id"),
    DATE_TIME("date_time"),
    STATUS("status"),
    COST("cost"),
    REPAIR_DETAILS("repair_details"),
    TECHNICIAN("technician"),
    REPAIR_PARTS("repair_parts"),
    PART("part"),
    NAME("name"),
    QUANTITY("quantity");

    private final String tagName;

    EventTag(String tagName) {
        this.tagName = tagName;
    }

    public String getTagName() {
        return tagName;
    }

    /**
     * Child of {@code parent} named by this tag, or null when absent or when {@code parent} has no children.
     */
    public JsonNode in(JsonNode parent) {
        return parent == null ? null : parent.get(tagName);
    }

    @Override
    public String toString() {
        return tagName;
    }
}
