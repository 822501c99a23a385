package com.rht.repairorder.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Header status of a repair order, keyed by the label used in event documents
 * and stored in the {@code status} column.
 */
public enum RepairStatus {
    COMPLETED("Completed"),
    IN_PROGRESS("In Progress"),
    RECEIVED("Received"),
    REOPENED("Reopened");

    private final String label;

    RepairStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Exact, case-sensitive lookup by document label.
     */
    public static Optional<RepairStatus> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(status -> status.label.equals(label))
            .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
