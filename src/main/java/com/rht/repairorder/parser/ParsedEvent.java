package com.rht.repairorder.parser;

import com.rht.repairorder.entity.RepairStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One structurally validated repair-order report.
 * {@code parts} is always a list, even when the document held a single part.
 */
public record ParsedEvent(
        int orderId,
        LocalDateTime timestamp,
        RepairStatus status,
        double cost,
        String technician,
        List<ParsedPart> parts) {

    public ParsedEvent {
        parts = List.copyOf(parts);
    }
}
