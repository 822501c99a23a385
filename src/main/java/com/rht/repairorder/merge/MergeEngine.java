package com.rht.repairorder.merge;

import com.rht.repairorder.entity.RepairOrder;
import com.rht.repairorder.parser.ParsedEvent;
import com.rht.repairorder.parser.ParsedPart;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds parsed events into one winning report per order id (last write wins on the report timestamp).
 *
 * <p>A report replaces the stored one only when its timestamp is strictly later; the replacement swaps
 * the header and the whole parts list together. On equal timestamps the report applied first stays,
 * so the outcome depends on the order in which events are applied. Callers must apply events in
 * document order from a single thread.
 */
@Slf4j
public class MergeEngine {

    private final Map<Integer, ParsedEvent> winners = new LinkedHashMap<>();
    private final MergeStats stats = new MergeStats();

    public void apply(ParsedEvent event) {
        ParsedEvent current = winners.get(event.orderId());
        if (current == null) {
            log.debug("We are seeing order {} for the first time.", event.orderId());
            winners.put(event.orderId(), event);
            stats.recordInserted();
        } else if (event.timestamp().isAfter(current.timestamp())) {
            log.debug("Replacing order {}: report of {} supersedes report of {}.",
                event.orderId(), event.timestamp(), current.timestamp());
            winners.put(event.orderId(), event);
            stats.recordReplaced();
        } else {
            log.debug("Discarding report of {} for order {}: kept report is from {}.",
                event.timestamp(), event.orderId(), current.timestamp());
            stats.recordDiscarded();
        }
    }

    /**
     * Final state as entity graphs: each order carries the detail lines of its winning report.
     */
    public List<RepairOrder> finalState() {
        List<RepairOrder> orders = new ArrayList<>(winners.size());
        for (ParsedEvent event : winners.values()) {
            RepairOrder order = RepairOrder.builder()
                .orderId(event.orderId())
                .timestamp(event.timestamp())
                .status(event.status())
                .cost(event.cost())
                .technician(event.technician())
                .build();
            for (ParsedPart part : event.parts()) {
                order.addDetail(part.name(), part.quantity());
            }
            orders.add(order);
        }
        return orders;
    }

    public MergeStats getStats() {
        return stats;
    }
}
