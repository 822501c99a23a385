package com.rht.repairorder.load;

/**
 * Rows written by one {@link OrderLoader#persist} call, per table.
 */
public record LoadSummary(int ordersInserted, int detailsInserted) {
}
