package com.rht.repairorder.merge;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters kept by {@link MergeEngine} over one run.
 */
@Getter
@ToString
public class MergeStats {

    private long applied;
    private long inserted;
    private long replaced;
    private long discarded;

    void recordInserted() {
        applied++;
        inserted++;
    }

    void recordReplaced() {
        applied++;
        replaced++;
    }

    void recordDiscarded() {
        applied++;
        discarded++;
    }
}
