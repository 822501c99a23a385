package com.rht.repairorder.batch;

import com.rht.repairorder.merge.MergeEngine;
import com.rht.repairorder.parser.ParsedEvent;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;
import org.springframework.stereotype.Component;

/**
 * Applies parsed events to the run's {@link MergeEngine} in chunk order.
 */
@Component
public class MergingItemWriter implements ItemWriter<ParsedEvent> {

    private final MergeEngine mergeEngine;

    public MergingItemWriter(MergeEngine mergeEngine) {
        this.mergeEngine = mergeEngine;
    }

    @Override
    public void write(Chunk<? extends ParsedEvent> chunk) {
        for (ParsedEvent event : chunk) {
            mergeEngine.apply(event);
        }
    }
}
