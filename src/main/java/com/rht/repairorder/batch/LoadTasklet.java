package com.rht.repairorder.batch;

import com.rht.repairorder.entity.RepairOrder;
import com.rht.repairorder.load.LoadSummary;
import com.rht.repairorder.load.OrderLoader;
import com.rht.repairorder.load.SchemaManager;
import com.rht.repairorder.merge.MergeEngine;
import com.rht.repairorder.merge.MergeStats;
import com.rht.repairorder.repository.RepairOrderDetailRepository;
import com.rht.repairorder.repository.RepairOrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Empties the target tables and bulk-loads the merged state.
 *
 * <p>Runs inside the step's transaction, so the reset and both inserts commit or roll back together.
 */
@Slf4j
@Component
public class LoadTasklet implements Tasklet {

    public static final String ORDERS_MERGED = "orders.merged";
    public static final String REPORTS_REPLACED = "reports.replaced";
    public static final String REPORTS_DISCARDED = "reports.discarded";
    public static final String ORDERS_INSERTED = "orders.inserted";
    public static final String DETAILS_INSERTED = "details.inserted";

    private final MergeEngine mergeEngine;
    private final SchemaManager schemaManager;
    private final OrderLoader orderLoader;
    private final RepairOrderRepository orderRepository;
    private final RepairOrderDetailRepository detailRepository;

    public LoadTasklet(MergeEngine mergeEngine,
                       SchemaManager schemaManager,
                       OrderLoader orderLoader,
                       RepairOrderRepository orderRepository,
                       RepairOrderDetailRepository detailRepository) {
        this.mergeEngine = mergeEngine;
        this.schemaManager = schemaManager;
        this.orderLoader = orderLoader;
        this.orderRepository = orderRepository;
        this.detailRepository = detailRepository;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        ExecutionContext jobContext = chunkContext.getStepContext().getStepExecution()
            .getJobExecution().getExecutionContext();

        List<RepairOrder> orders = mergeEngine.finalState();
        MergeStats stats = mergeEngine.getStats();
        jobContext.putInt(ORDERS_MERGED, orders.size());
        jobContext.putLong(REPORTS_REPLACED, stats.getReplaced());
        jobContext.putLong(REPORTS_DISCARDED, stats.getDiscarded());

        schemaManager.reset();
        LoadSummary summary = orderLoader.persist(orders);
        contribution.incrementWriteCount(summary.ordersInserted() + summary.detailsInserted());
        jobContext.putInt(ORDERS_INSERTED, summary.ordersInserted());
        jobContext.putInt(DETAILS_INSERTED, summary.detailsInserted());

        log.debug("Store now holds {} orders and {} detail rows.",
            orderRepository.count(), detailRepository.count());
        return RepeatStatus.FINISHED;
    }
}
