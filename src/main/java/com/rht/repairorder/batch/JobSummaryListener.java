package com.rht.repairorder.batch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.stereotype.Component;

/**
 * Logs the outcome of each run: documents read and rejected, merge decisions, rows inserted.
 */
@Slf4j
@Component
public class JobSummaryListener implements JobExecutionListener {

    @Override
    public void afterJob(JobExecution jobExecution) {
        long read = 0;
        long rejected = 0;
        for (StepExecution step : jobExecution.getStepExecutions()) {
            if (RepairOrderJobConfig.MERGE_STEP.equals(step.getStepName())) {
                read = step.getReadCount();
                rejected = step.getFilterCount();
            }
        }
        ExecutionContext context = jobExecution.getExecutionContext();

        if (jobExecution.getStatus() == BatchStatus.COMPLETED) {
            log.info("Load complete: {} documents read, {} rejected, {} orders merged ({} reports replaced, {} discarded); "
                    + "{} order rows and {} detail rows inserted.",
                read, rejected,
                context.getInt(LoadTasklet.ORDERS_MERGED, 0),
                context.getLong(LoadTasklet.REPORTS_REPLACED, 0L),
                context.getLong(LoadTasklet.REPORTS_DISCARDED, 0L),
                context.getInt(LoadTasklet.ORDERS_INSERTED, 0),
                context.getInt(LoadTasklet.DETAILS_INSERTED, 0));
            return;
        }
        log.error("Load failed with status {} after {} documents read, {} rejected.",
            jobExecution.getStatus(), read, rejected);
        for (Throwable failure : jobExecution.getAllFailureExceptions()) {
            log.error("Cause:", failure);
        }
    }
}
