package com.rht.repairorder.batch;

import com.rht.repairorder.config.PipelineProperties;
import com.rht.repairorder.load.SchemaManager;
import com.rht.repairorder.merge.MergeEngine;
import com.rht.repairorder.parser.ParsedEvent;
import com.rht.repairorder.source.DocumentStore;
import com.rht.repairorder.source.RawDocument;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.nio.file.Path;

/**
 * The full-reload job: parse and merge every document, make sure the schema exists, then reset and load.
 * All steps run sequentially on the launching thread.
 */
@Configuration
public class RepairOrderJobConfig {

    public static final String JOB_NAME = "repairOrderLoadJob";
    public static final String MERGE_STEP = "mergeStep";
    public static final String SCHEMA_STEP = "schemaStep";
    public static final String LOAD_STEP = "loadStep";
    public static final String DATA_DIR_PARAMETER = "dataDir";

    @Bean
    public Job repairOrderLoadJob(JobRepository jobRepository,
                                  Step mergeStep,
                                  Step schemaStep,
                                  Step loadStep,
                                  JobSummaryListener summaryListener) {
        return new JobBuilder(JOB_NAME, jobRepository)
            .listener(summaryListener)
            .start(mergeStep)
            .next(schemaStep)
            .next(loadStep)
            .build();
    }

    /**
     * One merge state per run, dropped when the job ends.
     */
    @Bean
    @JobScope
    public MergeEngine mergeEngine() {
        return new MergeEngine();
    }

    @Bean
    @StepScope
    public RawDocumentItemReader rawDocumentItemReader(DocumentStore documentStore,
                                                       @Value("#{jobParameters['" + DATA_DIR_PARAMETER + "']}") String dataDir) {
        return new RawDocumentItemReader(documentStore, Path.of(dataDir));
    }

    @Bean
    public Step mergeStep(JobRepository jobRepository,
                          PlatformTransactionManager transactionManager,
                          RawDocumentItemReader rawDocumentItemReader,
                          ParsingItemProcessor parsingItemProcessor,
                          MergingItemWriter mergingItemWriter,
                          PipelineProperties properties) {
        return new StepBuilder(MERGE_STEP, jobRepository)
            .<RawDocument, ParsedEvent>chunk(properties.getChunkSize(), transactionManager)
            .reader(rawDocumentItemReader)
            .processor(parsingItemProcessor)
            .writer(mergingItemWriter)
            .build();
    }

    @Bean
    public Step schemaStep(JobRepository jobRepository,
                           PlatformTransactionManager transactionManager,
                           SchemaManager schemaManager) {
        return new StepBuilder(SCHEMA_STEP, jobRepository)
            .tasklet((contribution, chunkContext) -> {
                schemaManager.ensureSchema();
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .build();
    }

    @Bean
    public Step loadStep(JobRepository jobRepository,
                         PlatformTransactionManager transactionManager,
                         LoadTasklet loadTasklet) {
        return new StepBuilder(LOAD_STEP, jobRepository)
            .tasklet(loadTasklet, transactionManager)
            .build();
    }
}
