package com.rht.repairorder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the repair-order load pipeline, bound from {@code repair.pipeline.*}.
 */
@Data
@ConfigurationProperties(prefix = "repair.pipeline")
public class PipelineProperties {

    /**
     * Directory holding the {@code *.xml} event documents.
     */
    private String dataDir = "../data";

    /**
     * Documents parsed and merged per chunk of the merge step.
     */
    private int chunkSize = 10;

    /**
     * Rows per JDBC batch during bulk insert.
     */
    private int insertBatchSize = 500;

    /**
     * Launch the load job when the application starts.
     */
    private boolean runOnStartup = true;
}
