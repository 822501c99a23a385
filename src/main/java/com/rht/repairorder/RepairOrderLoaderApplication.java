package com.rht.repairorder;

import com.rht.repairorder.cli.VerbosityApplicationListener;
import com.rht.repairorder.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the Repair Order Loader.
 *
 * Reads a directory of repair-order event documents, keeps the latest report of every
 * order and reloads the repair_order / repair_order_detail tables from scratch.
 * The process exits with 0 on success and 1 when the load fails.
 */
@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class RepairOrderLoaderApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(RepairOrderLoaderApplication.class);
        application.addListeners(new VerbosityApplicationListener());
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
