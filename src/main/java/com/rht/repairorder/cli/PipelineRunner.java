package com.rht.repairorder.cli;

import com.rht.repairorder.batch.RepairOrderJobConfig;
import com.rht.repairorder.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Launches the load job once at startup and turns its outcome into the process exit code:
 * 0 when the job completes, 1 otherwise.
 */
@Slf4j
@Component
public class PipelineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final JobLauncher jobLauncher;
    private final Job repairOrderLoadJob;
    private final PipelineProperties properties;

    private int exitCode;

    public PipelineRunner(JobLauncher jobLauncher,
                          Job repairOrderLoadJob,
                          PipelineProperties properties) {
        this.jobLauncher = jobLauncher;
        this.repairOrderLoadJob = repairOrderLoadJob;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws JobExecutionException {
        CommandLineOptions options = CommandLineOptions.parse(args);
        if (!properties.isRunOnStartup()) {
            log.debug("Startup run disabled, not launching {}.", RepairOrderJobConfig.JOB_NAME);
            return;
        }
        launch(options.getDataDir().orElse(properties.getDataDir()));
    }

    /**
     * Run the job once against {@code dataDir} and record the exit code.
     */
    public BatchStatus launch(String dataDir) throws JobExecutionException {
        Path directory = Path.of(dataDir).toAbsolutePath().normalize();
        JobParameters parameters = new JobParametersBuilder()
            .addString(RepairOrderJobConfig.DATA_DIR_PARAMETER, directory.toString())
            .addString("run.id", UUID.randomUUID().toString())
            .toJobParameters();

        log.info("Launching {} for '{}'.", RepairOrderJobConfig.JOB_NAME, directory);
        JobExecution execution = jobLauncher.run(repairOrderLoadJob, parameters);
        exitCode = execution.getStatus() == BatchStatus.COMPLETED ? 0 : 1;
        return execution.getStatus();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
