package com.rht.repairorder.cli;

import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.boot.context.logging.LoggingApplicationListener;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.ApplicationListener;
import org.springframework.core.Ordered;

/**
 * Applies {@code --verbose} / {@code --quiet} right after Spring Boot has initialised logging,
 * so the chosen level also covers startup output.
 * Quiet applies to every logger, verbose to this application's loggers only.
 */
public class VerbosityApplicationListener implements ApplicationListener<ApplicationEnvironmentPreparedEvent>, Ordered {

    static final String APPLICATION_LOGGER = "com.rht.repairorder";

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        CommandLineOptions options = CommandLineOptions.parse(new DefaultApplicationArguments(event.getArgs()));
        options.getLogLevel().ifPresent(level -> {
            String loggerName = level.compareTo(LogLevel.INFO) > 0
                ? LoggingSystem.ROOT_LOGGER_NAME
                : APPLICATION_LOGGER;
            LoggingSystem.get(event.getSpringApplication().getClassLoader()).setLogLevel(loggerName, level);
        });
    }

    @Override
    public int getOrder() {
        return LoggingApplicationListener.DEFAULT_ORDER + 1;
    }
}
