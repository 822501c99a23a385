package com.rht.repairorder.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.logging.LogLevel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CommandLineOptions.
 */
@DisplayName("CommandLineOptions Unit Tests")
class CommandLineOptionsTest {

    @Test
    @DisplayName("Should leave everything unset when no options are given")
    void shouldDefaultToUnset() {
        CommandLineOptions options = CommandLineOptions.parse(new DefaultApplicationArguments());

        assertThat(options.getDataDir()).isEmpty();
        assertThat(options.getLogLevel()).isEmpty();
    }

    @Test
    @DisplayName("Should read the data directory")
    void shouldReadDataDir() {
        CommandLineOptions options = CommandLineOptions.parse(
            new DefaultApplicationArguments("--data-dir=/srv/repair/data"));

        assertThat(options.getDataDir()).contains("/srv/repair/data");
    }

    @Test
    @DisplayName("Should map --verbose to DEBUG and --quiet to WARN")
    void shouldMapVerbosityFlags() {
        assertThat(CommandLineOptions.parse(new DefaultApplicationArguments("--verbose")).getLogLevel())
            .contains(LogLevel.DEBUG);
        assertThat(CommandLineOptions.parse(new DefaultApplicationArguments("--quiet")).getLogLevel())
            .contains(LogLevel.WARN);
    }

    @Test
    @DisplayName("Should reject --verbose together with --quiet")
    void shouldRejectConflictingFlags() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new DefaultApplicationArguments("--verbose", "--quiet")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("mutually exclusive");
    }

    @Test
    @DisplayName("Should reject an empty or repeated data directory")
    void shouldRejectBadDataDir() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new DefaultApplicationArguments("--data-dir")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommandLineOptions.parse(
            new DefaultApplicationArguments("--data-dir=a", "--data-dir=b")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
