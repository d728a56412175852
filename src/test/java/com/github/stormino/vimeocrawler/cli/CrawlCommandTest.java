package com.github.stormino.vimeocrawler.cli;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.ConfigurationException;
import com.github.stormino.vimeocrawler.exception.FilesystemException;
import com.github.stormino.vimeocrawler.exception.InvalidLinkException;
import com.github.stormino.vimeocrawler.model.RunResult;
import com.github.stormino.vimeocrawler.service.CrawlRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("CrawlCommand")
class CrawlCommandTest {

    private CrawlRunner crawlRunner;
    private CrawlerProperties properties;
    private CrawlCommand command;

    @BeforeEach
    void setUp() {
        crawlRunner = mock(CrawlRunner.class);
        properties = new CrawlerProperties();
        command = new CrawlCommand(crawlRunner, properties);
    }

    private static RunResult result(int errors) {
        return RunResult.builder().errorCount(errors).build();
    }

    @Test
    @DisplayName("should prefer the positional start link over configuration")
    void shouldPreferPositionalArgument() {
        properties.setStartUrl("https://vimeo.com/configured");
        when(crawlRunner.run("https://vimeo.com/someone")).thenReturn(result(0));

        command.run(new DefaultApplicationArguments("--crawler.download.retry-count=1", "https://vimeo.com/someone"));

        verify(crawlRunner).run("https://vimeo.com/someone");
        assertEquals(CrawlCommand.EXIT_OK, command.getExitCode());
    }

    @Test
    @DisplayName("should fall back to configured start link")
    void shouldUseConfiguredStart() {
        properties.setStartUrl("https://vimeo.com/configured");
        when(crawlRunner.run("https://vimeo.com/configured")).thenReturn(result(2));

        command.run(new DefaultApplicationArguments());

        assertEquals(CrawlCommand.EXIT_ERRORS, command.getExitCode());
    }

    @Test
    @DisplayName("should report usage problems with a distinct exit code")
    void shouldReportUsageProblems() {
        when(crawlRunner.run(any())).thenThrow(new ConfigurationException("Nothing to crawl", "crawler.start-url"));
        command.run(new DefaultApplicationArguments());
        assertEquals(CrawlCommand.EXIT_USAGE, command.getExitCode());

        when(crawlRunner.run(any())).thenThrow(new InvalidLinkException("Invalid site URL", "x"));
        command.run(new DefaultApplicationArguments("x"));
        assertEquals(CrawlCommand.EXIT_USAGE, command.getExitCode());
    }

    @Test
    @DisplayName("should report startup failures as errors")
    void shouldReportStartupFailures() {
        when(crawlRunner.run(any())).thenThrow(
                new FilesystemException("Cannot write shortcut", new IOException("denied"), Path.of(".")));

        command.run(new DefaultApplicationArguments("https://vimeo.com/someone"));

        assertEquals(CrawlCommand.EXIT_ERRORS, command.getExitCode());
    }
}
