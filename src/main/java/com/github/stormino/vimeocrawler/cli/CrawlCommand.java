package com.github.stormino.vimeocrawler.cli;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.ConfigurationException;
import com.github.stormino.vimeocrawler.exception.CrawlerException;
import com.github.stormino.vimeocrawler.exception.InvalidLinkException;
import com.github.stormino.vimeocrawler.model.RunResult;
import com.github.stormino.vimeocrawler.service.CrawlRunner;
import com.github.stormino.vimeocrawler.util.FormatUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command line entry: {@code vimeo-crawler [--crawler.*=...] [start-url]}.
 * The first non-option argument overrides {@code crawler.start-url}.
 *
 * <p>Exit codes: 0 when the run had no errors, 1 when it had some, 2 when it
 * could not start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrawlCommand implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;

    private final CrawlRunner crawlRunner;
    private final CrawlerProperties properties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        String startUrl = positional.isEmpty() ? properties.getStartUrl() : positional.get(0);

        try {
            RunResult result = crawlRunner.run(startUrl);
            log.info("{} videos, {} folders, {} announced, {} duplicates removed",
                    result.getVideoCount(), result.getFolderCount(),
                    FormatUtils.formatSize(result.getTotalBytesSeen()), result.getDuplicatesRemoved());
            exitCode = result.isSuccessful() ? EXIT_OK : EXIT_ERRORS;
        } catch (ConfigurationException | InvalidLinkException e) {
            log.error("{}", e.getMessage());
            exitCode = EXIT_USAGE;
        } catch (CrawlerException e) {
            log.error("Crawl failed: {}", e.getMessage(), e);
            exitCode = EXIT_ERRORS;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
