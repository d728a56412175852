package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.ConfigurationException;
import com.github.stormino.vimeocrawler.exception.FilesystemException;
import com.github.stormino.vimeocrawler.exception.NavigationException;
import com.github.stormino.vimeocrawler.model.CrawlSession;
import com.github.stormino.vimeocrawler.model.LinkNode;
import com.github.stormino.vimeocrawler.model.RunResult;
import com.github.stormino.vimeocrawler.service.render.PageRenderer;
import com.github.stormino.vimeocrawler.service.render.PageRendererFactory;
import com.github.stormino.vimeocrawler.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs one complete crawl: walk, download, reconcile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrawlRunner {

    private final LinkClassifier classifier;
    private final LoginService loginService;
    private final SiteGraphWalker walker;
    private final VideoDownloadService downloadService;
    private final DuplicateReconciler reconciler;
    private final PageRendererFactory rendererFactory;
    private final CrawlerProperties properties;

    /**
     * Crawl from the given start link.
     *
     * @param startUrl Account, folder or video URL, or bare video ID; null to start from
     *                 the account page reached by logging in
     * @return Summary of the run; a failure anywhere after startup is counted, not thrown
     * @throws ConfigurationException if there is nothing to start from or the target
     *                                directory cannot be created
     * @throws com.github.stormino.vimeocrawler.exception.InvalidLinkException if the start
     *                                link does not point at the site
     */
    public RunResult run(String startUrl) {
        boolean hasStart = startUrl != null && !startUrl.isBlank();
        boolean login = properties.getLogin().isConfigured();
        if (!hasStart && !login) {
            throw new ConfigurationException("Nothing to crawl: no start URL and no login configured",
                    "crawler.start-url");
        }

        Path target = properties.getTargetPath();
        if (!PathUtils.createDirectoryStructure(target)) {
            throw new ConfigurationException("Cannot create target directory " + target,
                    "crawler.target-directory");
        }

        log.info("Crawling {} into {}", hasStart ? startUrl.trim() : "own account", target.toAbsolutePath());
        CrawlSession session = new CrawlSession(properties.getDownload().getCapitalizedLanguage());
        LinkNode start = hasStart ? classifier.classify(startUrl) : null;
        if (start != null) {
            log.debug("Start link {} is {} {}", start.getRawInput(), start.getKind(), start.getUrl());
            writeShortcut(target, start.getUrl());
        }

        try (PageRenderer page = rendererFactory.open()) {
            if (login && !loginService.login(page, session)) {
                throw new NavigationException("Login failed", properties.getSite().getBaseUrl());
            }
            if (start == null) {
                start = classifier.classify(page.currentUrl());
                writeShortcut(target, start.getUrl());
            }

            walker.walk(page, start, session);
            log.info("Got total of {} folders", session.getFolders().size());
            log.info("Processing {} videos...", session.getVisitedVideoIds().size());
            downloadService.processAll(page, session);
        } catch (RuntimeException e) {
            log.error("Crawl aborted: {}", e.getMessage(), e);
            session.recordError();
        }

        int removed = reconciler.reconcile(target);
        RunResult result = RunResult.of(session, removed);
        if (result.isSuccessful()) {
            log.info("Crawling completed");
        } else {
            log.info("Crawling completed with {} errors", result.getErrorCount());
        }
        return result;
    }

    private void writeShortcut(Path target, String url) {
        try {
            PathUtils.writeShortcutFile(target, url);
        } catch (IOException e) {
            throw new FilesystemException("Cannot write shortcut into " + target, e, target);
        }
    }
}
