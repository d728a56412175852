package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.IntegrityException;
import com.github.stormino.vimeocrawler.exception.NavigationException;
import com.github.stormino.vimeocrawler.exception.TransferException;
import com.github.stormino.vimeocrawler.exception.TransferInterruptedException;
import com.github.stormino.vimeocrawler.model.CrawlSession;
import com.github.stormino.vimeocrawler.model.DownloadOutcome;
import com.github.stormino.vimeocrawler.model.DownloadVariant;
import com.github.stormino.vimeocrawler.model.VideoDownloadPlan;
import com.github.stormino.vimeocrawler.service.render.PageElement;
import com.github.stormino.vimeocrawler.service.render.PageRenderer;
import com.github.stormino.vimeocrawler.service.render.SiteSelectors;
import com.github.stormino.vimeocrawler.service.transfer.BulkTransferClient;
import com.github.stormino.vimeocrawler.service.transfer.RemoteMetadata;
import com.github.stormino.vimeocrawler.service.transfer.TransferRequest;
import com.github.stormino.vimeocrawler.util.CrawlerConstants;
import com.github.stormino.vimeocrawler.util.FormatUtils;
import com.github.stormino.vimeocrawler.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Downloads every discovered video into the flat store and links it into its folders.
 *
 * <p>Each video gets a bounded number of attempts. An attempt reloads the video page,
 * picks the best variant, and either settles the video (downloaded, already present,
 * deliberately skipped) or fails and is retried from scratch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VideoDownloadService {

    private final LinkClassifier classifier;
    private final VariantSelector variantSelector;
    private final LanguagePreferenceService languagePreferenceService;
    private final FolderLinker folderLinker;
    private final BulkTransferClient transferClient;
    private final CrawlerProperties properties;

    /**
     * Process all registered videos, most recent first. A failing video never stops the run.
     */
    public void processAll(PageRenderer page, CrawlSession session) {
        List<Long> videoIds = session.getProcessingOrder();
        int total = videoIds.size();
        for (int i = 0; i < total; i++) {
            processVideo(page, session, videoIds.get(i), i + 1, total);
        }
    }

    /**
     * Process one video, retrying failed attempts, then link it into its folders.
     *
     * @param number Position of the video in the run, starting at 1
     * @param total Number of videos in the run
     * @return Outcome of the last attempt
     */
    public DownloadOutcome processVideo(PageRenderer page, CrawlSession session, long videoId, int number, int total) {
        int attempts = Math.max(1, properties.getDownload().getRetryCount());
        DownloadOutcome outcome = DownloadOutcome.FAILED;
        String fileName = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                VideoDownloadPlan plan = preparePlan(page, session, videoId, number, total);
                if (plan.getLocalFileName() != null) {
                    fileName = plan.getLocalFileName();
                    languagePreferenceService.apply(page, session);
                }
                outcome = execute(session, plan);
            } catch (TransferInterruptedException e) {
                log.error("Download of video {} interrupted", videoId);
                session.recordError();
                Thread.interrupted();
                outcome = DownloadOutcome.INTERRUPTED;
            } catch (NavigationException e) {
                log.error("Video page failed ({}/{}): {}", attempt, attempts, e.getMessage());
                session.recordError();
                outcome = DownloadOutcome.FAILED;
            } catch (TransferException | IntegrityException e) {
                log.error("Download failed ({}/{}): {}", attempt, attempts, e.getMessage());
                session.recordError();
                outcome = DownloadOutcome.FAILED;
            }

            if (outcome.isTerminal()) {
                break;
            }
            if (outcome == DownloadOutcome.NO_VARIANT && !properties.getDownload().isEnabled()) {
                break;
            }
        }

        log.debug("Video {}: {}", videoId, outcome.getDisplayName());
        if (!outcome.isTerminal()) {
            log.error("Download ultimately failed after {} retries: {}", attempts, classifier.videoUrl(videoId));
        }

        if (fileName != null) {
            folderLinker.linkIntoFolders(session, videoId, fileName);
        }
        return outcome;
    }

    /**
     * Load the video page and resolve everything needed for one attempt.
     * The returned plan has no file name if the page never loaded.
     *
     * @throws NavigationException if the browser identity could not be read from the loaded page
     */
    VideoDownloadPlan preparePlan(PageRenderer page, CrawlSession session, long videoId, int number, int total) {
        VideoDownloadPlan.VideoDownloadPlanBuilder plan = VideoDownloadPlan.builder().videoId(videoId);

        VideoPage videoPage = acquirePage(page, session, videoId);
        if (videoPage.getTitle() == null) {
            return plan.build();
        }
        plan.title(videoPage.getTitle());

        Optional<DownloadVariant> variant = videoPage.getDownloadPanel().flatMap(variantSelector::select);
        String description = CrawlerConstants.NO_VARIANT;
        String extension = CrawlerConstants.NO_VARIANT;
        Long expectedSize = null;
        if (variant.isPresent()) {
            String userAgent = readUserAgent(page);
            Map<String, String> cookies = page.getCookies();
            plan.variant(variant.get()).userAgent(userAgent).cookies(cookies);
            description = variant.get().describe();
            extension = variant.get().getFileExtension();
            if (properties.getDownload().isProbeSizes()) {
                expectedSize = probeSize(variant.get(), userAgent, cookies, session);
                plan.expectedByteSize(expectedSize);
            }
        }

        log.info("{} ({}{}) {}{}", videoPage.getTitle(), description,
                expectedSize == null ? "" : ", " + FormatUtils.formatSize(expectedSize),
                FormatUtils.formatPosition(number, total),
                session.getTotalBytesSeen() > 0 ? " " + FormatUtils.formatSize(session.getTotalBytesSeen()) : "");

        String fileName = PathUtils.buildVideoFileName(videoPage.getTitle(), videoId, extension);
        return plan.localFileName(fileName)
                .localPath(properties.getTargetPath().resolve(fileName))
                .build();
    }

    private DownloadOutcome execute(CrawlSession session, VideoDownloadPlan plan) {
        if (!plan.hasVariant()) {
            if (plan.getLocalFileName() != null) {
                log.warn("No downloadable file for video {}", plan.getVideoId());
            }
            return DownloadOutcome.NO_VARIANT;
        }

        Long expected = plan.getExpectedByteSize();
        Long existing = PathUtils.fileSize(plan.getLocalPath());
        if (expected != null && existing != null) {
            if (existing.equals(expected)) {
                log.info("Already downloaded: {}", plan.getLocalFileName());
                return DownloadOutcome.ALREADY_PRESENT;
            }
            if (existing > expected) {
                log.error("Local file {} is larger than remote ({} > {}), skipping",
                        plan.getLocalFileName(), existing, expected);
                session.recordError();
                return DownloadOutcome.SKIPPED_INCONSISTENT;
            }
        }

        if (!properties.getDownload().isEnabled()) {
            log.debug("Downloads disabled, not fetching {}", plan.getLocalFileName());
            return DownloadOutcome.SKIPPED_DISABLED;
        }

        TransferRequest request = TransferRequest.builder()
                .url(plan.getVariant().getHref())
                .userAgent(plan.getUserAgent())
                .cookies(plan.getCookies() == null ? Collections.emptyMap() : plan.getCookies())
                .build();
        transferClient.download(request, plan.getLocalPath(), properties.getDownload().getTimeoutSeconds(), null);
        validate(plan);
        log.info("Downloaded {}", plan.getLocalFileName());
        return DownloadOutcome.DOWNLOADED;
    }

    /**
     * Check the downloaded file against the announced size.
     *
     * @throws IntegrityException if the file is missing, empty or of the wrong size
     */
    private void validate(VideoDownloadPlan plan) {
        Path file = plan.getLocalPath();
        Long expected = plan.getExpectedByteSize();
        Long actual = Files.isRegularFile(file) ? PathUtils.fileSize(file) : null;
        if (actual == null || actual == 0) {
            throw new IntegrityException("File seems corrupt: " + file, file, expected, actual);
        }
        if (expected != null && actual > expected) {
            throw new IntegrityException("Local file is larger than remote: " + actual + " > " + expected,
                    file, expected, actual);
        }
        if (expected != null && actual < expected) {
            throw new IntegrityException("Local file is smaller than remote: " + actual + " < " + expected,
                    file, expected, actual);
        }
    }

    private VideoPage acquirePage(PageRenderer page, CrawlSession session, long videoId) {
        String url = classifier.videoUrl(videoId);
        int attempts = properties.getDownload().getRetryCount() + 1;
        String title = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            log.info("Going to {}", url);
            try {
                page.navigate(url);

                Optional<String> pageTitle = page.findElement(SiteSelectors.VIDEO_TITLE)
                        .map(PageElement::getText)
                        .map(text -> PathUtils.stripTrailingDots(text.trim()));
                if (pageTitle.isEmpty()) {
                    log.warn("Video title not found ({}/{})", attempt, attempts);
                    continue;
                }
                title = pageTitle.get();

                Optional<PageElement> button = page.findElement(SiteSelectors.DOWNLOAD_BUTTON);
                if (button.isEmpty()) {
                    log.warn("Download button not found ({}/{})", attempt, attempts);
                    continue;
                }
                button.get().click();

                Optional<PageElement> panel = page.findElement(SiteSelectors.DOWNLOAD_PANEL);
                if (panel.isPresent()) {
                    return new VideoPage(title, panel);
                }
                log.warn("Download panel not found ({}/{})", attempt, attempts);
            } catch (NavigationException e) {
                log.warn("Video page failed ({}/{}): {}", attempt, attempts, e.getMessage());
            }
        }

        log.error("Page load failed: {}", url);
        session.recordError();
        return new VideoPage(title, Optional.empty());
    }

    private String readUserAgent(PageRenderer page) {
        Object userAgent = page.executeScript(SiteSelectors.USER_AGENT_SCRIPT);
        return userAgent == null ? null : userAgent.toString();
    }

    private Long probeSize(DownloadVariant variant, String userAgent, Map<String, String> cookies,
                           CrawlSession session) {
        TransferRequest request = TransferRequest.builder()
                .url(variant.getHref())
                .userAgent(userAgent)
                .cookies(cookies == null ? Collections.emptyMap() : cookies)
                .build();
        try {
            RemoteMetadata metadata = transferClient.fetchMetadata(request);
            if (!metadata.hasContentLength()) {
                return null;
            }
            session.addBytesSeen(metadata.getContentLength());
            return metadata.getContentLength();
        } catch (TransferException e) {
            log.warn("Could not determine size of {}: {}", variant.describe(), e.getMessage());
            return null;
        }
    }

    /**
     * A loaded video page: its title, if it was read, and its download panel, if it opened.
     */
    private static final class VideoPage {
        private final String title;
        private final Optional<PageElement> downloadPanel;

        private VideoPage(String title, Optional<PageElement> downloadPanel) {
            this.title = title;
            this.downloadPanel = downloadPanel;
        }

        String getTitle() {
            return title;
        }

        Optional<PageElement> getDownloadPanel() {
            return downloadPanel;
        }
    }
}
