package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.NavigationException;
import com.github.stormino.vimeocrawler.model.CrawlSession;
import com.github.stormino.vimeocrawler.model.FolderRecord;
import com.github.stormino.vimeocrawler.model.LinkNode;
import com.github.stormino.vimeocrawler.model.LinkNode.AccountNode;
import com.github.stormino.vimeocrawler.model.LinkNode.FolderNode;
import com.github.stormino.vimeocrawler.model.LinkNode.VideoNode;
import com.github.stormino.vimeocrawler.service.render.PageRenderer;
import com.github.stormino.vimeocrawler.util.CrawlerConstants;
import com.github.stormino.vimeocrawler.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Expands a start link into the full set of reachable videos, recording which
 * videos belong to which mirrored folder.
 *
 * <p>Expansion is depth-first in listing order. Every branch carries the folder its
 * videos are filed under, if any; a folder page replaces it for its own subtree.
 * A branch whose pages fail to read is counted as an error and contributes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SiteGraphWalker {

    private final LinkClassifier classifier;
    private final PaginatedListingReader listingReader;
    private final FolderTitleResolver titleResolver;
    private final CrawlerProperties properties;

    /**
     * Walk everything reachable from a start node, filling the session's video and folder registries.
     */
    public void walk(PageRenderer page, LinkNode start, CrawlSession session) {
        expand(page, start, session, null);
        log.info("Walk finished: {} videos, {} folders",
                session.getVisitedVideoIds().size(), session.getFolders().size());
    }

    private void expand(PageRenderer page, LinkNode node, CrawlSession session, FolderRecord target) {
        List<LinkNode> children;
        try {
            switch (node.getKind()) {
                case VIDEO:
                    registerVideo((VideoNode) node, session, target);
                    return;
                case ACCOUNT:
                    children = expandAccount(page, (AccountNode) node, session);
                    break;
                case CATEGORY:
                    children = expandListing(page, node, session);
                    enableFolderCreation(session);
                    break;
                case VIDEOS_LISTING:
                    children = expandListing(page, node, session);
                    break;
                case FOLDER:
                    expandFolder(page, (FolderNode) node, session, target);
                    return;
                case GENERIC:
                    children = expandGeneric(page, node, session);
                    break;
                case SYSTEM:
                    log.debug("Skipping site page {}", node);
                    return;
                default:
                    throw new IllegalStateException("Unhandled link kind: " + node.getKind());
            }
        } catch (NavigationException e) {
            log.error("Failed to read {}: {}", node.getUrl(), e.getMessage());
            session.recordError();
            return;
        }

        for (LinkNode child : children) {
            expand(page, child, session, target);
        }
    }

    private void registerVideo(VideoNode node, CrawlSession session, FolderRecord target) {
        if (session.registerVideo(node.getVideoId())) {
            log.debug("Found video {}", node.getVideoId());
        }
        if (target != null) {
            target.addMember(node.getVideoId());
        }
    }

    private List<LinkNode> expandAccount(PageRenderer page, AccountNode node, CrawlSession session) {
        String videosUrl = node.getUrl() + "/" + CrawlerConstants.VIDEOS_SEGMENT;
        if (!goTo(page, videosUrl, session)) {
            return Collections.emptyList();
        }
        log.info("Processing account {}", node.getAccountName());

        List<LinkNode> children = new ArrayList<>(listingReader.readAllPages(page));
        children.add(classifier.classify(node.getUrl() + "/channels"));
        children.add(classifier.classify(node.getUrl() + "/albums"));
        enableFolderCreation(session);
        return children;
    }

    private List<LinkNode> expandListing(PageRenderer page, LinkNode node, CrawlSession session) {
        if (!goTo(page, node.getUrl(), session)) {
            return Collections.emptyList();
        }
        return listingReader.readAllPages(page);
    }

    private List<LinkNode> expandGeneric(PageRenderer page, LinkNode node, CrawlSession session) {
        if (!goTo(page, node.getUrl(), session)) {
            return Collections.emptyList();
        }
        return listingReader.readPage(page);
    }

    private void expandFolder(PageRenderer page, FolderNode node, CrawlSession session, FolderRecord target) {
        int retryCount = properties.getDownload().getRetryCount();
        Optional<String> title = Optional.empty();
        for (int attempt = 0; attempt <= retryCount && title.isEmpty(); attempt++) {
            if (goTo(page, node.getUrl(), null)) {
                title = readTitle(page);
            }
            if (title.isEmpty()) {
                log.warn("Folder title not found at {} (attempt {}/{})", node.getUrl(), attempt + 1, retryCount + 1);
            }
        }

        if (title.isEmpty()) {
            log.error("Page load failed: {}", node.getUrl());
            session.recordError();
            return;
        }

        log.info("Folder: {} ({})", title.get(), node.getFolderKind().getDisplayName());
        FolderRecord folderTarget = target;
        if (session.isFolderCreationEnabled()) {
            folderTarget = createFolder(title.get(), node, session).orElse(target);
        }

        for (LinkNode child : listingReader.readAllPages(page)) {
            expand(page, child, session, folderTarget);
        }
    }

    private Optional<String> readTitle(PageRenderer page) {
        try {
            return titleResolver.resolveTitle(page);
        } catch (NavigationException e) {
            log.warn("Failed to read folder title: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<FolderRecord> createFolder(String title, FolderNode node, CrawlSession session) {
        String directoryName = PathUtils.sanitizeFilename(title.trim());
        if (directoryName.isEmpty()) {
            directoryName = node.getDisplayName();
        }
        Path directory = properties.getTargetPath().resolve(directoryName);
        try {
            if (!PathUtils.createDirectoryStructure(directory)) {
                session.recordError();
                return Optional.empty();
            }
            PathUtils.writeShortcutFile(directory, node.getUrl());
        } catch (IOException e) {
            log.error("Failed to write shortcut into {}: {}", directory, e.getMessage());
            session.recordError();
            return Optional.empty();
        }

        FolderRecord folder = new FolderRecord(directory, node.getUrl());
        session.registerFolder(folder);
        log.debug("Mirroring {} into {}", folder.getSourceUrl(), folder.getLocalPath());
        return Optional.of(folder);
    }

    private void enableFolderCreation(CrawlSession session) {
        if (properties.getWalk().isCreateFolders()) {
            session.enableFolderCreation();
        }
    }

    /**
     * Load a page. A failure is logged and, when a session is given, counted.
     *
     * @return true if the page loaded
     */
    private boolean goTo(PageRenderer page, String url, CrawlSession session) {
        log.info("Going to {}", url);
        try {
            page.navigate(url);
            return true;
        } catch (NavigationException e) {
            if (session != null) {
                log.error("Navigation failed: {}", e.getMessage());
                session.recordError();
            } else {
                log.warn("Navigation failed: {}", e.getMessage());
            }
            return false;
        }
    }
}
