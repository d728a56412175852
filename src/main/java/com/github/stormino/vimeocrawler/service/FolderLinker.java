package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.FilesystemException;
import com.github.stormino.vimeocrawler.model.CrawlSession;
import com.github.stormino.vimeocrawler.model.FolderRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Mirrors a flat-store file into every folder the video belongs to, as a hard or symbolic link.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FolderLinker {

    private final CrawlerProperties properties;

    /**
     * Link a video's file into its folders, replacing earlier links of the same name.
     *
     * @return Number of links created
     */
    public int linkIntoFolders(CrawlSession session, long videoId, String fileName) {
        Path flatFile = properties.getTargetPath().resolve(fileName);
        int created = 0;
        for (FolderRecord folder : session.foldersContaining(videoId)) {
            Path link = folder.getLocalPath().resolve(fileName);
            try {
                replaceLink(link, flatFile);
                created++;
            } catch (FilesystemException e) {
                log.warn("Can't create link at {}: {}", link, e.getMessage());
                session.recordError();
            }
        }
        return created;
    }

    private void replaceLink(Path link, Path flatFile) {
        try {
            Files.deleteIfExists(link);
        } catch (IOException e) {
            log.debug("Could not remove old link {}: {}", link, e.getMessage());
        }

        try {
            if (properties.getDownload().isHardLinks()) {
                Files.createLink(link, flatFile);
            } else {
                Path parent = link.toAbsolutePath().getParent();
                Files.createSymbolicLink(link, parent.relativize(flatFile.toAbsolutePath()));
            }
            log.debug("Linked {} -> {}", link, flatFile);
        } catch (IOException | UnsupportedOperationException e) {
            throw new FilesystemException(e.toString(), e, link);
        }
    }
}
