package com.github.stormino.vimeocrawler.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * State of one crawl run: discovered videos, mirrored folders, error tally and
 * total announced bytes. Owned by a single run and mutated only by its sequential
 * walk and download passes, so it is not thread-safe.
 */
@Getter
public class CrawlSession {

    private final Set<Long> visitedVideoIds = new LinkedHashSet<>();
    private final List<FolderRecord> folders = new ArrayList<>();
    private int errorCount;
    private long totalBytesSeen;
    private boolean folderCreationEnabled;
    private String languagePreference;

    public CrawlSession() {
        this(null);
    }

    public CrawlSession(String languagePreference) {
        this.languagePreference = languagePreference;
    }

    /**
     * Register a discovered video.
     *
     * @param videoId Video ID
     * @return true if the video was not known before
     */
    public boolean registerVideo(long videoId) {
        return visitedVideoIds.add(videoId);
    }

    public void registerFolder(FolderRecord folder) {
        folders.add(folder);
    }

    public void recordError() {
        errorCount++;
    }

    public void addBytesSeen(long bytes) {
        totalBytesSeen += bytes;
    }

    public void enableFolderCreation() {
        folderCreationEnabled = true;
    }

    /**
     * Stop trying to switch the site language for the rest of the run.
     */
    public void abandonLanguagePreference() {
        languagePreference = null;
    }

    public Set<Long> getVisitedVideoIds() {
        return Collections.unmodifiableSet(visitedVideoIds);
    }

    public List<FolderRecord> getFolders() {
        return Collections.unmodifiableList(folders);
    }

    /**
     * Videos in the order they were discovered.
     */
    public List<Long> getDiscoveryOrder() {
        return new ArrayList<>(visitedVideoIds);
    }

    /**
     * Videos in download order: highest ID, i.e. most recently uploaded, first.
     */
    public List<Long> getProcessingOrder() {
        return visitedVideoIds.stream()
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
    }

    public List<FolderRecord> foldersContaining(long videoId) {
        return folders.stream()
                .filter(folder -> folder.contains(videoId))
                .collect(Collectors.toList());
    }
}
