package com.github.stormino.vimeocrawler.model;

import lombok.Builder;
import lombok.Data;

/**
 * Summary of a finished crawl run.
 */
@Data
@Builder
public class RunResult {

    private final int errorCount;
    private final int videoCount;
    private final int folderCount;
    private final long totalBytesSeen;
    private final int duplicatesRemoved;

    public boolean isSuccessful() {
        return errorCount == 0;
    }

    public static RunResult of(CrawlSession session, int duplicatesRemoved) {
        return RunResult.builder()
                .errorCount(session.getErrorCount())
                .videoCount(session.getVisitedVideoIds().size())
                .folderCount(session.getFolders().size())
                .totalBytesSeen(session.getTotalBytesSeen())
                .duplicatesRemoved(duplicatesRemoved)
                .build();
    }
}
