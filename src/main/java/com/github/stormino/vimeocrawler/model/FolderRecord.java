package com.github.stormino.vimeocrawler.model;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A local directory mirroring one site folder, with the IDs of the videos found beneath it.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class FolderRecord {

    @NonNull
    private final Path localPath;
    @NonNull
    private final String sourceUrl;
    @ToString.Exclude
    private final Set<Long> memberVideoIds = new LinkedHashSet<>();

    public void addMember(long videoId) {
        memberVideoIds.add(videoId);
    }

    public boolean contains(long videoId) {
        return memberVideoIds.contains(videoId);
    }

    public Set<Long> getMemberVideoIds() {
        return Collections.unmodifiableSet(memberVideoIds);
    }
}
