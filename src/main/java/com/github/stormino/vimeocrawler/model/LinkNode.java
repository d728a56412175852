package com.github.stormino.vimeocrawler.model;

import lombok.Getter;
import lombok.NonNull;

/**
 * A classified site link. One subclass per {@link LinkKind}, each carrying only the fields
 * that kind has. Equality is defined over the normalized URL, so alias forms of the same
 * page compare equal once classified.
 */
@Getter
public abstract class LinkNode {

    private final String rawInput;
    private final String url;
    private final LinkKind kind;

    private LinkNode(@NonNull String rawInput, @NonNull String url, @NonNull LinkKind kind) {
        this.rawInput = rawInput;
        this.url = url;
        this.kind = kind;
    }

    public boolean isVideo() {
        return kind == LinkKind.VIDEO;
    }

    @Override
    public final boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LinkNode)) {
            return false;
        }
        return url.equals(((LinkNode) other).url);
    }

    @Override
    public final int hashCode() {
        return url.hashCode();
    }

    @Override
    public String toString() {
        return url;
    }

    public static VideoNode video(String rawInput, String url, long videoId) {
        return new VideoNode(rawInput, url, videoId);
    }

    public static AccountNode account(String rawInput, String url, String accountName) {
        return new AccountNode(rawInput, url, accountName);
    }

    public static CategoryNode category(String rawInput, String url, String accountName, String categoryName) {
        return new CategoryNode(rawInput, url, accountName, categoryName);
    }

    public static VideosListingNode videosListing(String rawInput, String url, String accountName) {
        return new VideosListingNode(rawInput, url, accountName);
    }

    public static FolderNode folder(String rawInput, String url, FolderKind folderKind, String displayName) {
        return new FolderNode(rawInput, url, folderKind, displayName);
    }

    public static SystemNode system(String rawInput, String url) {
        return new SystemNode(rawInput, url);
    }

    public static GenericNode generic(String rawInput, String url) {
        return new GenericNode(rawInput, url);
    }

    @Getter
    public static final class VideoNode extends LinkNode {
        private final long videoId;

        private VideoNode(String rawInput, String url, long videoId) {
            super(rawInput, url, LinkKind.VIDEO);
            this.videoId = videoId;
        }
    }

    @Getter
    public static final class AccountNode extends LinkNode {
        private final String accountName;

        private AccountNode(String rawInput, String url, String accountName) {
            super(rawInput, url, LinkKind.ACCOUNT);
            this.accountName = accountName;
        }
    }

    /**
     * An account's albums, groups or channels index.
     */
    @Getter
    public static final class CategoryNode extends LinkNode {
        private final String accountName;
        private final String categoryName;

        private CategoryNode(String rawInput, String url, String accountName, String categoryName) {
            super(rawInput, url, LinkKind.CATEGORY);
            this.accountName = accountName;
            this.categoryName = categoryName;
        }
    }

    @Getter
    public static final class VideosListingNode extends LinkNode {
        private final String accountName;

        private VideosListingNode(String rawInput, String url, String accountName) {
            super(rawInput, url, LinkKind.VIDEOS_LISTING);
            this.accountName = accountName;
        }

        public String getCategoryName() {
            return "videos";
        }
    }

    @Getter
    public static final class FolderNode extends LinkNode {
        private final FolderKind folderKind;
        /**
         * URL slug of the folder; the human-readable title is only known once the page is loaded.
         */
        private final String displayName;

        private FolderNode(String rawInput, String url, FolderKind folderKind, String displayName) {
            super(rawInput, url, LinkKind.FOLDER);
            this.folderKind = folderKind;
            this.displayName = displayName;
        }
    }

    public static final class SystemNode extends LinkNode {
        private SystemNode(String rawInput, String url) {
            super(rawInput, url, LinkKind.SYSTEM);
        }
    }

    public static final class GenericNode extends LinkNode {
        private GenericNode(String rawInput, String url) {
            super(rawInput, url, LinkKind.GENERIC);
        }
    }
}
