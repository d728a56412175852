package com.github.stormino.vimeocrawler.model;

/**
 * Navigation target a site link resolves to.
 */
public enum LinkKind {
    VIDEO("Video"),
    ACCOUNT("Account"),
    CATEGORY("Category"),
    VIDEOS_LISTING("Videos listing"),
    FOLDER("Folder"),
    SYSTEM("System page"),
    GENERIC("Page");

    private final String displayName;

    LinkKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
