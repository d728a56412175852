package com.github.stormino.vimeocrawler.service.render;

/**
 * CSS selectors and scripts describing the site's page layout.
 */
public final class SiteSelectors {

    private SiteSelectors() {
        // Utility class, no instantiation
    }

    // ========== Listings ==========

    public static final String LISTING_LINKS = "#browse_content .browse a";
    public static final String NEXT_PAGE = ".pagination a[rel=next]";

    // ========== Folder pages ==========

    public static final String PAGE_HEADER_LINK = "#page_header h1 a";
    public static final String PAGE_HEADER = "#page_header h1";
    public static final String GROUP_HEADER_LINK = "#group_header h1 a";

    // ========== Video pages ==========

    public static final String VIDEO_TITLE = "h1[itemprop=name]";
    public static final String DOWNLOAD_BUTTON = ".iconify_down_b";
    public static final String DOWNLOAD_PANEL = "#download";
    public static final String DOWNLOAD_LINKS = "a";

    // ========== Settings ==========

    public static final String SETTINGS_BUTTON = "#change_settings";
    public static final String LANGUAGE_OPTIONS = "select[name=language] option";
    public static final String SETTINGS_SUBMIT = "#settings_form input[type=submit]";

    // ========== Login ==========

    public static final String LOGIN_EMAIL = "#email";
    public static final String LOGIN_PASSWORD = "#password";
    public static final String LOGIN_SUBMIT = "#login_form input[type=submit]";
    public static final String LOGIN_ACCOUNT_MENU = "#menu .me a";

    // ========== Scripts ==========

    public static final String USER_AGENT_SCRIPT = "window.navigator.userAgent";
}
