package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.InvalidLinkException;
import com.github.stormino.vimeocrawler.model.FolderKind;
import com.github.stormino.vimeocrawler.model.LinkNode;
import com.github.stormino.vimeocrawler.util.CrawlerConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns raw site links into typed {@link LinkNode}s according to the site's URL grammar.
 * Pure, performs no I/O.
 *
 * <pre>
 * https://vimeo.com/123456               Video
 * https://vimeo.com/someone              Account
 * https://vimeo.com/someone/albums       Category
 * https://vimeo.com/someone/videos       Videos listing
 * https://vimeo.com/channels/staffpicks  Folder
 * https://vimeo.com/help                 System
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class LinkClassifier {

    /**
     * Top-level pages that belong to the site rather than to an account.
     */
    static final Set<String> SYSTEM_LINKS = Set.of(
            "about", "blog", "categories", "channels", "cookie_policy", "couchmode", "creativecommons",
            "creatorservices", "dmca", "enhancer", "everywhere", "explore", "groups", "help", "jobs", "join",
            "log_in", "love", "musicstore", "ondemand", "plus", "privacy", "pro", "robots.txt", "search",
            "site_map", "staffpicks", "terms", "upload", "videoschool");

    /**
     * Account sub-pages listing folders.
     */
    static final Set<String> CATEGORY_LINKS = Set.of("albums", "groups", "channels");

    // Longest digit run that still fits a long
    private static final int MAX_ID_DIGITS = 18;

    private final CrawlerProperties properties;

    /**
     * Classify a link.
     *
     * @param rawLink Absolute URL or bare numeric video ID
     * @return Classified node
     * @throws InvalidLinkException if the link does not point at the site
     */
    public LinkNode classify(@NonNull String rawLink) {
        String domain = properties.getSite().getDomain().toLowerCase(Locale.ROOT);
        String url = normalize(rawLink);
        String lowerUrl = url.toLowerCase(Locale.ROOT);

        int domainIndex = lowerUrl.indexOf(domain);
        if (domainIndex < 0) {
            throw new InvalidLinkException("Invalid site URL: " + rawLink, rawLink);
        }

        List<String> tokens = tokenize(lowerUrl.substring(domainIndex + domain.length()));

        // Share URLs embed the video ID as the last of several segments
        if ((tokens.size() == 3 || tokens.size() == 4) && isNumeric(last(tokens))) {
            url = videoUrl(last(tokens));
            tokens = List.of(last(tokens));
        }

        if (tokens.size() == 3 && CrawlerConstants.VIDEOS_SEGMENT.equals(last(tokens))) {
            tokens = tokens.subList(0, 2);
        }

        return classifyTokens(rawLink, url, tokens);
    }

    /**
     * URL of a video page.
     */
    public String videoUrl(long videoId) {
        return videoUrl(String.valueOf(videoId));
    }

    private LinkNode classifyTokens(String rawLink, String url, List<String> tokens) {
        if (isSystem(tokens)) {
            return LinkNode.system(rawLink, url);
        }

        if (tokens.size() == 1) {
            String token = tokens.get(0);
            if (isNumeric(token)) {
                return LinkNode.video(rawLink, url, Long.parseLong(token));
            }
            return LinkNode.account(rawLink, url, token);
        }

        if (tokens.size() == 2) {
            String first = tokens.get(0);
            String second = tokens.get(1);
            if (CATEGORY_LINKS.contains(second)) {
                return LinkNode.category(rawLink, url, first, second);
            }
            if (CrawlerConstants.VIDEOS_SEGMENT.equals(second)) {
                return LinkNode.videosListing(rawLink, url, first);
            }
            Optional<FolderKind> folderKind = FolderKind.fromSegment(first);
            if (folderKind.isPresent()) {
                return LinkNode.folder(rawLink, folderUrl(url, folderKind.get()), folderKind.get(), second);
            }
        }

        return LinkNode.generic(rawLink, url);
    }

    /**
     * The site root, and pages like "/help/faq" whose first segment is a site page.
     * Folder-type names only count as site pages on their own ("/channels"), not with
     * a folder slug after them ("/channels/staffpicks").
     */
    private boolean isSystem(List<String> tokens) {
        if (tokens.isEmpty()) {
            return true;
        }
        String first = tokens.get(0);
        return SYSTEM_LINKS.contains(first)
                && (tokens.size() == 1 || FolderKind.fromSegment(first).isEmpty());
    }

    private String folderUrl(String url, FolderKind folderKind) {
        String suffix = "/" + CrawlerConstants.VIDEOS_SEGMENT;
        if (folderKind.paginatesUnderVideos() && !url.toLowerCase(Locale.ROOT).endsWith(suffix)) {
            return url + suffix;
        }
        return url;
    }

    private String normalize(String rawLink) {
        String link = rawLink.trim();
        if (link.indexOf('/') < 0) {
            link = videoUrl(link);
        }
        link = stripSlashes(link);

        int schemeEnd = link.indexOf("://");
        int pathStart = schemeEnd < 0 ? 0 : schemeEnd + 3;
        return link.substring(0, pathStart) + link.substring(pathStart).replaceAll("/{2,}", "/");
    }

    /**
     * Path segments after the domain, ignoring query string and fragment.
     */
    private List<String> tokenize(String afterDomain) {
        String path = afterDomain;
        for (char delimiter : new char[]{'?', '#'}) {
            int cut = path.indexOf(delimiter);
            if (cut >= 0) {
                path = path.substring(0, cut);
            }
        }
        List<String> tokens = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                tokens.add(segment);
            }
        }
        return tokens;
    }

    private String videoUrl(String videoId) {
        return stripSlashes(properties.getSite().getBaseUrl()) + "/" + videoId;
    }

    private static String stripSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isNumeric(String token) {
        return !token.isEmpty() && token.length() <= MAX_ID_DIGITS
                && token.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    private static String last(List<String> tokens) {
        return tokens.get(tokens.size() - 1);
    }
}
