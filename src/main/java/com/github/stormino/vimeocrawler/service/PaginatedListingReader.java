package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.ConsistencyException;
import com.github.stormino.vimeocrawler.model.LinkNode;
import com.github.stormino.vimeocrawler.service.render.PageElement;
import com.github.stormino.vimeocrawler.service.render.PageRenderer;
import com.github.stormino.vimeocrawler.service.render.SiteSelectors;
import com.github.stormino.vimeocrawler.util.CrawlerConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the item links of listing pages (account videos, categories, folders),
 * following the "next page" control.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaginatedListingReader {

    private final LinkClassifier classifier;
    private final CrawlerProperties properties;

    /**
     * Read the current listing page and every page after it. With a configured
     * max-items cap, at most that many pages are read.
     *
     * @param page Renderer showing the first listing page
     * @return Items of all pages, in page order
     * @throws ConsistencyException if a page lists the same item twice
     */
    public List<LinkNode> readAllPages(PageRenderer page) {
        Integer maxPages = properties.getWalk().getMaxItems();
        List<LinkNode> items = new ArrayList<>();
        for (int pageNumber = 0; maxPages == null || pageNumber < maxPages; pageNumber++) {
            items.addAll(readPage(page));

            Optional<PageElement> next = page.findElement(SiteSelectors.NEXT_PAGE);
            if (next.isEmpty()) {
                break;
            }
            next.get().click();
        }
        return items;
    }

    /**
     * Read the items of the current page only.
     *
     * @throws ConsistencyException if the page lists the same item twice
     */
    public List<LinkNode> readPage(PageRenderer page) {
        String pageUrl = page.currentUrl();
        log.info("Processing {}", pageUrl);

        String domain = properties.getSite().getDomain().toLowerCase(Locale.ROOT);
        List<LinkNode> items = page.findElements(SiteSelectors.LISTING_LINKS).stream()
                .map(link -> link.getAttribute("href"))
                .filter(href -> href != null && href.toLowerCase(Locale.ROOT).contains(domain))
                .filter(href -> !href.endsWith(CrawlerConstants.SETTINGS_SUFFIX))
                .map(classifier::classify)
                .collect(Collectors.toList());

        Integer maxItems = properties.getWalk().getMaxItems();
        if (maxItems != null && items.size() > maxItems) {
            items = new ArrayList<>(items.subList(0, maxItems));
        }

        logSummary(items);
        verifyUnique(pageUrl, items);
        return items;
    }

    private void logSummary(List<LinkNode> items) {
        long videos = items.stream().filter(LinkNode::isVideo).count();
        if (videos == 0) {
            log.info("Got {} items", items.size());
        } else if (videos == items.size()) {
            log.info("Got {} videos", videos);
        } else {
            log.info("Got {} videos and {} other items", videos, items.size() - videos);
        }
    }

    private void verifyUnique(String pageUrl, List<LinkNode> items) {
        Set<LinkNode> seen = new HashSet<>();
        List<String> duplicates = items.stream()
                .filter(item -> !seen.add(item))
                .map(LinkNode::getUrl)
                .collect(Collectors.toList());
        if (!duplicates.isEmpty()) {
            throw new ConsistencyException("Listing page returned duplicate items " + duplicates,
                    pageUrl, duplicates);
        }
    }
}
