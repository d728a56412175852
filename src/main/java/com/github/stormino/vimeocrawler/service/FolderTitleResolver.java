package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.service.render.PageElement;
import com.github.stormino.vimeocrawler.service.render.PageRenderer;
import com.github.stormino.vimeocrawler.service.render.SiteSelectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

/**
 * Finds the title of a folder page. Albums, channels and groups use different
 * header layouts, so several lookups are tried in turn.
 */
@Slf4j
@Component
public class FolderTitleResolver {

    public Optional<String> resolveTitle(PageRenderer page) {
        return lookup(page, SiteSelectors.PAGE_HEADER_LINK, PageElement::getText)
                .or(() -> lookup(page, SiteSelectors.PAGE_HEADER, PageElement::getText))
                .or(() -> lookup(page, SiteSelectors.GROUP_HEADER_LINK, element -> element.getAttribute("title")))
                .or(() -> lookup(page, SiteSelectors.GROUP_HEADER_LINK, PageElement::getText));
    }

    private Optional<String> lookup(PageRenderer page, String selector, Function<PageElement, String> reader) {
        Optional<String> title = page.findElement(selector)
                .map(reader)
                .map(String::trim)
                .filter(text -> !text.isEmpty());
        if (title.isEmpty()) {
            log.debug("No folder title at {}", selector);
        }
        return title;
    }
}
