package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.model.DownloadVariant;
import com.github.stormino.vimeocrawler.service.render.PageElement;
import com.github.stormino.vimeocrawler.service.render.SiteSelectors;
import com.github.stormino.vimeocrawler.util.CrawlerConstants;
import com.github.stormino.vimeocrawler.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the best quality file offered in a video's download panel.
 */
@Slf4j
@Component
public class VariantSelector {

    /**
     * Scan the panel's links for each preferred label in turn, best quality first.
     * The first link whose text contains the label wins.
     */
    public Optional<DownloadVariant> select(PageElement downloadPanel) {
        List<PageElement> links = downloadPanel.findElements(SiteSelectors.DOWNLOAD_LINKS);
        for (String preference : CrawlerConstants.FILE_PREFERENCES) {
            for (PageElement link : links) {
                String label = link.getText();
                if (label != null && label.contains(preference)) {
                    return Optional.of(toVariant(link, label));
                }
            }
        }
        log.debug("No download link among {} candidates", links.size());
        return Optional.empty();
    }

    private DownloadVariant toVariant(PageElement link, String label) {
        String extension = PathUtils.getExtension(link.getAttribute("download"));
        if (extension.isEmpty()) {
            extension = CrawlerConstants.DEFAULT_EXTENSION;
        }
        return DownloadVariant.builder()
                .label(label.trim())
                .fileExtension(extension)
                .href(link.getAttribute("href"))
                .build();
    }
}
