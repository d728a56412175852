package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.exception.NavigationException;
import com.github.stormino.vimeocrawler.model.CrawlSession;
import com.github.stormino.vimeocrawler.service.render.PageElement;
import com.github.stormino.vimeocrawler.service.render.PageRenderer;
import com.github.stormino.vimeocrawler.service.render.SiteSelectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sets the language of a video in its settings panel, where the owner left it at the default.
 * Best effort: nothing here fails a video.
 */
@Slf4j
@Service
public class LanguagePreferenceService {

    public void apply(PageRenderer page, CrawlSession session) {
        String preference = session.getLanguagePreference();
        if (preference == null) {
            return;
        }
        try {
            applyPreference(page, session, preference);
        } catch (NavigationException e) {
            log.warn("Failed to set language to {}: {}", preference, e.getMessage());
        }
    }

    private void applyPreference(PageRenderer page, CrawlSession session, String preference) {

        Optional<PageElement> settings = page.findElement(SiteSelectors.SETTINGS_BUTTON);
        if (settings.isEmpty()) {
            log.warn("Failed to set language to {}, settings not available", preference);
            return;
        }
        settings.get().click();

        List<PageElement> options = page.findElements(SiteSelectors.LANGUAGE_OPTIONS);
        PageElement current = options.stream().filter(PageElement::isSelected).findFirst().orElse(null);
        if (current != null && current != options.get(0)) {
            log.info("Language already set to {} / {}", upper(current.getAttribute("value")), current.getText());
            return;
        }

        List<PageElement> matches = matching(options, PageElement::getText, preference);
        if (matches.size() != 1) {
            matches = matching(options, option -> option.getAttribute("value"), preference);
        }
        if (matches.size() != 1) {
            log.error("Unsupported language: {}", preference);
            session.abandonLanguagePreference();
            return;
        }

        PageElement choice = matches.get(0);
        log.info("Language not set, setting to {}", choice.getText());
        choice.select();
        Optional<PageElement> submit = page.findElement(SiteSelectors.SETTINGS_SUBMIT);
        if (submit.isPresent()) {
            submit.get().click();
        } else {
            log.warn("Failed to set language to {}, settings form has no submit button", preference);
        }
    }

    private List<PageElement> matching(List<PageElement> options, Function<PageElement, String> reader,
                                       String preference) {
        String prefix = preference.toLowerCase(Locale.ROOT);
        return options.stream()
                .filter(option -> {
                    String value = reader.apply(option);
                    return value != null && value.trim().toLowerCase(Locale.ROOT).startsWith(prefix);
                })
                .collect(Collectors.toList());
    }

    private String upper(String value) {
        return value == null ? "" : value.toUpperCase(Locale.ROOT);
    }
}
