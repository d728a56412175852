package com.github.stormino.vimeocrawler.service.render;

import com.github.stormino.vimeocrawler.exception.NavigationException;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.PlaywrightException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link PageElement} backed by a Playwright locator resolving to exactly one element.
 */
class PlaywrightPageElement implements PageElement {

    // Property first, so href comes back absolute; falls back to the raw attribute.
    private static final String READ_ATTRIBUTE_SCRIPT =
            "(e, name) => { const v = e[name]; return (v === undefined || v === null || typeof v === 'object')"
                    + " ? e.getAttribute(name) : String(v); }";

    private static final String SELECT_OPTION_SCRIPT =
            "o => { o.selected = true; if (o.parentElement) {"
                    + " o.parentElement.dispatchEvent(new Event('change', { bubbles: true })); } }";

    private final Locator locator;

    PlaywrightPageElement(Locator locator) {
        this.locator = locator;
    }

    @Override
    public String getText() {
        try {
            String text = locator.innerText();
            if (text == null || text.isBlank()) {
                text = locator.textContent();
            }
            return text == null ? "" : text.trim();
        } catch (PlaywrightException e) {
            throw failure("read text", e);
        }
    }

    @Override
    public String getAttribute(String name) {
        try {
            Object value = locator.evaluate(READ_ATTRIBUTE_SCRIPT, name);
            return value == null ? null : value.toString();
        } catch (PlaywrightException e) {
            throw failure("read attribute " + name, e);
        }
    }

    @Override
    public void click() {
        try {
            locator.click();
        } catch (PlaywrightException e) {
            throw failure("click", e);
        }
    }

    @Override
    public void fill(String value) {
        try {
            locator.fill(value);
        } catch (PlaywrightException e) {
            throw failure("fill", e);
        }
    }

    @Override
    public boolean isSelected() {
        try {
            return Boolean.TRUE.equals(locator.evaluate("o => o.selected === true"));
        } catch (PlaywrightException e) {
            throw failure("inspect selection", e);
        }
    }

    @Override
    public void select() {
        try {
            locator.evaluate(SELECT_OPTION_SCRIPT);
        } catch (PlaywrightException e) {
            throw failure("select", e);
        }
    }

    @Override
    public List<PageElement> findElements(String selector) {
        try {
            return locator.locator(selector).all().stream()
                    .map(PlaywrightPageElement::new)
                    .collect(Collectors.toList());
        } catch (PlaywrightException e) {
            throw failure("find " + selector, e);
        }
    }

    private NavigationException failure(String action, PlaywrightException cause) {
        return new NavigationException("Failed to " + action + ": " + cause.getMessage(), cause,
                locator.page().url());
    }
}
