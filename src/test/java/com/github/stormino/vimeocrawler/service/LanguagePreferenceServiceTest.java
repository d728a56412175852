package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.exception.NavigationException;
import com.github.stormino.vimeocrawler.model.CrawlSession;
import com.github.stormino.vimeocrawler.service.render.ScriptedElement;
import com.github.stormino.vimeocrawler.service.render.ScriptedPage;
import com.github.stormino.vimeocrawler.service.render.ScriptedPageRenderer;
import com.github.stormino.vimeocrawler.service.render.SiteSelectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LanguagePreferenceService")
class LanguagePreferenceServiceTest {

    private static final String URL = "https://vimeo.com/123";

    private final LanguagePreferenceService service = new LanguagePreferenceService();

    private ScriptedElement settings;
    private ScriptedElement submit;
    private ScriptedElement none;
    private ScriptedElement english;
    private ScriptedElement german;
    private ScriptedElement greek;

    @BeforeEach
    void setUp() {
        settings = ScriptedElement.text("Settings");
        submit = ScriptedElement.text("Save");
        none = ScriptedElement.text("Select a language").attr("value", "").selected(true);
        english = ScriptedElement.text("English").attr("value", "en");
        german = ScriptedElement.text("Deutsch").attr("value", "de");
        greek = ScriptedElement.text("Ελληνικά").attr("value", "el");
    }

    private ScriptedPageRenderer renderer(ScriptedElement... options) {
        ScriptedPageRenderer renderer = new ScriptedPageRenderer().page(new ScriptedPage(URL)
                .with(SiteSelectors.SETTINGS_BUTTON, settings)
                .with(SiteSelectors.LANGUAGE_OPTIONS, options)
                .with(SiteSelectors.SETTINGS_SUBMIT, submit));
        renderer.navigate(URL);
        return renderer;
    }

    @Test
    @DisplayName("should select the option whose label starts with the preference")
    void shouldSelectByLabel() {
        CrawlSession session = new CrawlSession("English");

        service.apply(renderer(none, english, german), session);

        assertTrue(english.isSelected());
        assertEquals(1, settings.getClickCount());
        assertEquals(1, submit.getClickCount());
        assertEquals("English", session.getLanguagePreference());
    }

    @Test
    @DisplayName("should fall back to matching the option value")
    void shouldSelectByValue() {
        CrawlSession session = new CrawlSession("El");

        service.apply(renderer(none, english, greek), session);

        assertTrue(greek.isSelected());
        assertEquals(1, submit.getClickCount());
    }

    @Test
    @DisplayName("should leave a language chosen by the owner alone")
    void shouldKeepExistingLanguage() {
        none.selected(false);
        german.selected(true);
        CrawlSession session = new CrawlSession("English");

        service.apply(renderer(none, english, german), session);

        assertFalse(english.isSelected());
        assertEquals(0, submit.getClickCount());
    }

    @Test
    @DisplayName("should abandon an ambiguous preference for the rest of the run")
    void shouldAbandonAmbiguousPreference() {
        ScriptedElement british = ScriptedElement.text("English (UK)").attr("value", "en-gb");
        CrawlSession session = new CrawlSession("English");

        service.apply(renderer(none, english, british), session);

        assertNull(session.getLanguagePreference());
        assertFalse(english.isSelected());
        assertEquals(0, submit.getClickCount());
    }

    @Test
    @DisplayName("should warn and carry on when settings are not available")
    void shouldTolerateMissingSettings() {
        ScriptedPageRenderer renderer = new ScriptedPageRenderer();
        renderer.navigate(URL);
        CrawlSession session = new CrawlSession("English");

        service.apply(renderer, session);

        assertEquals("English", session.getLanguagePreference());
        assertEquals(0, session.getErrorCount());
    }

    @Test
    @DisplayName("should carry on when the settings button cannot be clicked")
    void shouldTolerateFailedClick() {
        settings.onClick(() -> {
            throw new NavigationException("Failed to click: Element is detached", URL);
        });
        CrawlSession session = new CrawlSession("English");

        assertDoesNotThrow(() -> service.apply(renderer(none, english), session));

        assertFalse(english.isSelected());
        assertEquals("English", session.getLanguagePreference());
    }

    @Test
    @DisplayName("should do nothing without a preference")
    void shouldDoNothingWithoutPreference() {
        service.apply(renderer(none, english), new CrawlSession());

        assertEquals(0, settings.getClickCount());
    }
}
