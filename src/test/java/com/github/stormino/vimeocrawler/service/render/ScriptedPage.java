package com.github.stormino.vimeocrawler.service.render;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canned contents of one page: the elements each selector finds.
 */
public class ScriptedPage {

    private final String url;
    private final Map<String, List<PageElement>> elements = new HashMap<>();

    public ScriptedPage(String url) {
        this.url = url;
    }

    public ScriptedPage with(String selector, PageElement... found) {
        elements.computeIfAbsent(selector, key -> new ArrayList<>()).addAll(List.of(found));
        return this;
    }

    public String getUrl() {
        return url;
    }

    List<PageElement> find(String selector) {
        return elements.getOrDefault(selector, List.of());
    }
}
