package com.github.stormino.vimeocrawler.service.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory page element with canned text, attributes and children.
 */
public class ScriptedElement implements PageElement {

    private final String text;
    private final Map<String, String> attributes = new HashMap<>();
    private final Map<String, List<PageElement>> children = new HashMap<>();
    private Runnable onClick = () -> { };
    private boolean selected;
    private String filledValue;
    private int clickCount;

    public ScriptedElement(String text) {
        this.text = text;
    }

    public static ScriptedElement text(String text) {
        return new ScriptedElement(text);
    }

    public static ScriptedElement link(String href) {
        return new ScriptedElement(href).attr("href", href);
    }

    public ScriptedElement attr(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    public ScriptedElement child(String selector, PageElement... elements) {
        children.computeIfAbsent(selector, key -> new ArrayList<>()).addAll(List.of(elements));
        return this;
    }

    public ScriptedElement onClick(Runnable action) {
        this.onClick = action;
        return this;
    }

    public ScriptedElement selected(boolean selected) {
        this.selected = selected;
        return this;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public String getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public void click() {
        clickCount++;
        onClick.run();
    }

    @Override
    public void fill(String value) {
        this.filledValue = value;
    }

    @Override
    public boolean isSelected() {
        return selected;
    }

    @Override
    public void select() {
        selected = true;
    }

    @Override
    public List<PageElement> findElements(String selector) {
        return Collections.unmodifiableList(children.getOrDefault(selector, List.of()));
    }

    public String getFilledValue() {
        return filledValue;
    }

    public int getClickCount() {
        return clickCount;
    }
}
