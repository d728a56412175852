package com.github.stormino.vimeocrawler.service.render;

import java.util.List;

/**
 * An element of the page currently loaded in a {@link PageRenderer}.
 */
public interface PageElement {

    /**
     * Visible text of the element.
     */
    String getText();

    /**
     * Attribute or property value, like {@code href} (resolved to an absolute URL),
     * {@code title} or {@code download}.
     *
     * @return Value, or null if the element has no such attribute
     */
    String getAttribute(String name);

    void click();

    /**
     * Replace the value of an input field.
     */
    void fill(String value);

    /**
     * Whether this {@code <option>} element is the selected one.
     */
    boolean isSelected();

    /**
     * Make this {@code <option>} element the selected one of its list.
     */
    void select();

    /**
     * Elements below this one matching a CSS selector, in document order.
     */
    List<PageElement> findElements(String selector);
}
