package com.github.stormino.vimeocrawler.service.render;

/**
 * Opens browser sessions; the caller owns and closes each one.
 */
public interface PageRendererFactory {

    PageRenderer open();
}
