package com.github.stormino.vimeocrawler.exception;

/**
 * Thrown when a crawl cannot start because settings are missing or invalid.
 */
public class ConfigurationException extends CrawlerException {

    private final String configKey;

    public ConfigurationException(String message, String configKey) {
        super(message);
        this.configKey = configKey;
    }

    public String getConfigKey() {
        return configKey;
    }
}
