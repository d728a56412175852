package com.github.stormino.vimeocrawler.config;

import com.github.stormino.vimeocrawler.util.CrawlerConstants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    @NotBlank
    private String targetDirectory = ".";

    /**
     * Account, folder or video URL (or bare video ID) to start from.
     * Optional when login credentials are configured.
     */
    private String startUrl;

    @Valid
    private Download download = new Download();
    @Valid
    private Walk walk = new Walk();
    @Valid
    private Login login = new Login();
    @Valid
    private Browser browser = new Browser();
    @Valid
    private Site site = new Site();

    public Path getTargetPath() {
        return Paths.get(targetDirectory);
    }

    @Data
    public static class Download {
        private boolean enabled = true;

        @Min(0)
        private int retryCount = 3;

        @Min(1)
        private int timeoutSeconds = 60;

        private boolean probeSizes = true;

        private boolean hardLinks = false;

        /**
         * Preferred site UI language, matched against the language options by prefix.
         */
        private String language;

        @Min(1)
        private long progressQuantumBytes = CrawlerConstants.DEFAULT_PROGRESS_QUANTUM_BYTES;

        public String getCapitalizedLanguage() {
            if (language == null || language.isBlank()) {
                return null;
            }
            String trimmed = language.trim();
            return trimmed.substring(0, 1).toUpperCase(Locale.ROOT) + trimmed.substring(1).toLowerCase(Locale.ROOT);
        }
    }

    @Data
    public static class Walk {
        /**
         * Caps both the items taken from one listing page and the number of pages followed.
         */
        @Min(0)
        private Integer maxItems;

        private boolean createFolders = true;
    }

    @Data
    public static class Login {
        private String email;
        private String password;

        public boolean isConfigured() {
            return email != null && !email.isBlank() && password != null && !password.isBlank();
        }
    }

    @Data
    public static class Browser {
        @Pattern(regexp = "chromium|firefox|webkit")
        private String type = "firefox";

        private boolean headless = true;

        @Min(1)
        private int navigationTimeoutMs = 30000;

        @Min(0)
        private int elementWaitMs = 3000;
    }

    @Data
    public static class Site {
        @NotBlank
        private String domain = "vimeo.com";

        @NotBlank
        private String baseUrl = "https://vimeo.com";
    }
}
