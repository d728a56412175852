package com.github.stormino.vimeocrawler.config;

import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final CrawlerProperties properties;

    /**
     * Shared client for size probes and downloads. The read timeout doubles as the
     * stall window: a socket that delivers no bytes for that long fails the call.
     */
    @Bean
    public OkHttpClient okHttpClient() {
        Duration timeout = Duration.ofSeconds(properties.getDownload().getTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .followRedirects(true)
                .followSslRedirects(true)
                .retryOnConnectionFailure(true)
                .build();
    }
}
