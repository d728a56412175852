package com.github.stormino.vimeocrawler.service.transfer;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A file request made on behalf of the browser session, carrying its identity.
 */
@Data
@Builder
public class TransferRequest {

    @NonNull
    private final String url;

    /**
     * User agent of the browser session, null to use the client default.
     */
    private final String userAgent;

    @Builder.Default
    private final Map<String, String> cookies = Collections.emptyMap();

    /**
     * Cookies rendered as a {@code Cookie} header value, empty if there are none.
     */
    public String cookieHeader() {
        return cookies.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("; "));
    }
}
