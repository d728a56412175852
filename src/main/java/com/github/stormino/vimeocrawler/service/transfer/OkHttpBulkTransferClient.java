package com.github.stormino.vimeocrawler.service.transfer;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.TransferException;
import com.github.stormino.vimeocrawler.exception.TransferInterruptedException;
import com.github.stormino.vimeocrawler.util.CrawlerConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.LongConsumer;

@Slf4j
@Component
@RequiredArgsConstructor
public class OkHttpBulkTransferClient implements BulkTransferClient {

    private final OkHttpClient httpClient;
    private final CrawlerProperties properties;

    @Override
    public RemoteMetadata fetchMetadata(TransferRequest request) {
        // GET rather than HEAD: the download links do not reliably answer HEAD.
        // The body is never read, closing the response drops it.
        try (Response response = httpClient.newCall(buildRequest(request)).execute()) {
            if (!response.isSuccessful()) {
                throw new TransferException("Unexpected response code: " + response.code(), request.getUrl());
            }
            return RemoteMetadata.builder()
                    .contentLength(parseLength(response.header("Content-Length")))
                    .build();
        } catch (IOException e) {
            throw new TransferException("Size probe failed: " + e.getMessage(), e, request.getUrl());
        }
    }

    @Override
    public long download(TransferRequest request, Path target, int timeoutSeconds, LongConsumer onProgress) {
        String url = request.getUrl();
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        OkHttpClient client = httpClient.newBuilder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
        ProgressIndicator indicator = new ProgressIndicator(
                properties.getDownload().getProgressQuantumBytes(), onProgress);

        log.debug("Downloading {} to {}", url, target);
        try (Response response = client.newCall(buildRequest(request)).execute()) {
            if (!response.isSuccessful()) {
                throw new TransferException("Unexpected response code: " + response.code(), url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransferException("Empty response body", url);
            }

            long total = 0;
            try (InputStream in = body.byteStream(); OutputStream out = Files.newOutputStream(target)) {
                byte[] buffer = new byte[CrawlerConstants.TRANSFER_BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new TransferInterruptedException(url);
                    }
                    out.write(buffer, 0, read);
                    total += read;
                    indicator.accept(total);
                }
            }
            indicator.finish();
            return total;

        } catch (SocketTimeoutException e) {
            throw new TransferException("Download seems stalled: no data for " + timeoutSeconds + " seconds",
                    e, url);
        } catch (InterruptedIOException e) {
            Thread.currentThread().interrupt();
            throw new TransferInterruptedException(e, url);
        } catch (IOException e) {
            throw new TransferException("Download failed: " + e.getMessage(), e, url);
        }
    }

    private Request buildRequest(TransferRequest request) {
        Request.Builder builder;
        try {
            builder = new Request.Builder().url(request.getUrl());
        } catch (IllegalArgumentException e) {
            throw new TransferException("Malformed download URL", e, request.getUrl());
        }
        builder.header("Accept", "*/*");
        if (request.getUserAgent() != null) {
            builder.header("User-Agent", request.getUserAgent());
        }
        String cookieHeader = request.cookieHeader();
        if (!cookieHeader.isEmpty()) {
            builder.header("Cookie", cookieHeader);
        }
        return builder.build();
    }

    private Long parseLength(String header) {
        if (header == null) {
            return null;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed Content-Length: {}", header);
            return null;
        }
    }
}
