package com.github.stormino.vimeocrawler.service.transfer;

import com.github.stormino.vimeocrawler.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.function.LongConsumer;

/**
 * Progress callback for a single transfer. Logs a line every time another quantum
 * of data has arrived and forwards each report downstream.
 *
 * <p>Stalls are not detected here: the transfer client's read timeout fails a
 * transfer that stops sending data.
 */
@Slf4j
public class ProgressIndicator implements LongConsumer {

    private final long quantumBytes;
    private final LongConsumer downstream;

    private long totalRead = 0;
    private long quanta = 0;

    public ProgressIndicator(long quantumBytes, LongConsumer downstream) {
        this.quantumBytes = Math.max(1, quantumBytes);
        this.downstream = downstream;
    }

    /**
     * Report the total number of bytes received so far.
     */
    @Override
    public void accept(long bytesSoFar) {
        totalRead = Math.max(totalRead, bytesSoFar);

        long reached = bytesSoFar / quantumBytes;
        if (reached > quanta) {
            quanta = reached;
            log.info("Downloading: {}", FormatUtils.formatSize(bytesSoFar));
        }

        if (downstream != null) {
            downstream.accept(bytesSoFar);
        }
    }

    public void finish() {
        log.info("Downloaded {}", FormatUtils.formatSize(totalRead));
    }

    public long getTotalRead() {
        return totalRead;
    }
}
