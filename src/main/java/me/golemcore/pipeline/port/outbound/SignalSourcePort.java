package me.golemcore.pipeline.port.outbound;

import me.golemcore.pipeline.domain.model.ScrapedItem;

import java.util.List;

/**
 * Source-specific collector of raw signals.
 */
public interface SignalSourcePort {

    /**
     * Stable source identifier, also the rate-limit key.
     */
    String sourceId();

    boolean isEnabled();

    /**
     * Collect the current batch of items. Network failures are thrown as
     * {@link me.golemcore.pipeline.domain.exception.TransientIOException}.
     */
    List<ScrapedItem> collect();
}
