package org.opensearch.indexsync.pipeline.channel;

import java.util.EnumSet;

import org.opensearch.indexsync.pipeline.ir.StreamSource;

import lombok.extern.slf4j.Slf4j;

/**
 * Follows the end-of-stream markers seen by the consumer of an operation channel.
 * Each producer may close its side exactly once.
 */
@Slf4j
public class ChannelStateTracker {
    private final EnumSet<StreamSource> closed = EnumSet.noneOf(StreamSource.class);

    public ChannelState close(StreamSource source) {
        if (!closed.add(source)) {
            throw new IllegalStateException("End of stream received twice for " + source);
        }
        log.atDebug().setMessage("{} stream closed").addArgument(source).log();
        return state();
    }

    public ChannelState state() {
        switch (closed.size()) {
            case 0:
                return ChannelState.OPEN;
            case 1:
                return ChannelState.ONE_SIDE_CLOSED;
            default:
                return ChannelState.BOTH_CLOSED;
        }
    }
}
