package org.opensearch.indexsync.pipeline.channel;

public enum ChannelState {
    OPEN,
    ONE_SIDE_CLOSED,
    BOTH_CLOSED
}
