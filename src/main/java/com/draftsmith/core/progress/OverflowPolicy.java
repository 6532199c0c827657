package com.draftsmith.core.progress;

/**
 * What a full subscriber buffer does with one more event.
 */
public enum OverflowPolicy {
    /** Evict the oldest buffered event to make room. Readers always see the latest state. */
    DROP_OLDEST,
    /** Discard the incoming event. Readers see an unbroken prefix of the stream. */
    DROP_NEWEST
}
