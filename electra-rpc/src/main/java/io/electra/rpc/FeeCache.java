// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * Caches fee estimates per confirmation target.
 *
 * <p>
 * A cached value is served while the clock is before its expiry; after that
 * the next call refreshes it through the estimator. Concurrent misses for the
 * same target may both call the estimator; the last result wins.
 */
public final class FeeCache {

    /** Default time a fee estimate stays cached. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

    private record CacheEntry(BigDecimal value, Instant expiresAt) {
    }

    private final IntFunction<BigDecimal> estimator;
    private final Clock clock;
    private final Map<Integer, CacheEntry> entries = new ConcurrentHashMap<>();

    /**
     * @param estimator fetches a fresh estimate for a target block count
     * @param clock     time source for expiry
     */
    public FeeCache(final IntFunction<BigDecimal> estimator, final Clock clock) {
        this.estimator = estimator;
        this.clock = clock;
    }

    public BigDecimal estimateFeeCached(final int targetBlocks, final Duration ttl) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative, got: " + ttl);
        }
        final Instant now = clock.instant();
        final CacheEntry entry = entries.get(targetBlocks);
        if (entry != null && now.isBefore(entry.expiresAt())) {
            return entry.value();
        }
        final BigDecimal fee = estimator.apply(targetBlocks);
        entries.put(targetBlocks, new CacheEntry(fee, now.plus(ttl)));
        return fee;
    }

    public void invalidate() {
        entries.clear();
    }
}
