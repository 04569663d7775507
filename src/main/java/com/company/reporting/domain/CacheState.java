package com.company.reporting.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Cached payload carried by a report or a widget, valid until cachedAt + ttl.
 */
@Getter
@ToString
@AllArgsConstructor
public class CacheState {

    private final Map<String, Object> payload;
    private final Instant cachedAt;
    private final int ttlMinutes;

    public static CacheState of(Map<String, Object> payload, Instant cachedAt,
                                Integer ttlMinutes, int defaultTtlMinutes) {
        return new CacheState(payload, cachedAt, ttlMinutes != null ? ttlMinutes : defaultTtlMinutes);
    }

    public boolean isValid(Instant now) {
        if (payload == null || cachedAt == null) {
            return false;
        }
        return now.isBefore(expiresAt());
    }

    public Instant expiresAt() {
        return cachedAt.plus(Duration.ofMinutes(ttlMinutes));
    }
}
