package com.prism.documents.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Two token buckets per key: one request per call, and a character budget
 * for the text sent with it. Both refill greedily over a minute.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> requestBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> characterBuckets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;
    private final int charactersPerMinute;

    public InMemoryDualRateLimiter(int requestsPerMinute, int charactersPerMinute) {
        this.requestsPerMinute = requestsPerMinute;
        this.charactersPerMinute = charactersPerMinute;
    }

    private static Bucket perMinute(int limit) {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(limit, Refill.greedy(limit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int characters) {
        Bucket requests = requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute));
        Bucket chars = characterBuckets.computeIfAbsent(key, k -> perMinute(charactersPerMinute));

        requests.asBlocking().consume(1);
        // a single oversized call may take at most one full minute of budget
        long needed = Math.max(1, Math.min(characters, charactersPerMinute));
        chars.asBlocking().consume(needed);
    }

    long availableRequests(String key) {
        Bucket bucket = requestBuckets.get(key);
        return bucket == null ? requestsPerMinute : bucket.getAvailableTokens();
    }

    long availableCharacters(String key) {
        Bucket bucket = characterBuckets.get(key);
        return bucket == null ? charactersPerMinute : bucket.getAvailableTokens();
    }
}
