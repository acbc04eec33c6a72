package dev.sidechain.websocket;

/**
 * Per-connection inbound rate limiter: refills {@code ratePerSecond} tokens per second
 * up to {@code burst}. One frame costs one token.
 */
public class TokenBucket {

    private final double ratePerNano;
    private final double burst;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(double ratePerSecond, int burst) {
        if (ratePerSecond <= 0 || burst <= 0) {
            throw new IllegalArgumentException("Rate and burst must be positive");
        }
        this.ratePerNano = ratePerSecond / 1_000_000_000d;
        this.burst = burst;
        this.tokens = burst;
        this.lastRefillNanos = System.nanoTime();
    }

    public synchronized boolean tryAcquire() {
        long now = System.nanoTime();
        tokens = Math.min(burst, tokens + (now - lastRefillNanos) * ratePerNano);
        lastRefillNanos = now;
        if (tokens >= 1d) {
            tokens -= 1d;
            return true;
        }
        return false;
    }
}
