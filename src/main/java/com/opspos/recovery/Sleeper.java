package com.opspos.recovery;

/**
 * Backoff pause between recovery attempts. Production uses {@link Thread#sleep(long)};
 * tests record the requested delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
