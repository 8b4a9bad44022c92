package com.opspos.recovery;

/**
 * A long-running component that the {@link RecoveryManager} can start, stop, probe and restart.
 *
 * <p>Implementations signal failure by throwing from {@link #start()} or {@link #healthCheck()}.
 * {@code start()} must be safe to call after {@code stop()}, since recovery is stop-then-start.
 */
public interface RecoverableService {

    String getName();

    void start();

    void stop();

    /** Returns false when degraded; throws when the service is broken. */
    boolean healthCheck();
}
