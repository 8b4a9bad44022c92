package com.opspos.lock;

/**
 * Tells a reachable lock holder to flush its pending edits and give up a check.
 * Delivery to the terminal is the transport layer's job.
 */
public interface LockHandoffNotifier {

    void requestHandoff(String checkId, String holderTerminalId, String requestingTerminalId);
}
