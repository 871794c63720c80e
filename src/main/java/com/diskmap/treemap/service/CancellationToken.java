package com.diskmap.treemap.service;

/**
 * Cooperative cancellation flag shared between a running scan and whoever may
 * stop it. The scan polls {@link #isCancelled()} at its checkpoints; nothing
 * is interrupted forcibly.
 *
 * Once the scan has {@link #finish() finished}, later cancel requests are
 * ignored so a complete tree is never reported as partial.
 */
public class CancellationToken {

    public enum Reason {
        /** Explicit cancel request from the caller. */
        REQUESTED,
        /** A newer scan replaced this one. */
        SUPERSEDED,
        /** The scan deadline fired. */
        TIMEOUT
    }

    private volatile Reason reason;

    // guarded by this
    private boolean finished;

    /**
     * Request cancellation. Only the first reason is kept.
     *
     * @return true if this call cancelled the token
     */
    public synchronized boolean cancel(Reason cancelReason) {
        if (finished || reason != null) {
            return false;
        }
        reason = cancelReason;
        return true;
    }

    /**
     * Mark the scan as done. Has no effect if it was already cancelled.
     *
     * @return true if the scan finished without being cancelled
     */
    public synchronized boolean finish() {
        if (reason != null) {
            return false;
        }
        finished = true;
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    /**
     * @return the first reason given, or null while not cancelled
     */
    public Reason getReason() {
        return reason;
    }
}
