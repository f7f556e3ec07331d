package com.trialwatch.service;

/**
 * Thrown when a sync pass is triggered while another one is still running.
 */
public class SyncInProgressException extends IllegalStateException {

    public SyncInProgressException() {
        super("A sync pass is already running");
    }
}
