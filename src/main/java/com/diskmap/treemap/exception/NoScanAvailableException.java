package com.diskmap.treemap.exception;

/**
 * A layout was requested before any path had been scanned.
 */
public class NoScanAvailableException extends RuntimeException {

    public NoScanAvailableException() {
        super("No scan result available; scan a path first");
    }
}
