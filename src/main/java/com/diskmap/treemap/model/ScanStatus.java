package com.diskmap.treemap.model;

/**
 * How a scan ended. Anything other than {@link #COMPLETE} means the tree may
 * hold fewer children than the directory really has.
 */
public enum ScanStatus {

    COMPLETE,

    /** Cancelled by the caller or superseded by a newer scan. */
    CANCELLED,

    /** The wall-clock deadline fired before the scan finished. */
    TIMED_OUT,

    /** The scan could not run or threw; the root is the error node. */
    FAILED;

    public boolean isPartial() {
        return this != COMPLETE;
    }
}
