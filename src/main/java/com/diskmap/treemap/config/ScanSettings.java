package com.diskmap.treemap.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Limits that bound the cost of one scan.
 * Defaults match application.properties.
 */
@Value
@Builder(toBuilder = true)
public class ScanSettings {

    /** Entries considered per directory, in enumeration order. */
    @Builder.Default
    int maxEntriesPerDirectory = 50;

    /** Children kept per directory after sorting by size. */
    @Builder.Default
    int maxChildren = 30;

    /** Size given to a directory that is not descended into. */
    @Builder.Default
    long directoryPlaceholderBytes = 1024L * 1024L;

    /** Directory levels scanned in detail below the root. */
    @Builder.Default
    int maxDepth = 1;

    @Builder.Default
    boolean includeHidden = false;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    /** How long to keep waiting for a scan after its deadline fired. */
    @Builder.Default
    Duration cancelGrace = Duration.ofSeconds(5);

    public static ScanSettings defaults() {
        return ScanSettings.builder().build();
    }
}
