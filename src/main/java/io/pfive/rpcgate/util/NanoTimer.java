// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.util;

import java.util.Locale;

/// Measures elapsed time from construction with the monotonic nanosecond clock. One instance is
/// created when a request arrives and read once when its response is encoded.
public class NanoTimer {
    private final long startNanos = System.nanoTime();

    public double getElapsedSeconds () {
        return (System.nanoTime() - startNanos) / 1e9;
    }

    /// Seconds with microsecond precision, as they appear in the per-call log line.
    public static String formatSeconds (double seconds) {
        return String.format(Locale.ROOT, "%.6f", seconds);
    }
}
