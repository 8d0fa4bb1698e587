package com.blazesports.intel.application;

/**
 * Outcome of one warming pass
 */
public record WarmingResult(int total, int warmed, int skipped, int errors) {

    public static WarmingResult empty() {
        return new WarmingResult(0, 0, 0, 0);
    }
}
