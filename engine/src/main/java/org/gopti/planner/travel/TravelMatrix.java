package org.gopti.planner.travel;

import lombok.Getter;

/**
 * Pairwise walking seconds and meters between the nodes of one request.
 */
public class TravelMatrix {
    private final long[][] seconds;
    private final double[][] meters;

    /* Some pair was replaced by a straight-line estimate after a provider failure */
    @Getter
    private final boolean degraded;

    @Getter
    private final String provider;

    public TravelMatrix(long[][] seconds, double[][] meters, boolean degraded, String provider) {
        if (seconds.length != meters.length) {
            throw new IllegalArgumentException("Seconds and meters must cover the same nodes");
        }
        this.seconds = seconds;
        this.meters = meters;
        this.degraded = degraded;
        this.provider = provider;
    }

    public int size() {
        return seconds.length;
    }

    public long seconds(int from, int to) {
        return seconds[from][to];
    }

    public double meters(int from, int to) {
        return meters[from][to];
    }
}
