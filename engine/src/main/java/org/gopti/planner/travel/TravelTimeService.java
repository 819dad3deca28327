package org.gopti.planner.travel;

import org.gopti.planner.config.PlannerProperties;
import org.gopti.planner.exception.provider.ProviderException;
import org.gopti.planner.model.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolves travel times through the shared cache. Provider failures never
 * escape: a pair falls back to its last known value, then to the estimate.
 */
@Service
public class TravelTimeService {

    private static final Logger logger = LoggerFactory.getLogger(TravelTimeService.class);

    private final TravelTimeCache cache;
    private final OSRMTravelTimeProvider osrmProvider;
    private final ExecutorService lookupExecutor;
    private final PlannerProperties properties;

    @Autowired
    public TravelTimeService(
        TravelTimeCache cache,
        OSRMTravelTimeProvider osrmProvider,
        ExecutorService lookupExecutor,
        PlannerProperties properties
    ) {
        this.cache = cache;
        this.osrmProvider = osrmProvider;
        this.lookupExecutor = lookupExecutor;
        this.properties = properties;
    }

    public ITravelTimeProvider estimateProvider(double walkingSpeed) {
        return new EstimateTravelTimeProvider(walkingSpeed);
    }

    public ITravelTimeProvider providerFor(double walkingSpeed) {
        if (OSRMTravelTimeProvider.MODE.equalsIgnoreCase(properties.getTravel().getProvider())) {
            return osrmProvider;
        }
        return estimateProvider(walkingSpeed);
    }

    /**
     * Builds the full matrix between {@code points}. Row {@code i} is looked up
     * with departure time {@code departures.get(i)}.
     */
    public TravelMatrix buildMatrix(List<Coordinate> points, List<Instant> departures, double walkingSpeed) {
        if (points.size() != departures.size()) {
            throw new IllegalArgumentException("One departure time per point is required");
        }

        var provider = providerFor(walkingSpeed);
        var estimate = estimateProvider(walkingSpeed);
        var mode = provider.mode();
        int size = points.size();
        var legs = new TravelLeg[size][size];

        int missing = 0;
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i == j) {
                    legs[i][j] = TravelLeg.ZERO;
                    continue;
                }
                var cached = cache.peekLeg(mode, points.get(i), points.get(j), departures.get(i));
                if (cached.isPresent()) {
                    legs[i][j] = cached.get();
                } else {
                    missing++;
                }
            }
        }

        var providerFailed = new AtomicBoolean(false);
        var degraded = new AtomicBoolean(false);

        /* Cold request: one matrix call seeds every pair */
        if (size > 1 && missing == size * (size - 1)) {
            try {
                var seeded = provider.matrix(points, departures.get(0));
                for (int i = 0; i < size; i++) {
                    for (int j = 0; j < size; j++) {
                        if (i != j) {
                            cache.putLeg(mode, points.get(i), points.get(j), departures.get(i), seeded[i][j]);
                            legs[i][j] = seeded[i][j];
                        }
                    }
                }
                missing = 0;
            } catch (ProviderException ex) {
                logger.warn("Travel matrix from {} failed, falling back per pair: {}", ex.getProvider(), ex.getMessage());
                providerFailed.set(true);
            }
        }

        if (missing > 0) {
            var lookups = new ArrayList<CompletableFuture<Void>>(missing);
            for (int i = 0; i < size; i++) {
                for (int j = 0; j < size; j++) {
                    if (legs[i][j] != null) {
                        continue;
                    }
                    final int from = i;
                    final int to = j;
                    lookups.add(CompletableFuture.runAsync(() -> legs[from][to] = resolveLeg(
                        provider, estimate, points.get(from), points.get(to), departures.get(from), providerFailed, degraded
                    ), lookupExecutor));
                }
            }
            CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0])).join();
        }

        long[][] seconds = new long[size][size];
        double[][] meters = new double[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                seconds[i][j] = legs[i][j].getSeconds();
                meters[i][j] = legs[i][j].getMeters();
            }
        }

        if (degraded.get()) {
            logger.warn("Travel matrix of {} points degraded to straight-line estimates", size);
        }
        return new TravelMatrix(seconds, meters, degraded.get(), mode);
    }

    /* Encoded path of one leg, through the directions cache */
    public String path(Coordinate from, Coordinate to, Instant departAt, double walkingSpeed) {
        var provider = providerFor(walkingSpeed);
        try {
            return cache.path(provider.mode(), from, to, () -> provider.duration(from, to, departAt).getPath());
        } catch (ProviderException ex) {
            logger.warn("Directions from {} failed, using straight line: {}", ex.getProvider(), ex.getMessage());
            return estimateProvider(walkingSpeed).duration(from, to, departAt).getPath();
        }
    }

    private TravelLeg resolveLeg(
        ITravelTimeProvider provider,
        ITravelTimeProvider estimate,
        Coordinate from,
        Coordinate to,
        Instant departAt,
        AtomicBoolean providerFailed,
        AtomicBoolean degraded
    ) {
        /* Once the provider failed in this request, stop hammering it */
        if (!providerFailed.get()) {
            try {
                return cache.leg(provider.mode(), from, to, departAt, () -> provider.duration(from, to, departAt));
            } catch (ProviderException ex) {
                if (providerFailed.compareAndSet(false, true)) {
                    logger.warn("Travel lookup from {} failed: {}", ex.getProvider(), ex.getMessage());
                }
            }
        }

        var stale = cache.lastKnown(provider.mode(), from, to);
        if (stale.isPresent()) {
            return stale.get();
        }
        degraded.set(true);
        return estimate.duration(from, to, departAt);
    }
}
