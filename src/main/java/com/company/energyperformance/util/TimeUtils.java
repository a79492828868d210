package com.company.energyperformance.util;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bucket arithmetic. All buckets are aligned to the UTC epoch, so a width that is
 * a multiple of another width yields boundaries that are a subset of the finer ones.
 */
public class TimeUtils {

    private TimeUtils() {
    }

    public static Instant floorToBucket(Instant instant, Duration width) {
        if (instant == null) return null;
        long widthSeconds = requirePositiveSeconds(width);
        long floored = Math.floorDiv(instant.getEpochSecond(), widthSeconds) * widthSeconds;
        return Instant.ofEpochSecond(floored);
    }

    public static Instant ceilToBucket(Instant instant, Duration width) {
        if (instant == null) return null;
        Instant floor = floorToBucket(instant, width);
        return floor.equals(instant) ? floor : floor.plus(width);
    }

    public static boolean isAligned(Instant instant, Duration width) {
        return instant != null && floorToBucket(instant, width).equals(instant);
    }

    /**
     * Start instants of every bucket of {@code width} in [start, end)
     */
    public static List<Instant> bucketStarts(Instant start, Instant end, Duration width) {
        List<Instant> starts = new ArrayList<>();
        Instant cursor = floorToBucket(start, width);
        while (cursor.isBefore(end)) {
            starts.add(cursor);
            cursor = cursor.plus(width);
        }
        return starts;
    }

    public static Instant earliest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static long requirePositiveSeconds(Duration width) {
        if (width == null || width.getSeconds() <= 0 || width.getNano() != 0) {
            throw new IllegalArgumentException("Bucket width must be a positive whole number of seconds: " + width);
        }
        return width.getSeconds();
    }
}
