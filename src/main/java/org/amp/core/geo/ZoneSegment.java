package org.amp.core.geo;

import lombok.Builder;
import lombok.Value;

/**
 * One edge of a restriction zone boundary.
 *
 * <p>{@code metadata} belongs to the caller (restriction text, schedule, tariff) and is never
 * read by the correlation engine. A segment whose start equals its end is legal and
 * behaves as a point-like zone.</p>
 */
@Value
@Builder
public class ZoneSegment {
    /** Segment start vertex. */
    @lombok.NonNull
    Point start;
    /** Segment end vertex. */
    @lombok.NonNull
    Point end;
    /** Opaque caller-owned payload, may be null. */
    Object metadata;

    /**
     * Creates a segment without metadata.
     */
    public static ZoneSegment of(Point start, Point end) {
        return new ZoneSegment(start, end, null);
    }

    /**
     * Creates a segment carrying caller metadata.
     */
    public static ZoneSegment of(Point start, Point end, Object metadata) {
        return new ZoneSegment(start, end, metadata);
    }

    /**
     * Returns true when start and end are the same coordinate.
     */
    public boolean isDegenerate() {
        return start.equals(end);
    }
}
