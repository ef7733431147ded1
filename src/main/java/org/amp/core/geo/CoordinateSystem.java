package org.amp.core.geo;

/**
 * Interpretation of {@link Point} coordinates for one correlation run.
 *
 * <p>{@code WGS84_DEGREES} treats {@code x} as longitude and {@code y} as latitude and
 * measures with the haversine formula on a spherical earth.</p>
 * <p>{@code PROJECTED_METERS} treats both axes as planar meters (for example SWEREF99 TM)
 * and measures Euclidean distance.</p>
 */
public enum CoordinateSystem {
    WGS84_DEGREES,
    PROJECTED_METERS
}
