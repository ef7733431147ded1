package org.amp.core.geo;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable two-dimensional coordinate pair.
 *
 * <p>Coordinates are held as {@link BigDecimal} so that values loaded from source data keep
 * their exact decimal representation. {@code x} is longitude (or easting) and {@code y} is
 * latitude (or northing); which one applies is decided by the run's
 * {@link CoordinateSystem}, not by the point itself.</p>
 *
 * <p>Equality is numeric ({@code 13.0} equals {@code 13.00}).</p>
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Point {
    @Getter
    @Accessors(fluent = true)
    private final BigDecimal x;
    @Getter
    @Accessors(fluent = true)
    private final BigDecimal y;

    @EqualsAndHashCode.Include
    private final BigDecimal normalizedX;
    @EqualsAndHashCode.Include
    private final BigDecimal normalizedY;

    private Point(BigDecimal x, BigDecimal y) {
        this.x = Objects.requireNonNull(x, "x");
        this.y = Objects.requireNonNull(y, "y");
        this.normalizedX = x.stripTrailingZeros();
        this.normalizedY = y.stripTrailingZeros();
    }

    /**
     * Creates a point from exact decimal coordinates.
     */
    public static Point of(BigDecimal x, BigDecimal y) {
        return new Point(x, y);
    }

    /**
     * Creates a point from decimal strings, e.g. {@code Point.of("13.1945945", "55.5932645")}.
     */
    public static Point of(String x, String y) {
        return new Point(new BigDecimal(x), new BigDecimal(y));
    }

    /**
     * Creates a point from primitive coordinates using their canonical decimal form.
     *
     * @throws NumberFormatException when either value is NaN or infinite.
     */
    public static Point of(double x, double y) {
        return new Point(BigDecimal.valueOf(x), BigDecimal.valueOf(y));
    }

    /**
     * Returns {@code x} narrowed to double for distance arithmetic.
     */
    public double xAsDouble() {
        return x.doubleValue();
    }

    /**
     * Returns {@code y} narrowed to double for distance arithmetic.
     */
    public double yAsDouble() {
        return y.doubleValue();
    }

    @Override
    public String toString() {
        return "Point[" + x.toPlainString() + ", " + y.toPlainString() + "]";
    }
}
