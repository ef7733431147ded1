package org.amp.correlation.geometry;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Axis-aligned half-widths, in coordinate units, that enclose a metric search radius.
 *
 * <p>Any coordinate outside {@code [x - halfWidthX, x + halfWidthX] x [y - halfWidthY, y + halfWidthY]}
 * is farther than the radius the extent was derived from.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SearchExtent {
    private final double halfWidthX;
    private final double halfWidthY;

    /**
     * Larger of the two half-widths.
     */
    public double maxHalfWidth() {
        return Math.max(halfWidthX, halfWidthY);
    }

    /**
     * Returns true when the box {@code [minX, maxX] x [minY, maxY]} intersects the extent centred at (x, y).
     */
    public boolean intersects(double x, double y, double minX, double minY, double maxX, double maxY) {
        return maxX >= x - halfWidthX
                && minX <= x + halfWidthX
                && maxY >= y - halfWidthY
                && minY <= y + halfWidthY;
    }

    @Override
    public String toString() {
        return "SearchExtent[halfWidthX=" + halfWidthX + ", halfWidthY=" + halfWidthY + "]";
    }
}
