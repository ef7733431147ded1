package org.amp.correlation.geometry;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Integer cell coordinate of a uniform grid.
 *
 * <p>{@link #key()} packs both components into one {@code long} so cell maps can use
 * primitive-keyed fastutil collections.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public final class GridCell {
    private final int x;
    private final int y;

    /**
     * Packed {@code (x << 32) | y} key.
     */
    public long key() {
        return pack(x, y);
    }

    /**
     * Packs a cell coordinate without allocating a {@link GridCell}.
     */
    public static long pack(int x, int y) {
        return ((long) x << 32) | (y & 0xFFFFFFFFL);
    }

    /**
     * Restores a cell from a packed key.
     */
    public static GridCell unpack(long key) {
        return new GridCell((int) (key >> 32), (int) key);
    }

    @Override
    public String toString() {
        return "GridCell(" + x + ", " + y + ")";
    }
}
