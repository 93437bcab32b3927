package com.grp.tank.engine;

import lombok.Value;

import java.util.List;

/**
 * Decomposed geometry shared by every calculator. Naming follows the panel layout:
 * counts are whole panels, totals are metres.
 */
@Value
public class TankGeometry {

    DimensionDecomposition width;
    List<DimensionDecomposition> lengths; // always four slots, absent ones are ABSENT
    DimensionDecomposition height;
    int partitions;

    public DimensionDecomposition length(int slot) {
        return lengths.get(slot - 1);
    }

    public int widthCount() {
        return width.getCount();
    }

    public boolean widthHalf() {
        return width.isHalf();
    }

    public double widthTotal() {
        return width.value();
    }

    public int lengthCount() {
        return lengths.stream().mapToInt(DimensionDecomposition::getCount).sum();
    }

    public int lengthHalfCount() {
        return (int) lengths.stream().filter(DimensionDecomposition::isHalf).count();
    }

    public double lengthTotal() {
        double total = 0;
        for (DimensionDecomposition length : lengths) {
            total += length.value();
        }
        return total;
    }

    public int heightCount() {
        return height.getCount();
    }

    public boolean heightHalf() {
        return height.isHalf();
    }

    public double heightTotal() {
        return height.value();
    }

    /** Height in millimetres as used in part numbers, e.g. 2500. */
    public int heightMm() {
        return height.halfUnits() * 500;
    }

    /** Height in decimetres as used in panel codes, e.g. 25. */
    public int heightCode() {
        return height.halfUnits() * 5;
    }

    public boolean isPartitioned() {
        return partitions > 0;
    }

    public double nominalVolume() {
        return widthTotal() * lengthTotal() * heightTotal();
    }
}
