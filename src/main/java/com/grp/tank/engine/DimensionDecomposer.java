package com.grp.tank.engine;

import com.grp.tank.domain.TankDimensions;
import com.grp.tank.error.InvalidGeometryException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class DimensionDecomposer {

    public DimensionDecomposition decompose(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new InvalidGeometryException(field, value, "must be a non-negative number");
        }
        double halfUnits = value * 2;
        if (halfUnits != Math.rint(halfUnits)) {
            throw new InvalidGeometryException(field, value, "must be a multiple of 0.5");
        }
        int units = (int) halfUnits;
        return new DimensionDecomposition(units / 2, units % 2 == 1);
    }

    public TankGeometry geometryOf(TankDimensions dimensions) {
        List<DimensionDecomposition> lengths = new ArrayList<>(4);
        lengths.add(decompose("length1", dimensions.getLength1()));
        lengths.add(decompose("length2", dimensions.getLength2()));
        lengths.add(decompose("length3", dimensions.getLength3()));
        lengths.add(decompose("length4", dimensions.getLength4()));

        int partitions = 0;
        for (int slot = 1; slot < lengths.size(); slot++) {
            if (lengths.get(slot).isPresent()) {
                partitions++;
            }
        }
        return new TankGeometry(
                decompose("width", dimensions.getWidth()),
                List.copyOf(lengths),
                decompose("height", dimensions.getHeight()),
                partitions);
    }
}
