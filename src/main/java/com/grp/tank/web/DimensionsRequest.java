package com.grp.tank.web;

import com.grp.tank.domain.TankDimensions;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DimensionsRequest {
    @NotNull
    private Double width;
    @NotNull
    private Double length1;
    private double length2;
    private double length3;
    private double length4;
    @NotNull
    private Double height;
    private int quantity = 1;

    public TankDimensions toDimensions() {
        return TankDimensions.builder()
                .width(width)
                .length1(length1)
                .length2(length2)
                .length3(length3)
                .length4(length4)
                .height(height)
                .quantity(quantity)
                .build();
    }
}
