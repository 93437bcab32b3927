package com.grp.tank.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TankDimensions {
    private double width;   // metres, 0.5 grid
    private double length1; // first compartment, always present
    private double length2; // 0 when the compartment is absent
    private double length3;
    private double length4;
    private double height;  // one of the standard panel heights

    @Builder.Default
    private int quantity = 1; // identical tanks in the order
}
