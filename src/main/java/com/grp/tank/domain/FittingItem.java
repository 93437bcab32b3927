package com.grp.tank.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FittingItem {
    private String fittingType; // fitting part number, e.g. WFL-100A
    private int quantity;
    private String position;    // free text, e.g. "Inlet"
}
