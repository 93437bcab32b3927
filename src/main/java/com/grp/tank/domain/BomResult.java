package com.grp.tank.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Value
@Builder
public class BomResult {
    CapacitySummary capacity;
    List<BomLineItem> bom;
    CostSummary costSummary;
    WeightSummary weightSummary;
    OrderInfo orderInfo;

    public Optional<BomLineItem> line(String partNo) {
        return bom.stream().filter(item -> item.getPartNo().equals(partNo)).findFirst();
    }

    public int quantityOf(String partNo) {
        return line(partNo).map(BomLineItem::getQuantity).orElse(0);
    }

    public List<BomLineItem> linesIn(PartCategory category) {
        return bom.stream().filter(item -> item.getCategory() == category).collect(Collectors.toList());
    }
}
