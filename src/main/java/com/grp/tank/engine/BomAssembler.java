package com.grp.tank.engine;

import com.grp.tank.catalog.CatalogEntry;
import com.grp.tank.catalog.PriceWeightCatalog;
import com.grp.tank.config.TankBomProperties;
import com.grp.tank.domain.BomLineItem;
import com.grp.tank.domain.BomResult;
import com.grp.tank.domain.CapacitySummary;
import com.grp.tank.domain.CostSummary;
import com.grp.tank.domain.OrderInfo;
import com.grp.tank.domain.PartCategory;
import com.grp.tank.domain.WeightSummary;
import com.grp.tank.error.BomInvariantException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges calculator outputs into priced BOM lines and the cost and weight summaries.
 */
@Component
@RequiredArgsConstructor
public class BomAssembler {

    private final PriceWeightCatalog catalog;
    private final TankBomProperties properties;

    public BomResult assemble(List<? extends SubsystemResult> results, int batchQuantity, BigDecimal exchangeRate,
                              CapacitySummary capacity, OrderInfo orderInfo) {
        Map<String, MergedPart> merged = new LinkedHashMap<>();
        for (SubsystemResult result : results) {
            for (PartQuantity part : result.getParts()) {
                if (part.getQuantity() < 0) {
                    throw new BomInvariantException(part.getPartNo(), part.getQuantity());
                }
                merged.computeIfAbsent(part.getPartNo(), key -> new MergedPart(part))
                        .add(part.getQuantity(), result.retainsZeroLines());
            }
        }

        List<BomLineItem> lines = new ArrayList<>();
        for (MergedPart part : merged.values()) {
            if (part.quantity == 0 && !part.retainZero) {
                continue;
            }
            lines.add(priced(part, Math.multiplyExact(part.quantity, batchQuantity)));
        }
        lines.sort(Comparator.comparing(BomLineItem::getCategory)); // stable: emission order within a category

        return BomResult.builder()
                .capacity(capacity)
                .bom(List.copyOf(lines))
                .costSummary(costSummary(lines, exchangeRate))
                .weightSummary(weightSummary(lines))
                .orderInfo(orderInfo)
                .build();
    }

    private BomLineItem priced(MergedPart part, int quantity) {
        CatalogEntry entry = catalog.resolve(part.partNo);
        BigDecimal count = BigDecimal.valueOf(quantity);
        return BomLineItem.builder()
                .partNo(part.partNo)
                .partName(entry.getName())
                .quantity(quantity)
                .unitPriceUsd(entry.getUnitPriceUsd())
                .totalPriceUsd(entry.getUnitPriceUsd().multiply(count).setScale(2, RoundingMode.HALF_UP))
                .weightKg(entry.getUnitWeightKg())
                .totalWeightKg(entry.getUnitWeightKg().multiply(count).setScale(2, RoundingMode.HALF_UP))
                .category(part.category)
                .build();
    }

    private CostSummary costSummary(List<BomLineItem> lines, BigDecimal exchangeRate) {
        Map<String, BigDecimal> byCategory = emptyByCategory();
        BigDecimal total = zero();
        for (BomLineItem line : lines) {
            byCategory.merge(line.getCategory().getLabel(), line.getTotalPriceUsd(), BigDecimal::add);
            total = total.add(line.getTotalPriceUsd());
        }
        return CostSummary.builder()
                .byCategory(byCategory)
                .totalUsd(total)
                .exchangeRate(exchangeRate)
                .localCurrency(properties.getLocalCurrency())
                .totalLocal(total.multiply(exchangeRate).setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    private WeightSummary weightSummary(List<BomLineItem> lines) {
        Map<String, BigDecimal> byCategory = emptyByCategory();
        Map<PartCategory.WeightGroup, BigDecimal> byGroup = new EnumMap<>(PartCategory.WeightGroup.class);
        for (PartCategory.WeightGroup group : PartCategory.WeightGroup.values()) {
            byGroup.put(group, zero());
        }
        for (BomLineItem line : lines) {
            byCategory.merge(line.getCategory().getLabel(), line.getTotalWeightKg(), BigDecimal::add);
            byGroup.merge(line.getCategory().getWeightGroup(), line.getTotalWeightKg(), BigDecimal::add);
        }
        BigDecimal panels = byGroup.get(PartCategory.WeightGroup.PANELS);
        BigDecimal steel = byGroup.get(PartCategory.WeightGroup.STEEL);
        BigDecimal accessories = byGroup.get(PartCategory.WeightGroup.ACCESSORIES);
        return WeightSummary.builder()
                .byCategory(byCategory)
                .panelsKg(panels)
                .steelKg(steel)
                .accessoriesKg(accessories)
                .totalKg(panels.add(steel).add(accessories))
                .build();
    }

    private static Map<String, BigDecimal> emptyByCategory() {
        Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
        for (PartCategory category : PartCategory.values()) {
            byCategory.put(category.getLabel(), zero());
        }
        return byCategory;
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
    }

    private static final class MergedPart {
        private final String partNo;
        private final PartCategory category; // first emitter wins
        private int quantity;
        private boolean retainZero;

        private MergedPart(PartQuantity first) {
            this.partNo = first.getPartNo();
            this.category = first.getCategory();
        }

        private void add(int added, boolean retainsZeroLines) {
            quantity = Math.addExact(quantity, added);
            retainZero |= retainsZeroLines;
        }
    }
}
