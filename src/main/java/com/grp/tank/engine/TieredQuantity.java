package com.grp.tank.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.function.IntUnaryOperator;

/**
 * Quantity built from an ordered list of (tier predicate, contribution) steps. Every step whose
 * predicate accepts the tier adds its contribution, which receives the tier index.
 */
public final class TieredQuantity {

    private final int base;
    private final List<Step> steps = new ArrayList<>();

    private TieredQuantity(int base) {
        this.base = base;
    }

    public static TieredQuantity startingAt(int base) {
        return new TieredQuantity(base);
    }

    public TieredQuantity when(IntPredicate applies, IntUnaryOperator contribution) {
        steps.add(new Step(applies, contribution));
        return this;
    }

    public TieredQuantity fromTier(int minimumTier, IntUnaryOperator contribution) {
        return when(tier -> tier >= minimumTier, contribution);
    }

    public int evaluate(int tier) {
        int total = base;
        for (Step step : steps) {
            if (step.applies.test(tier)) {
                total += step.contribution.applyAsInt(tier);
            }
        }
        return total;
    }

    private static final class Step {
        private final IntPredicate applies;
        private final IntUnaryOperator contribution;

        private Step(IntPredicate applies, IntUnaryOperator contribution) {
            this.applies = applies;
            this.contribution = contribution;
        }
    }
}
