package com.vtb.attacktree.feasibility;

import com.vtb.attacktree.config.EngineConfig;
import com.vtb.attacktree.models.AttackPotential;
import com.vtb.attacktree.models.FeasibilityRating;

import java.util.Objects;

/**
 * Табличный маппер: балл - сумма пяти полей, рейтинг - ступенчатая функция по порогам из конфигурации.
 * Если хотя бы одно поле равно маркеру "невыполнимо", балл равен самому маркеру.
 */
public class ThresholdFeasibilityMapper implements FeasibilityMapper {

    private final EngineConfig.Feasibility settings;

    public ThresholdFeasibilityMapper() {
        this(EngineConfig.load().getFeasibility());
    }

    public ThresholdFeasibilityMapper(EngineConfig.Feasibility settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.settings.ensureDefaults();
    }

    @Override
    public int scoreOf(AttackPotential potential) {
        Objects.requireNonNull(potential, "potential");
        int infeasible = settings.getInfeasibleValue();
        if (potential.hasFieldEqualTo(infeasible)) {
            return infeasible;
        }
        return potential.sum();
    }

    @Override
    public FeasibilityRating ratingOf(int score) {
        if (score <= settings.getHighMax()) {
            return FeasibilityRating.HIGH;
        }
        if (score <= settings.getMediumMax()) {
            return FeasibilityRating.MEDIUM;
        }
        if (score <= settings.getLowMax()) {
            return FeasibilityRating.LOW;
        }
        return FeasibilityRating.VERY_LOW;
    }
}
