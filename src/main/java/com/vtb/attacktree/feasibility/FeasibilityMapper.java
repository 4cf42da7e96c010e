package com.vtb.attacktree.feasibility;

import com.vtb.attacktree.models.AttackPotential;
import com.vtb.attacktree.models.FeasibilityRating;

/**
 * Перевод потенциала атаки в числовой балл и рейтинг осуществимости.
 * Движок использует только {@link #scoreOf}; рейтинг нужен отчётам и оценке угроз.
 */
public interface FeasibilityMapper {

    int scoreOf(AttackPotential potential);

    FeasibilityRating ratingOf(int score);
}
