package quest.progression.core.domain.model.dungeon;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 던전 성과 등급
 *
 * <p>점수 = 0.5 * 클리어 비율 + 0.3 * 남은 HP 비율 + 0.2 * 준비도
 */
@Getter
@AllArgsConstructor
public enum PerformanceRating {
  S(0.95, 1.50),
  A(0.85, 1.25),
  B(0.70, 1.10),
  C(0.50, 1.00),
  D(0.30, 0.80),
  F(0.0, 0.50);

  private final double minScore;
  private final double lootMultiplier;

  public static PerformanceRating fromScore(double score) {
    for (PerformanceRating rating : values()) {
      if (score >= rating.minScore) {
        return rating;
      }
    }
    return F;
  }

  public static double score(
      int roomsCleared, int totalRooms, int hpRemaining, int maxHp, double statReadiness) {
    double clearedRatio = totalRooms > 0 ? (double) roomsCleared / totalRooms : 0.0;
    double hpRatio = maxHp > 0 ? (double) Math.max(0, hpRemaining) / maxHp : 0.0;
    return clearedRatio * 0.50 + hpRatio * 0.30 + statReadiness * 0.20;
  }
}
