package quest.progression.core.domain.model.card;

import java.util.Map;

/**
 * 보유 카드 보너스 합계
 *
 * @param totals 보너스 종류별 합
 * @param powerScoreBonus 전투력 점수 환산값
 */
public record CardBonusSummary(Map<CardBonusType, Double> totals, int powerScoreBonus) {

  public CardBonusSummary {
    totals = Map.copyOf(totals);
  }

  public double total(CardBonusType type) {
    return totals.getOrDefault(type, 0.0);
  }
}
