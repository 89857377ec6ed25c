package quest.progression.core.card;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import quest.progression.core.domain.model.card.CardBonusSummary;
import quest.progression.core.domain.model.card.CardBonusType;
import quest.progression.core.domain.model.card.MonsterCard;

/**
 * 보유 카드 보너스 집계
 *
 * <p>전투력 점수 = {@code floor(퍼센트 보너스 합 * 100 + 고정 방어력 * 5)}
 */
public class CardBonusCalculator {

  private static final int PERCENT_SCORE_SCALE = 100;
  private static final int FLAT_DEFENSE_SCORE = 5;

  public CardBonusSummary summarize(Collection<MonsterCard> cards) {
    Map<CardBonusType, Double> totals = new EnumMap<>(CardBonusType.class);
    for (MonsterCard card : cards) {
      totals.merge(card.getBonusType(), card.getBonusValue(), Double::sum);
    }

    double percentSum = 0;
    double flatDefense = 0;
    for (Map.Entry<CardBonusType, Double> entry : totals.entrySet()) {
      if (entry.getKey().isPercent()) {
        percentSum += entry.getValue();
      } else {
        flatDefense += entry.getValue();
      }
    }
    int score =
        (int) Math.floor(percentSum * PERCENT_SCORE_SCALE + flatDefense * FLAT_DEFENSE_SCORE);
    return new CardBonusSummary(totals, score);
  }
}
