package quest.progression.core.domain.model.card;

/**
 * 카드 수집 결과
 *
 * @param outcome 신규 또는 중복 흡수
 * @param card 수집 후 카드 상태
 * @param rarityUpgraded 중복 흡수로 등급이 올랐는지 (신규면 false)
 */
public record CollectResult(Outcome outcome, MonsterCard card, boolean rarityUpgraded) {

  public enum Outcome {
    NEW_CARD,
    DUPLICATE_ABSORBED
  }

  public static CollectResult newCard(MonsterCard card) {
    return new CollectResult(Outcome.NEW_CARD, card, false);
  }

  public static CollectResult duplicate(MonsterCard card, boolean rarityUpgraded) {
    return new CollectResult(Outcome.DUPLICATE_ABSORBED, card, rarityUpgraded);
  }

  public boolean isNew() {
    return outcome == Outcome.NEW_CARD;
  }
}
