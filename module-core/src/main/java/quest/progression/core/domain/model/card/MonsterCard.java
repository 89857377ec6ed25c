package quest.progression.core.domain.model.card;

import java.time.Instant;
import java.util.List;
import lombok.Getter;
import quest.progression.core.domain.model.Rarity;

/**
 * 수집한 몬스터 카드 (소유자 단일 가변 엔티티)
 *
 * <h3>중복 흡수</h3>
 *
 * <ul>
 *   <li>{@code bonusValue == baseBonusValue * (1 + 0.25 * duplicateCount)}는 항상 성립
 *   <li>중복 횟수가 사다리 {3, 7, 12, 18}의 한 칸을 넘을 때마다 upgradeLevel +1, 등급 한 단계 상승 (Legendary에서 멈춤)
 * </ul>
 */
@Getter
public class MonsterCard {

  public static final List<Integer> RARITY_UPGRADE_THRESHOLDS = List.of(3, 7, 12, 18);
  static final double BONUS_PER_DUPLICATE = 0.25;

  private final String id;
  private final String cardId;
  private final String ownerId;
  private final CardBonusType bonusType;
  private final double baseBonusValue;
  private final CardSourceType sourceType;
  private final Instant collectedAt;

  private Rarity rarity;
  private double bonusValue;
  private int duplicateCount;
  private int upgradeLevel;

  public MonsterCard(
      String id,
      String cardId,
      String ownerId,
      Rarity rarity,
      CardBonusType bonusType,
      double baseBonusValue,
      CardSourceType sourceType,
      Instant collectedAt) {
    this.id = id;
    this.cardId = cardId;
    this.ownerId = ownerId;
    this.rarity = rarity;
    this.bonusType = bonusType;
    this.baseBonusValue = baseBonusValue;
    this.bonusValue = baseBonusValue;
    this.sourceType = sourceType;
    this.collectedAt = collectedAt;
  }

  /** 카드 정의로부터 새 카드 생성 (중복 0, 업그레이드 0) */
  public static MonsterCard collect(
      String id, ContentCardDefinition definition, String ownerId, Instant now) {
    return new MonsterCard(
        id,
        definition.id(),
        ownerId,
        definition.rarity(),
        definition.bonusType(),
        definition.bonusValue(),
        definition.sourceType(),
        now);
  }

  /**
   * 중복 카드를 흡수합니다.
   *
   * @return 등급이 올랐으면 true. 보너스 수치 상승과는 별개입니다
   */
  public boolean absorbDuplicate() {
    duplicateCount++;
    bonusValue = baseBonusValue * (1 + BONUS_PER_DUPLICATE * duplicateCount);

    int target = targetUpgradeLevel(duplicateCount);
    if (target <= upgradeLevel) {
      return false;
    }
    upgradeLevel = target;
    return rarity
        .next()
        .map(
            next -> {
              rarity = next;
              return true;
            })
        .orElse(false);
  }

  /** 중복 횟수로 넘은 사다리 칸 수 */
  public static int targetUpgradeLevel(int duplicateCount) {
    return (int) RARITY_UPGRADE_THRESHOLDS.stream().filter(t -> duplicateCount >= t).count();
  }
}
