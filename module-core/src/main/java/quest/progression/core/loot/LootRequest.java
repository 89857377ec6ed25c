package quest.progression.core.loot;

import lombok.Builder;
import quest.progression.core.domain.model.CharacterClass;
import quest.progression.core.domain.model.EquipmentSlot;
import quest.progression.core.domain.model.Rarity;
import quest.progression.error.exception.InvalidProbabilityInputException;
import quest.progression.error.exception.InvalidTierException;

/**
 * 장비 생성 요청
 *
 * @param tier 1 이상
 * @param luck 0 이상
 * @param slot 원하는 부위 (null이면 무작위)
 * @param forcedRarity 지정 등급 (null이면 굴림)
 * @param characterClass 옵션 가중치용 직업 (nullable)
 * @param playerLevel 착용 레벨 상한 계산용 (nullable)
 */
@Builder(toBuilder = true)
public record LootRequest(
    int tier,
    int luck,
    EquipmentSlot slot,
    Rarity forcedRarity,
    CharacterClass characterClass,
    Integer playerLevel) {

  public LootRequest {
    if (tier < 1) {
      throw new InvalidTierException(tier);
    }
    if (luck < 0) {
      throw new InvalidProbabilityInputException("luck must be non-negative: " + luck);
    }
  }

  public static LootRequest of(int tier, int luck) {
    return new LootRequest(tier, luck, null, null, null, null);
  }

  public LootRequest withForcedRarity(Rarity rarity) {
    return toBuilder().forcedRarity(rarity).build();
  }

  public LootRequest withTier(int newTier) {
    return toBuilder().tier(newTier).build();
  }
}
