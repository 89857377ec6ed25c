package quest.progression.core.domain.model;

import java.util.Optional;

/**
 * 장비 아이템 (불변 값 객체)
 *
 * <h3>불변식</h3>
 *
 * <ul>
 *   <li>주 능력치 보너스는 항상 0보다 큼
 *   <li>보조 능력치 보너스는 보조 능력치가 없을 때만 0이며, 주 능력치와 같을 수 없음
 *   <li>강화 수치 0~10, 강화 1당 주 능력치 +1
 *   <li>prefix는 PREFIX 타입, suffix는 SUFFIX 타입
 * </ul>
 *
 * @param id 아이템 id
 * @param slot 장착 부위
 * @param rarity 등급
 * @param primaryStat 주 능력치
 * @param statBonus 주 능력치 기본 보너스
 * @param secondaryStat 보조 능력치 (nullable)
 * @param secondaryStatBonus 보조 능력치 보너스
 * @param levelRequirement 착용 레벨 (1 이상)
 * @param enhancementLevel 강화 수치
 * @param prefix 접두 옵션 (nullable)
 * @param suffix 접미 옵션 (nullable)
 * @param templateId 템플릿에서 생성된 경우 템플릿 id (nullable)
 */
public record EquipmentItem(
    String id,
    EquipmentSlot slot,
    Rarity rarity,
    StatType primaryStat,
    int statBonus,
    StatType secondaryStat,
    int secondaryStatBonus,
    int levelRequirement,
    int enhancementLevel,
    Affix prefix,
    Affix suffix,
    String templateId) {

  public static final int MAX_ENHANCEMENT = 10;

  public EquipmentItem {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (slot == null || rarity == null || primaryStat == null) {
      throw new IllegalArgumentException("slot, rarity and primaryStat cannot be null");
    }
    if (statBonus <= 0) {
      throw new IllegalArgumentException("statBonus must be positive: " + statBonus);
    }
    if (secondaryStat == null && secondaryStatBonus != 0) {
      throw new IllegalArgumentException("secondaryStatBonus without secondaryStat");
    }
    if (secondaryStat != null && (secondaryStatBonus <= 0 || secondaryStat == primaryStat)) {
      throw new IllegalArgumentException(
          "invalid secondary stat: " + secondaryStat + " +" + secondaryStatBonus);
    }
    if (levelRequirement < 1) {
      throw new IllegalArgumentException("levelRequirement must be positive: " + levelRequirement);
    }
    if (enhancementLevel < 0 || enhancementLevel > MAX_ENHANCEMENT) {
      throw new IllegalArgumentException("enhancementLevel out of range: " + enhancementLevel);
    }
    if (prefix != null && prefix.type() != AffixType.PREFIX) {
      throw new IllegalArgumentException("prefix must be a PREFIX affix");
    }
    if (suffix != null && suffix.type() != AffixType.SUFFIX) {
      throw new IllegalArgumentException("suffix must be a SUFFIX affix");
    }
  }

  /** 강화가 반영된 주 능력치 보너스 */
  public int effectivePrimaryBonus() {
    return statBonus + enhancementLevel;
  }

  public boolean isMaxEnhanced() {
    return enhancementLevel >= MAX_ENHANCEMENT;
  }

  /** 강화 +1. 최대치에서는 그대로 반환합니다. */
  public EquipmentItem enhance() {
    if (isMaxEnhanced()) {
      return this;
    }
    return new EquipmentItem(
        id,
        slot,
        rarity,
        primaryStat,
        statBonus,
        secondaryStat,
        secondaryStatBonus,
        levelRequirement,
        enhancementLevel + 1,
        prefix,
        suffix,
        templateId);
  }

  public EquipmentItem withAffixes(Affix newPrefix, Affix newSuffix) {
    return new EquipmentItem(
        id,
        slot,
        rarity,
        primaryStat,
        statBonus,
        secondaryStat,
        secondaryStatBonus,
        levelRequirement,
        enhancementLevel,
        newPrefix,
        newSuffix,
        templateId);
  }

  public Optional<StatType> secondary() {
    return Optional.ofNullable(secondaryStat);
  }

  public Optional<Affix> prefixAffix() {
    return Optional.ofNullable(prefix);
  }

  public Optional<Affix> suffixAffix() {
    return Optional.ofNullable(suffix);
  }
}
