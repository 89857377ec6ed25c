package quest.progression.core.domain.model;

/**
 * 미리 작성된 장비 템플릿 (콘텐츠 카탈로그)
 *
 * @param id 템플릿 id
 * @param slot 장착 부위
 * @param rarity 등급
 * @param primaryStat 주 능력치
 * @param statBonus 주 능력치 보너스 (1 이상)
 * @param secondaryStat 보조 능력치 (nullable)
 * @param secondaryStatBonus 보조 능력치 보너스
 * @param levelRequirement 착용 레벨
 * @param active 비활성 템플릿은 드롭되지 않음
 */
public record EquipmentTemplate(
    String id,
    EquipmentSlot slot,
    Rarity rarity,
    StatType primaryStat,
    int statBonus,
    StatType secondaryStat,
    int secondaryStatBonus,
    int levelRequirement,
    boolean active) {

  public EquipmentTemplate {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (slot == null || rarity == null || primaryStat == null) {
      throw new IllegalArgumentException("slot, rarity and primaryStat cannot be null");
    }
    if (statBonus <= 0 || levelRequirement < 1) {
      throw new IllegalArgumentException(
          "invalid template " + id + ": statBonus=" + statBonus + ", level=" + levelRequirement);
    }
    if (secondaryStat == null || secondaryStat == primaryStat || secondaryStatBonus <= 0) {
      secondaryStat = null;
      secondaryStatBonus = 0;
    }
  }

  public boolean matches(EquipmentSlot wantedSlot, Rarity wantedRarity, Integer maxLevel) {
    return active
        && (wantedSlot == null || slot == wantedSlot)
        && rarity == wantedRarity
        && (maxLevel == null || levelRequirement <= maxLevel);
  }
}
