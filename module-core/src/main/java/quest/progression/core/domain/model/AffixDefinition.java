package quest.progression.core.domain.model;

/**
 * 옵션 정의 (콘텐츠 카탈로그)
 *
 * @param id 정의 id
 * @param type PREFIX 또는 SUFFIX
 * @param bonusType 보너스 분류 키. 직업 가중치 매칭에 사용됩니다
 * @param minValue 배율 적용 전 최소값
 * @param maxValue 배율 적용 전 최대값
 * @param minItemRarity 이 등급 이상의 아이템에만 등장
 * @param category 자유 분류 태그 (nullable)
 * @param active 비활성 정의는 풀에서 제외
 */
public record AffixDefinition(
    String id,
    AffixType type,
    String bonusType,
    double minValue,
    double maxValue,
    Rarity minItemRarity,
    String category,
    boolean active) {

  public AffixDefinition {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (type == null) {
      throw new IllegalArgumentException("type cannot be null");
    }
    if (bonusType == null || bonusType.isBlank()) {
      throw new IllegalArgumentException("bonusType cannot be null or blank");
    }
    if (minValue < 0 || maxValue < minValue) {
      throw new IllegalArgumentException(
          "invalid value range for " + id + ": [" + minValue + ", " + maxValue + "]");
    }
    if (minItemRarity == null) {
      minItemRarity = Rarity.COMMON;
    }
  }

  /** 등급 제한 없는 활성 정의 */
  public static AffixDefinition of(
      String id, AffixType type, String bonusType, double minValue, double maxValue) {
    return new AffixDefinition(id, type, bonusType, minValue, maxValue, Rarity.COMMON, null, true);
  }

  public boolean availableFor(Rarity itemRarity) {
    return active && itemRarity.isAtLeast(minItemRarity);
  }
}
