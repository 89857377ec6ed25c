package quest.progression.core.domain.model.card;

import quest.progression.core.domain.model.Rarity;

/**
 * 몬스터 카드 정의 (콘텐츠 카탈로그)
 *
 * @param id 카드 정의 id
 * @param theme 던전 테마 키 (던전 카드만, nullable)
 * @param rarity 기본 등급
 * @param bonusType 보너스 종류
 * @param bonusValue 기본 보너스 수치 (0 이상)
 * @param sourceType 획득처
 * @param sourceName 획득처 이름. 레이드 보스 매칭에 사용 (nullable)
 * @param dropChance 서버 설정 드롭 확률. 0이면 미설정
 * @param active 비활성 카드는 드롭되지 않음
 */
public record ContentCardDefinition(
    String id,
    String theme,
    Rarity rarity,
    CardBonusType bonusType,
    double bonusValue,
    CardSourceType sourceType,
    String sourceName,
    double dropChance,
    boolean active) {

  public ContentCardDefinition {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (rarity == null || bonusType == null || sourceType == null) {
      throw new IllegalArgumentException("rarity, bonusType and sourceType cannot be null");
    }
    if (bonusValue < 0) {
      throw new IllegalArgumentException("bonusValue must be non-negative: " + bonusValue);
    }
    if (dropChance < 0 || dropChance > 1) {
      throw new IllegalArgumentException("dropChance must be in [0, 1]: " + dropChance);
    }
  }

  public boolean hasTheme(String themeKey) {
    return theme != null && theme.equalsIgnoreCase(themeKey);
  }
}
