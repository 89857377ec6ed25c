package quest.progression.core.domain.model;

/**
 * 굴림이 끝난 접두/접미 옵션
 *
 * @param type PREFIX 또는 SUFFIX
 * @param definitionId 원본 정의 id
 * @param bonusType 보너스 분류 키 (예: "exp_physical_percent")
 * @param value 레벨/등급 배율 적용 후 소수 첫째 자리로 반올림한 값
 * @param greater 상위 옵션 여부 (Legendary 전용, 1.5배)
 */
public record Affix(
    AffixType type, String definitionId, String bonusType, double value, boolean greater) {

  public Affix {
    if (type == null) {
      throw new IllegalArgumentException("type cannot be null");
    }
    if (bonusType == null || bonusType.isBlank()) {
      throw new IllegalArgumentException("bonusType cannot be null or blank");
    }
    if (value < 0) {
      throw new IllegalArgumentException("value must be non-negative: " + value);
    }
  }
}
