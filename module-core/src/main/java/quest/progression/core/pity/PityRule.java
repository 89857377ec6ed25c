package quest.progression.core.pity;

import quest.progression.core.domain.model.Rarity;

/**
 * 천장 규칙
 *
 * @param threshold 이 횟수만큼 연속으로 드롭이 없으면 다음 판정은 강제 드롭 (1 이상)
 * @param minimumRarity 강제 드롭의 최소 등급
 */
public record PityRule(int threshold, Rarity minimumRarity) {
  public PityRule {
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be positive: " + threshold);
    }
    if (minimumRarity == null) {
      throw new IllegalArgumentException("minimumRarity cannot be null");
    }
  }
}
