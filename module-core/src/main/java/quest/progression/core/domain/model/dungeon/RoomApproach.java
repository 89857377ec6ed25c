package quest.progression.core.domain.model.dungeon;

import quest.progression.core.domain.model.StatType;

/**
 * 방 공략법
 *
 * @param key 표현 계층이 서사 텍스트를 고를 때 쓰는 구조화 태그
 * @param primaryStat 파티 전투력 계산에 쓰는 능력치
 * @param powerModifier 전투력 배율 (0 이상)
 * @param riskModifier 실패 시 피해 배율 (0 이상)
 */
public record RoomApproach(
    String key, StatType primaryStat, double powerModifier, double riskModifier) {

  public RoomApproach {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key cannot be null or blank");
    }
    if (primaryStat == null) {
      throw new IllegalArgumentException("primaryStat cannot be null");
    }
    if (powerModifier < 0 || riskModifier < 0) {
      throw new IllegalArgumentException(
          "modifiers must be non-negative: power=" + powerModifier + ", risk=" + riskModifier);
    }
  }

  public static RoomApproach of(
      String key, StatType primaryStat, double powerModifier, double riskModifier) {
    return new RoomApproach(key, primaryStat, powerModifier, riskModifier);
  }

  /** 보정 없는 정면 돌파. 표준 공략법이 없을 때의 대체값입니다. */
  public static RoomApproach direct(StatType primaryStat) {
    return new RoomApproach("direct", primaryStat, 1.0, 1.0);
  }
}
