package quest.progression.core.domain.model.dungeon;

import java.util.List;

/**
 * 던전 정의 (읽기 전용 콘텐츠)
 *
 * @param id 던전 식별자
 * @param theme 테마 (카드 드롭 풀 필터)
 * @param difficulty 난이도
 * @param lootTier 전리품/재료 tier (1 이상)
 * @param rooms 방 풀. 런마다 일부가 선택됩니다
 * @param statRequirements 권장 능력치. 비어 있으면 준비도 1.0
 * @param baseExpReward 전체 클리어 기준 경험치
 * @param baseGoldReward 전체 클리어 기준 골드
 */
public record Dungeon(
    String id,
    DungeonTheme theme,
    DungeonDifficulty difficulty,
    int lootTier,
    List<DungeonRoom> rooms,
    List<StatRequirement> statRequirements,
    int baseExpReward,
    int baseGoldReward) {

  public Dungeon {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (theme == null || difficulty == null) {
      throw new IllegalArgumentException("theme and difficulty cannot be null");
    }
    if (lootTier < 1) {
      throw new IllegalArgumentException("lootTier must be positive: " + lootTier);
    }
    if (baseExpReward < 0 || baseGoldReward < 0) {
      throw new IllegalArgumentException("rewards must be non-negative");
    }
    rooms = rooms == null ? List.of() : List.copyOf(rooms);
    statRequirements = statRequirements == null ? List.of() : List.copyOf(statRequirements);
  }
}
