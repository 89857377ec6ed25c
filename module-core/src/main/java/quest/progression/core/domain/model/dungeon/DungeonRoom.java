package quest.progression.core.domain.model.dungeon;

import java.util.Collection;
import java.util.Optional;
import quest.progression.core.domain.model.ClassLine;
import quest.progression.core.domain.model.PartyMember;
import quest.progression.core.domain.model.StatType;

/**
 * 던전 방 정의
 *
 * @param id 방 식별자
 * @param encounterType 조우 유형
 * @param primaryStat 공략법 없이 판정할 때 쓰는 능력치
 * @param difficultyRating 기본 요구 전투력 (1 이상)
 * @param bossRoom 보스 방 여부 (보상 2배, 항상 마지막에 배치)
 * @param bonusRoom 보너스 방 여부 (런마다 30% 확률로 등장)
 * @param bonusLootChance 방 고유 전리품 확률 가산 [0, 1]
 * @param classGate 이 계열 파티원이 있을 때만 등장 (nullable)
 */
public record DungeonRoom(
    String id,
    EncounterType encounterType,
    StatType primaryStat,
    int difficultyRating,
    boolean bossRoom,
    boolean bonusRoom,
    double bonusLootChance,
    ClassLine classGate) {

  public DungeonRoom {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (encounterType == null || primaryStat == null) {
      throw new IllegalArgumentException("encounterType and primaryStat cannot be null");
    }
    if (difficultyRating < 1) {
      throw new IllegalArgumentException("difficultyRating must be positive: " + difficultyRating);
    }
    if (bonusLootChance < 0 || bonusLootChance > 1) {
      throw new IllegalArgumentException("bonusLootChance must be in [0, 1]: " + bonusLootChance);
    }
  }

  /** 일반 방 */
  public static DungeonRoom regular(
      String id, EncounterType encounterType, StatType primaryStat, int difficultyRating) {
    return new DungeonRoom(
        id, encounterType, primaryStat, difficultyRating, false, false, 0.0, null);
  }

  /** 보스 방 */
  public static DungeonRoom boss(String id, StatType primaryStat, int difficultyRating) {
    return new DungeonRoom(
        id, EncounterType.BOSS, primaryStat, difficultyRating, true, false, 0.0, null);
  }

  public Optional<ClassLine> gate() {
    return Optional.ofNullable(classGate);
  }

  /** 계열 제한이 없거나, 같은 계열의 파티원이 있으면 입장 가능 */
  public boolean canEnter(Collection<PartyMember> party) {
    if (classGate == null) {
      return true;
    }
    return party.stream()
        .anyMatch(
            m -> m.characterClass() != null && m.characterClass().getClassLine() == classGate);
  }
}
