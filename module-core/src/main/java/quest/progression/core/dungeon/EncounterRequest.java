package quest.progression.core.dungeon;

import java.util.List;
import lombok.Builder;
import quest.progression.core.domain.model.card.ContentCardDefinition;
import quest.progression.core.domain.model.dungeon.DungeonDifficulty;
import quest.progression.core.domain.model.dungeon.DungeonRoom;
import quest.progression.core.domain.model.dungeon.RoomApproach;

/**
 * 방 판정 입력
 *
 * <p>파티 스냅샷에서 미리 계산한 수치만 담습니다. 판정기는 캐릭터 상태를 직접 읽지 않습니다.
 *
 * @param room 판정할 방
 * @param approach 선택한 공략법
 * @param partyPower 공략 능력치 기준 파티 전투력 (배율 적용 전)
 * @param partySize 파티 인원 (요구 전투력 보정)
 * @param difficulty 난이도
 * @param roomIndex 런 안에서의 방 순서
 * @param roomCount 런의 총 방 수 (보상 분배)
 * @param baseExpReward 던전 기준 경험치
 * @param baseGoldReward 던전 기준 골드
 * @param lootTier 전리품 tier
 * @param luck 파티 최고 행운
 * @param classLootBonus 직업 전리품 가산
 * @param damageReduction 직업 피해 감소
 * @param successBonus 성공 확률 가산
 * @param statReadiness 권장 능력치 준비도 [0, 1] (null이면 1.0)
 * @param dungeonTheme 카드 드롭 테마 키 (nullable이면 카드 판정 생략)
 * @param cardPool 카드 후보
 */
@Builder
public record EncounterRequest(
    DungeonRoom room,
    RoomApproach approach,
    int partyPower,
    int partySize,
    DungeonDifficulty difficulty,
    int roomIndex,
    int roomCount,
    int baseExpReward,
    int baseGoldReward,
    int lootTier,
    int luck,
    double classLootBonus,
    double damageReduction,
    double successBonus,
    Double statReadiness,
    String dungeonTheme,
    List<ContentCardDefinition> cardPool) {

  public EncounterRequest {
    if (room == null || difficulty == null) {
      throw new IllegalArgumentException("room and difficulty cannot be null");
    }
    if (approach == null) {
      approach = RoomApproach.direct(room.primaryStat());
    }
    if (partyPower < 0) {
      throw new IllegalArgumentException("partyPower must be non-negative: " + partyPower);
    }
    partySize = Math.max(1, partySize);
    roomCount = Math.max(1, roomCount);
    lootTier = Math.max(1, lootTier);
    statReadiness = statReadiness == null ? 1.0 : Math.max(0.0, Math.min(1.0, statReadiness));
    cardPool = cardPool == null ? List.of() : List.copyOf(cardPool);
  }
}
