package quest.progression.core.domain.model.dungeon;

import java.util.List;
import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.domain.model.MaterialDrop;
import quest.progression.core.pity.PityCounters;

/**
 * 던전 종료 정산 결과
 *
 * @param runId 런 id
 * @param status 종료 상태
 * @param totalExp 누적 경험치
 * @param totalGold 누적 골드 (숨겨진 보물 골드 포함)
 * @param roomsCleared 성공한 방 수
 * @param totalRooms 런의 방 수
 * @param hpRemaining 남은 파티 HP
 * @param maxHp 최대 파티 HP
 * @param loot 장비 보상 (성공 시에만)
 * @param materials 재료 보상 (성공 시에만)
 * @param cardIds 방에서 드롭된 카드 정의 id
 * @param rating 성과 등급
 * @param score 성과 점수
 * @param secret 숨겨진 보물
 * @param pityCounters 정산 후 천장 카운터
 */
public record DungeonCompletion(
    String runId,
    RunStatus status,
    int totalExp,
    int totalGold,
    int roomsCleared,
    int totalRooms,
    int hpRemaining,
    int maxHp,
    List<EquipmentItem> loot,
    List<MaterialDrop> materials,
    List<String> cardIds,
    PerformanceRating rating,
    double score,
    SecretDiscovery secret,
    PityCounters pityCounters) {

  public DungeonCompletion {
    loot = List.copyOf(loot);
    materials = List.copyOf(materials);
    cardIds = List.copyOf(cardIds);
  }

  public boolean success() {
    return status == RunStatus.COMPLETED;
  }

  public double lootMultiplier() {
    return rating.getLootMultiplier();
  }
}
