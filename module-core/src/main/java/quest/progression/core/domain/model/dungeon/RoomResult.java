package quest.progression.core.domain.model.dungeon;

import java.util.Optional;

/**
 * 방 하나의 판정 결과
 *
 * <p>서사 텍스트는 만들지 않습니다. 표현 계층은 (encounterType, approachKey, success) 태그로 문구를 고릅니다.
 *
 * @param roomIndex 런 안에서의 방 순서 (0부터)
 * @param encounterType 조우 유형
 * @param approachKey 사용한 공략법 키
 * @param success 성공 여부
 * @param playerPower 공략법 배율이 적용된 파티 전투력
 * @param requiredPower 난이도와 파티 규모가 반영된 요구 전투력
 * @param successChance 판정에 사용된 성공 확률
 * @param expEarned 획득 경험치
 * @param goldEarned 획득 골드
 * @param hpLost 잃은 파티 HP
 * @param lootDropped 장비 전리품 자격 여부
 * @param cardId 드롭된 몬스터 카드 정의 id (nullable)
 */
public record RoomResult(
    int roomIndex,
    EncounterType encounterType,
    String approachKey,
    boolean success,
    int playerPower,
    int requiredPower,
    double successChance,
    int expEarned,
    int goldEarned,
    int hpLost,
    boolean lootDropped,
    String cardId) {

  public RoomResult {
    if (hpLost < 0 || expEarned < 0 || goldEarned < 0) {
      throw new IllegalArgumentException("rewards and hpLost must be non-negative");
    }
  }

  public Optional<String> droppedCardId() {
    return Optional.ofNullable(cardId);
  }

  public boolean cardDropped() {
    return cardId != null;
  }
}
