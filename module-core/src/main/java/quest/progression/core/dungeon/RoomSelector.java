package quest.progression.core.dungeon;

import java.util.ArrayList;
import java.util.List;
import quest.progression.core.domain.model.PartyMember;
import quest.progression.core.domain.model.dungeon.DungeonRoom;
import quest.progression.core.probability.RandomSource;

/**
 * 런마다 방 풀에서 방을 고릅니다.
 *
 * <ul>
 *   <li>보스 방은 항상 포함, 항상 마지막
 *   <li>계열 제한 방은 해당 계열 파티원이 있을 때만
 *   <li>보너스 방은 각각 30% 확률로 포함
 *   <li>남은 자리는 섞은 일반 방으로 채움. 기본 목표 수 {@code min(7, max(5, poolSize - 2))}
 * </ul>
 */
public class RoomSelector {

  static final double BONUS_ROOM_CHANCE = 0.30;

  private final RandomSource random;

  public RoomSelector(RandomSource random) {
    this.random = random;
  }

  public static int defaultTargetCount(int poolSize) {
    return Math.min(7, Math.max(5, poolSize - 2));
  }

  /**
   * @param targetRoomCount null이면 기본 목표 수
   */
  public List<DungeonRoom> selectRoomsForRun(
      List<DungeonRoom> rooms, List<PartyMember> party, Integer targetRoomCount) {
    List<DungeonRoom> bossRooms = rooms.stream().filter(DungeonRoom::bossRoom).toList();
    List<DungeonRoom> bonusRooms =
        rooms.stream().filter(r -> r.bonusRoom() && !r.bossRoom() && r.canEnter(party)).toList();
    List<DungeonRoom> regularRooms =
        rooms.stream().filter(r -> !r.bonusRoom() && !r.bossRoom() && r.canEnter(party)).toList();

    int target = targetRoomCount != null ? targetRoomCount : defaultTargetCount(rooms.size());

    List<DungeonRoom> nonBoss = new ArrayList<>();
    for (DungeonRoom bonus : random.shuffle(bonusRooms)) {
      if (random.chance(BONUS_ROOM_CHANCE)) {
        nonBoss.add(bonus);
      }
    }
    int remaining = Math.max(0, target - bossRooms.size() - nonBoss.size());
    List<DungeonRoom> shuffledRegular = random.shuffle(regularRooms);
    nonBoss.addAll(shuffledRegular.subList(0, Math.min(remaining, shuffledRegular.size())));

    List<DungeonRoom> selected = new ArrayList<>(random.shuffle(nonBoss));
    selected.addAll(bossRooms);
    return selected;
  }
}
