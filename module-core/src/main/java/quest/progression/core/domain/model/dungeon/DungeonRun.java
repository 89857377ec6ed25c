package quest.progression.core.domain.model.dungeon;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import quest.progression.error.exception.EmptyContentPoolException;
import quest.progression.error.exception.InvalidRunStateException;

/**
 * 던전 진행 상태 (단일 소유자 가변 집합체)
 *
 * <h3>상태 전이</h3>
 *
 * <pre>
 * IN_PROGRESS ─ recordStageResult ─▶ COMPLETED (마지막 방 기록, HP &gt; 0)
 *             ─ recordStageResult ─▶ FAILED    (HP 0, 남은 방과 무관)
 *             ─ abandon ───────────▶ ABANDONED
 * 종료 상태 ─ markSettled ─▶ 정산 완료 (1회)
 * </pre>
 *
 * <p>불변식: {@code currentRoomIndex() == results.size()}. 종료 상태에서의 기록/포기는 {@link
 * InvalidRunStateException}입니다. 보상 정산은 런당 한 번뿐이며 두 번째 정산도 같은 예외입니다.
 *
 * <h3>타이머</h3>
 *
 * <p>n번째 방(0부터)은 {@code startedAt + (n + 1) * secondsPerRoom} 이후에만 판정할 수 있습니다. 스스로 진행하지 않으며 외부
 * 드라이버가 {@link #isCurrentRoomReady(Instant)}를 확인한 뒤 호출합니다.
 */
@Getter
public class DungeonRun {

  private final String id;
  private final String dungeonId;
  private final String ownerId;
  private final DungeonDifficulty difficulty;
  private final List<DungeonRoom> rooms;
  private final Instant startedAt;
  private final int maxPartyHp;

  private final List<RoomResult> results = new ArrayList<>();
  private RunStatus status = RunStatus.IN_PROGRESS;
  private int partyHp;
  private int totalExpEarned;
  private int totalGoldEarned;
  private Instant endedAt;
  private boolean settled;

  public DungeonRun(
      String id,
      String dungeonId,
      String ownerId,
      DungeonDifficulty difficulty,
      List<DungeonRoom> rooms,
      int maxPartyHp,
      Instant startedAt) {
    if (rooms == null || rooms.isEmpty()) {
      throw new EmptyContentPoolException("dungeon run rooms");
    }
    if (maxPartyHp < 1) {
      throw new IllegalArgumentException("maxPartyHp must be positive: " + maxPartyHp);
    }
    this.id = id;
    this.dungeonId = dungeonId;
    this.ownerId = ownerId;
    this.difficulty = difficulty;
    this.rooms = List.copyOf(rooms);
    this.maxPartyHp = maxPartyHp;
    this.partyHp = maxPartyHp;
    this.startedAt = startedAt;
  }

  public List<RoomResult> getResults() {
    return Collections.unmodifiableList(results);
  }

  public int currentRoomIndex() {
    return results.size();
  }

  public int totalRooms() {
    return rooms.size();
  }

  /** 다음에 판정할 방. 종료 상태면 empty. */
  public Optional<DungeonRoom> currentRoom() {
    if (status.isTerminal() || currentRoomIndex() >= rooms.size()) {
      return Optional.empty();
    }
    return Optional.of(rooms.get(currentRoomIndex()));
  }

  /**
   * 방 결과를 기록하고 상태를 전이합니다.
   *
   * @throws InvalidRunStateException 이미 종료된 런일 때
   */
  public void recordStageResult(RoomResult result, Instant now) {
    requireInProgress();
    results.add(result);
    totalExpEarned += result.expEarned();
    totalGoldEarned += result.goldEarned();
    partyHp = Math.max(0, partyHp - result.hpLost());

    if (partyHp == 0) {
      finish(RunStatus.FAILED, now);
    } else if (currentRoomIndex() >= rooms.size()) {
      finish(RunStatus.COMPLETED, now);
    }
  }

  /** 플레이어가 포기. IN_PROGRESS에서 항상 허용됩니다. */
  public void abandon(Instant now) {
    requireInProgress();
    finish(RunStatus.ABANDONED, now);
  }

  public Instant roomCompletesAt(int roomIndex) {
    return startedAt.plusSeconds((roomIndex + 1L) * difficulty.getSecondsPerRoom());
  }

  public Instant completesAt() {
    return roomCompletesAt(rooms.size() - 1);
  }

  /** 현재 방의 타이머가 끝났는지 (now &gt;= completesAt). 종료 상태면 false. */
  public boolean isCurrentRoomReady(Instant now) {
    if (status.isTerminal()) {
      return false;
    }
    return !now.isBefore(roomCompletesAt(currentRoomIndex()));
  }

  public int roomsCleared() {
    return (int) results.stream().filter(RoomResult::success).count();
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  /**
   * 보상 정산 완료를 표시합니다.
   *
   * @throws InvalidRunStateException 진행 중이거나 이미 정산된 런일 때
   */
  public void markSettled() {
    requireUnsettled();
    this.settled = true;
  }

  /** 종료되었고 아직 정산되지 않은 런인지 확인합니다. */
  public void requireUnsettled() {
    if (!status.isTerminal() || settled) {
      throw new InvalidRunStateException(id, settled ? status.name() + "(SETTLED)" : status.name());
    }
  }

  private void requireInProgress() {
    if (status.isTerminal()) {
      throw new InvalidRunStateException(id, status.name());
    }
  }

  private void finish(RunStatus terminal, Instant now) {
    this.status = terminal;
    this.endedAt = now;
  }
}
