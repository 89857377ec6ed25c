package quest.progression.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.progression.config.DungeonProperties;
import quest.progression.core.catalog.ContentCatalog;
import quest.progression.core.domain.model.PartyMember;
import quest.progression.core.domain.model.card.CardSourceType;
import quest.progression.core.domain.model.dungeon.Dungeon;
import quest.progression.core.domain.model.dungeon.DungeonCompletion;
import quest.progression.core.domain.model.dungeon.DungeonRun;
import quest.progression.core.domain.model.dungeon.RoomApproach;
import quest.progression.core.domain.model.dungeon.RoomResult;
import quest.progression.core.dungeon.DungeonRunService;
import quest.progression.core.pity.PityCounters;
import quest.progression.core.port.out.PityCounterPort;

/**
 * 던전 진행 애플리케이션 서비스
 *
 * <h3>흐름</h3>
 *
 * <ul>
 *   <li>자동 진행: {@link #autoRun} 한 번으로 방 선택부터 정산까지
 *   <li>타이머 진행: {@link #startRun} → {@link #advance} 반복 → {@link #complete}
 * </ul>
 *
 * <p>진행 중인 {@link DungeonRun}은 호출자가 보관합니다. 이 서비스는 런 상태를 들고 있지 않습니다. 정산 시 리더(첫 파티원)의 천장
 * 카운터를 갱신하고, 방에서 드롭된 카드를 리더에게 수집합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DungeonService {

  private final DungeonRunService dungeonRunService;
  private final ContentCatalog contentCatalog;
  private final PityCounterPort pityCounterPort;
  private final CardService cardService;
  private final DungeonProperties dungeonProperties;
  private final Clock clock;

  public DungeonCompletion autoRun(Dungeon dungeon, List<PartyMember> party, String ownerId) {
    log.info(
        "[DungeonService] Auto run {} ({}) by {} with {} members",
        dungeon.id(),
        dungeon.difficulty().getKey(),
        ownerId,
        party.size());
    DungeonCompletion completion =
        dungeonRunService.autoRun(
            dungeon,
            party,
            ownerId,
            dungeonProperties.targetRoomCount(),
            contentCatalog.cards(CardSourceType.DUNGEON),
            pityCounterPort.load(ownerId),
            Instant.now(clock));
    return settle(ownerId, completion);
  }

  public DungeonRun startRun(Dungeon dungeon, List<PartyMember> party, String ownerId) {
    DungeonRun run =
        dungeonRunService.startRun(
            dungeon, party, ownerId, dungeonProperties.targetRoomCount(), Instant.now(clock));
    log.info(
        "[DungeonService] Started run {} in {} ({} rooms, ends at {})",
        run.getId(),
        dungeon.id(),
        run.totalRooms(),
        run.completesAt());
    return run;
  }

  /**
   * 현재 방 타이머가 끝났으면 판정합니다.
   *
   * @param approach null이면 자동 선택
   * @return 아직 대기 중이면 empty
   */
  public Optional<RoomResult> advance(
      DungeonRun run, Dungeon dungeon, List<PartyMember> party, RoomApproach approach) {
    Optional<RoomResult> result =
        dungeonRunService.advance(
            run,
            dungeon,
            party,
            approach,
            contentCatalog.cards(CardSourceType.DUNGEON),
            Instant.now(clock));
    result.ifPresent(
        r ->
            log.debug(
                "[DungeonService] Run {} room {} ({}): success={}, hpLost={}, status={}",
                run.getId(),
                r.roomIndex(),
                r.approachKey(),
                r.success(),
                r.hpLost(),
                run.getStatus()));
    return result;
  }

  public void abandon(DungeonRun run) {
    run.abandon(Instant.now(clock));
    log.info(
        "[DungeonService] Run {} abandoned after {} rooms", run.getId(), run.currentRoomIndex());
  }

  /** 종료된 런을 정산합니다. */
  public DungeonCompletion complete(DungeonRun run, Dungeon dungeon, List<PartyMember> party) {
    String ownerId = run.getOwnerId();
    DungeonCompletion completion =
        dungeonRunService.complete(run, dungeon, party, pityCounterPort.load(ownerId));
    return settle(ownerId, completion);
  }

  private DungeonCompletion settle(String ownerId, DungeonCompletion completion) {
    PityCounters counters = completion.pityCounters();
    pityCounterPort.save(ownerId, counters);
    cardService.collectAll(ownerId, completion.cardIds());

    log.info(
        "[DungeonService] Run {} {}: rooms {}/{}, rating {}, loot {}, materials {}, gold {}",
        completion.runId(),
        completion.status(),
        completion.roomsCleared(),
        completion.totalRooms(),
        completion.rating(),
        completion.loot().size(),
        completion.materials().size(),
        completion.totalGold());
    if (completion.secret().discovered()) {
      log.info(
          "[DungeonService] Secret discovered in run {} (+{} gold)",
          completion.runId(),
          completion.secret().bonusGold());
    }
    return completion;
  }
}
