package quest.progression.core.dungeon;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.domain.model.MaterialDrop;
import quest.progression.core.domain.model.PartyMember;
import quest.progression.core.domain.model.card.ContentCardDefinition;
import quest.progression.core.domain.model.dungeon.Dungeon;
import quest.progression.core.domain.model.dungeon.DungeonCompletion;
import quest.progression.core.domain.model.dungeon.DungeonDifficulty;
import quest.progression.core.domain.model.dungeon.DungeonRoom;
import quest.progression.core.domain.model.dungeon.DungeonRun;
import quest.progression.core.domain.model.dungeon.PerformanceRating;
import quest.progression.core.domain.model.dungeon.RoomApproach;
import quest.progression.core.domain.model.dungeon.RoomResult;
import quest.progression.core.domain.model.dungeon.RunStatus;
import quest.progression.core.domain.model.dungeon.SecretDiscovery;
import quest.progression.core.loot.LootDrop;
import quest.progression.core.loot.LootDropService;
import quest.progression.core.loot.LootGenerator;
import quest.progression.core.loot.LootRequest;
import quest.progression.core.loot.MaterialRoller;
import quest.progression.core.pity.PityContentType;
import quest.progression.core.pity.PityCounters;
import quest.progression.error.exception.EmptyContentPoolException;
import quest.progression.error.exception.InvalidRunStateException;

/**
 * 던전 진행 오케스트레이터
 *
 * <h3>흐름</h3>
 *
 * <pre>
 * startRun ─▶ advance (방 타이머 경과 시 1개 판정) ─▶ ... ─▶ 종료 상태 ─▶ complete (정산)
 * autoRun  ─▶ 타이머 없이 모든 방을 최적 공략법으로 연속 판정 후 정산
 * </pre>
 *
 * <p>방 판정은 엄격히 순차적입니다. n+1번째 방은 n번째 결과가 기록된 뒤에만 판정됩니다.
 */
public class DungeonRunService {

  private final RoomSelector roomSelector;
  private final ApproachSelector approachSelector;
  private final PartyPowerCalculator powerCalculator;
  private final StatReadinessCalculator readinessCalculator;
  private final EncounterResolver encounterResolver;
  private final LootGenerator lootGenerator;
  private final LootDropService lootDropService;
  private final MaterialRoller materialRoller;
  private final SecretDiscoveryRoller secretDiscoveryRoller;

  public DungeonRunService(
      RoomSelector roomSelector,
      ApproachSelector approachSelector,
      PartyPowerCalculator powerCalculator,
      StatReadinessCalculator readinessCalculator,
      EncounterResolver encounterResolver,
      LootGenerator lootGenerator,
      LootDropService lootDropService,
      MaterialRoller materialRoller,
      SecretDiscoveryRoller secretDiscoveryRoller) {
    this.roomSelector = roomSelector;
    this.approachSelector = approachSelector;
    this.powerCalculator = powerCalculator;
    this.readinessCalculator = readinessCalculator;
    this.encounterResolver = encounterResolver;
    this.lootGenerator = lootGenerator;
    this.lootDropService = lootDropService;
    this.materialRoller = materialRoller;
    this.secretDiscoveryRoller = secretDiscoveryRoller;
  }

  /**
   * 방을 골라 새 런을 시작합니다. 파티 HP는 파티원 최대 HP의 합입니다.
   *
   * @param targetRoomCount null이면 기본 목표 수
   * @throws EmptyContentPoolException 파티가 비었거나 입장 가능한 방이 없을 때
   */
  public DungeonRun startRun(
      Dungeon dungeon,
      List<PartyMember> party,
      String ownerId,
      Integer targetRoomCount,
      Instant now) {
    requireParty(party);
    List<DungeonRoom> rooms =
        roomSelector.selectRoomsForRun(dungeon.rooms(), party, targetRoomCount);
    return new DungeonRun(
        UUID.randomUUID().toString(),
        dungeon.id(),
        ownerId,
        dungeon.difficulty(),
        rooms,
        powerCalculator.totalMaxHp(party),
        now);
  }

  /**
   * 현재 방의 타이머가 끝났으면 판정하고 기록합니다.
   *
   * @param approach null이면 자동 선택
   * @return 타이머가 아직 남았으면 empty
   * @throws InvalidRunStateException 종료된 런
   */
  public Optional<RoomResult> advance(
      DungeonRun run,
      Dungeon dungeon,
      List<PartyMember> party,
      RoomApproach approach,
      List<ContentCardDefinition> cardPool,
      Instant now) {
    if (run.isTerminal()) {
      throw new InvalidRunStateException(run.getId(), run.getStatus().name());
    }
    if (!run.isCurrentRoomReady(now)) {
      return Optional.empty();
    }
    return Optional.of(resolveCurrentRoom(run, dungeon, party, approach, cardPool, now));
  }

  /** 방을 골라 시작한 뒤, 종료될 때까지 타이머 없이 연속 판정하고 정산합니다. */
  public DungeonCompletion autoRun(
      Dungeon dungeon,
      List<PartyMember> party,
      String ownerId,
      List<ContentCardDefinition> cardPool,
      PityCounters counters,
      Instant now) {
    return autoRun(dungeon, party, ownerId, null, cardPool, counters, now);
  }

  /**
   * @param targetRoomCount null이면 기본 목표 수
   */
  public DungeonCompletion autoRun(
      Dungeon dungeon,
      List<PartyMember> party,
      String ownerId,
      Integer targetRoomCount,
      List<ContentCardDefinition> cardPool,
      PityCounters counters,
      Instant now) {
    DungeonRun run = startRun(dungeon, party, ownerId, targetRoomCount, now);
    while (!run.isTerminal()) {
      resolveCurrentRoom(run, dungeon, party, null, cardPool, now);
    }
    return complete(run, dungeon, party, counters);
  }

  /**
   * 종료된 런을 정산합니다. 장비/재료/숨겨진 보물은 성공(COMPLETED)한 런에만 지급되고, 천장 카운터도 그때만 갱신됩니다.
   *
   * @throws InvalidRunStateException 아직 진행 중이거나 이미 정산된 런
   */
  public DungeonCompletion complete(
      DungeonRun run, Dungeon dungeon, List<PartyMember> party, PityCounters counters) {
    run.requireUnsettled();
    double readiness = readinessCalculator.calculate(party, dungeon.statRequirements());
    double score =
        PerformanceRating.score(
            run.roomsCleared(), run.totalRooms(), run.getPartyHp(), run.getMaxPartyHp(), readiness);
    List<String> cardIds =
        run.getResults().stream().map(RoomResult::cardId).filter(Objects::nonNull).toList();

    List<EquipmentItem> loot = new ArrayList<>();
    List<MaterialDrop> materials = new ArrayList<>();
    SecretDiscovery secret = SecretDiscovery.none();
    PityCounters updatedCounters = counters;

    if (run.getStatus() == RunStatus.COMPLETED) {
      LootRequest request = lootRequest(dungeon, party);

      List<EquipmentItem> roomDrops = new ArrayList<>();
      for (RoomResult result : run.getResults()) {
        if (result.success() && result.lootDropped()) {
          roomDrops.add(lootGenerator.generate(request));
        }
      }
      if (dungeon.difficulty() != DungeonDifficulty.NORMAL) {
        roomDrops.add(lootGenerator.generate(request.withTier(dungeon.lootTier() + 1)));
      }
      LootDrop settled =
          lootDropService.settleBatch(roomDrops, request, counters, PityContentType.DUNGEONS);
      loot.addAll(settled.items());
      updatedCounters = settled.counters();

      for (RoomResult result : run.getResults()) {
        if (result.success()) {
          materials.add(materialRoller.roomMaterial(result.encounterType(), dungeon.lootTier()));
        }
      }

      secret = secretDiscoveryRoller.roll(dungeon, powerCalculator.maxLuck(party), request);
      if (secret.discovered()) {
        materials.addAll(secret.materials());
        if (secret.equipment() != null) {
          loot.add(secret.equipment());
        }
      }
    }

    run.markSettled();
    return new DungeonCompletion(
        run.getId(),
        run.getStatus(),
        run.getTotalExpEarned(),
        run.getTotalGoldEarned() + secret.bonusGold(),
        run.roomsCleared(),
        run.totalRooms(),
        run.getPartyHp(),
        run.getMaxPartyHp(),
        loot,
        materials,
        cardIds,
        PerformanceRating.fromScore(score),
        score,
        secret,
        updatedCounters);
  }

  private RoomResult resolveCurrentRoom(
      DungeonRun run,
      Dungeon dungeon,
      List<PartyMember> party,
      RoomApproach approach,
      List<ContentCardDefinition> cardPool,
      Instant now) {
    requireParty(party);
    DungeonRoom room =
        run.currentRoom()
            .orElseThrow(() -> new InvalidRunStateException(run.getId(), run.getStatus().name()));
    RoomApproach chosen =
        approach != null ? approach : approachSelector.autoSelectBestApproach(party, room);

    EncounterRequest request =
        EncounterRequest.builder()
            .room(room)
            .approach(chosen)
            .partyPower(powerCalculator.calculatePartyPower(party, room, chosen.primaryStat()))
            .partySize(party.size())
            .difficulty(dungeon.difficulty())
            .roomIndex(run.currentRoomIndex())
            .roomCount(run.totalRooms())
            .baseExpReward(dungeon.baseExpReward())
            .baseGoldReward(dungeon.baseGoldReward())
            .lootTier(dungeon.lootTier())
            .luck(powerCalculator.maxLuck(party))
            .classLootBonus(powerCalculator.classLootBonus(party))
            .damageReduction(powerCalculator.damageReduction(party))
            .successBonus(powerCalculator.averageSuccessBonus(party))
            .statReadiness(readinessCalculator.calculate(party, dungeon.statRequirements()))
            .dungeonTheme(dungeon.theme().getKey())
            .cardPool(cardPool)
            .build();

    RoomResult result = encounterResolver.resolve(request);
    run.recordStageResult(result, now);
    return result;
  }

  /** 보상 장비는 파티 리더(첫 파티원) 기준, 행운은 파티 최고값 */
  private LootRequest lootRequest(Dungeon dungeon, List<PartyMember> party) {
    PartyMember leader = party.get(0);
    return LootRequest.builder()
        .tier(dungeon.lootTier())
        .luck(powerCalculator.maxLuck(party))
        .characterClass(leader.characterClass())
        .playerLevel(leader.level())
        .build();
  }

  private static void requireParty(List<PartyMember> party) {
    if (party == null || party.isEmpty()) {
      throw new EmptyContentPoolException("dungeon party");
    }
  }
}
