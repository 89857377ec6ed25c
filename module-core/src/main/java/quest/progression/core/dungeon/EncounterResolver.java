package quest.progression.core.dungeon;

import quest.progression.core.card.CardDropEngine;
import quest.progression.core.domain.model.card.CardDropContext;
import quest.progression.core.domain.model.card.CardSourceType;
import quest.progression.core.domain.model.card.ContentCardDefinition;
import quest.progression.core.domain.model.dungeon.DungeonDifficulty;
import quest.progression.core.domain.model.dungeon.DungeonRoom;
import quest.progression.core.domain.model.dungeon.RoomApproach;
import quest.progression.core.domain.model.dungeon.RoomResult;
import quest.progression.core.probability.RandomSource;

/**
 * 방 조우 판정기
 *
 * <h3>성공 확률</h3>
 *
 * <pre>
 * required  = rating * difficulty.scalar * (1 + 0.5 * (partySize - 1))
 * effective = partyPower * approach.powerModifier
 * chance    = effective / required + successBonus - (1 - readiness) * 0.40
 *           → [difficulty.successFloor, 0.95]로 고정
 * </pre>
 *
 * <h3>결과</h3>
 *
 * <ul>
 *   <li>성공: 보상 = 기준 보상 / 방 수 * rewardMultiplier (보스 2배, powerModifier &gt; 1.1이면 위험 보너스). 전리품 자격과
 *       카드 드롭을 각각 판정
 *   <li>실패: HP 손실 = max(1, max(5, required - effective) * damageMultiplier * risk * (1 -
 *       피해 감소)). 위로 경험치 2%
 * </ul>
 *
 * <p>실패는 정상 결과이며 예외를 던지지 않습니다.
 */
public class EncounterResolver {

  static final double MAX_SUCCESS_CHANCE = 0.95;
  static final double PARTY_SIZE_SCALING = 0.5;
  static final double READINESS_PENALTY = 0.40;
  static final double RISK_BONUS_THRESHOLD = 1.1;
  static final int MIN_BASE_DAMAGE = 5;
  static final double CONSOLATION_EXP_RATIO = 0.02;
  static final double BASE_LOOT_CHANCE = 0.15;
  static final double LOOT_CHANCE_PER_TIER = 0.05;
  static final double LOOT_CHANCE_PER_LUCK = 0.005;

  private final RandomSource random;
  private final CardDropEngine cardDropEngine;

  public EncounterResolver(RandomSource random, CardDropEngine cardDropEngine) {
    this.random = random;
    this.cardDropEngine = cardDropEngine;
  }

  /** 단일 캐릭터 판정. 보상/전리품/카드 맥락이 없는 최소 형태입니다. */
  public RoomResult resolve(
      DungeonRoom room, RoomApproach approach, int characterPower, DungeonDifficulty difficulty) {
    return resolve(
        EncounterRequest.builder()
            .room(room)
            .approach(approach)
            .partyPower(characterPower)
            .partySize(1)
            .difficulty(difficulty)
            .roomCount(1)
            .lootTier(1)
            .statReadiness(1.0)
            .build());
  }

  public RoomResult resolve(EncounterRequest request) {
    DungeonRoom room = request.room();
    RoomApproach approach = request.approach();
    DungeonDifficulty difficulty = request.difficulty();

    double requiredExact = requiredPower(room, difficulty, request.partySize());
    double effectiveExact = request.partyPower() * approach.powerModifier();
    int required = (int) requiredExact;
    int effective = (int) effectiveExact;

    double chance =
        successChance(
            effectiveExact,
            requiredExact,
            request.successBonus(),
            request.statReadiness(),
            difficulty);
    boolean success = random.chance(chance);

    if (!success) {
      int hpLost = damage(required, effective, approach, difficulty, request.damageReduction());
      int consolationExp = (int) (request.baseExpReward() * CONSOLATION_EXP_RATIO);
      return new RoomResult(
          request.roomIndex(),
          room.encounterType(),
          approach.key(),
          false,
          effective,
          required,
          chance,
          consolationExp,
          0,
          hpLost,
          false,
          null);
    }

    double share = 1.0 / request.roomCount();
    double exp = (int) (request.baseExpReward() * share * difficulty.getRewardMultiplier());
    double gold = (int) (request.baseGoldReward() * share * difficulty.getRewardMultiplier());
    if (room.bossRoom()) {
      exp *= 2;
      gold *= 2;
    }
    if (approach.powerModifier() > RISK_BONUS_THRESHOLD) {
      double bonus = 1.0 + (approach.powerModifier() - 1.0) * 0.5;
      exp = (int) (exp * bonus);
      gold = (int) (gold * bonus);
    }

    boolean lootDropped = random.chance(lootChance(request));
    String cardId = null;
    if (request.dungeonTheme() != null) {
      cardId =
          cardDropEngine
              .rollCardDrop(
                  CardSourceType.DUNGEON,
                  CardDropContext.dungeon(request.dungeonTheme(), room.bossRoom()),
                  request.cardPool())
              .map(ContentCardDefinition::id)
              .orElse(null);
    }

    return new RoomResult(
        request.roomIndex(),
        room.encounterType(),
        approach.key(),
        true,
        effective,
        required,
        chance,
        (int) exp,
        (int) gold,
        0,
        lootDropped,
        cardId);
  }

  public static double requiredPower(
      DungeonRoom room, DungeonDifficulty difficulty, int partySize) {
    return room.difficultyRating()
        * difficulty.getScalar()
        * (1 + PARTY_SIZE_SCALING * (Math.max(1, partySize) - 1));
  }

  /** 비율 기반 성공 확률, 난이도 하한과 0.95 사이로 고정 */
  public static double successChance(
      double effective,
      double required,
      double successBonus,
      double statReadiness,
      DungeonDifficulty difficulty) {
    double chance = required <= 0 ? MAX_SUCCESS_CHANCE : effective / required;
    chance += successBonus;
    if (statReadiness < 1.0) {
      chance -= (1.0 - statReadiness) * READINESS_PENALTY;
    }
    return Math.min(MAX_SUCCESS_CHANCE, Math.max(difficulty.getSuccessFloor(), chance));
  }

  /** 방 전리품 자격 확률 (난이도별 상한) */
  public static double lootChance(EncounterRequest request) {
    double chance =
        BASE_LOOT_CHANCE
            + request.lootTier() * LOOT_CHANCE_PER_TIER
            + request.luck() * LOOT_CHANCE_PER_LUCK
            + request.classLootBonus()
            + request.room().bonusLootChance();
    return Math.min(request.difficulty().getDropChanceCap(), chance);
  }

  static int damage(
      int required,
      int effective,
      RoomApproach approach,
      DungeonDifficulty difficulty,
      double damageReduction) {
    int baseDamage = Math.max(MIN_BASE_DAMAGE, required - effective);
    double raw = baseDamage * difficulty.getDamageMultiplier() * approach.riskModifier();
    return Math.max(1, (int) (raw * (1.0 - damageReduction)));
  }
}
