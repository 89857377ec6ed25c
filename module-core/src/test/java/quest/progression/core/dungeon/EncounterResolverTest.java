package quest.progression.core.dungeon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import quest.progression.core.card.CardDropEngine;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.StatType;
import quest.progression.core.domain.model.card.CardBonusType;
import quest.progression.core.domain.model.card.CardSourceType;
import quest.progression.core.domain.model.card.ContentCardDefinition;
import quest.progression.core.domain.model.dungeon.DungeonDifficulty;
import quest.progression.core.domain.model.dungeon.DungeonRoom;
import quest.progression.core.domain.model.dungeon.EncounterType;
import quest.progression.core.domain.model.dungeon.RoomApproach;
import quest.progression.core.domain.model.dungeon.RoomResult;
import quest.progression.core.probability.ScriptedRandomSource;

@Tag("unit")
@DisplayName("EncounterResolver 테스트")
class EncounterResolverTest {

  private static final DungeonRoom COMBAT_ROOM =
      DungeonRoom.regular("combat", EncounterType.COMBAT, StatType.STRENGTH, 10);
  private static final DungeonRoom BOSS_ROOM = DungeonRoom.boss("boss", StatType.STRENGTH, 10);

  private static EncounterResolver resolver(ScriptedRandomSource random) {
    return new EncounterResolver(random, new CardDropEngine(random));
  }

  @Nested
  @DisplayName("성공")
  class Success {

    @Test
    @DisplayName("전투력이 충분하면 확률은 0.95로 고정")
    void overpowered_chance_is_capped() {
      // 성공 판정, 전리품 판정 실패
      ScriptedRandomSource random = ScriptedRandomSource.of(0.5, 0.9);

      RoomResult result =
          resolver(random)
              .resolve(
                  COMBAT_ROOM,
                  RoomApproach.direct(StatType.STRENGTH),
                  20,
                  DungeonDifficulty.NORMAL);

      assertAll(
          () -> assertThat(result.success()).isTrue(),
          () -> assertThat(result.playerPower()).isEqualTo(20),
          () -> assertThat(result.requiredPower()).isEqualTo(10),
          () -> assertThat(result.successChance()).isEqualTo(0.95),
          () -> assertThat(result.hpLost()).isZero(),
          () -> assertThat(result.lootDropped()).isFalse(),
          () -> assertThat(result.cardDropped()).isFalse(),
          () -> assertThat(random.remaining()).isZero());
    }

    @Test
    @DisplayName("보스 방 보상 2배, 고위험 공략법 보너스")
    void boss_rewards_with_risk_bonus() {
      RoomApproach allOut = RoomApproach.of("all_out_assault", StatType.STRENGTH, 1.3, 1.6);
      EncounterRequest request =
          EncounterRequest.builder()
              .room(BOSS_ROOM)
              .approach(allOut)
              .partyPower(100)
              .partySize(1)
              .difficulty(DungeonDifficulty.NORMAL)
              .roomCount(5)
              .baseExpReward(1000)
              .baseGoldReward(500)
              .lootTier(1)
              .build();

      RoomResult result = resolver(ScriptedRandomSource.of(0.1, 0.99)).resolve(request);

      // 1000 / 5 = 200 → 보스 400 → * 1.15
      assertThat(result.expEarned()).isEqualTo(460);
      assertThat(result.goldEarned()).isEqualTo(230);
      assertThat(result.approachKey()).isEqualTo("all_out_assault");
    }

    @Test
    @DisplayName("성공 시 같은 테마 카드 판정")
    void themed_card_drop_on_success() {
      ContentCardDefinition caveCard =
          new ContentCardDefinition(
              "card_cave_01",
              "cave",
              Rarity.COMMON,
              CardBonusType.EXP_PERCENT,
              0.005,
              CardSourceType.DUNGEON,
              null,
              0,
              true);
      EncounterRequest request =
          EncounterRequest.builder()
              .room(COMBAT_ROOM)
              .partyPower(50)
              .difficulty(DungeonDifficulty.NORMAL)
              .dungeonTheme("cave")
              .cardPool(List.of(caveCard))
              .build();

      // 성공, 전리품 실패, 카드 판정(10%) 성공, 카드 선택
      RoomResult result =
          resolver(ScriptedRandomSource.of(0.1, 0.99, 0.05, 0.0)).resolve(request);

      assertThat(result.cardId()).isEqualTo("card_cave_01");
      assertThat(result.approachKey()).isEqualTo("direct");
    }
  }

  @Nested
  @DisplayName("실패")
  class Failure {

    @Test
    @DisplayName("전투력이 부족해도 난이도 하한 확률이 남고, 실패 시 피해")
    void underpowered_failure() {
      ScriptedRandomSource random = ScriptedRandomSource.of(0.9);

      RoomResult result =
          resolver(random)
              .resolve(
                  COMBAT_ROOM, RoomApproach.direct(StatType.STRENGTH), 1, DungeonDifficulty.NORMAL);

      assertThat(result.success()).isFalse();
      assertThat(result.successChance()).isEqualTo(0.25);
      // max(5, 10 - 1) * 1.0 * 1.0
      assertThat(result.hpLost()).isEqualTo(9);
      assertThat(result.lootDropped()).isFalse();
    }

    @Test
    @DisplayName("피해 = 기본 피해 * 난이도 * 위험도 * (1 - Paladin 감소), 위로 경험치 2%")
    void damage_with_paladin_reduction() {
      EncounterRequest request =
          EncounterRequest.builder()
              .room(COMBAT_ROOM)
              .approach(RoomApproach.of("aggressive_strike", StatType.STRENGTH, 1.25, 1.5))
              .partyPower(0)
              .difficulty(DungeonDifficulty.HEROIC)
              .baseExpReward(1000)
              .damageReduction(0.5)
              .build();

      RoomResult result = resolver(ScriptedRandomSource.of(0.5)).resolve(request);

      // required 25, 25 * 2.5 * 1.5 * 0.5 = 46.875
      assertThat(result.successChance()).isEqualTo(0.10);
      assertThat(result.hpLost()).isEqualTo(46);
      assertThat(result.expEarned()).isEqualTo(20);
      assertThat(result.goldEarned()).isZero();
    }

    @Test
    @DisplayName("피해는 최소 1")
    void damage_is_at_least_one() {
      RoomApproach careful = RoomApproach.of("careful", StatType.DEXTERITY, 1.0, 0.0);

      assertThat(EncounterResolver.damage(10, 0, careful, DungeonDifficulty.NORMAL, 0.0))
          .isEqualTo(1);
    }
  }

  @Test
  @DisplayName("요구 전투력은 파티 인원 1명당 50% 증가")
  void required_power_scales_with_party_size() {
    assertThat(EncounterResolver.requiredPower(COMBAT_ROOM, DungeonDifficulty.NORMAL, 3))
        .isEqualTo(20.0);
    assertThat(EncounterResolver.requiredPower(COMBAT_ROOM, DungeonDifficulty.MYTHIC, 1))
        .isEqualTo(40.0);
  }

  @Test
  @DisplayName("준비도 부족 시 (1 - 준비도) * 0.40 감산")
  void readiness_penalty() {
    assertThat(EncounterResolver.successChance(10, 10, 0, 0.5, DungeonDifficulty.NORMAL))
        .isCloseTo(0.8, within(1e-9));
    assertThat(EncounterResolver.successChance(8, 10, 0.1, 1.0, DungeonDifficulty.NORMAL))
        .isCloseTo(0.9, within(1e-9));
  }

  @Test
  @DisplayName("전리품 확률은 난이도 상한을 넘지 않음")
  void loot_chance_capped_by_difficulty() {
    EncounterRequest generous =
        EncounterRequest.builder()
            .room(COMBAT_ROOM)
            .difficulty(DungeonDifficulty.NORMAL)
            .lootTier(10)
            .luck(100)
            .build();
    EncounterRequest modest =
        EncounterRequest.builder()
            .room(COMBAT_ROOM)
            .difficulty(DungeonDifficulty.MYTHIC)
            .lootTier(2)
            .luck(10)
            .classLootBonus(0.25)
            .build();

    assertThat(EncounterResolver.lootChance(generous)).isEqualTo(0.40);
    assertThat(EncounterResolver.lootChance(modest)).isCloseTo(0.55, within(1e-9));
  }
}
