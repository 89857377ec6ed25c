package quest.progression.core.dungeon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import quest.progression.core.domain.model.CharacterClass;
import quest.progression.core.domain.model.PartyMember;
import quest.progression.core.domain.model.StatType;
import quest.progression.core.domain.model.dungeon.DungeonRoom;
import quest.progression.core.domain.model.dungeon.EncounterType;
import quest.progression.core.domain.model.dungeon.RoomApproach;
import quest.progression.core.domain.model.dungeon.StatRequirement;

@Tag("unit")
@DisplayName("파티 전투력 / 공략법 선택 / 준비도 테스트")
class PartyPowerCalculatorTest {

  private static final DungeonRoom COMBAT =
      DungeonRoom.regular("combat", EncounterType.COMBAT, StatType.STRENGTH, 10);
  private static final DungeonRoom BOSS = DungeonRoom.boss("boss", StatType.STRENGTH, 20);
  private static final DungeonRoom PUZZLE =
      DungeonRoom.regular("puzzle", EncounterType.PUZZLE, StatType.WISDOM, 10);

  private final PartyPowerCalculator calculator = new PartyPowerCalculator();

  private static PartyMember member(String id, CharacterClass clazz, Map<StatType, Integer> stats) {
    return PartyMember.of(id, 10, clazz, stats, 100);
  }

  @Nested
  @DisplayName("전투력")
  class Power {

    @Test
    @DisplayName("Warrior는 전투 방에서 25% 가산")
    void warrior_combat_bonus() {
      PartyMember warrior = member("w", CharacterClass.WARRIOR, Map.of(StatType.STRENGTH, 20));

      assertThat(calculator.calculatePartyPower(List.of(warrior), COMBAT)).isEqualTo(25);
      assertThat(calculator.calculatePartyPower(List.of(warrior), PUZZLE, StatType.STRENGTH))
          .isEqualTo(20);
    }

    @Test
    @DisplayName("보스 방 가산은 Warrior만")
    void only_warrior_bonus_in_boss_room() {
      PartyMember warrior = member("w", CharacterClass.WARRIOR, Map.of(StatType.STRENGTH, 20));
      PartyMember mage = member("m", CharacterClass.MAGE, Map.of(StatType.STRENGTH, 10));

      assertThat(calculator.calculatePartyPower(List.of(warrior), BOSS)).isEqualTo(25);
      assertThat(calculator.calculatePartyPower(List.of(mage), BOSS)).isEqualTo(10);
    }

    @Test
    @DisplayName("Berserker는 전투 방에서만 40% 가산, 보스 방에서는 능력치 그대로")
    void berserker_has_no_boss_bonus() {
      PartyMember berserker = member("b", CharacterClass.BERSERKER, Map.of(StatType.STRENGTH, 100));

      assertThat(calculator.calculatePartyPower(List.of(berserker), COMBAT)).isEqualTo(140);
      assertThat(calculator.calculatePartyPower(List.of(berserker), BOSS)).isEqualTo(100);
      assertThat(CharacterClass.BERSERKER.hasEncounterBonus(EncounterType.BOSS)).isFalse();
    }

    @Test
    @DisplayName("Enchanter가 있으면 파티 합계 20% 가산")
    void enchanter_party_bonus() {
      PartyMember warrior = member("w", CharacterClass.WARRIOR, Map.of(StatType.STRENGTH, 20));
      PartyMember enchanter = member("e", CharacterClass.ENCHANTER, Map.of(StatType.STRENGTH, 10));

      // (25 + 10) * 1.2
      assertThat(calculator.calculatePartyPower(List.of(warrior, enchanter), COMBAT)).isEqualTo(42);
    }

    @Test
    @DisplayName("직업이 없는 파티원은 능력치 그대로")
    void classless_member() {
      PartyMember novice = member("n", null, Map.of(StatType.WISDOM, 7));

      assertThat(calculator.calculatePartyPower(List.of(novice), PUZZLE)).isEqualTo(7);
    }
  }

  @Test
  @DisplayName("파티 보정치: 피해 감소는 직업별 한 번, 전리품 가산은 최대값")
  void party_modifiers() {
    PartyMember paladin1 = member("p1", CharacterClass.PALADIN, Map.of(StatType.LUCK, 3));
    PartyMember paladin2 = member("p2", CharacterClass.PALADIN, Map.of(StatType.LUCK, 9));
    PartyMember trickster = member("t", CharacterClass.TRICKSTER, Map.of(StatType.LUCK, 5));
    List<PartyMember> party = List.of(paladin1, paladin2, trickster);

    assertThat(calculator.damageReduction(party)).isEqualTo(0.5);
    assertThat(calculator.classLootBonus(party)).isEqualTo(0.25);
    assertThat(calculator.maxLuck(party)).isEqualTo(9);
    assertThat(calculator.totalMaxHp(party)).isEqualTo(300);
  }

  @Test
  @DisplayName("성공 가산은 파티 평균")
  void average_success_bonus() {
    PartyMember a = new PartyMember("a", 5, null, Map.of(), 50, 0.10);
    PartyMember b = new PartyMember("b", 5, null, Map.of(), 50, 0.0);

    assertThat(calculator.averageSuccessBonus(List.of(a, b))).isCloseTo(0.05, within(1e-9));
  }

  @Nested
  @DisplayName("공략법 자동 선택")
  class Approach {

    private final ApproachSelector selector = new ApproachSelector(calculator);

    @Test
    @DisplayName("능력치 * 배율이 가장 큰 공략법")
    void picks_highest_weighted_power() {
      PartyMember lucky =
          member("l", null, Map.of(StatType.LUCK, 20, StatType.WISDOM, 20, StatType.CHARISMA, 20));

      RoomApproach approach = selector.autoSelectBestApproach(List.of(lucky), PUZZLE);

      assertThat(approach.key()).isEqualTo("intuition");
    }

    @Test
    @DisplayName("모든 공략법 전투력이 0이면 첫 표준 공략법")
    void zero_power_keeps_first() {
      PartyMember empty = member("e", null, Map.of());

      assertThat(selector.autoSelectBestApproach(List.of(empty), COMBAT).key())
          .isEqualTo("aggressive_strike");
    }

    @Test
    @DisplayName("방어형 파티는 방어 공략법")
    void defensive_party() {
      PartyMember tank = member("t", null, Map.of(StatType.DEFENSE, 40, StatType.STRENGTH, 10));

      assertThat(selector.autoSelectBestApproach(List.of(tank), COMBAT).key())
          .isEqualTo("defensive_stance");
    }
  }

  @Test
  @DisplayName("준비도: 요구 능력치별 min(1, 최고값 / 요구치)의 평균")
  void stat_readiness() {
    StatReadinessCalculator readiness = new StatReadinessCalculator();
    PartyMember a = member("a", null, Map.of(StatType.STRENGTH, 10));
    PartyMember b = member("b", null, Map.of(StatType.WISDOM, 15));
    List<StatRequirement> requirements =
        List.of(
            new StatRequirement(StatType.STRENGTH, 20), new StatRequirement(StatType.WISDOM, 10));

    assertThat(readiness.calculate(List.of(a, b), requirements)).isEqualTo(0.75);
    assertThat(readiness.calculate(List.of(a, b), List.of())).isEqualTo(1.0);
  }
}
