package quest.progression.core.pity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.Map;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.probability.ScriptedRandomSource;
import quest.progression.error.exception.InvalidProbabilityInputException;

@Tag("unit")
@DisplayName("PityTracker 테스트")
class PityTrackerTest {

  @Nested
  @DisplayName("천장 발동")
  class Forced {

    @Test
    @DisplayName("던전 12회 연속 빈 판정 후 13번째는 Rare 이상 강제 드롭, 카운터 0")
    void dungeon_pity_after_twelve_dry_runs() {
      // baseChance 0이면 난수를 소비하지 않으므로 빈 스크립트로 충분
      PityTracker tracker = new PityTracker(ScriptedRandomSource.of());
      PityCounters counters = PityCounters.empty();

      for (int i = 1; i <= 12; i++) {
        PityRoll roll = tracker.shouldDrop(0.0, 0, counters, PityContentType.DUNGEONS);
        assertThat(roll.dropped()).isFalse();
        assertThat(roll.counters().get(PityContentType.DUNGEONS)).isEqualTo(i);
        counters = roll.counters();
      }

      PityRoll thirteenth = tracker.shouldDrop(0.0, 0, counters, PityContentType.DUNGEONS);

      assertAll(
          () -> assertThat(thirteenth.dropped()).isTrue(),
          () -> assertThat(thirteenth.forcedMinRarity()).isEqualTo(Rarity.RARE),
          () -> assertThat(thirteenth.isForced()).isTrue(),
          () -> assertThat(thirteenth.counters().get(PityContentType.DUNGEONS)).isZero());
    }

    @Test
    @DisplayName("천장 판정은 난수를 소비하지 않음")
    void forced_drop_consumes_no_randomness() {
      ScriptedRandomSource random = ScriptedRandomSource.of(0.99);
      PityTracker tracker = new PityTracker(random);
      PityCounters counters = PityCounters.of(Map.of(PityContentType.EXPEDITIONS, 3));

      PityRoll roll = tracker.shouldDrop(0.5, 0, counters, PityContentType.EXPEDITIONS);

      assertThat(roll.forcedMinRarity()).isEqualTo(Rarity.EPIC);
      assertThat(random.remaining()).isEqualTo(1);
    }

    @Test
    @DisplayName("설정으로 규칙을 덮어쓸 수 있음")
    void overridden_rule() {
      PityTracker tracker =
          new PityTracker(
              Map.of(PityContentType.MISSIONS, new PityRule(2, Rarity.LEGENDARY)),
              ScriptedRandomSource.of());
      PityCounters counters = PityCounters.empty();

      counters = tracker.shouldDrop(0.0, 0, counters, PityContentType.MISSIONS).counters();
      counters = tracker.shouldDrop(0.0, 0, counters, PityContentType.MISSIONS).counters();
      PityRoll third = tracker.shouldDrop(0.0, 0, counters, PityContentType.MISSIONS);

      assertThat(third.forcedMinRarity()).isEqualTo(Rarity.LEGENDARY);
      assertThat(tracker.ruleFor(PityContentType.TASKS))
          .isEqualTo(new PityRule(20, Rarity.UNCOMMON));
    }
  }

  @Nested
  @DisplayName("일반 판정")
  class Normal {

    @Test
    @DisplayName("행운 1당 0.3%p 가산")
    void luck_adds_to_base_chance() {
      PityTracker tracker = new PityTracker(ScriptedRandomSource.of(0.125, 0.135));
      PityCounters counters = PityCounters.of(Map.of(PityContentType.TASKS, 4));

      PityRoll hit = tracker.shouldDrop(0.10, 10, counters, PityContentType.TASKS);
      PityRoll miss = tracker.shouldDrop(0.10, 10, counters, PityContentType.TASKS);

      assertThat(hit.dropped()).isTrue();
      assertThat(hit.isForced()).isFalse();
      assertThat(hit.counters().get(PityContentType.TASKS)).isZero();
      assertThat(miss.dropped()).isFalse();
      assertThat(miss.counters().get(PityContentType.TASKS)).isEqualTo(5);
    }

    @Test
    @DisplayName("다른 콘텐츠 카운터는 건드리지 않음")
    void other_counters_untouched() {
      PityTracker tracker = new PityTracker(ScriptedRandomSource.of());
      PityCounters counters = PityCounters.of(Map.of(PityContentType.MISSIONS, 3));

      PityRoll roll = tracker.shouldDrop(0.0, 0, counters, PityContentType.DUNGEONS);

      assertThat(roll.counters().get(PityContentType.MISSIONS)).isEqualTo(3);
      assertThat(roll.counters().get(PityContentType.DUNGEONS)).isEqualTo(1);
    }

    @Test
    @DisplayName("잘못된 확률/행운은 즉시 실패")
    void invalid_inputs() {
      PityTracker tracker = new PityTracker(ScriptedRandomSource.of());

      assertThatThrownBy(
              () -> tracker.shouldDrop(1.5, 0, PityCounters.empty(), PityContentType.TASKS))
          .isInstanceOf(InvalidProbabilityInputException.class);
      assertThatThrownBy(
              () -> tracker.shouldDrop(0.5, -3, PityCounters.empty(), PityContentType.TASKS))
          .isInstanceOf(InvalidProbabilityInputException.class);
    }
  }

  @Test
  @DisplayName("settle: 유지하면 초기화, 버리면 빈 판정")
  void settle() {
    PityTracker tracker = new PityTracker(ScriptedRandomSource.of());
    PityCounters counters = PityCounters.of(Map.of(PityContentType.DUNGEONS, 7));

    assertThat(
            tracker.settle(counters, PityContentType.DUNGEONS, true).get(PityContentType.DUNGEONS))
        .isZero();
    assertThat(
            tracker.settle(counters, PityContentType.DUNGEONS, false).get(PityContentType.DUNGEONS))
        .isEqualTo(8);
  }

  @Test
  @DisplayName("저장 형식 키로 복원")
  void counters_round_trip_through_keys() {
    PityCounters counters = PityCounters.fromKeys(Map.of("dungeons", 3, "tasks", 11));

    assertThat(counters.get(PityContentType.DUNGEONS)).isEqualTo(3);
    assertThat(PityCounters.fromKeys(counters.asKeyMap())).isEqualTo(counters);
  }

  @Property(tries = 200)
  void counter_never_exceeds_threshold(
      @ForAll PityContentType type,
      @ForAll @DoubleRange(min = 0.0, max = 0.3) double baseChance,
      @ForAll @IntRange(min = 0, max = 20) int luck,
      @ForAll long seed) {
    PityTracker tracker = new PityTracker(ScriptedRandomSource.seeded(seed));
    int threshold = type.getDefaultThreshold();
    PityCounters counters = PityCounters.empty();
    int dryStreak = 0;

    for (int i = 0; i < 100; i++) {
      PityRoll roll = tracker.shouldDrop(baseChance, luck, counters, type);
      counters = roll.counters();
      dryStreak = roll.dropped() ? 0 : dryStreak + 1;

      assertThat(counters.get(type)).isBetween(0, threshold);
      assertThat(dryStreak).isLessThanOrEqualTo(threshold);
    }
  }
}
