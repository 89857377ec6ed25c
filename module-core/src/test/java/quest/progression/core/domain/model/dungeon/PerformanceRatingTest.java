package quest.progression.core.domain.model.dungeon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@Tag("unit")
@DisplayName("PerformanceRating 테스트")
class PerformanceRatingTest {

  @ParameterizedTest
  @CsvSource({
    "1.0, S", "0.95, S", "0.94, A", "0.85, A", "0.84, B", "0.70, B",
    "0.69, C", "0.50, C", "0.49, D", "0.30, D", "0.29, F", "0.0, F"
  })
  @DisplayName("점수 구간별 등급")
  void rating_boundaries(double score, PerformanceRating expected) {
    assertThat(PerformanceRating.fromScore(score)).isEqualTo(expected);
  }

  @Test
  @DisplayName("점수 = 0.5 * 클리어 + 0.3 * HP + 0.2 * 준비도")
  void weighted_score() {
    assertThat(PerformanceRating.score(5, 5, 100, 100, 1.0)).isCloseTo(1.0, within(1e-9));
    assertThat(PerformanceRating.score(2, 4, 50, 100, 0.5)).isCloseTo(0.5, within(1e-9));
    assertThat(PerformanceRating.score(0, 4, 0, 100, 1.0)).isCloseTo(0.2, within(1e-9));
  }

  @Test
  @DisplayName("방/HP가 0이면 해당 비율은 0")
  void degenerate_inputs() {
    assertThat(PerformanceRating.score(0, 0, 10, 0, 0.0)).isZero();
    assertThat(PerformanceRating.score(1, 2, -30, 100, 0.0)).isCloseTo(0.25, within(1e-9));
  }

  @Test
  @DisplayName("등급별 전리품 배율")
  void loot_multiplier() {
    assertThat(PerformanceRating.S.getLootMultiplier()).isEqualTo(1.50);
    assertThat(PerformanceRating.F.getLootMultiplier()).isEqualTo(0.50);
  }
}
