package quest.progression.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.pity.PityContentType;
import quest.progression.core.pity.PityRule;
import quest.progression.error.exception.UnknownContentKeyException;

@Tag("unit")
@DisplayName("PityProperties 테스트")
class PityPropertiesTest {

  @Test
  @DisplayName("설정이 없으면 오버라이드 없음")
  void defaults_have_no_overrides() {
    assertThat(PityProperties.defaults().toRules()).isEmpty();
    assertThat(new PityProperties(null, null).toRules()).isEmpty();
  }

  @Test
  @DisplayName("기준 횟수만 지정하면 최소 등급은 기본값 유지")
  void threshold_only_keeps_default_rarity() {
    Map<PityContentType, PityRule> rules =
        new PityProperties(Map.of("dungeons", 8), Map.of()).toRules();

    assertThat(rules).containsOnlyKeys(PityContentType.DUNGEONS);
    assertThat(rules.get(PityContentType.DUNGEONS)).isEqualTo(new PityRule(8, Rarity.RARE));
  }

  @Test
  @DisplayName("최소 등급만 지정하면 기준 횟수는 기본값 유지, 키는 대소문자 무시")
  void rarity_only_keeps_default_threshold() {
    Map<PityContentType, PityRule> rules =
        new PityProperties(Map.of(), Map.of("Tasks", "RARE")).toRules();

    assertThat(rules.get(PityContentType.TASKS)).isEqualTo(new PityRule(20, Rarity.RARE));
  }

  @Test
  @DisplayName("두 값 모두 지정")
  void both_overrides() {
    Map<PityContentType, PityRule> rules =
        new PityProperties(
                Map.of("expeditions", 2, "missions", 4), Map.of("expeditions", "legendary"))
            .toRules();

    assertAll(
        () -> assertThat(rules).hasSize(2),
        () ->
            assertThat(rules.get(PityContentType.EXPEDITIONS))
                .isEqualTo(new PityRule(2, Rarity.LEGENDARY)),
        () ->
            assertThat(rules.get(PityContentType.MISSIONS))
                .isEqualTo(new PityRule(4, Rarity.RARE)));
  }

  @Test
  @DisplayName("알 수 없는 콘텐츠 키나 등급 키는 UnknownContentKeyException")
  void unknown_keys_fail() {
    assertThatThrownBy(() -> new PityProperties(Map.of("raids", 3), Map.of()).toRules())
        .isInstanceOf(UnknownContentKeyException.class);
    assertThatThrownBy(() -> new PityProperties(Map.of(), Map.of("tasks", "mythic")).toRules())
        .isInstanceOf(UnknownContentKeyException.class);
  }
}
