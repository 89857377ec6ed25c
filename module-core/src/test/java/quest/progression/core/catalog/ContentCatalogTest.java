package quest.progression.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import quest.progression.core.domain.model.AffixDefinition;
import quest.progression.core.domain.model.AffixType;
import quest.progression.core.domain.model.EquipmentSlot;
import quest.progression.core.domain.model.EquipmentTemplate;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.StatType;
import quest.progression.core.domain.model.card.CardBonusType;
import quest.progression.core.domain.model.card.CardSourceType;
import quest.progression.core.domain.model.card.ContentCardDefinition;

@Tag("unit")
@DisplayName("ContentCatalog 테스트")
class ContentCatalogTest {

  private static final EquipmentTemplate RARE_BLADE = blade("tpl_rare_blade", true);
  private static final EquipmentTemplate RETIRED_BLADE = blade("tpl_retired", false);

  private static final AffixDefinition REMOTE_PREFIX =
      AffixDefinition.of("remote_keen", AffixType.PREFIX, "crit_percent", 1, 4);

  private static final ContentCardDefinition CAVE_BAT =
      new ContentCardDefinition(
          "card_cave_bat",
          "cave",
          Rarity.COMMON,
          CardBonusType.EXP_PERCENT,
          1.0,
          CardSourceType.DUNGEON,
          "Cave Bat",
          0.0,
          true);

  private static EquipmentTemplate blade(String id, boolean active) {
    return new EquipmentTemplate(
        id, EquipmentSlot.WEAPON, Rarity.RARE, StatType.STRENGTH, 8, null, 0, 10, active);
  }

  @Nested
  @DisplayName("서버 데이터 적재됨")
  class RemoteLoaded {

    private final ContentCatalog catalog =
        new ContentCatalog(
            RemoteCatalogSource.of(
                List.of(RARE_BLADE, RETIRED_BLADE), List.of(REMOTE_PREFIX), List.of(CAVE_BAT)),
            new StaticCatalogSource());

    @Test
    @DisplayName("조건에 맞는 활성 항목이 있으면 서버 결과")
    void prefers_remote() {
      assertThat(catalog.isRemoteLoaded()).isTrue();
      assertThat(catalog.templates(EquipmentSlot.WEAPON, Rarity.RARE, 12))
          .containsExactly(RARE_BLADE);
      assertThat(catalog.affixes(AffixType.PREFIX, Rarity.COMMON)).containsExactly(REMOTE_PREFIX);
      assertThat(catalog.cards(CardSourceType.DUNGEON)).containsExactly(CAVE_BAT);
    }

    @Test
    @DisplayName("서버 결과가 비면 질의 단위로 정적 소스 사용")
    void falls_back_per_query() {
      // 서버에는 접미 옵션이 없음
      assertThat(catalog.affixes(AffixType.SUFFIX, Rarity.COMMON))
          .hasSize(8)
          .allMatch(a -> a.type() == AffixType.SUFFIX);
      assertThat(catalog.templates(EquipmentSlot.WEAPON, Rarity.RARE, 5)).isEmpty();
      assertThat(catalog.cards(CardSourceType.RAID)).isEmpty();
    }
  }

  @Test
  @DisplayName("정적 소스: 접두 10종, 접미 8종, 템플릿과 카드는 없음")
  void static_only() {
    ContentCatalog catalog = ContentCatalog.staticOnly();

    assertThat(catalog.isRemoteLoaded()).isFalse();
    assertThat(catalog.affixes(AffixType.PREFIX, Rarity.LEGENDARY)).hasSize(10);
    assertThat(catalog.affixes(AffixType.SUFFIX, Rarity.COMMON)).hasSize(8);
    assertThat(catalog.templates(null, Rarity.RARE, null)).isEmpty();
    assertThat(catalog.activeCards()).isEmpty();
  }

  @Test
  @DisplayName("적재 전 서버 소스는 무시")
  void unloaded_remote_is_ignored() {
    ContentCatalog catalog =
        new ContentCatalog(
            new RemoteCatalogSource(false, List.of(RARE_BLADE), List.of(), List.of()),
            new StaticCatalogSource());

    assertThat(catalog.templates(EquipmentSlot.WEAPON, Rarity.RARE, null)).isEmpty();
  }
}
