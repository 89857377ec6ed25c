package quest.progression.core.dungeon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.domain.model.EquipmentSlot;
import quest.progression.core.domain.model.MaterialType;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.StatType;
import quest.progression.core.domain.model.dungeon.Dungeon;
import quest.progression.core.domain.model.dungeon.DungeonDifficulty;
import quest.progression.core.domain.model.dungeon.DungeonRoom;
import quest.progression.core.domain.model.dungeon.DungeonTheme;
import quest.progression.core.domain.model.dungeon.SecretDiscovery;
import quest.progression.core.loot.LootGenerator;
import quest.progression.core.loot.LootRequest;
import quest.progression.core.loot.MaterialRoller;
import quest.progression.core.probability.ScriptedRandomSource;

@Tag("unit")
@DisplayName("SecretDiscoveryRoller 테스트")
class SecretDiscoveryRollerTest {

  private static final LootRequest REQUEST = LootRequest.of(2, 10);

  private static Dungeon dungeon(DungeonDifficulty difficulty) {
    return new Dungeon(
        "sunken_vault",
        DungeonTheme.RUINS,
        difficulty,
        2,
        List.of(DungeonRoom.boss("warden", StatType.STRENGTH, 10)),
        List.of(),
        500,
        400);
  }

  @ParameterizedTest
  @CsvSource({"0, 0.03", "10, 0.05", "60, 0.15", "200, 0.15"})
  @DisplayName("발견 확률은 행운 1당 0.2%p, 최대 15%")
  void discovery_chance(int luck, double expected) {
    assertThat(SecretDiscoveryRoller.discoveryChance(luck)).isCloseTo(expected, within(1e-9));
  }

  @Test
  @DisplayName("발견 실패 시 추가 판정 없음")
  void not_discovered() {
    ScriptedRandomSource random = ScriptedRandomSource.of(0.5);
    LootGenerator lootGenerator = mock(LootGenerator.class);

    SecretDiscovery secret =
        new SecretDiscoveryRoller(random, new MaterialRoller(random), lootGenerator)
            .roll(dungeon(DungeonDifficulty.NORMAL), 0, REQUEST);

    assertThat(secret).isEqualTo(SecretDiscovery.none());
    assertThat(random.remaining()).isZero();
  }

  @Test
  @DisplayName("발견: 골드 = 기본 골드 * 2 * 난이도 배율, 재료 3개, 장비 없음")
  void discovered_without_equipment() {
    // 발견, 재료 수(3), 장비 실패, 재료 종류 3회
    ScriptedRandomSource random = ScriptedRandomSource.of(0.03, 0.99, 0.5, 0.0, 0.4, 0.9);
    LootGenerator lootGenerator = mock(LootGenerator.class);

    SecretDiscovery secret =
        new SecretDiscoveryRoller(random, new MaterialRoller(random), lootGenerator)
            .roll(dungeon(DungeonDifficulty.HARD), 0, REQUEST);

    assertAll(
        () -> assertThat(secret.discovered()).isTrue(),
        () -> assertThat(secret.bonusGold()).isEqualTo(1200),
        () ->
            assertThat(secret.materials())
                .extracting(m -> m.type())
                .containsExactly(MaterialType.ORE, MaterialType.CRYSTAL, MaterialType.HIDE),
        () -> assertThat(secret.materials()).allMatch(m -> m.rarity() == Rarity.UNCOMMON),
        () -> assertThat(secret.equipment()).isNull(),
        () -> assertThat(random.remaining()).isZero());
  }

  @Test
  @DisplayName("25% 분기 성공 시 Rare 지정 장비")
  void discovered_with_rare_equipment() {
    ScriptedRandomSource random = ScriptedRandomSource.of(0.0, 0.0, 0.25, 0.0, 0.0);
    LootGenerator lootGenerator = mock(LootGenerator.class);
    EquipmentItem item =
        new EquipmentItem(
            "secret-1",
            EquipmentSlot.ACCESSORY,
            Rarity.RARE,
            StatType.LUCK,
            6,
            null,
            0,
            3,
            0,
            null,
            null,
            null);
    given(lootGenerator.generate(any(LootRequest.class))).willReturn(item);

    SecretDiscovery secret =
        new SecretDiscoveryRoller(random, new MaterialRoller(random), lootGenerator)
            .roll(dungeon(DungeonDifficulty.NORMAL), 5, REQUEST);

    ArgumentCaptor<LootRequest> captor = ArgumentCaptor.forClass(LootRequest.class);
    verify(lootGenerator).generate(captor.capture());
    assertThat(captor.getValue().forcedRarity()).isEqualTo(Rarity.RARE);
    assertThat(captor.getValue().tier()).isEqualTo(2);
    assertThat(secret.equipment()).isSameAs(item);
    assertThat(secret.materials()).hasSize(2);
    assertThat(secret.bonusGold()).isEqualTo(800);
  }
}
