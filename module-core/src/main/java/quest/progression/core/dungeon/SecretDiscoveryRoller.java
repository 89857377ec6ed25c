package quest.progression.core.dungeon;

import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.dungeon.Dungeon;
import quest.progression.core.domain.model.dungeon.SecretDiscovery;
import quest.progression.core.loot.LootGenerator;
import quest.progression.core.loot.LootRequest;
import quest.progression.core.loot.MaterialRoller;
import quest.progression.core.probability.RandomSource;

/**
 * 숨겨진 보물 판정 (성공한 던전당 1회)
 *
 * <p>확률 {@code min(0.03 + maxLuck * 0.002, 0.15)}. 발견 시 골드 {@code baseGold * 2 *
 * rewardMultiplier}, 재료 2~3개, 25% 확률로 Rare 장비.
 */
public class SecretDiscoveryRoller {

  static final double BASE_CHANCE = 0.03;
  static final double CHANCE_PER_LUCK = 0.002;
  static final double MAX_CHANCE = 0.15;
  static final double EQUIPMENT_CHANCE = 0.25;

  private final RandomSource random;
  private final MaterialRoller materialRoller;
  private final LootGenerator lootGenerator;

  public SecretDiscoveryRoller(
      RandomSource random, MaterialRoller materialRoller, LootGenerator lootGenerator) {
    this.random = random;
    this.materialRoller = materialRoller;
    this.lootGenerator = lootGenerator;
  }

  public static double discoveryChance(int maxLuck) {
    return Math.min(BASE_CHANCE + maxLuck * CHANCE_PER_LUCK, MAX_CHANCE);
  }

  public SecretDiscovery roll(Dungeon dungeon, int maxLuck, LootRequest lootRequest) {
    if (!random.chance(discoveryChance(maxLuck))) {
      return SecretDiscovery.none();
    }
    int gold =
        (int) (dungeon.baseGoldReward() * 2.0 * dungeon.difficulty().getRewardMultiplier());
    int materialCount = random.nextInt(2, 3);
    EquipmentItem equipment = null;
    if (random.chance(EQUIPMENT_CHANCE)) {
      equipment = lootGenerator.generate(lootRequest.withForcedRarity(Rarity.RARE));
    }
    return new SecretDiscovery(
        true,
        gold,
        materialRoller.randomMaterials(materialCount, dungeon.lootTier()),
        equipment);
  }
}
