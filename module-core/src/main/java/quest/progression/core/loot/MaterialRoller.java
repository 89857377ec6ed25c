package quest.progression.core.loot;

import java.util.ArrayList;
import java.util.List;
import quest.progression.core.domain.model.MaterialDrop;
import quest.progression.core.domain.model.MaterialType;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.dungeon.EncounterType;
import quest.progression.core.probability.RandomSource;

/**
 * 던전 재료 드롭
 *
 * <p>조우 유형별 재료: Combat 광석, Puzzle 수정, Trap/Boss 가죽, Treasure 무작위. 보스 방은 2개, 나머지 1개. 등급은 던전
 * tier를 따릅니다.
 */
public class MaterialRoller {

  private static final List<MaterialType> TREASURE_POOL =
      List.of(MaterialType.ORE, MaterialType.CRYSTAL, MaterialType.HIDE);

  private final RandomSource random;

  public MaterialRoller(RandomSource random) {
    this.random = random;
  }

  public MaterialDrop roomMaterial(EncounterType encounterType, int lootTier) {
    MaterialType type =
        switch (encounterType) {
          case COMBAT -> MaterialType.ORE;
          case PUZZLE -> MaterialType.CRYSTAL;
          case TRAP, BOSS -> MaterialType.HIDE;
          case TREASURE -> random.pick(TREASURE_POOL);
        };
    int quantity = encounterType == EncounterType.BOSS ? 2 : 1;
    return new MaterialDrop(type, Rarity.forDungeonTier(lootTier), quantity);
  }

  /** 숨겨진 보물: 무작위 재료 count개 (각 1개) */
  public List<MaterialDrop> randomMaterials(int count, int lootTier) {
    List<MaterialDrop> drops = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      drops.add(new MaterialDrop(random.pick(TREASURE_POOL), Rarity.forDungeonTier(lootTier), 1));
    }
    return drops;
  }
}
