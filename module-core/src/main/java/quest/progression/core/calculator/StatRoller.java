package quest.progression.core.calculator;

import java.util.List;
import java.util.Optional;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.StatBonus;
import quest.progression.core.domain.model.StatType;
import quest.progression.core.probability.RandomSource;

/**
 * 능력치 보너스 굴림 컴포넌트
 *
 * <h3>등급별 범위</h3>
 *
 * <pre>
 * 등급       주 능력치   보조 확률   보조 범위
 * Common     1 ~ 3      0%          -
 * Uncommon   2 ~ 5      30%         1 ~ 2
 * Rare       4 ~ 8      60%         2 ~ 4
 * Epic       7 ~ 12     80%         3 ~ 6
 * Legendary  10 ~ 18    100%        5 ~ 10
 * </pre>
 */
public class StatRoller {

  private static final int[][] PRIMARY_RANGE = {{1, 3}, {2, 5}, {4, 8}, {7, 12}, {10, 18}};
  private static final double[] SECONDARY_CHANCE = {0.0, 0.3, 0.6, 0.8, 1.0};
  private static final int[][] SECONDARY_RANGE = {{0, 0}, {1, 2}, {2, 4}, {3, 6}, {5, 10}};

  private static final int LEVEL_PER_TIER = 5;
  private static final int OVER_LEVEL_ALLOWANCE = 5;

  private final RandomSource random;

  public StatRoller(RandomSource random) {
    this.random = random;
  }

  public int rollStatBonus(Rarity rarity) {
    int[] range = primaryRange(rarity);
    return random.nextInt(range[0], range[1]);
  }

  /** 주 능력치를 균등 선택 */
  public StatType rollPrimaryStat() {
    return random.pick(List.of(StatType.values()));
  }

  /**
   * 보조 능력치 굴림. 확률 게이트를 통과하면 주 능력치를 제외한 나머지에서 균등 선택합니다.
   *
   * @param rarity 아이템 등급
   * @param excluding 주 능력치
   * @return 게이트 실패 또는 후보가 없으면 empty
   */
  public Optional<StatBonus> rollSecondaryStat(Rarity rarity, StatType excluding) {
    double chance = SECONDARY_CHANCE[rarity.ordinal()];
    if (!random.chance(chance)) {
      return Optional.empty();
    }
    List<StatType> candidates = excluding == null ? List.of(StatType.values()) : excluding.others();
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    StatType stat = random.pick(candidates);
    int[] range = SECONDARY_RANGE[rarity.ordinal()];
    return Optional.of(new StatBonus(stat, random.nextInt(range[0], range[1])));
  }

  /**
   * 절차 생성 장비의 착용 레벨: {@code max(1, (tier - 1) * 5 + bonus / 2)}, 플레이어 레벨이 주어지면 {@code
   * playerLevel + 5}로 상한.
   */
  public static int levelRequirement(int tier, int primaryBonus, Integer playerLevel) {
    int level = Math.max(1, (tier - 1) * LEVEL_PER_TIER + primaryBonus / 2);
    if (playerLevel != null) {
      level = Math.min(level, playerLevel + OVER_LEVEL_ALLOWANCE);
    }
    return Math.max(1, level);
  }

  public static int maxLevelFor(Integer playerLevel) {
    return playerLevel == null ? Integer.MAX_VALUE : playerLevel + OVER_LEVEL_ALLOWANCE;
  }

  public static int minPrimaryBonus(Rarity rarity) {
    return primaryRange(rarity)[0];
  }

  public static int maxPrimaryBonus(Rarity rarity) {
    return primaryRange(rarity)[1];
  }

  private static int[] primaryRange(Rarity rarity) {
    return PRIMARY_RANGE[rarity.ordinal()];
  }
}
