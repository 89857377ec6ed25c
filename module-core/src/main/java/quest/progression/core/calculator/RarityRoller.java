package quest.progression.core.calculator;

import quest.progression.core.domain.model.Rarity;
import quest.progression.core.probability.RandomSource;
import quest.progression.error.exception.InvalidProbabilityInputException;
import quest.progression.error.exception.InvalidTierException;

/**
 * 등급 굴림 컴포넌트
 *
 * <h3>알고리즘</h3>
 *
 * <ol>
 *   <li>{@code U[0,100] + luck * 0.5 + tier * 3.0}을 고정 임계값으로 등급에 매핑
 *   <li>Hard cap: tier 4 미만에서 Legendary는 Epic으로 강등
 *   <li>Soft cap: tier 3 미만의 Epic은 행운 비례 유지 확률로 한 번 더 굴려 실패 시 강등 (tier 2 → Rare, tier 1 → Uncommon)
 * </ol>
 *
 * <p>Hard cap으로 강등된 Epic도 soft cap 판정을 받습니다.
 */
public class RarityRoller {

  private static final double LUCK_WEIGHT = 0.5;
  private static final double TIER_WEIGHT = 3.0;

  private static final double LEGENDARY_THRESHOLD = 95;
  private static final double EPIC_THRESHOLD = 82;
  private static final double RARE_THRESHOLD = 65;
  private static final double UNCOMMON_THRESHOLD = 40;

  static final int LEGENDARY_MIN_TIER = 4;
  static final int EPIC_FREE_TIER = 3;

  private final RandomSource random;

  public RarityRoller(RandomSource random) {
    this.random = random;
  }

  /**
   * @param tier 1 이상
   * @param luck 0 이상
   * @throws InvalidTierException tier &lt; 1
   */
  public Rarity rollRarity(int tier, int luck) {
    return roll(tier, luck).rarity();
  }

  /**
   * {@link #rollRarity(int, int)}와 같은 굴림이지만 soft cap 강등 여부도 함께 돌려줍니다.
   *
   * @throws InvalidTierException tier &lt; 1
   */
  public RarityRoll roll(int tier, int luck) {
    requireTier(tier);
    requireLuck(luck);

    double adjusted = random.nextDouble() * 100 + luck * LUCK_WEIGHT + tier * TIER_WEIGHT;
    Rarity rolled = fromAdjustedRoll(adjusted);
    return applyCaps(rolled, tier, luck);
  }

  /** 보정이 끝난 굴림값을 등급으로 매핑 */
  public static Rarity fromAdjustedRoll(double adjusted) {
    if (adjusted >= LEGENDARY_THRESHOLD) {
      return Rarity.LEGENDARY;
    }
    if (adjusted >= EPIC_THRESHOLD) {
      return Rarity.EPIC;
    }
    if (adjusted >= RARE_THRESHOLD) {
      return Rarity.RARE;
    }
    if (adjusted >= UNCOMMON_THRESHOLD) {
      return Rarity.UNCOMMON;
    }
    return Rarity.COMMON;
  }

  /**
   * tier 1: 0.02 + luck * 0.003, tier 2: 0.05 + luck * 0.005. tier 3 이상은 항상 유지.
   *
   * @return 저 tier Epic 유지 확률
   */
  public static double epicKeepChance(int tier, int luck) {
    return switch (tier) {
      case 1 -> 0.02 + luck * 0.003;
      case 2 -> 0.05 + luck * 0.005;
      default -> 1.0;
    };
  }

  private RarityRoll applyCaps(Rarity rolled, int tier, int luck) {
    Rarity capped = rolled;
    if (capped == Rarity.LEGENDARY && tier < LEGENDARY_MIN_TIER) {
      capped = Rarity.EPIC;
    }
    if (capped == Rarity.EPIC && tier < EPIC_FREE_TIER) {
      if (!random.chance(epicKeepChance(tier, luck))) {
        return new RarityRoll(tier == 2 ? Rarity.RARE : Rarity.UNCOMMON, true);
      }
    }
    return new RarityRoll(capped, false);
  }

  static void requireTier(int tier) {
    if (tier < 1) {
      throw new InvalidTierException(tier);
    }
  }

  static void requireLuck(int luck) {
    if (luck < 0) {
      throw new InvalidProbabilityInputException("luck must be non-negative: " + luck);
    }
  }
}
