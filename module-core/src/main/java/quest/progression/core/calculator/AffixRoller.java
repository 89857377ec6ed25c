package quest.progression.core.calculator;

import java.util.List;
import quest.progression.core.catalog.ContentCatalog;
import quest.progression.core.domain.model.Affix;
import quest.progression.core.domain.model.AffixDefinition;
import quest.progression.core.domain.model.AffixRoll;
import quest.progression.core.domain.model.AffixType;
import quest.progression.core.domain.model.CharacterClass;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.probability.RandomSource;
import quest.progression.core.probability.WeightedPicker;

/**
 * 접두/접미 옵션 굴림 컴포넌트
 *
 * <h3>등급별 확률과 배율</h3>
 *
 * <pre>
 * 등급       접두   접미   배율
 * Common     0%     0%     0.50
 * Uncommon   20%    0%     0.75
 * Rare       50%    30%    1.00
 * Epic       80%    60%    1.25
 * Legendary  100%   80%    1.50  (+10% 확률로 상위 옵션 1.5배)
 * </pre>
 *
 * <p>수치 = {@code U[min, max] * (1 + itemLevel * 0.02) * 등급 배율}, 소수 첫째 자리 반올림.
 */
public class AffixRoller {

  private static final double[] PREFIX_CHANCE = {0.0, 0.2, 0.5, 0.8, 1.0};
  private static final double[] SUFFIX_CHANCE = {0.0, 0.0, 0.3, 0.6, 0.8};
  private static final double[] RARITY_SCALE = {0.5, 0.75, 1.0, 1.25, 1.5};

  private static final double LEVEL_SCALE_PER_LEVEL = 0.02;
  private static final double GREATER_CHANCE = 0.10;
  private static final double GREATER_MULTIPLIER = 1.5;

  private final ContentCatalog catalog;
  private final AffixWeightTable weightTable;
  private final RandomSource random;

  public AffixRoller(ContentCatalog catalog, AffixWeightTable weightTable, RandomSource random) {
    this.catalog = catalog;
    this.weightTable = weightTable;
    this.random = random;
  }

  /**
   * @param rarity 아이템 등급
   * @param characterClass 직업 가중치 (nullable)
   * @param itemLevel 아이템 착용 레벨
   */
  public AffixRoll rollAffixes(Rarity rarity, CharacterClass characterClass, int itemLevel) {
    Affix prefix = null;
    Affix suffix = null;
    if (random.chance(PREFIX_CHANCE[rarity.ordinal()])) {
      prefix = rollOne(AffixType.PREFIX, rarity, characterClass, itemLevel);
    }
    if (random.chance(SUFFIX_CHANCE[rarity.ordinal()])) {
      suffix = rollOne(AffixType.SUFFIX, rarity, characterClass, itemLevel);
    }
    return new AffixRoll(prefix, suffix);
  }

  /** 배율 적용 전 원시 수치에 레벨/등급 배율을 곱하고 반올림 */
  public static double scaleValue(double raw, Rarity rarity, int itemLevel, boolean greater) {
    double value = raw * (1 + itemLevel * LEVEL_SCALE_PER_LEVEL) * RARITY_SCALE[rarity.ordinal()];
    if (greater) {
      value *= GREATER_MULTIPLIER;
    }
    return Math.round(value * 10) / 10.0;
  }

  private Affix rollOne(
      AffixType type, Rarity rarity, CharacterClass characterClass, int itemLevel) {
    List<AffixDefinition> pool = catalog.affixes(type, rarity);
    if (pool.isEmpty()) {
      return null;
    }
    int poolSize = pool.size();
    AffixDefinition definition =
        WeightedPicker.pick(
            pool, d -> weightTable.weightFor(d, characterClass, poolSize), random);

    double raw = random.nextDouble(definition.minValue(), definition.maxValue());
    boolean greater = rarity == Rarity.LEGENDARY && random.chance(GREATER_CHANCE);
    return new Affix(
        type,
        definition.id(),
        definition.bonusType(),
        scaleValue(raw, rarity, itemLevel, greater),
        greater);
  }
}
