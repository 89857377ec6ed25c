package quest.progression.core.pity;

import java.util.EnumMap;
import java.util.Map;
import quest.progression.core.probability.RandomSource;
import quest.progression.error.exception.InvalidProbabilityInputException;

/**
 * 천장(bad-luck protection) 판정기
 *
 * <h3>판정 순서</h3>
 *
 * <ol>
 *   <li>{@code counter >= threshold}: 강제 드롭, 카운터 0, 최소 등급 반환
 *   <li>{@code U[0,1) <= baseChance + luck * 0.003}: 드롭, 카운터 0
 *   <li>그 외: 카운터 +1, 드롭 없음
 * </ol>
 *
 * <p>카운터는 threshold를 넘지 않습니다. threshold에 도달한 다음 호출이 항상 초기화하기 때문입니다. 상태는 인자와 반환값으로만
 * 주고받으며 이 클래스는 카운터를 보관하지 않습니다.
 */
public class PityTracker {

  static final double LUCK_BONUS_PER_POINT = 0.003;

  private final Map<PityContentType, PityRule> rules;
  private final RandomSource random;

  public PityTracker(RandomSource random) {
    this(Map.of(), random);
  }

  /**
   * @param overrides 기본 규칙을 대체할 콘텐츠별 규칙 (없는 종류는 기본값)
   */
  public PityTracker(Map<PityContentType, PityRule> overrides, RandomSource random) {
    EnumMap<PityContentType, PityRule> merged = new EnumMap<>(PityContentType.class);
    for (PityContentType type : PityContentType.values()) {
      merged.put(type, overrides.getOrDefault(type, type.defaultRule()));
    }
    this.rules = merged;
    this.random = random;
  }

  public PityRule ruleFor(PityContentType type) {
    return rules.get(type);
  }

  /**
   * @param baseChance 기본 드롭 확률 [0, 1]
   * @param luck 행운 (0 이상)
   * @param counters 현재 카운터
   * @param type 콘텐츠 종류
   */
  public PityRoll shouldDrop(
      double baseChance, int luck, PityCounters counters, PityContentType type) {
    if (baseChance < 0 || baseChance > 1 || Double.isNaN(baseChance)) {
      throw new InvalidProbabilityInputException("baseChance must be in [0, 1]: " + baseChance);
    }
    if (luck < 0) {
      throw new InvalidProbabilityInputException("luck must be non-negative: " + luck);
    }

    PityRule rule = ruleFor(type);
    if (isDue(counters, type)) {
      return new PityRoll(true, rule.minimumRarity(), counters.reset(type));
    }
    if (random.chance(baseChance + luck * LUCK_BONUS_PER_POINT)) {
      return new PityRoll(true, null, counters.reset(type));
    }
    return new PityRoll(false, null, counters.increment(type));
  }

  /** 다음 판정이 강제 드롭인지 */
  public boolean isDue(PityCounters counters, PityContentType type) {
    return counters.get(type) >= ruleFor(type).threshold();
  }

  /**
   * 드롭 결과를 나중에 확정할 때 사용합니다. 유지된 드롭은 초기화, 버려지거나 강등된 드롭은 빈 판정으로 +1.
   *
   * @param kept 드롭을 그대로 유지했는지
   */
  public PityCounters settle(PityCounters counters, PityContentType type, boolean kept) {
    return kept ? counters.reset(type) : counters.increment(type);
  }
}
