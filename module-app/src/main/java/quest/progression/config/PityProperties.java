package quest.progression.config;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.pity.PityContentType;
import quest.progression.core.pity.PityRule;

/**
 * 천장 규칙 오버라이드
 *
 * <p>서버 드롭률 테이블처럼 콘텐츠 종류별 기준 횟수와 최소 등급을 바꿀 수 있습니다. 지정하지 않은 종류는 기본 규칙(tasks 20 /
 * Uncommon, dungeons 12 / Rare, missions 5 / Rare, expeditions 3 / Epic)을 따릅니다.
 *
 * <pre>
 * progression:
 *   pity:
 *     thresholds:
 *       dungeons: 10
 *     minimum-rarities:
 *       dungeons: epic
 * </pre>
 *
 * @param thresholds 콘텐츠 키별 기준 횟수
 * @param minimumRarities 콘텐츠 키별 강제 최소 등급 키
 */
@Validated
@ConfigurationProperties(prefix = "progression.pity")
public record PityProperties(
    Map<String, Integer> thresholds, Map<String, String> minimumRarities) {

  public PityProperties {
    thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
    minimumRarities = minimumRarities == null ? Map.of() : Map.copyOf(minimumRarities);
  }

  public static PityProperties defaults() {
    return new PityProperties(Map.of(), Map.of());
  }

  /**
   * 설정된 키만 규칙으로 변환합니다.
   *
   * @throws quest.progression.error.exception.UnknownContentKeyException 알 수 없는 콘텐츠/등급 키
   */
  public Map<PityContentType, PityRule> toRules() {
    Set<String> keys = new HashSet<>(thresholds.keySet());
    keys.addAll(minimumRarities.keySet());

    Map<PityContentType, PityRule> rules = new EnumMap<>(PityContentType.class);
    for (String key : keys) {
      PityContentType type = PityContentType.fromKey(key);
      int threshold = thresholds.getOrDefault(key, type.getDefaultThreshold());
      String rarityKey = minimumRarities.get(key);
      Rarity minimum =
          rarityKey != null ? Rarity.fromKey(rarityKey) : type.getDefaultMinimumRarity();
      rules.put(type, new PityRule(threshold, minimum));
    }
    return rules;
  }
}
