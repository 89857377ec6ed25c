package quest.progression.core.calculator;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import quest.progression.core.domain.model.AffixDefinition;
import quest.progression.core.domain.model.CharacterClass;
import quest.progression.core.domain.model.StatType;

/**
 * 직업 주 능력치 기반 옵션 가중치 테이블
 *
 * <p>bonusType 키에 능력치 키워드가 포함된 정의는 가중치 {@code 1 + max(1, poolSize / 10)}, 나머지는 1입니다. 풀의 약 10%에
 * 해당하는 추가 비중을 항목 복제 없이 표현합니다.
 */
public class AffixWeightTable {

  private static final Map<StatType, List<String>> KEYWORDS = new EnumMap<>(StatType.class);

  static {
    KEYWORDS.put(StatType.STRENGTH, List.of("physical", "strength"));
    KEYWORDS.put(StatType.WISDOM, List.of("mental", "wisdom", "mission_speed"));
    KEYWORDS.put(StatType.DEXTERITY, List.of("mission_duration", "dexterity", "haste"));
    KEYWORDS.put(StatType.CHARISMA, List.of("social", "charisma", "party_bond"));
    KEYWORDS.put(StatType.LUCK, List.of("loot", "luck", "drop_chance", "fortune"));
    KEYWORDS.put(StatType.DEFENSE, List.of("defense", "dungeon_success", "warding"));
  }

  /** 옵션 정의가 능력치 분류에 속하는지 (bonusType 또는 id에 키워드 포함) */
  public boolean matches(AffixDefinition definition, StatType stat) {
    String bonusType = definition.bonusType().toLowerCase(Locale.ROOT);
    String id = definition.id().toLowerCase(Locale.ROOT);
    return KEYWORDS.getOrDefault(stat, List.of()).stream()
        .anyMatch(k -> bonusType.contains(k) || id.contains(k));
  }

  /**
   * @param definition 후보 정의
   * @param characterClass 직업 (null이면 가중치 없음)
   * @param poolSize 후보 풀 크기
   */
  public double weightFor(AffixDefinition definition, CharacterClass characterClass, int poolSize) {
    if (characterClass == null || !matches(definition, characterClass.getPrimaryStat())) {
      return 1.0;
    }
    return 1.0 + Math.max(1, poolSize / 10);
  }
}
