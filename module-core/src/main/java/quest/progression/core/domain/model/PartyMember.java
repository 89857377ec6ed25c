package quest.progression.core.domain.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * 캐릭터 스냅샷 (읽기 전용)
 *
 * <p>능력치는 직업/별자리/장비가 모두 반영된 유효값입니다. 계산은 외부 협력자가 수행합니다.
 *
 * @param id 캐릭터 식별자
 * @param level 캐릭터 레벨 (1 이상)
 * @param characterClass 직업 (전직 전이면 null)
 * @param stats 유효 능력치
 * @param maxHp 최대 HP (1 이상)
 * @param dungeonSuccessBonus 연구 트리 등으로 얻은 던전 성공 확률 가산
 */
public record PartyMember(
    String id,
    int level,
    CharacterClass characterClass,
    Map<StatType, Integer> stats,
    int maxHp,
    double dungeonSuccessBonus) {

  public PartyMember {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (level < 1) {
      throw new IllegalArgumentException("level must be positive: " + level);
    }
    if (maxHp < 1) {
      throw new IllegalArgumentException("maxHp must be positive: " + maxHp);
    }
    EnumMap<StatType, Integer> copy = new EnumMap<>(StatType.class);
    if (stats != null) {
      stats.forEach(
          (stat, value) -> {
            if (value == null || value < 0) {
              throw new IllegalArgumentException("stat value must be non-negative: " + stat);
            }
            copy.put(stat, value);
          });
    }
    stats = Map.copyOf(copy);
  }

  public static PartyMember of(
      String id,
      int level,
      CharacterClass characterClass,
      Map<StatType, Integer> stats,
      int maxHp) {
    return new PartyMember(id, level, characterClass, stats, maxHp, 0.0);
  }

  public int statValue(StatType stat) {
    return stats.getOrDefault(stat, 0);
  }

  public int luck() {
    return statValue(StatType.LUCK);
  }

  public boolean is(CharacterClass clazz) {
    return characterClass == clazz;
  }
}
