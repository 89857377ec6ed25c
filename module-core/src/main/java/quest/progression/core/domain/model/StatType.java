package quest.progression.core.domain.model;

import java.util.Arrays;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

/** 배분 가능한 캐릭터 능력치 */
@Getter
@AllArgsConstructor
public enum StatType {
  STRENGTH("strength", "STR"),
  WISDOM("wisdom", "WIS"),
  CHARISMA("charisma", "CHA"),
  DEXTERITY("dexterity", "DEX"),
  LUCK("luck", "LUK"),
  DEFENSE("defense", "DEF");

  private final String key;
  private final String shortName;

  /** 자신을 제외한 나머지 능력치 (보조 능력치 후보) */
  public List<StatType> others() {
    return Arrays.stream(values()).filter(s -> s != this).toList();
  }

  public static StatType fromKey(String key) {
    return Arrays.stream(values())
        .filter(s -> s.key.equalsIgnoreCase(key) || s.shortName.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("stat", key));
  }
}
