package quest.progression.core.domain.model;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

/** 직업 계열. 계열 제한 방(class gate)은 같은 계열의 파티원이 있을 때만 등장합니다. */
@Getter
@AllArgsConstructor
public enum ClassLine {
  WARRIOR("warrior"),
  MAGE("mage"),
  ARCHER("archer");

  private final String key;

  public static ClassLine fromKey(String key) {
    return Arrays.stream(values())
        .filter(l -> l.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("class line", key));
  }
}
