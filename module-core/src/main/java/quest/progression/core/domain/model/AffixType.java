package quest.progression.core.domain.model;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

@Getter
@AllArgsConstructor
public enum AffixType {
  PREFIX("prefix"),
  SUFFIX("suffix");

  private final String key;

  public static AffixType fromKey(String key) {
    return Arrays.stream(values())
        .filter(t -> t.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("affix type", key));
  }
}
