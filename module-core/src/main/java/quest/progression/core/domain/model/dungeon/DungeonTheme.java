package quest.progression.core.domain.model.dungeon;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

@Getter
@AllArgsConstructor
public enum DungeonTheme {
  CAVE("cave"),
  RUINS("ruins"),
  FOREST("forest"),
  FORTRESS("fortress"),
  VOLCANO("volcano"),
  ABYSS("abyss");

  private final String key;

  public static DungeonTheme fromKey(String key) {
    return Arrays.stream(values())
        .filter(t -> t.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("theme", key));
  }
}
