package quest.progression.core.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum MaterialType {
  ORE("ore"),
  CRYSTAL("crystal"),
  HIDE("hide");

  private final String key;
}
