package quest.progression.core.domain.model.dungeon;

import quest.progression.core.domain.model.StatType;

public record StatRequirement(StatType stat, int minimum) {
  public StatRequirement {
    if (stat == null) {
      throw new IllegalArgumentException("stat cannot be null");
    }
    if (minimum < 1) {
      throw new IllegalArgumentException("minimum must be positive: " + minimum);
    }
  }
}
