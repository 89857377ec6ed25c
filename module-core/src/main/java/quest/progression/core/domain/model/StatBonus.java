package quest.progression.core.domain.model;

/** 능력치와 보너스 수치 쌍 */
public record StatBonus(StatType stat, int bonus) {
  public StatBonus {
    if (stat == null) {
      throw new IllegalArgumentException("stat cannot be null");
    }
    if (bonus <= 0) {
      throw new IllegalArgumentException("bonus must be positive: " + bonus);
    }
  }
}
