package quest.progression.core.dungeon;

import java.util.Collection;
import java.util.List;
import quest.progression.core.domain.model.PartyMember;
import quest.progression.core.domain.model.dungeon.StatRequirement;

/**
 * 권장 능력치 준비도 [0, 1]
 *
 * <p>요구 능력치마다 {@code min(1, 파티 최고값 / minimum)}을 구해 평균합니다. 요구가 없으면 1.0.
 */
public class StatReadinessCalculator {

  public double calculate(Collection<PartyMember> party, List<StatRequirement> requirements) {
    if (requirements.isEmpty()) {
      return 1.0;
    }
    double total = 0;
    for (StatRequirement requirement : requirements) {
      int best = party.stream().mapToInt(m -> m.statValue(requirement.stat())).max().orElse(0);
      total += Math.min(1.0, (double) best / Math.max(1, requirement.minimum()));
    }
    return total / requirements.size();
  }
}
