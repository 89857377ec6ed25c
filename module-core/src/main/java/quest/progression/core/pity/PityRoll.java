package quest.progression.core.pity;

import java.util.Optional;
import quest.progression.core.domain.model.Rarity;

/**
 * 천장 판정 결과
 *
 * @param dropped 드롭 여부
 * @param forcedMinRarity 천장 발동 시 최소 등급 (nullable)
 * @param counters 판정 후 카운터. 호출자가 저장합니다
 */
public record PityRoll(boolean dropped, Rarity forcedMinRarity, PityCounters counters) {

  public Optional<Rarity> forcedMinimum() {
    return Optional.ofNullable(forcedMinRarity);
  }

  public boolean isForced() {
    return forcedMinRarity != null;
  }
}
