package quest.progression.core.loot;

import java.util.List;
import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.pity.PityCounters;

/**
 * 천장 판정을 거친 드롭 결과
 *
 * @param items 드롭된 장비 (없으면 빈 목록)
 * @param counters 갱신된 천장 카운터. 호출자가 저장합니다
 * @param pityTriggered 천장이 발동해 최소 등급이 강제되었는지
 * @param downgraded soft cap으로 강등된 드롭인지. 이때 카운터는 빈 판정처럼 +1
 */
public record LootDrop(
    List<EquipmentItem> items, PityCounters counters, boolean pityTriggered, boolean downgraded) {

  public LootDrop {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public LootDrop(List<EquipmentItem> items, PityCounters counters, boolean pityTriggered) {
    this(items, counters, pityTriggered, false);
  }

  public static LootDrop none(PityCounters counters) {
    return new LootDrop(List.of(), counters, false);
  }

  public boolean dropped() {
    return !items.isEmpty();
  }
}
