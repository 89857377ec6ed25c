package quest.progression.core.loot;

import java.util.ArrayList;
import java.util.List;
import quest.progression.core.calculator.RarityRoll;
import quest.progression.core.calculator.RarityRoller;
import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.pity.PityContentType;
import quest.progression.core.pity.PityCounters;
import quest.progression.core.pity.PityRoll;
import quest.progression.core.pity.PityTracker;

/**
 * 천장으로 감싼 장비 드롭
 *
 * <p>천장 발동 시 등급은 {@code max(굴린 등급, 강제 최소 등급)}입니다. 요청에 지정 등급이 있으면 그 값이 굴린 등급을 대신합니다.
 *
 * <p>천장이 아닌 드롭의 등급이 soft cap으로 강등되면 장비는 주되 카운터는 초기화하지 않고 +1 합니다.
 */
public class LootDropService {

  private final PityTracker pityTracker;
  private final RarityRoller rarityRoller;
  private final LootGenerator lootGenerator;

  public LootDropService(
      PityTracker pityTracker, RarityRoller rarityRoller, LootGenerator lootGenerator) {
    this.pityTracker = pityTracker;
    this.rarityRoller = rarityRoller;
    this.lootGenerator = lootGenerator;
  }

  /**
   * 드롭 여부를 천장 판정으로 결정하고, 드롭이면 장비를 생성합니다.
   *
   * @param request 장비 생성 요청 (luck은 천장 판정에도 사용)
   * @param baseChance 기본 드롭 확률
   * @param counters 현재 카운터
   * @param type 콘텐츠 종류
   */
  public LootDrop rollDrop(
      LootRequest request, double baseChance, PityCounters counters, PityContentType type) {
    PityRoll roll = pityTracker.shouldDrop(baseChance, request.luck(), counters, type);
    if (!roll.dropped()) {
      return LootDrop.none(roll.counters());
    }
    if (roll.isForced()) {
      LootRequest effective = forced(request, roll.forcedMinRarity());
      return new LootDrop(List.of(lootGenerator.generate(effective)), roll.counters(), true);
    }
    if (request.forcedRarity() != null) {
      return new LootDrop(List.of(lootGenerator.generate(request)), roll.counters(), false);
    }
    RarityRoll rarity = rarityRoller.roll(request.tier(), request.luck());
    EquipmentItem item = lootGenerator.generate(request.withForcedRarity(rarity.rarity()));
    if (rarity.softCapped()) {
      return new LootDrop(List.of(item), pityTracker.settle(counters, type, false), false, true);
    }
    return new LootDrop(List.of(item), roll.counters(), false);
  }

  /**
   * 드롭 여부가 이미 결정된 묶음(던전 완료 보상 등)에 천장을 적용합니다.
   *
   * <p>하나라도 드롭되었으면 카운터 초기화. 비어 있고 천장에 도달했으면 최소 등급 장비를 하나 추가하고 초기화. 그 외에는 +1.
   */
  public LootDrop settleBatch(
      List<EquipmentItem> drops, LootRequest request, PityCounters counters, PityContentType type) {
    if (!drops.isEmpty()) {
      return new LootDrop(drops, pityTracker.settle(counters, type, true), false);
    }
    if (pityTracker.isDue(counters, type)) {
      Rarity minimum = pityTracker.ruleFor(type).minimumRarity();
      List<EquipmentItem> forcedDrops = new ArrayList<>();
      forcedDrops.add(lootGenerator.generate(forced(request, minimum)));
      return new LootDrop(forcedDrops, counters.reset(type), true);
    }
    return LootDrop.none(pityTracker.settle(counters, type, false));
  }

  private LootRequest forced(LootRequest request, Rarity minimum) {
    Rarity base =
        request.forcedRarity() != null
            ? request.forcedRarity()
            : rarityRoller.rollRarity(request.tier(), request.luck());
    return request.withForcedRarity(Rarity.max(base, minimum));
  }
}
