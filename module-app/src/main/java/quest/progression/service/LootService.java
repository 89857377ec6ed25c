package quest.progression.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.loot.LootDrop;
import quest.progression.core.loot.LootDropService;
import quest.progression.core.loot.LootGenerator;
import quest.progression.core.loot.LootRequest;
import quest.progression.core.pity.PityContentType;
import quest.progression.core.pity.PityCounters;
import quest.progression.core.pity.PityTracker;
import quest.progression.core.port.out.PityCounterPort;

/**
 * 장비 드롭 애플리케이션 서비스
 *
 * <p>캐릭터의 천장 카운터를 읽고, 판정하고, 결과 카운터를 다시 저장합니다. 같은 캐릭터에 대한 호출은 한 번에 하나씩 들어온다고 가정합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LootService {

  private final LootGenerator lootGenerator;
  private final LootDropService lootDropService;
  private final PityTracker pityTracker;
  private final PityCounterPort pityCounterPort;

  /** 천장과 무관한 장비 1개 생성 (보상 확정 후 지급 등) */
  public EquipmentItem generate(LootRequest request) {
    EquipmentItem item = lootGenerator.generate(request);
    log.debug(
        "[LootService] Generated {} {} (tier={}, template={})",
        item.rarity(),
        item.slot(),
        request.tier(),
        item.templateId());
    return item;
  }

  /**
   * 천장 포함 드롭 판정
   *
   * @param characterId 카운터 소유 캐릭터
   * @param baseChance 기본 드롭 확률 [0, 1]
   */
  public LootDrop rollDrop(
      String characterId, LootRequest request, double baseChance, PityContentType type) {
    PityCounters before = pityCounterPort.load(characterId);
    LootDrop drop = lootDropService.rollDrop(request, baseChance, before, type);
    pityCounterPort.save(characterId, drop.counters());

    if (drop.pityTriggered()) {
      log.info(
          "[LootService] Pity drop for {} ({}): {} after {} dry rolls",
          characterId,
          type.getKey(),
          drop.items().get(0).rarity(),
          before.get(type));
    } else {
      log.debug(
          "[LootService] Roll for {} ({}): dropped={}, downgraded={}, counter={}",
          characterId,
          type.getKey(),
          drop.dropped(),
          drop.downgraded(),
          drop.counters().get(type));
    }
    return drop;
  }

  /**
   * 이미 받은 드롭을 나중에 확정합니다. 버려지거나 강등되었으면 빈 판정으로 기록합니다.
   *
   * @param kept 드롭을 그대로 유지했는지
   */
  public PityCounters settle(String characterId, PityContentType type, boolean kept) {
    PityCounters updated = pityTracker.settle(pityCounterPort.load(characterId), type, kept);
    pityCounterPort.save(characterId, updated);
    return updated;
  }

  public PityCounters counters(String characterId) {
    return pityCounterPort.load(characterId);
  }
}
