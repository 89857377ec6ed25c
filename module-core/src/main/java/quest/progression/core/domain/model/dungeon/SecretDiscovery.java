package quest.progression.core.domain.model.dungeon;

import java.util.List;
import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.domain.model.MaterialDrop;

/**
 * 숨겨진 보물 발견 결과
 *
 * @param discovered 발견 여부
 * @param bonusGold 추가 골드
 * @param materials 추가 재료 (2~3개)
 * @param equipment 추가 장비 (25% 확률, nullable)
 */
public record SecretDiscovery(
    boolean discovered, int bonusGold, List<MaterialDrop> materials, EquipmentItem equipment) {

  public SecretDiscovery {
    materials = materials == null ? List.of() : List.copyOf(materials);
  }

  public static SecretDiscovery none() {
    return new SecretDiscovery(false, 0, List.of(), null);
  }
}
