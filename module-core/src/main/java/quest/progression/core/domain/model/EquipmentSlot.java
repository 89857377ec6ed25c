package quest.progression.core.domain.model;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

@Getter
@AllArgsConstructor
public enum EquipmentSlot {
  WEAPON("weapon"),
  ARMOR("armor"),
  ACCESSORY("accessory"),
  TRINKET("trinket");

  private final String key;

  public static EquipmentSlot fromKey(String key) {
    return Arrays.stream(values())
        .filter(s -> s.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("slot", key));
  }
}
