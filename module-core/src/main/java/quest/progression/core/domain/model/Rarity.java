package quest.progression.core.domain.model;

import java.util.Arrays;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

/**
 * 아이템/카드 등급
 *
 * <p>선언 순서가 곧 전순서(total order)입니다. 상한(cap), 업그레이드, 최소 등급 비교는 모두 {@link #ordinal()} 기준입니다.
 */
@Getter
@AllArgsConstructor
public enum Rarity {
  COMMON("common"),
  UNCOMMON("uncommon"),
  RARE("rare"),
  EPIC("epic"),
  LEGENDARY("legendary");

  private final String key;

  public boolean isAtLeast(Rarity other) {
    return ordinal() >= other.ordinal();
  }

  /** 한 단계 위 등급. LEGENDARY는 다음 등급이 없습니다. */
  public Optional<Rarity> next() {
    Rarity[] values = values();
    return ordinal() + 1 < values.length ? Optional.of(values[ordinal() + 1]) : Optional.empty();
  }

  public static Rarity max(Rarity a, Rarity b) {
    return a.ordinal() >= b.ordinal() ? a : b;
  }

  /**
   * 던전 tier에 대응하는 재료 등급 (1 Common ... 5 이상 Legendary)
   *
   * @param tier 1 이상
   */
  public static Rarity forDungeonTier(int tier) {
    return switch (tier) {
      case 1 -> COMMON;
      case 2 -> UNCOMMON;
      case 3 -> RARE;
      case 4 -> EPIC;
      default -> tier >= 5 ? LEGENDARY : COMMON;
    };
  }

  public static Rarity fromKey(String key) {
    return Arrays.stream(values())
        .filter(r -> r.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("rarity", key));
  }
}
