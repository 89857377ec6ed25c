package quest.progression.core.domain.model.card;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

/**
 * 카드 획득처와 서버 설정이 없을 때의 기본 드롭 확률
 *
 * <p>보스 방 확률은 던전에만 적용됩니다. 레이드는 항상 드롭됩니다.
 */
@Getter
@AllArgsConstructor
public enum CardSourceType {
  DUNGEON("dungeon", 0.10, 0.15),
  ARENA("arena", 0.20, 0.20),
  EXPEDITION("expedition", 0.15, 0.15),
  RAID("raid", 1.0, 1.0);

  private final String key;
  private final double fallbackChance;
  private final double bossFallbackChance;

  public static CardSourceType fromKey(String key) {
    return Arrays.stream(values())
        .filter(t -> t.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("card source", key));
  }
}
