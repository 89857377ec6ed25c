package quest.progression.core.domain.model.dungeon;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

/**
 * 던전 난이도
 *
 * <p>scalar는 요구 전투력, damageMultiplier는 실패 피해, successFloor는 최소 성공 확률, dropChanceCap은 방 전리품
 * 확률 상한입니다.
 */
@Getter
@AllArgsConstructor
public enum DungeonDifficulty {
  NORMAL("normal", 1.0, 1.0, 600, 0.40, 1.0, 0.25),
  HARD("hard", 1.5, 1.5, 900, 0.55, 1.5, 0.15),
  HEROIC("heroic", 2.5, 2.5, 1200, 0.70, 2.5, 0.10),
  MYTHIC("mythic", 4.0, 4.0, 1800, 0.80, 4.0, 0.05);

  private final String key;
  private final double scalar;
  private final double rewardMultiplier;
  private final long secondsPerRoom;
  private final double dropChanceCap;
  private final double damageMultiplier;
  private final double successFloor;

  public static DungeonDifficulty fromKey(String key) {
    return Arrays.stream(values())
        .filter(d -> d.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("difficulty", key));
  }
}
