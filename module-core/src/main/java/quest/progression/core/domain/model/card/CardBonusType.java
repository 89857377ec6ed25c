package quest.progression.core.domain.model.card;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.error.exception.UnknownContentKeyException;

/** 몬스터 카드 보너스 종류. percent 여부에 따라 전투력 점수 환산이 다릅니다. */
@Getter
@AllArgsConstructor
public enum CardBonusType {
  EXP_PERCENT("exp_percent", true),
  GOLD_PERCENT("gold_percent", true),
  DUNGEON_SUCCESS("dungeon_success", true),
  LOOT_CHANCE("loot_chance", true),
  MISSION_SPEED("mission_speed", true),
  FLAT_DEFENSE("flat_defense", false);

  private final String key;
  private final boolean percent;

  public static CardBonusType fromKey(String key) {
    return Arrays.stream(values())
        .filter(t -> t.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("card bonus", key));
  }
}
