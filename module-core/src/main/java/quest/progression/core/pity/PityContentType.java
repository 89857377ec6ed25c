package quest.progression.core.pity;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.core.domain.model.Rarity;
import quest.progression.error.exception.UnknownContentKeyException;

/** 천장(pity) 카운터를 따로 두는 콘텐츠 종류와 기본 규칙 */
@Getter
@AllArgsConstructor
public enum PityContentType {
  TASKS("tasks", 20, Rarity.UNCOMMON),
  DUNGEONS("dungeons", 12, Rarity.RARE),
  MISSIONS("missions", 5, Rarity.RARE),
  EXPEDITIONS("expeditions", 3, Rarity.EPIC);

  private final String key;
  private final int defaultThreshold;
  private final Rarity defaultMinimumRarity;

  public PityRule defaultRule() {
    return new PityRule(defaultThreshold, defaultMinimumRarity);
  }

  public static PityContentType fromKey(String key) {
    return Arrays.stream(values())
        .filter(t -> t.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("pity content", key));
  }
}
