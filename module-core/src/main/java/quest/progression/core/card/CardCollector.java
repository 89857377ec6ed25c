package quest.progression.core.card;

import java.time.Instant;
import java.util.UUID;
import quest.progression.core.domain.model.card.CollectResult;
import quest.progression.core.domain.model.card.ContentCardDefinition;
import quest.progression.core.domain.model.card.MonsterCard;

/** 드롭된 카드를 소유 카드에 반영합니다. 이미 보유 중이면 중복 흡수, 아니면 신규 생성. */
public class CardCollector {

  /**
   * @param definition 드롭된 카드 정의
   * @param ownerId 소유 캐릭터
   * @param existing 같은 정의의 보유 카드 (없으면 null)
   * @param now 수집 시각
   */
  public CollectResult collect(
      ContentCardDefinition definition, String ownerId, MonsterCard existing, Instant now) {
    if (existing == null) {
      return CollectResult.newCard(
          MonsterCard.collect(UUID.randomUUID().toString(), definition, ownerId, now));
    }
    if (!existing.getCardId().equals(definition.id())) {
      throw new IllegalArgumentException(
          "existing card " + existing.getCardId() + " does not match " + definition.id());
    }
    boolean upgraded = existing.absorbDuplicate();
    return CollectResult.duplicate(existing, upgraded);
  }
}
