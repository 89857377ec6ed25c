package quest.progression.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.card.CardBonusType;
import quest.progression.core.domain.model.card.CardSourceType;
import quest.progression.core.domain.model.card.ContentCardDefinition;

/** content_cards 행 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CardRow(
    String id,
    String theme,
    String rarity,
    String bonusType,
    double bonusValue,
    String sourceType,
    String sourceName,
    double dropChance,
    Boolean active) {

  public ContentCardDefinition toDefinition() {
    return new ContentCardDefinition(
        id,
        theme,
        Rarity.fromKey(rarity),
        CardBonusType.fromKey(bonusType),
        bonusValue,
        CardSourceType.fromKey(sourceType),
        sourceName,
        dropChance,
        active == null || active);
  }
}
