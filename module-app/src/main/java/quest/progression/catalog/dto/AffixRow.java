package quest.progression.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import quest.progression.core.domain.model.AffixDefinition;
import quest.progression.core.domain.model.AffixType;
import quest.progression.core.domain.model.Rarity;

/**
 * content_affixes 행
 *
 * <p>min_item_rarity가 없으면 테이블 기본값과 같은 Uncommon입니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AffixRow(
    String id,
    String affixType,
    String bonusType,
    double minValue,
    double maxValue,
    String minItemRarity,
    String category,
    Boolean active) {

  public AffixDefinition toDefinition() {
    return new AffixDefinition(
        id,
        AffixType.fromKey(affixType),
        bonusType,
        minValue,
        maxValue,
        minItemRarity == null ? Rarity.UNCOMMON : Rarity.fromKey(minItemRarity),
        category,
        active == null || active);
  }
}
