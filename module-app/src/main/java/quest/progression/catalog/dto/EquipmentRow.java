package quest.progression.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import quest.progression.core.domain.model.EquipmentSlot;
import quest.progression.core.domain.model.EquipmentTemplate;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.StatType;

/** content_equipment 행 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EquipmentRow(
    String id,
    String slot,
    String rarity,
    String primaryStat,
    int statBonus,
    String secondaryStat,
    int secondaryStatBonus,
    Integer levelRequirement,
    Boolean active) {

  public EquipmentTemplate toTemplate() {
    return new EquipmentTemplate(
        id,
        EquipmentSlot.fromKey(slot),
        Rarity.fromKey(rarity),
        StatType.fromKey(primaryStat),
        statBonus,
        secondaryStat == null || secondaryStat.isBlank() ? null : StatType.fromKey(secondaryStat),
        secondaryStatBonus,
        levelRequirement == null ? 1 : levelRequirement,
        active == null || active);
  }
}
