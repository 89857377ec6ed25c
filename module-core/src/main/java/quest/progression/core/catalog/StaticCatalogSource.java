package quest.progression.core.catalog;

import java.util.List;
import java.util.stream.Stream;
import quest.progression.core.domain.model.AffixDefinition;
import quest.progression.core.domain.model.AffixType;
import quest.progression.core.domain.model.EquipmentTemplate;
import quest.progression.core.domain.model.card.ContentCardDefinition;

/**
 * 내장 카탈로그
 *
 * <p>서버 데이터가 없을 때의 대체 경로입니다. 옵션 풀(접두 10종, 접미 8종)만 제공하고, 템플릿과 카드는 비어 있어 장비는 절차 생성으로,
 * 카드는 드롭 없음으로 귀결됩니다.
 */
public class StaticCatalogSource implements CatalogSource {

  private static final List<AffixDefinition> PREFIXES =
      List.of(
          prefix("blazing", "exp_physical_percent", 3, 10),
          prefix("scholarly", "exp_mental_percent", 3, 10),
          prefix("social", "exp_social_percent", 3, 10),
          prefix("industrious", "exp_household_percent", 3, 10),
          prefix("mindful", "exp_wellness_percent", 3, 10),
          prefix("inspired", "exp_creative_percent", 3, 10),
          prefix("swift", "mission_duration_reduction", 3, 8),
          prefix("prosperous", "gold_percent", 3, 8),
          prefix("lucky", "rare_drop_chance", 2, 6),
          prefix("resilient", "streak_shield_chance", 3, 8));

  private static final List<AffixDefinition> SUFFIXES =
      List.of(
          suffix("vigilant", "dungeon_success_percent", 3, 8),
          suffix("of_fortune", "loot_drop_chance_percent", 2, 6),
          suffix("of_scholar", "mission_speed_percent", 3, 8),
          suffix("of_devotion", "party_bond_exp_percent", 3, 8),
          suffix("of_persistence", "habit_streak_bonus_percent", 3, 8),
          suffix("of_pathfinder", "expedition_reward_percent", 3, 8),
          suffix("of_warding", "defense_flat", 2, 6),
          suffix("of_haste", "dungeon_room_time_reduction", 3, 8));

  @Override
  public boolean isLoaded() {
    return true;
  }

  @Override
  public List<EquipmentTemplate> equipmentTemplates() {
    return List.of();
  }

  @Override
  public List<AffixDefinition> affixDefinitions() {
    return Stream.concat(PREFIXES.stream(), SUFFIXES.stream()).toList();
  }

  @Override
  public List<ContentCardDefinition> cardDefinitions() {
    return List.of();
  }

  private static AffixDefinition prefix(String id, String bonusType, double min, double max) {
    return AffixDefinition.of(id, AffixType.PREFIX, bonusType, min, max);
  }

  private static AffixDefinition suffix(String id, String bonusType, double min, double max) {
    return AffixDefinition.of(id, AffixType.SUFFIX, bonusType, min, max);
  }
}
