package quest.progression.core.domain.model;

import java.util.Arrays;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.core.domain.model.dungeon.EncounterType;
import quest.progression.error.exception.UnknownContentKeyException;

/**
 * 캐릭터 직업
 *
 * <h3>던전 보정치</h3>
 *
 * <ul>
 *   <li>encounterPowerMultiplier: 특기 조우(bonusEncounterType)에서 해당 능력치에 곱해 더하는 비율
 *   <li>partyPowerMultiplier: 파티 전체 전투력에 더하는 비율 (Enchanter)
 *   <li>damageReduction: 실패 피해 감소율 (Paladin)
 *   <li>lootDropBonus: 방 전리품 확률 가산 (Trickster)
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum CharacterClass {
  WARRIOR("warrior", ClassLine.WARRIOR, StatType.STRENGTH, EncounterType.COMBAT, 0.25, 0, 0, 0),
  MAGE("mage", ClassLine.MAGE, StatType.WISDOM, EncounterType.PUZZLE, 0.25, 0, 0, 0),
  ARCHER("archer", ClassLine.ARCHER, StatType.DEXTERITY, EncounterType.TRAP, 0.20, 0, 0, 0),
  BERSERKER("berserker", ClassLine.WARRIOR, StatType.STRENGTH, EncounterType.COMBAT, 0.40, 0, 0, 0),
  PALADIN("paladin", ClassLine.WARRIOR, StatType.DEXTERITY, null, 0, 0, 0.50, 0),
  SORCERER("sorcerer", ClassLine.MAGE, StatType.WISDOM, EncounterType.PUZZLE, 0.40, 0, 0, 0),
  ENCHANTER("enchanter", ClassLine.MAGE, StatType.CHARISMA, null, 0, 0.20, 0, 0),
  RANGER("ranger", ClassLine.ARCHER, StatType.DEXTERITY, EncounterType.TRAP, 0.30, 0, 0, 0),
  TRICKSTER("trickster", ClassLine.ARCHER, StatType.LUCK, null, 0, 0, 0, 0.25);

  private final String key;
  private final ClassLine classLine;
  private final StatType primaryStat;
  private final EncounterType bonusEncounterType;
  private final double encounterPowerMultiplier;
  private final double partyPowerMultiplier;
  private final double damageReduction;
  private final double lootDropBonus;

  /**
   * 이 직업이 해당 조우에서 특기 보정을 받는지 여부. 보스 방에서는 Warrior만 추가로 보정을 받습니다.
   *
   * @param encounterType 방의 조우 유형
   */
  public boolean hasEncounterBonus(EncounterType encounterType) {
    if (bonusEncounterType == null) {
      return false;
    }
    return bonusEncounterType == encounterType
        || (encounterType == EncounterType.BOSS && this == WARRIOR);
  }

  public Optional<EncounterType> bonusEncounter() {
    return Optional.ofNullable(bonusEncounterType);
  }

  public static CharacterClass fromKey(String key) {
    return Arrays.stream(values())
        .filter(c -> c.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("class", key));
  }
}
