package quest.progression.core.dungeon;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import quest.progression.core.domain.model.CharacterClass;
import quest.progression.core.domain.model.PartyMember;
import quest.progression.core.domain.model.StatType;
import quest.progression.core.domain.model.dungeon.DungeonRoom;

/**
 * 파티 전투력과 파티 단위 보정치 계산
 *
 * <h3>전투력</h3>
 *
 * <ol>
 *   <li>파티원별 판정 능력치 값을 합산
 *   <li>직업 특기 조우와 방 유형이 맞으면 {@code stat * encounterPowerMultiplier} 추가 (전투 특기 직업은 보스 방 포함)
 *   <li>Enchanter가 있으면 합계의 20% 추가
 * </ol>
 */
public class PartyPowerCalculator {

  static final double MAX_DAMAGE_REDUCTION = 0.75;

  /** 방 기본 능력치로 계산 */
  public int calculatePartyPower(List<PartyMember> party, DungeonRoom room) {
    return calculatePartyPower(party, room, null);
  }

  /**
   * @param statOverride 공략법 능력치 (null이면 방 기본 능력치)
   */
  public int calculatePartyPower(List<PartyMember> party, DungeonRoom room, StatType statOverride) {
    StatType stat = statOverride != null ? statOverride : room.primaryStat();
    int total = 0;
    for (PartyMember member : party) {
      int value = member.statValue(stat);
      int memberPower = value;
      CharacterClass clazz = member.characterClass();
      if (clazz != null && clazz.hasEncounterBonus(room.encounterType())) {
        memberPower += (int) (value * clazz.getEncounterPowerMultiplier());
      }
      total += memberPower;
    }
    if (hasClass(party, CharacterClass.ENCHANTER)) {
      total += (int) (total * CharacterClass.ENCHANTER.getPartyPowerMultiplier());
    }
    return total;
  }

  /** 파티에 있는 직업들의 피해 감소 합 (최대 75%) */
  public double damageReduction(Collection<PartyMember> party) {
    double reduction =
        party.stream()
            .map(PartyMember::characterClass)
            .filter(Objects::nonNull)
            .distinct()
            .mapToDouble(CharacterClass::getDamageReduction)
            .sum();
    return Math.min(MAX_DAMAGE_REDUCTION, reduction);
  }

  /** 파티원 중 가장 큰 전리품 확률 가산 */
  public double classLootBonus(Collection<PartyMember> party) {
    return party.stream()
        .map(PartyMember::characterClass)
        .filter(Objects::nonNull)
        .mapToDouble(CharacterClass::getLootDropBonus)
        .max()
        .orElse(0.0);
  }

  /** 파티원 던전 성공 가산의 평균 */
  public double averageSuccessBonus(Collection<PartyMember> party) {
    return party.stream().mapToDouble(PartyMember::dungeonSuccessBonus).sum()
        / Math.max(1, party.size());
  }

  public int maxLuck(Collection<PartyMember> party) {
    return party.stream().mapToInt(PartyMember::luck).max().orElse(0);
  }

  public int totalMaxHp(Collection<PartyMember> party) {
    return party.stream().mapToInt(PartyMember::maxHp).sum();
  }

  private static boolean hasClass(Collection<PartyMember> party, CharacterClass clazz) {
    return party.stream().anyMatch(m -> m.is(clazz));
  }
}
