package quest.progression.core.domain.model.dungeon;

import java.util.Arrays;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import quest.progression.core.domain.model.StatType;
import quest.progression.error.exception.UnknownContentKeyException;

/** 던전 방의 조우 유형과 유형별 표준 공략법 */
@Getter
@AllArgsConstructor
public enum EncounterType {
  COMBAT("combat"),
  PUZZLE("puzzle"),
  TRAP("trap"),
  TREASURE("treasure"),
  BOSS("boss");

  private final String key;

  /**
   * 유형별 표준 공략법 (stat, power, risk)
   *
   * <p>power가 높은 공략은 risk도 높습니다. 자동 진행은 이 중 기대 전투력이 가장 큰 것을 고릅니다.
   */
  public List<RoomApproach> approaches() {
    return switch (this) {
      case COMBAT ->
          List.of(
              RoomApproach.of("aggressive_strike", StatType.STRENGTH, 1.25, 1.5),
              RoomApproach.of("defensive_stance", StatType.DEFENSE, 0.9, 0.7),
              RoomApproach.of("tactical_maneuver", StatType.DEXTERITY, 1.1, 1.0));
      case PUZZLE ->
          List.of(
              RoomApproach.of("analyze", StatType.WISDOM, 1.0, 0.8),
              RoomApproach.of("intuition", StatType.LUCK, 1.3, 1.5),
              RoomApproach.of("negotiate", StatType.CHARISMA, 1.05, 1.0));
      case TRAP ->
          List.of(
              RoomApproach.of("disarm", StatType.DEXTERITY, 1.1, 1.0),
              RoomApproach.of("tank_through", StatType.DEFENSE, 0.85, 0.6),
              RoomApproach.of("alternate_route", StatType.WISDOM, 1.2, 1.3));
      case TREASURE ->
          List.of(
              RoomApproach.of("open_carefully", StatType.DEXTERITY, 1.0, 0.7),
              RoomApproach.of("detect_magic", StatType.WISDOM, 1.1, 1.0),
              RoomApproach.of("just_grab_it", StatType.LUCK, 1.35, 1.6));
      case BOSS ->
          List.of(
              RoomApproach.of("all_out_assault", StatType.STRENGTH, 1.3, 1.6),
              RoomApproach.of("endurance_battle", StatType.DEFENSE, 0.95, 0.7),
              RoomApproach.of("exploit_weakness", StatType.WISDOM, 1.2, 1.2));
    };
  }

  public static EncounterType fromKey(String key) {
    return Arrays.stream(values())
        .filter(t -> t.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new UnknownContentKeyException("encounter type", key));
  }
}
