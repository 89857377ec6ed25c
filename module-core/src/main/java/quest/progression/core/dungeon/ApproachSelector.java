package quest.progression.core.dungeon;

import java.util.List;
import quest.progression.core.domain.model.PartyMember;
import quest.progression.core.domain.model.dungeon.DungeonRoom;
import quest.progression.core.domain.model.dungeon.RoomApproach;

/** 자동 진행용 공략법 선택: {@code 파티 전투력(공략 능력치) * powerModifier}가 가장 큰 표준 공략법 */
public class ApproachSelector {

  private final PartyPowerCalculator powerCalculator;

  public ApproachSelector(PartyPowerCalculator powerCalculator) {
    this.powerCalculator = powerCalculator;
  }

  public RoomApproach autoSelectBestApproach(List<PartyMember> party, DungeonRoom room) {
    List<RoomApproach> approaches = room.encounterType().approaches();
    if (approaches.isEmpty()) {
      return RoomApproach.direct(room.primaryStat());
    }
    RoomApproach best = approaches.get(0);
    double bestPower = 0;
    for (RoomApproach approach : approaches) {
      double power =
          powerCalculator.calculatePartyPower(party, room, approach.primaryStat())
              * approach.powerModifier();
      if (power > bestPower) {
        bestPower = power;
        best = approach;
      }
    }
    return best;
  }
}
