package quest.progression.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 던전 진행 설정
 *
 * @param defaultRoomCount 런당 목표 방 수. 0이면 방 풀 크기로 결정 ({@code min(7, max(5, poolSize - 2))})
 */
@Validated
@ConfigurationProperties(prefix = "progression.dungeon")
public record DungeonProperties(@DefaultValue("0") @Min(0) @Max(20) int defaultRoomCount) {

  public static DungeonProperties defaults() {
    return new DungeonProperties(0);
  }

  /** 코어에 넘길 목표 방 수 (미설정이면 null) */
  public Integer targetRoomCount() {
    return defaultRoomCount > 0 ? defaultRoomCount : null;
  }
}
