package quest.progression.core.pity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 캐릭터별 천장 카운터 (불변)
 *
 * <p>모든 갱신은 새 인스턴스를 반환합니다. 호출자는 판정 결과의 카운터를 저장소에 다시 씁니다.
 */
public final class PityCounters {

  private static final PityCounters EMPTY = new PityCounters(new EnumMap<>(PityContentType.class));

  private final EnumMap<PityContentType, Integer> counts;

  private PityCounters(EnumMap<PityContentType, Integer> counts) {
    this.counts = counts;
  }

  public static PityCounters empty() {
    return EMPTY;
  }

  public static PityCounters of(Map<PityContentType, Integer> counts) {
    EnumMap<PityContentType, Integer> copy = new EnumMap<>(PityContentType.class);
    counts.forEach(
        (type, count) -> {
          if (count == null || count < 0) {
            throw new IllegalArgumentException("pity counter must be non-negative: " + type);
          }
          copy.put(type, count);
        });
    return new PityCounters(copy);
  }

  /** 저장 형식({@code "dungeons" -> 3})에서 복원 */
  public static PityCounters fromKeys(Map<String, Integer> counts) {
    Map<PityContentType, Integer> typed = new EnumMap<>(PityContentType.class);
    counts.forEach((key, count) -> typed.put(PityContentType.fromKey(key), count));
    return of(typed);
  }

  public int get(PityContentType type) {
    return counts.getOrDefault(type, 0);
  }

  public PityCounters increment(PityContentType type) {
    return with(type, get(type) + 1);
  }

  public PityCounters reset(PityContentType type) {
    return with(type, 0);
  }

  /** 저장 형식 */
  public Map<String, Integer> asKeyMap() {
    Map<String, Integer> map = new LinkedHashMap<>();
    counts.forEach((type, count) -> map.put(type.getKey(), count));
    return Collections.unmodifiableMap(map);
  }

  private PityCounters with(PityContentType type, int value) {
    EnumMap<PityContentType, Integer> copy = new EnumMap<>(PityContentType.class);
    copy.putAll(counts);
    copy.put(type, value);
    return new PityCounters(copy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PityCounters other)) {
      return false;
    }
    for (PityContentType type : PityContentType.values()) {
      if (get(type) != other.get(type)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = 1;
    for (PityContentType type : PityContentType.values()) {
      hash = 31 * hash + get(type);
    }
    return hash;
  }

  @Override
  public String toString() {
    return "PityCounters" + counts;
  }
}
