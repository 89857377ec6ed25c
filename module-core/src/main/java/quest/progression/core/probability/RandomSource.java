package quest.progression.core.probability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import quest.progression.error.exception.EmptyContentPoolException;

/**
 * 게임 판정용 난수 소스
 *
 * <p>모든 굴림기(roller)는 이 인터페이스를 주입받습니다. 운영 환경은 시드 없는 {@link ThreadLocalRandomSource}, 테스트는
 * 값을 지정할 수 있는 구현을 사용합니다. 파생 연산은 모두 {@link #nextDouble()} 하나로 정의되어, 스크립트된 값 하나가 굴림 하나에
 * 대응합니다.
 */
public interface RandomSource {

  /** [0, 1) 균등 분포 */
  double nextDouble();

  /** [minInclusive, maxInclusive] 균등 정수 */
  default int nextInt(int minInclusive, int maxInclusive) {
    if (maxInclusive < minInclusive) {
      throw new IllegalArgumentException("empty range: " + minInclusive + ".." + maxInclusive);
    }
    int span = maxInclusive - minInclusive + 1;
    int offset = (int) Math.floor(nextDouble() * span);
    return minInclusive + Math.min(offset, span - 1);
  }

  /** [min, max] 균등 실수 */
  default double nextDouble(double min, double max) {
    return min + nextDouble() * (max - min);
  }

  /**
   * 확률 p로 true. {@code p <= 0}이면 항상 false, {@code p >= 1}이면 항상 true입니다.
   *
   * @param probability 성공 확률
   */
  default boolean chance(double probability) {
    return probability > 0 && nextDouble() <= probability;
  }

  /**
   * 균등 선택
   *
   * @throws EmptyContentPoolException 빈 목록
   */
  default <T> T pick(List<T> items) {
    if (items == null || items.isEmpty()) {
      throw new EmptyContentPoolException("random pick");
    }
    return items.get(nextInt(0, items.size() - 1));
  }

  /** Fisher-Yates 셔플 (새 목록 반환) */
  default <T> List<T> shuffle(List<T> items) {
    List<T> copy = new ArrayList<>(items);
    for (int i = copy.size() - 1; i > 0; i--) {
      Collections.swap(copy, i, nextInt(0, i));
    }
    return copy;
  }
}
