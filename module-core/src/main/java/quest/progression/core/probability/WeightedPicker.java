package quest.progression.core.probability;

import java.util.List;
import java.util.function.ToDoubleFunction;
import quest.progression.error.exception.EmptyContentPoolException;

/**
 * 누적 가중치 선택
 *
 * <p>{@code r = U[0,1) * totalWeight}를 뽑고 누적합이 처음으로 r을 넘는 항목을 고릅니다. 가중치 합이 0이면 균등 선택으로
 * 대체합니다.
 */
public final class WeightedPicker {

  private WeightedPicker() {}

  /**
   * @param items 후보 (비어 있으면 안 됨)
   * @param weight 항목별 가중치 (음수는 0으로 취급)
   * @param random 난수 소스
   * @throws EmptyContentPoolException 후보가 비어 있을 때
   */
  public static <T> T pick(List<T> items, ToDoubleFunction<T> weight, RandomSource random) {
    if (items == null || items.isEmpty()) {
      throw new EmptyContentPoolException("weighted pick");
    }
    double total = 0;
    for (T item : items) {
      total += Math.max(0, weight.applyAsDouble(item));
    }
    if (total <= 0) {
      return random.pick(items);
    }

    double roll = random.nextDouble() * total;
    double cumulative = 0;
    for (T item : items) {
      cumulative += Math.max(0, weight.applyAsDouble(item));
      if (roll < cumulative) {
        return item;
      }
    }
    // 부동소수점 오차로 끝까지 온 경우
    return items.get(items.size() - 1);
  }
}
