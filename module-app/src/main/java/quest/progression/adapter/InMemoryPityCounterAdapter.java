package quest.progression.adapter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import quest.progression.core.pity.PityCounters;
import quest.progression.core.port.out.PityCounterPort;

/**
 * 캐릭터별 천장 카운터 메모리 저장소
 *
 * <p>{@link PityCounters}가 불변이므로 값을 그대로 보관합니다. 같은 캐릭터의 load-save 구간은 호출 측이 직렬화합니다.
 */
public class InMemoryPityCounterAdapter implements PityCounterPort {

  private final Map<String, PityCounters> store = new ConcurrentHashMap<>();

  @Override
  public PityCounters load(String characterId) {
    return store.getOrDefault(characterId, PityCounters.empty());
  }

  @Override
  public void save(String characterId, PityCounters counters) {
    store.put(characterId, counters);
  }
}
