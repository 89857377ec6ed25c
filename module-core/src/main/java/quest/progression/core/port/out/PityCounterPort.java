package quest.progression.core.port.out;

import quest.progression.core.pity.PityCounters;

/**
 * 캐릭터별 천장 카운터 저장소 포트
 *
 * <p>module-app 어댑터가 구현합니다. 카운터는 캐릭터에 귀속되며 로드/저장 사이의 값은 엔진이 관리합니다.
 */
public interface PityCounterPort {

  /**
   * @param characterId 캐릭터 id
   * @return 저장된 카운터, 없으면 {@link PityCounters#empty()}
   */
  PityCounters load(String characterId);

  void save(String characterId, PityCounters counters);
}
