package quest.progression.core.calculator;

import quest.progression.core.domain.model.Rarity;

/**
 * 상한 적용까지 끝난 등급 굴림 결과
 *
 * @param rarity 최종 등급
 * @param softCapped 저 tier Epic이 유지 판정에 실패해 강등되었는지
 */
public record RarityRoll(Rarity rarity, boolean softCapped) {}
