package quest.progression.core.card;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.card.CardDropContext;
import quest.progression.core.domain.model.card.CardSourceType;
import quest.progression.core.domain.model.card.ContentCardDefinition;
import quest.progression.core.probability.RandomSource;
import quest.progression.core.probability.WeightedPicker;

/**
 * 몬스터 카드 드롭 엔진
 *
 * <h3>획득처별 규칙</h3>
 *
 * <ul>
 *   <li>던전: 같은 테마의 던전 카드, 기본 10% (보스 방 15%)
 *   <li>투기장: 마일스톤 웨이브(15, 25, 35, ...)에서만, 기본 20%
 *   <li>원정: 기본 15%
 *   <li>레이드: 항상 드롭. 보스 이름이 획득처 이름에 포함된 카드 우선, 없으면 아무 레이드 카드
 * </ul>
 *
 * <p>후보 카드의 서버 설정 확률 평균이 0보다 크면 기본 확률 대신 사용합니다. 드롭이 확정되면 등급 가중치 {@code Common 5.0,
 * Uncommon 3.0, Rare 1.5, Epic 0.5, Legendary 0.1}로 누적 가중 선택합니다.
 */
public class CardDropEngine {

  private static final double[] RARITY_WEIGHTS = {5.0, 3.0, 1.5, 0.5, 0.1};
  private static final int ARENA_FIRST_MILESTONE = 15;

  private final RandomSource random;

  public CardDropEngine(RandomSource random) {
    this.random = random;
  }

  public Optional<ContentCardDefinition> rollCardDrop(
      CardSourceType sourceType, CardDropContext context, List<ContentCardDefinition> cardPool) {
    return switch (sourceType) {
      case DUNGEON -> rollDungeon(context, cardPool);
      case ARENA -> rollArena(context.arenaWave(), cardPool);
      case EXPEDITION ->
          rollChanced(
              candidates(CardSourceType.EXPEDITION, cardPool), false, CardSourceType.EXPEDITION);
      case RAID -> raidDrop(context.raidBossName(), cardPool);
    };
  }

  /** 투기장 마일스톤 웨이브: 15 이상이면서 10으로 나눈 나머지가 5 */
  public static boolean isArenaMilestone(int wave) {
    return wave >= ARENA_FIRST_MILESTONE && wave % 10 == 5;
  }

  public static double rarityWeight(Rarity rarity) {
    return RARITY_WEIGHTS[rarity.ordinal()];
  }

  /** 누적 가중치로 카드 하나 선택 */
  public ContentCardDefinition weightedRandomCard(List<ContentCardDefinition> cards) {
    return WeightedPicker.pick(cards, c -> rarityWeight(c.rarity()), random);
  }

  /** 서버 설정 확률 평균이 양수면 그 값, 아니면 기본 확률 */
  static double effectiveChance(List<ContentCardDefinition> candidates, double fallback) {
    OptionalDouble average =
        candidates.stream().mapToDouble(ContentCardDefinition::dropChance).average();
    return average.isPresent() && average.getAsDouble() > 0 ? average.getAsDouble() : fallback;
  }

  private Optional<ContentCardDefinition> rollDungeon(
      CardDropContext context, List<ContentCardDefinition> cardPool) {
    if (context.theme() == null) {
      return Optional.empty();
    }
    List<ContentCardDefinition> themed =
        candidates(CardSourceType.DUNGEON, cardPool).stream()
            .filter(c -> c.hasTheme(context.theme()))
            .toList();
    return rollChanced(themed, context.bossRoom(), CardSourceType.DUNGEON);
  }

  private Optional<ContentCardDefinition> rollArena(
      int wave, List<ContentCardDefinition> cardPool) {
    if (!isArenaMilestone(wave)) {
      return Optional.empty();
    }
    return rollChanced(candidates(CardSourceType.ARENA, cardPool), false, CardSourceType.ARENA);
  }

  private Optional<ContentCardDefinition> rollChanced(
      List<ContentCardDefinition> candidates, boolean boss, CardSourceType sourceType) {
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    double fallback = boss ? sourceType.getBossFallbackChance() : sourceType.getFallbackChance();
    if (!random.chance(effectiveChance(candidates, fallback))) {
      return Optional.empty();
    }
    return Optional.of(weightedRandomCard(candidates));
  }

  private Optional<ContentCardDefinition> raidDrop(
      String bossName, List<ContentCardDefinition> cardPool) {
    List<ContentCardDefinition> raidCards = candidates(CardSourceType.RAID, cardPool);
    if (raidCards.isEmpty()) {
      return Optional.empty();
    }
    if (bossName != null && !bossName.isBlank()) {
      String needle = bossName.toLowerCase(Locale.ROOT);
      Optional<ContentCardDefinition> bossCard =
          raidCards.stream()
              .filter(
                  c ->
                      c.sourceName() != null
                          && c.sourceName().toLowerCase(Locale.ROOT).contains(needle))
              .findFirst();
      if (bossCard.isPresent()) {
        return bossCard;
      }
    }
    return Optional.of(random.pick(raidCards));
  }

  private static List<ContentCardDefinition> candidates(
      CardSourceType sourceType, List<ContentCardDefinition> cardPool) {
    return cardPool.stream().filter(c -> c.active() && c.sourceType() == sourceType).toList();
  }
}
