package quest.progression.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.progression.core.card.CardBonusCalculator;
import quest.progression.core.card.CardCollector;
import quest.progression.core.card.CardDropEngine;
import quest.progression.core.catalog.ContentCatalog;
import quest.progression.core.domain.model.card.CardBonusSummary;
import quest.progression.core.domain.model.card.CardDropContext;
import quest.progression.core.domain.model.card.CardSourceType;
import quest.progression.core.domain.model.card.CollectResult;
import quest.progression.core.domain.model.card.ContentCardDefinition;
import quest.progression.core.domain.model.card.MonsterCard;
import quest.progression.core.port.out.MonsterCardPort;

/** 몬스터 카드 드롭, 수집, 보너스 집계 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CardService {

  private final CardDropEngine cardDropEngine;
  private final CardCollector cardCollector;
  private final CardBonusCalculator bonusCalculator;
  private final ContentCatalog contentCatalog;
  private final MonsterCardPort monsterCardPort;
  private final Clock clock;

  /**
   * 카탈로그의 활성 카드로 드롭을 판정하고, 드롭되면 소유자 카드에 반영합니다.
   *
   * @return 드롭이 없으면 empty
   */
  public Optional<CollectResult> rollAndCollect(
      String ownerId, CardSourceType sourceType, CardDropContext context) {
    List<ContentCardDefinition> pool = contentCatalog.cards(sourceType);
    return cardDropEngine
        .rollCardDrop(sourceType, context, pool)
        .map(definition -> collect(ownerId, definition));
  }

  /** 이미 결정된 카드 정의 id들을 수집합니다 (던전 정산 결과 등). 카탈로그에 없는 id는 건너뜁니다. */
  public List<CollectResult> collectAll(String ownerId, List<String> cardIds) {
    if (cardIds.isEmpty()) {
      return List.of();
    }
    List<ContentCardDefinition> active = contentCatalog.activeCards();
    return cardIds.stream()
        .map(cardId -> findDefinition(active, ownerId, cardId))
        .flatMap(Optional::stream)
        .map(definition -> collect(ownerId, definition))
        .toList();
  }

  public CollectResult collect(String ownerId, ContentCardDefinition definition) {
    MonsterCard existing =
        monsterCardPort.findByOwnerAndCardId(ownerId, definition.id()).orElse(null);
    CollectResult result =
        cardCollector.collect(definition, ownerId, existing, Instant.now(clock));
    monsterCardPort.save(result.card());

    if (result.rarityUpgraded()) {
      log.info(
          "[CardService] {} upgraded {} to {} ({} duplicates)",
          ownerId,
          definition.id(),
          result.card().getRarity(),
          result.card().getDuplicateCount());
    } else {
      log.debug("[CardService] {} collected {} ({})", ownerId, definition.id(), result.outcome());
    }
    return result;
  }

  private static Optional<ContentCardDefinition> findDefinition(
      List<ContentCardDefinition> definitions, String ownerId, String cardId) {
    Optional<ContentCardDefinition> found =
        definitions.stream().filter(d -> d.id().equals(cardId)).findFirst();
    if (found.isEmpty()) {
      log.warn("[CardService] Unknown card {} for {}, skipped", cardId, ownerId);
    }
    return found;
  }

  public CardBonusSummary summary(String ownerId) {
    return bonusCalculator.summarize(monsterCardPort.findByOwner(ownerId));
  }
}
