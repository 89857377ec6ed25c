package quest.progression.adapter;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import quest.progression.core.domain.model.card.MonsterCard;
import quest.progression.core.port.out.MonsterCardPort;

/** 소유자 + 카드 정의 id 기준 메모리 저장소 */
public class InMemoryMonsterCardAdapter implements MonsterCardPort {

  private final Map<String, Map<String, MonsterCard>> byOwner = new ConcurrentHashMap<>();

  @Override
  public Optional<MonsterCard> findByOwnerAndCardId(String ownerId, String cardId) {
    return Optional.ofNullable(byOwner.getOrDefault(ownerId, Map.of()).get(cardId));
  }

  @Override
  public List<MonsterCard> findByOwner(String ownerId) {
    return byOwner.getOrDefault(ownerId, Map.of()).values().stream()
        .sorted(Comparator.comparing(MonsterCard::getCollectedAt))
        .toList();
  }

  @Override
  public MonsterCard save(MonsterCard card) {
    byOwner
        .computeIfAbsent(card.getOwnerId(), k -> new ConcurrentHashMap<>())
        .put(card.getCardId(), card);
    return card;
  }
}
