package quest.progression.core.port.out;

import java.util.List;
import java.util.Optional;
import quest.progression.core.domain.model.card.MonsterCard;

/** 소유 카드 저장소 포트. (ownerId, cardId) 쌍은 유일합니다. */
public interface MonsterCardPort {

  Optional<MonsterCard> findByOwnerAndCardId(String ownerId, String cardId);

  List<MonsterCard> findByOwner(String ownerId);

  MonsterCard save(MonsterCard card);
}
