package quest.progression.core.catalog;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import quest.progression.core.domain.model.AffixDefinition;
import quest.progression.core.domain.model.AffixType;
import quest.progression.core.domain.model.EquipmentSlot;
import quest.progression.core.domain.model.EquipmentTemplate;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.card.CardSourceType;
import quest.progression.core.domain.model.card.ContentCardDefinition;

/**
 * 콘텐츠 카탈로그 조회
 *
 * <p>질의마다 "서버 데이터 우선, 없으면 정적 데이터" 규칙을 적용합니다. 서버 스냅샷이 적재되어 있고 조건에 맞는 활성 항목이 하나라도 있으면
 * 서버 결과를, 아니면 정적 소스 결과를 반환합니다. 반환 형태는 두 경우 모두 같습니다.
 */
public class ContentCatalog {

  private final CatalogSource remote;
  private final CatalogSource fallback;

  public ContentCatalog(CatalogSource remote, CatalogSource fallback) {
    this.remote = remote;
    this.fallback = fallback;
  }

  /** 서버 데이터 없이 정적 소스만 사용 */
  public static ContentCatalog staticOnly() {
    return new ContentCatalog(RemoteCatalogSource.unloaded(), new StaticCatalogSource());
  }

  public boolean isRemoteLoaded() {
    return remote.isLoaded();
  }

  /**
   * 슬롯/등급/최대 레벨 조건에 맞는 템플릿
   *
   * @param slot null이면 모든 슬롯
   * @param maxLevel null이면 제한 없음
   */
  public List<EquipmentTemplate> templates(EquipmentSlot slot, Rarity rarity, Integer maxLevel) {
    return resolve(
        CatalogSource::equipmentTemplates, t -> t.matches(slot, rarity, maxLevel));
  }

  /** 해당 등급 아이템에 붙을 수 있는 활성 옵션 정의 */
  public List<AffixDefinition> affixes(AffixType type, Rarity itemRarity) {
    return resolve(
        CatalogSource::affixDefinitions, a -> a.type() == type && a.availableFor(itemRarity));
  }

  /** 획득처가 일치하는 활성 카드 정의 */
  public List<ContentCardDefinition> cards(CardSourceType sourceType) {
    return resolve(
        CatalogSource::cardDefinitions, c -> c.active() && c.sourceType() == sourceType);
  }

  /** 모든 활성 카드 정의 */
  public List<ContentCardDefinition> activeCards() {
    return resolve(CatalogSource::cardDefinitions, ContentCardDefinition::active);
  }

  private <T> List<T> resolve(Function<CatalogSource, List<T>> getter, Predicate<T> filter) {
    if (remote.isLoaded()) {
      List<T> fromRemote = getter.apply(remote).stream().filter(filter).toList();
      if (!fromRemote.isEmpty()) {
        return fromRemote;
      }
    }
    return getter.apply(fallback).stream().filter(filter).toList();
  }
}
