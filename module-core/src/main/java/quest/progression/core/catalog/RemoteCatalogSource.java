package quest.progression.core.catalog;

import java.util.List;
import quest.progression.core.domain.model.AffixDefinition;
import quest.progression.core.domain.model.EquipmentTemplate;
import quest.progression.core.domain.model.card.ContentCardDefinition;

/**
 * 서버 콘텐츠 스냅샷
 *
 * <p>이미 메모리에 적재된 목록만 보관합니다. 네트워크/파일 I/O는 앱 계층의 로더가 담당하며, 적재 전에는 {@link #unloaded()}를
 * 사용합니다.
 */
public record RemoteCatalogSource(
    boolean loaded,
    List<EquipmentTemplate> equipmentTemplates,
    List<AffixDefinition> affixDefinitions,
    List<ContentCardDefinition> cardDefinitions)
    implements CatalogSource {

  public RemoteCatalogSource {
    equipmentTemplates = equipmentTemplates == null ? List.of() : List.copyOf(equipmentTemplates);
    affixDefinitions = affixDefinitions == null ? List.of() : List.copyOf(affixDefinitions);
    cardDefinitions = cardDefinitions == null ? List.of() : List.copyOf(cardDefinitions);
  }

  public static RemoteCatalogSource unloaded() {
    return new RemoteCatalogSource(false, List.of(), List.of(), List.of());
  }

  public static RemoteCatalogSource of(
      List<EquipmentTemplate> templates,
      List<AffixDefinition> affixes,
      List<ContentCardDefinition> cards) {
    return new RemoteCatalogSource(true, templates, affixes, cards);
  }

  @Override
  public boolean isLoaded() {
    return loaded;
  }
}
