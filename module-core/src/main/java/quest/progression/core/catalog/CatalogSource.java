package quest.progression.core.catalog;

import java.util.List;
import quest.progression.core.domain.model.AffixDefinition;
import quest.progression.core.domain.model.EquipmentTemplate;
import quest.progression.core.domain.model.card.ContentCardDefinition;

/**
 * 콘텐츠 카탈로그 데이터 소스
 *
 * <p>두 구현만 존재합니다: 서버에서 받은 스냅샷인 {@link RemoteCatalogSource}, 내장 데이터인 {@link
 * StaticCatalogSource}. 선택은 {@link ContentCatalog}가 질의마다 수행합니다.
 */
public interface CatalogSource {

  /** 스냅샷이 적재되었는지. 정적 소스는 항상 true */
  boolean isLoaded();

  List<EquipmentTemplate> equipmentTemplates();

  List<AffixDefinition> affixDefinitions();

  List<ContentCardDefinition> cardDefinitions();
}
