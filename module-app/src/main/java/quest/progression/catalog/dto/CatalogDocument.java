package quest.progression.catalog.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import quest.progression.core.catalog.RemoteCatalogSource;

/**
 * 콘텐츠 스냅샷 JSON 최상위 문서
 *
 * <pre>
 * {
 *   "version": 3,
 *   "equipment": [ ... ],
 *   "affixes": [ ... ],
 *   "cards": [ ... ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CatalogDocument(
    Integer version,
    List<EquipmentRow> equipment,
    List<AffixRow> affixes,
    List<CardRow> cards) {

  public RemoteCatalogSource toSource() {
    return RemoteCatalogSource.of(
        rows(equipment).stream().map(EquipmentRow::toTemplate).toList(),
        rows(affixes).stream().map(AffixRow::toDefinition).toList(),
        rows(cards).stream().map(CardRow::toDefinition).toList());
  }

  public int size() {
    return rows(equipment).size() + rows(affixes).size() + rows(cards).size();
  }

  private static <T> List<T> rows(List<T> list) {
    return list == null ? List.of() : list;
  }
}
