package quest.progression.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import quest.progression.catalog.dto.CatalogDocument;
import quest.progression.common.resource.ClasspathResources;
import quest.progression.core.catalog.RemoteCatalogSource;
import quest.progression.error.exception.CatalogLoadException;
import quest.progression.error.exception.base.BaseException;

/**
 * 클래스패스 JSON에서 콘텐츠 스냅샷을 읽습니다.
 *
 * <h3>Failure Mode</h3>
 *
 * <ul>
 *   <li>파일 없음, JSON 구문 오류, 알 수 없는 키, 불변식 위반: {@link CatalogLoadException}
 *   <li>위치는 {@code classpath:} 접두사를 붙여도 됩니다
 *   <li>{@link #loadOrUnloaded(String)}는 이를 warn으로 기록하고 적재되지 않은 소스를 반환합니다. 조회는 정적 카탈로그로 이어집니다.
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class JsonCatalogLoader {

  private final ObjectMapper objectMapper;
  private final ClasspathResources resources;

  /**
   * @throws CatalogLoadException 읽기/해석 실패
   */
  public RemoteCatalogSource load(String location) {
    // 없는 리소스는 open이 원인 그대로 CatalogLoadException을 던짐
    InputStream opened = resources.open(location);
    try (InputStream in = opened) {
      CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
      RemoteCatalogSource source = document.toSource();
      log.info(
          "[ContentCatalog] Loaded {} (version={}, templates={}, affixes={}, cards={})",
          location,
          document.version(),
          source.equipmentTemplates().size(),
          source.affixDefinitions().size(),
          source.cardDefinitions().size());
      return source;
    } catch (IOException | IllegalArgumentException | BaseException e) {
      throw new CatalogLoadException(location, e);
    }
  }

  /** 실패 시 정적 카탈로그로 강등합니다. */
  public RemoteCatalogSource loadOrUnloaded(String location) {
    if (!resources.exists(location)) {
      log.warn("[ContentCatalog] {} not found - falling back to static catalog", location);
      return RemoteCatalogSource.unloaded();
    }
    try {
      return load(location);
    } catch (CatalogLoadException e) {
      log.warn("[ContentCatalog] {} - falling back to static catalog", e.getMessage(), e);
      return RemoteCatalogSource.unloaded();
    }
  }
}
