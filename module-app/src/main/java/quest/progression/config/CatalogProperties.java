package quest.progression.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 콘텐츠 카탈로그 설정
 *
 * <pre>
 * progression:
 *   catalog:
 *     enabled: true
 *     location: catalog/content.json
 * </pre>
 *
 * @param enabled false면 서버 스냅샷을 읽지 않고 정적 카탈로그만 사용
 * @param location 클래스패스 JSON 경로
 */
@Validated
@ConfigurationProperties(prefix = "progression.catalog")
public record CatalogProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("catalog/content.json") @NotBlank String location) {

  public static CatalogProperties defaults() {
    return new CatalogProperties(true, "catalog/content.json");
  }
}
