package quest.progression.common.resource;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.util.Objects;
import quest.progression.error.exception.CatalogLoadException;

/**
 * 콘텐츠 스냅샷 같은 번들 리소스를 클래스패스에서 찾습니다.
 *
 * <p>위치는 {@code catalog/content.json}, {@code /catalog/content.json}, {@code
 * classpath:catalog/content.json} 모두 같은 리소스를 가리킵니다.
 */
public class ClasspathResources {

  private static final String CLASSPATH_PREFIX = "classpath:";

  private final ClassLoader classLoader;

  public ClasspathResources() {
    this(ClasspathResources.class.getClassLoader());
  }

  public ClasspathResources(ClassLoader classLoader) {
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
  }

  /**
   * 리소스 스트림을 엽니다. 닫는 것은 호출자 몫입니다.
   *
   * @throws CatalogLoadException 리소스가 없을 때 (원인은 {@link FileNotFoundException})
   */
  public InputStream open(String location) {
    String path = normalize(location);
    InputStream in = classLoader.getResourceAsStream(path);
    if (in == null) {
      throw new CatalogLoadException(location, new FileNotFoundException(path));
    }
    return in;
  }

  public boolean exists(String location) {
    return classLoader.getResource(normalize(location)) != null;
  }

  static String normalize(String location) {
    if (location == null || location.isBlank()) {
      throw new IllegalArgumentException("resource location must not be blank");
    }
    String path = location.strip();
    if (path.startsWith(CLASSPATH_PREFIX)) {
      path = path.substring(CLASSPATH_PREFIX.length());
    }
    while (path.startsWith("/")) {
      path = path.substring(1);
    }
    return path;
  }
}
