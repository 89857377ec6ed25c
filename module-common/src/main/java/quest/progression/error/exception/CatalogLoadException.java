package quest.progression.error.exception;

import quest.progression.error.CommonErrorCode;
import quest.progression.error.exception.base.ServerBaseException;

/**
 * 콘텐츠 카탈로그 리소스를 읽거나 해석하지 못했을 때 발생합니다.
 *
 * <p>호출 측은 이 예외를 잡아 정적 카탈로그로 강등(degrade)합니다. 게임 진행을 중단시키지 않습니다.
 */
public class CatalogLoadException extends ServerBaseException {

  public CatalogLoadException(String location, Throwable cause) {
    super(CommonErrorCode.DATA_INITIALIZATION_FAILED, cause, location);
  }
}
