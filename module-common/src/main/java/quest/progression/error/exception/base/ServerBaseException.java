package quest.progression.error.exception.base;

import quest.progression.error.ErrorCode;

/**
 * 호출자와 무관한 장애 ({@code S*} 코드)
 *
 * <p>항상 원인을 함께 받습니다. 받는 쪽은 콘텐츠 스냅샷 대신 정적 카탈로그를 쓰는 식으로 강등할 수 있습니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(requireFamily(errorCode, "S"), cause, args);
  }
}
