package quest.progression.error.exception.base;

import quest.progression.error.ErrorCode;

/**
 * 호출자 계약 위반 ({@code C*} 코드)
 *
 * <p>잘못된 tier, 모르는 키, 빈 풀은 호출 코드의 버그이므로 기본값으로 대체하지 않습니다. 던전 실패나 빈 천장 판정 같은 게임 결과는 이 계층에
 * 속하지 않습니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(requireFamily(errorCode, "C"), args);
  }
}
