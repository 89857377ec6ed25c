package quest.progression.error.exception.base;

import lombok.Getter;
import quest.progression.error.ErrorCode;

/** 모든 엔진 예외의 공통 부모. 메시지는 {@link ErrorCode}의 포맷 문자열에 인자를 채운 값입니다. */
@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;
  private final String message;

  protected BaseException(ErrorCode errorCode, Object... args) {
    this(errorCode, null, args);
  }

  protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
    this.message = String.format(errorCode.getMessage(), args);
  }

  /** 코드 접두사가 예외 계층(C: 호출자, S: 서버)과 맞는지 확인합니다. */
  protected static ErrorCode requireFamily(ErrorCode errorCode, String prefix) {
    if (!errorCode.getCode().startsWith(prefix)) {
      throw new IllegalArgumentException(
          "error code " + errorCode.getCode() + " is not in the " + prefix + "* family");
    }
    return errorCode;
  }
}
