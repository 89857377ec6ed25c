package quest.progression.error;

/**
 * 에러 코드 계약
 *
 * <p>{@code C*} 코드는 호출자 계약 위반, {@code S*} 코드는 서버 측 장애를 뜻합니다. 메시지는 {@link
 * String#format(String, Object...)} 포맷 문자열입니다.
 */
public interface ErrorCode {
  String getCode();

  String getMessage();
}
