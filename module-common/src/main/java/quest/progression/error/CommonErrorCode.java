package quest.progression.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (caller contract) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s"),
  INVALID_TIER("C002", "tier는 1 이상이어야 합니다 (입력: %s)"),
  UNKNOWN_CONTENT_KEY("C003", "알 수 없는 %s 키입니다: %s"),
  EMPTY_CONTENT_POOL("C004", "비어 있는 콘텐츠 풀입니다 (대상: %s)"),
  INVALID_RUN_TRANSITION("C005", "던전 진행 상태 전이가 불가능합니다 (run: %s, status: %s)"),

  // === Server Errors ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다."),
  DATA_INITIALIZATION_FAILED("S002", "데이터 초기화 실패 (대상: %s)");

  private final String code;
  private final String message;
}
