package quest.progression.error.exception;

import quest.progression.error.CommonErrorCode;
import quest.progression.error.exception.base.ClientBaseException;

/** 이미 종료된(Completed/Failed/Abandoned) 던전 진행에 결과를 기록하려 할 때 발생합니다. */
public class InvalidRunStateException extends ClientBaseException {
  public InvalidRunStateException(String runId, String status) {
    super(CommonErrorCode.INVALID_RUN_TRANSITION, runId, status);
  }
}
