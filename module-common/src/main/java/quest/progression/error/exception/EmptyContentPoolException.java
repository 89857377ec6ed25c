package quest.progression.error.exception;

import quest.progression.error.CommonErrorCode;
import quest.progression.error.exception.base.ClientBaseException;

public class EmptyContentPoolException extends ClientBaseException {
  public EmptyContentPoolException(String poolName) {
    super(CommonErrorCode.EMPTY_CONTENT_POOL, poolName);
  }
}
