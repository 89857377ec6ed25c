package quest.progression.error.exception;

import quest.progression.error.CommonErrorCode;
import quest.progression.error.exception.base.ClientBaseException;

public class InvalidTierException extends ClientBaseException {
  public InvalidTierException(int tier) {
    super(CommonErrorCode.INVALID_TIER, tier);
  }
}
