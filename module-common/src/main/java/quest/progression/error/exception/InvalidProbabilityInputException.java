package quest.progression.error.exception;

import quest.progression.error.CommonErrorCode;
import quest.progression.error.exception.base.ClientBaseException;

public class InvalidProbabilityInputException extends ClientBaseException {
  public InvalidProbabilityInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
