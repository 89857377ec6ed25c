package quest.progression.error.exception;

import quest.progression.error.CommonErrorCode;
import quest.progression.error.exception.base.ClientBaseException;

/** 문자열 키(rarity, stat, slot, source 등)를 enum으로 해석할 수 없을 때 발생합니다. */
public class UnknownContentKeyException extends ClientBaseException {
  public UnknownContentKeyException(String keyKind, String key) {
    super(CommonErrorCode.UNKNOWN_CONTENT_KEY, keyKind, key);
  }
}
