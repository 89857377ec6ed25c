package quest.progression.core.domain.model;

import java.util.Optional;

/** 옵션 굴림 결과. 두 옵션 모두 없을 수 있습니다. */
public record AffixRoll(Affix prefix, Affix suffix) {

  public static AffixRoll none() {
    return new AffixRoll(null, null);
  }

  public Optional<Affix> prefixAffix() {
    return Optional.ofNullable(prefix);
  }

  public Optional<Affix> suffixAffix() {
    return Optional.ofNullable(suffix);
  }

  public int count() {
    return (prefix == null ? 0 : 1) + (suffix == null ? 0 : 1);
  }
}
