package quest.progression.core.probability;

import java.util.concurrent.ThreadLocalRandom;

/** 운영용 난수 소스. 시드를 지정하지 않으며 스레드마다 독립적인 생성기를 사용합니다. */
public class ThreadLocalRandomSource implements RandomSource {

  @Override
  public double nextDouble() {
    return ThreadLocalRandom.current().nextDouble();
  }

  @Override
  public int nextInt(int minInclusive, int maxInclusive) {
    return ThreadLocalRandom.current().nextInt(minInclusive, maxInclusive + 1);
  }
}
