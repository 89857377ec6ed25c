package quest.progression.core.domain.model;

/**
 * 제작 재료 드롭
 *
 * @param type 재료 종류
 * @param rarity 재료 등급
 * @param quantity 수량 (1 이상)
 */
public record MaterialDrop(MaterialType type, Rarity rarity, int quantity) {
  public MaterialDrop {
    if (type == null || rarity == null) {
      throw new IllegalArgumentException("type and rarity cannot be null");
    }
    if (quantity < 1) {
      throw new IllegalArgumentException("quantity must be positive: " + quantity);
    }
  }
}
