package quest.progression.core.domain.model.card;

/**
 * 카드 드롭 판정 맥락
 *
 * @param theme 던전 테마 키 (던전만)
 * @param bossRoom 보스 방 여부 (던전만)
 * @param arenaWave 투기장 웨이브 (투기장만)
 * @param raidBossName 레이드 보스 템플릿 이름 (레이드만)
 */
public record CardDropContext(String theme, boolean bossRoom, int arenaWave, String raidBossName) {

  public static CardDropContext dungeon(String theme, boolean bossRoom) {
    return new CardDropContext(theme, bossRoom, 0, null);
  }

  public static CardDropContext arena(int wave) {
    return new CardDropContext(null, false, wave, null);
  }

  public static CardDropContext expedition() {
    return new CardDropContext(null, false, 0, null);
  }

  public static CardDropContext raid(String bossName) {
    return new CardDropContext(null, true, 0, bossName);
  }
}
