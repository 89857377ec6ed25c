package quest.progression.core.domain.model.dungeon;

/** 던전 진행 상태. IN_PROGRESS 외의 상태는 모두 종료 상태이며 되돌릴 수 없습니다. */
public enum RunStatus {
  IN_PROGRESS,
  COMPLETED,
  FAILED,
  ABANDONED;

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }
}
