package quest.progression.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import quest.progression.adapter.InMemoryMonsterCardAdapter;
import quest.progression.adapter.InMemoryPityCounterAdapter;
import quest.progression.catalog.JsonCatalogLoader;
import quest.progression.common.resource.ClasspathResources;
import quest.progression.core.calculator.AffixRoller;
import quest.progression.core.calculator.AffixWeightTable;
import quest.progression.core.calculator.RarityRoller;
import quest.progression.core.calculator.StatRoller;
import quest.progression.core.card.CardBonusCalculator;
import quest.progression.core.card.CardCollector;
import quest.progression.core.card.CardDropEngine;
import quest.progression.core.catalog.ContentCatalog;
import quest.progression.core.catalog.RemoteCatalogSource;
import quest.progression.core.catalog.StaticCatalogSource;
import quest.progression.core.dungeon.ApproachSelector;
import quest.progression.core.dungeon.DungeonRunService;
import quest.progression.core.dungeon.EncounterResolver;
import quest.progression.core.dungeon.PartyPowerCalculator;
import quest.progression.core.dungeon.RoomSelector;
import quest.progression.core.dungeon.SecretDiscoveryRoller;
import quest.progression.core.dungeon.StatReadinessCalculator;
import quest.progression.core.loot.LootDropService;
import quest.progression.core.loot.LootGenerator;
import quest.progression.core.loot.MaterialRoller;
import quest.progression.core.pity.PityContentType;
import quest.progression.core.pity.PityRule;
import quest.progression.core.pity.PityTracker;
import quest.progression.core.port.out.MonsterCardPort;
import quest.progression.core.port.out.PityCounterPort;
import quest.progression.core.probability.RandomSource;
import quest.progression.core.probability.ThreadLocalRandomSource;

/**
 * 진행 엔진 Bean 구성
 *
 * <p>module-core는 Spring을 모르는 순수 Java입니다. 여기서 계산기들을 조립하고, 모든 굴림기에 같은 {@link RandomSource}를
 * 주입합니다.
 *
 * <h3>교체 지점</h3>
 *
 * <ul>
 *   <li>{@link RandomSource}, {@link Clock}: 테스트에서 고정값으로 교체
 *   <li>{@link PityCounterPort}, {@link MonsterCardPort}: 영속 저장소 어댑터가 있으면 메모리 구현 대신 사용
 * </ul>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
  CatalogProperties.class,
  PityProperties.class,
  DungeonProperties.class
})
public class ProgressionEngineConfig {

  @Bean
  @ConditionalOnMissingBean
  public RandomSource randomSource() {
    log.info("[ProgressionEngine] Initializing RandomSource (ThreadLocalRandom, unseeded)");
    return new ThreadLocalRandomSource();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // ==================== Content catalog ====================

  @Bean
  public JsonCatalogLoader jsonCatalogLoader(ObjectMapper objectMapper) {
    return new JsonCatalogLoader(objectMapper, new ClasspathResources());
  }

  @Bean
  public ContentCatalog contentCatalog(JsonCatalogLoader loader, CatalogProperties properties) {
    RemoteCatalogSource remote =
        properties.enabled()
            ? loader.loadOrUnloaded(properties.location())
            : RemoteCatalogSource.unloaded();
    log.info(
        "[ProgressionEngine] Initializing ContentCatalog (remote loaded: {})", remote.isLoaded());
    return new ContentCatalog(remote, new StaticCatalogSource());
  }

  // ==================== Loot ====================

  @Bean
  public RarityRoller rarityRoller(RandomSource randomSource) {
    return new RarityRoller(randomSource);
  }

  @Bean
  public StatRoller statRoller(RandomSource randomSource) {
    return new StatRoller(randomSource);
  }

  @Bean
  public AffixRoller affixRoller(ContentCatalog contentCatalog, RandomSource randomSource) {
    return new AffixRoller(contentCatalog, new AffixWeightTable(), randomSource);
  }

  @Bean
  public LootGenerator lootGenerator(
      RarityRoller rarityRoller,
      StatRoller statRoller,
      AffixRoller affixRoller,
      ContentCatalog contentCatalog,
      RandomSource randomSource) {
    return new LootGenerator(rarityRoller, statRoller, affixRoller, contentCatalog, randomSource);
  }

  @Bean
  public MaterialRoller materialRoller(RandomSource randomSource) {
    return new MaterialRoller(randomSource);
  }

  @Bean
  public PityTracker pityTracker(PityProperties properties, RandomSource randomSource) {
    Map<PityContentType, PityRule> overrides = properties.toRules();
    log.info("[ProgressionEngine] Initializing PityTracker (overrides: {})", overrides);
    return new PityTracker(overrides, randomSource);
  }

  @Bean
  public LootDropService lootDropService(
      PityTracker pityTracker, RarityRoller rarityRoller, LootGenerator lootGenerator) {
    return new LootDropService(pityTracker, rarityRoller, lootGenerator);
  }

  // ==================== Cards ====================

  @Bean
  public CardDropEngine cardDropEngine(RandomSource randomSource) {
    return new CardDropEngine(randomSource);
  }

  @Bean
  public CardCollector cardCollector() {
    return new CardCollector();
  }

  @Bean
  public CardBonusCalculator cardBonusCalculator() {
    return new CardBonusCalculator();
  }

  // ==================== Dungeon ====================

  @Bean
  public PartyPowerCalculator partyPowerCalculator() {
    return new PartyPowerCalculator();
  }

  @Bean
  public DungeonRunService dungeonRunService(
      RandomSource randomSource,
      PartyPowerCalculator powerCalculator,
      CardDropEngine cardDropEngine,
      LootGenerator lootGenerator,
      LootDropService lootDropService,
      MaterialRoller materialRoller) {
    log.info("[ProgressionEngine] Initializing DungeonRunService");
    return new DungeonRunService(
        new RoomSelector(randomSource),
        new ApproachSelector(powerCalculator),
        powerCalculator,
        new StatReadinessCalculator(),
        new EncounterResolver(randomSource, cardDropEngine),
        lootGenerator,
        lootDropService,
        materialRoller,
        new SecretDiscoveryRoller(randomSource, materialRoller, lootGenerator));
  }

  // ==================== Ports ====================

  @Bean
  @ConditionalOnMissingBean
  public PityCounterPort pityCounterPort() {
    return new InMemoryPityCounterAdapter();
  }

  @Bean
  @ConditionalOnMissingBean
  public MonsterCardPort monsterCardPort() {
    return new InMemoryMonsterCardAdapter();
  }
}
