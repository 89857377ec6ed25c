package quest.progression.core.loot;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import quest.progression.core.calculator.AffixRoller;
import quest.progression.core.calculator.RarityRoller;
import quest.progression.core.calculator.StatRoller;
import quest.progression.core.catalog.ContentCatalog;
import quest.progression.core.domain.model.AffixRoll;
import quest.progression.core.domain.model.CharacterClass;
import quest.progression.core.domain.model.EquipmentItem;
import quest.progression.core.domain.model.EquipmentSlot;
import quest.progression.core.domain.model.EquipmentTemplate;
import quest.progression.core.domain.model.Rarity;
import quest.progression.core.domain.model.StatBonus;
import quest.progression.core.domain.model.StatType;
import quest.progression.core.probability.RandomSource;

/**
 * 장비 생성기
 *
 * <h3>절차</h3>
 *
 * <ol>
 *   <li>등급 결정 (지정 등급이 있으면 굴림 생략)
 *   <li>80% 확률로 카탈로그 템플릿 시도 (slot, rarity, level &lt;= playerLevel + 5)
 *   <li>템플릿이 없거나 20% 분기면 절차 생성
 *   <li>어느 경우든 옵션 굴림 후 부착
 * </ol>
 *
 * <p>부작용이 없습니다. 천장 카운터와 저장은 호출자 책임입니다 ({@link LootDropService}).
 */
public class LootGenerator {

  static final double TEMPLATE_CHANCE = 0.80;

  private final RarityRoller rarityRoller;
  private final StatRoller statRoller;
  private final AffixRoller affixRoller;
  private final ContentCatalog catalog;
  private final RandomSource random;
  private final Supplier<String> idGenerator;

  public LootGenerator(
      RarityRoller rarityRoller,
      StatRoller statRoller,
      AffixRoller affixRoller,
      ContentCatalog catalog,
      RandomSource random) {
    this(
        rarityRoller, statRoller, affixRoller, catalog, random, () -> UUID.randomUUID().toString());
  }

  public LootGenerator(
      RarityRoller rarityRoller,
      StatRoller statRoller,
      AffixRoller affixRoller,
      ContentCatalog catalog,
      RandomSource random,
      Supplier<String> idGenerator) {
    this.rarityRoller = rarityRoller;
    this.statRoller = statRoller;
    this.affixRoller = affixRoller;
    this.catalog = catalog;
    this.random = random;
    this.idGenerator = idGenerator;
  }

  public EquipmentItem generate(
      int tier,
      int luck,
      EquipmentSlot slot,
      Rarity forcedRarity,
      CharacterClass characterClass,
      Integer playerLevel) {
    return generate(new LootRequest(tier, luck, slot, forcedRarity, characterClass, playerLevel));
  }

  public EquipmentItem generate(LootRequest request) {
    Rarity rarity =
        request.forcedRarity() != null
            ? request.forcedRarity()
            : rarityRoller.rollRarity(request.tier(), request.luck());

    EquipmentItem base = null;
    if (random.chance(TEMPLATE_CHANCE)) {
      base = fromTemplate(request, rarity);
    }
    if (base == null) {
      base = procedural(request, rarity);
    }

    AffixRoll affixes =
        affixRoller.rollAffixes(rarity, request.characterClass(), base.levelRequirement());
    return base.withAffixes(affixes.prefix(), affixes.suffix());
  }

  private EquipmentItem fromTemplate(LootRequest request, Rarity rarity) {
    Integer maxLevel =
        request.playerLevel() == null ? null : StatRoller.maxLevelFor(request.playerLevel());
    List<EquipmentTemplate> candidates = catalog.templates(request.slot(), rarity, maxLevel);
    if (candidates.isEmpty()) {
      return null;
    }
    EquipmentTemplate template = random.pick(candidates);
    return new EquipmentItem(
        idGenerator.get(),
        template.slot(),
        template.rarity(),
        template.primaryStat(),
        template.statBonus(),
        template.secondaryStat(),
        template.secondaryStatBonus(),
        template.levelRequirement(),
        0,
        null,
        null,
        template.id());
  }

  private EquipmentItem procedural(LootRequest request, Rarity rarity) {
    EquipmentSlot slot =
        request.slot() != null ? request.slot() : random.pick(List.of(EquipmentSlot.values()));
    StatType primary = statRoller.rollPrimaryStat();
    int bonus = statRoller.rollStatBonus(rarity);
    StatBonus secondary = statRoller.rollSecondaryStat(rarity, primary).orElse(null);
    int level = StatRoller.levelRequirement(request.tier(), bonus, request.playerLevel());

    return new EquipmentItem(
        idGenerator.get(),
        slot,
        rarity,
        primary,
        bonus,
        secondary == null ? null : secondary.stat(),
        secondary == null ? 0 : secondary.bonus(),
        level,
        0,
        null,
        null,
        null);
  }
}
