package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.stereotype.Service;

/**
 * 모듈 경계 테스트
 *
 * <ul>
 *   <li>module-core: 순수 Java. Spring, Jackson, Bean Validation 의존 금지
 *   <li>module-common: 어떤 상위 모듈에도 의존하지 않음
 *   <li>module-app: 서비스는 포트만 보고 메모리 어댑터 구현을 직접 참조하지 않음
 * </ul>
 *
 * <p>난수는 {@code core.probability} 패키지의 {@code RandomSource}를 통해서만 사용합니다. 그래야 모든 굴림을 테스트에서 고정할
 * 수 있습니다.
 */
@Tag("unit")
@DisplayName("Module Boundary Tests")
class ModuleBoundaryTest {

  private static final String CORE = "quest.progression.core..";
  private static final String[] APP = {
    "quest.progression.adapter..",
    "quest.progression.catalog..",
    "quest.progression.config..",
    "quest.progression.service.."
  };

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .importPackages("quest.progression");

  @Nested
  @DisplayName("Core Module: Framework-Agnostic Enforcement")
  class CoreModuleTests {

    @Test
    @DisplayName("Core should not depend on Spring Framework classes")
    void coreShouldNotDependOnSpring() {
      noClasses()
          .that()
          .resideInAPackage(CORE)
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework..")
          .because("Bean wiring belongs in module-app (ProgressionEngineConfig)")
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("Core should not depend on serialization or validation libraries")
    void coreShouldNotDependOnJacksonOrValidation() {
      noClasses()
          .that()
          .resideInAPackage(CORE)
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("com.fasterxml.jackson..", "jakarta.validation..")
          .because("Catalog rows are parsed into domain records by module-app")
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("Core should not depend on module-app packages")
    void coreShouldNotDependOnApp() {
      noClasses()
          .that()
          .resideInAPackage(CORE)
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(APP)
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("Randomness only through RandomSource")
    void randomnessOnlyThroughRandomSource() {
      noClasses()
          .that()
          .resideInAPackage(CORE)
          .and()
          .resideOutsideOfPackage("quest.progression.core.probability..")
          .should()
          .dependOnClassesThat()
          .haveFullyQualifiedName("java.util.Random")
          .orShould()
          .dependOnClassesThat()
          .haveFullyQualifiedName("java.util.concurrent.ThreadLocalRandom")
          .because("Every roll must be reproducible with a scripted RandomSource")
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("Outbound ports are interfaces")
    void portsAreInterfaces() {
      classes()
          .that()
          .resideInAPackage("quest.progression.core.port.out..")
          .should()
          .beInterfaces()
          .allowEmptyShould(true)
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Common Module: Leaf Enforcement")
  class CommonModuleTests {

    @Test
    @DisplayName("Common should not depend on core or app")
    void commonShouldBeLeaf() {
      noClasses()
          .that()
          .resideInAnyPackage("quest.progression.common..", "quest.progression.error..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage(CORE)
          .orShould()
          .dependOnClassesThat()
          .resideInAnyPackage(APP)
          .allowEmptyShould(true)
          .check(classes);
    }
  }

  @Nested
  @DisplayName("App Module: Port Usage")
  class AppModuleTests {

    @Test
    @DisplayName("Services should not reference adapter implementations")
    void servicesUsePorts() {
      noClasses()
          .that()
          .resideInAPackage("quest.progression.service..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("quest.progression.adapter..")
          .because("Adapters are swapped through PityCounterPort and MonsterCardPort beans")
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("Services are Spring @Service beans")
    void servicesAreAnnotated() {
      classes()
          .that()
          .resideInAPackage("quest.progression.service..")
          .and()
          .areTopLevelClasses()
          .should()
          .beAnnotatedWith(Service.class)
          .allowEmptyShould(true)
          .check(classes);
    }
  }
}
