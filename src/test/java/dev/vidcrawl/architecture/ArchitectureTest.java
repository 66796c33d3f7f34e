package dev.vidcrawl.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.vidcrawl", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // The API client and the store know nothing about crawling.
  @ArchTest
  static final ArchRule api_and_store_should_not_depend_on_crawling =
      noClasses()
          .that()
          .resideInAnyPackage("..api..", "..store..", "..query..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..crawl..", "..schedule..", "..cli..");

  @ArchTest
  static final ArchRule api_should_not_depend_on_store =
      noClasses()
          .that()
          .resideInAPackage("..api..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("..store..");

  // Only the command line reaches the scheduler.
  @ArchTest
  static final ArchRule crawl_should_not_depend_on_scheduling =
      noClasses()
          .that()
          .resideInAPackage("..crawl..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..schedule..", "..cli..");

  @ArchTest
  static final ArchRule config_should_not_depend_on_features =
      noClasses()
          .that()
          .resideInAPackage("dev.vidcrawl.config..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "..api..", "..crawl..", "..store..", "..schedule..", "..cli..", "..query..");

  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.vidcrawl.(*)..").should().beFreeOfCycles();
}
