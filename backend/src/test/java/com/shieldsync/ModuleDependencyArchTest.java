package com.shieldsync;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Keeps package boundaries: engine packages never reach up into the API, and state never knows about sync.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.shieldsync");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..ingestion..", "..config..", "..api..", "..state..", "..history..", "..planner..", "..tx..", "..query..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..domain..", "..ingestion..", "..config..", "..api..", "..state..", "..history..", "..planner..", "..tx..");
        rule.check(classes);
    }

    @Test
    void nothing_but_api_depends_on_api() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("..api..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void state_and_history_must_not_depend_on_sync_or_transactions() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..state..", "..history..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..planner..", "..tx..", "..query..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_planner_or_transactions() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage("..planner..", "..tx..", "..query..");
        rule.check(classes);
    }

    @Test
    void crypto_depends_only_on_domain() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..crypto..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..ingestion..", "..config..", "..api..", "..state..", "..history..", "..planner..", "..tx..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.shieldsync.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
