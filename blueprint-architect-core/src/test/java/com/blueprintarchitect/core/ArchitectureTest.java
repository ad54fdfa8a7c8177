package com.blueprintarchitect.core;

import com.blueprintarchitect.core.validation.ValidationCheck;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Validation never reaches into healing or orchestration</li>
 *   <li>Checks live in the impl package and implement the SPI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.blueprintarchitect.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer depends on nothing else in the engine.
     */
    @Test
    void models_shouldNotDependOnEngine() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.validation..", "..core.healing..", "..core.orchestration..", "..core.parser..");

        rule.check(classes);
    }

    /**
     * Verifies validation only reads blueprints and never repairs them.
     */
    @Test
    void validation_shouldNotDependOnHealing() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.validation..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.healing..", "..core.orchestration..");

        rule.check(classes);
    }

    /**
     * Verifies every top-level class in validation.impl is a pluggable check.
     */
    @Test
    void checks_shouldImplementValidationCheck() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.validation.impl..")
            .and().areTopLevelClasses()
            .should().implement(ValidationCheck.class);

        rule.check(classes);
    }

    /**
     * Verifies the parser does not depend on healing, which runs on raw documents before parsing.
     */
    @Test
    void parser_shouldNotDependOnHealing() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.parser..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.healing..", "..core.orchestration..");

        rule.check(classes);
    }
}
