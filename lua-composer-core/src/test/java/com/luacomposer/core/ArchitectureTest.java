package com.luacomposer.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests for the layering of the composer core.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are records or enums</li>
 *   <li>The AST layer knows nothing about what is built on it</li>
 *   <li>Only the build package ties the steps together</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.luacomposer.core");
    }

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
     * The parser and tree must stay usable without the graph, sanitizer or composer.
     */
    @Test
    void ast_shouldNotDependOnLaterSteps() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.ast..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.graph..", "..core.sanitizer..", "..core.compose..", "..core.build..",
                "..core.dependency..", "..core.config..", "..core.model..");

        rule.check(classes);
    }

    @Test
    void steps_shouldNotDependOnPipeline() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..core.build..")
            .should().dependOnClassesThat().resideInAPackage("..core.build..");

        rule.check(classes);
    }

    @Test
    void dependencyFetching_shouldNotDependOnSourceProcessing() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.dependency..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.ast..", "..core.graph..", "..core.sanitizer..", "..core.discovery..");

        rule.check(classes);
    }

    @Test
    void errors_shouldExtendComposerException() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.error..")
            .and().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo("com.luacomposer.core.error.ComposerException");

        rule.check(classes);
    }
}
