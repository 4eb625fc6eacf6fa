package com.solseq.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Extractors extend the shared base class</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>Extraction and model building never depend on rendering</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter().importPackages("com.solseq.core");
    }

    @Test
    void extractors_shouldExtendAbstractExtractor() {
        ArchRule rule = classes()
            .that().resideInAnyPackage("..extractor.ast..", "..extractor.source..")
            .and().haveSimpleNameEndingWith("Extractor")
            .should().beAssignableTo("com.solseq.core.extractor.base.AbstractExtractor");

        rule.check(classes);
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     * The statement-effect hierarchy is an interface over nested records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void baseExtractors_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor.base..")
            .should().dependOnClassesThat().resideInAnyPackage("..extractor.ast..", "..extractor.source..");

        rule.check(classes);
    }

    /**
     * Verifies the pipeline up to the correlated messages knows nothing about diagram output.
     */
    @Test
    void extractionAndModel_shouldNotDependOnGenerators() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("com.solseq.core.model..", "com.solseq.core.ast..",
                "com.solseq.core.extractor..", "com.solseq.core.builder..", "com.solseq.core.correlate..")
            .should().dependOnClassesThat().resideInAPackage("com.solseq.core.generator..");

        rule.check(classes);
    }

    @Test
    void model_shouldNotDependOnJackson() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.solseq.core.model..")
            .should().dependOnClassesThat().resideInAPackage("com.fasterxml.jackson..");

        rule.check(classes);
    }

    @Test
    void extractorImplementations_shouldNotDependOnEachOther() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor.source..")
            .should().dependOnClassesThat().resideInAPackage("..extractor.ast..");

        rule.check(classes);
    }
}
