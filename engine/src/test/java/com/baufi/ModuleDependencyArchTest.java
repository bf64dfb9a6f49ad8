package com.baufi;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Keeps the calculation core (value types, loan math, property and Sondertilgung rules) free of Spring
 * configuration and of the services built on top of it.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.baufi");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.baufi.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.baufi.domain..", "com.baufi.loan..",
                        "com.baufi.property..", "com.baufi.sondertilgung..", "com.baufi.amortization..",
                        "com.baufi.analysis..", "com.baufi.portfolio..", "com.baufi.config..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.baufi.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.baufi.loan..", "com.baufi.property..",
                        "com.baufi.sondertilgung..", "com.baufi.amortization..", "com.baufi.analysis..",
                        "com.baufi.portfolio..", "com.baufi.config..");
        rule.check(classes);
    }

    @Test
    void loan_and_property_must_not_depend_on_services_or_config() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.baufi.loan..", "com.baufi.property..")
                .should().dependOnClassesThat().resideInAnyPackage("com.baufi.sondertilgung..",
                        "com.baufi.amortization..", "com.baufi.analysis..", "com.baufi.portfolio..",
                        "com.baufi.config..");
        rule.check(classes);
    }

    @Test
    void loan_and_property_are_independent() {
        ArchRule loanRule = noClasses()
                .that().resideInAPackage("com.baufi.loan..")
                .should().dependOnClassesThat().resideInAPackage("com.baufi.property..");
        ArchRule propertyRule = noClasses()
                .that().resideInAPackage("com.baufi.property..")
                .should().dependOnClassesThat().resideInAPackage("com.baufi.loan..");
        loanRule.check(classes);
        propertyRule.check(classes);
    }

    @Test
    void sondertilgung_must_not_depend_on_services_or_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.baufi.sondertilgung..")
                .should().dependOnClassesThat().resideInAnyPackage("com.baufi.property..",
                        "com.baufi.amortization..", "com.baufi.analysis..", "com.baufi.portfolio..",
                        "com.baufi.config..");
        rule.check(classes);
    }

    @Test
    void amortization_must_not_depend_on_analysis_portfolio() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.baufi.amortization..")
                .should().dependOnClassesThat().resideInAnyPackage("com.baufi.analysis..", "com.baufi.portfolio..");
        rule.check(classes);
    }

    @Test
    void analysis_and_portfolio_are_independent() {
        ArchRule analysisRule = noClasses()
                .that().resideInAPackage("com.baufi.analysis..")
                .should().dependOnClassesThat().resideInAPackage("com.baufi.portfolio..");
        ArchRule portfolioRule = noClasses()
                .that().resideInAPackage("com.baufi.portfolio..")
                .should().dependOnClassesThat().resideInAPackage("com.baufi.analysis..");
        analysisRule.check(classes);
        portfolioRule.check(classes);
    }

    @Test
    void config_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.baufi.config..")
                .should().dependOnClassesThat().resideInAnyPackage("com.baufi.domain..", "com.baufi.loan..",
                        "com.baufi.property..", "com.baufi.sondertilgung..", "com.baufi.amortization..",
                        "com.baufi.analysis..", "com.baufi.portfolio..");
        rule.check(classes);
    }

    @Test
    void only_portfolio_may_use_repositories() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("com.baufi.portfolio..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.baufi.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
