package io.urlcrypt.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Architecture guardrails for the core module: the engine works only against the {@code Protector}
 * interface, reflection stays in the one-time annotation derivation, and request-time classes hold
 * no mutable state.
 */
@AnalyzeClasses(
        packages = "io.urlcrypt.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule engineDependsOnProtectorInterfaceOnly = noClasses()
            .that()
            .resideInAPackage("io.urlcrypt.core.engine..")
            .should()
            .dependOnClassesThat()
            .haveSimpleNameStartingWith("AesGcm")
            .because("the engine must work with any Protector implementation");

    @ArchTest
    static final ArchRule reflectionOnlyInShapeDerivation = noClasses()
            .that()
            .doNotHaveFullyQualifiedName("io.urlcrypt.core.schema.TargetShapes")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("shapes are resolved once at startup, never by per-request introspection");

    @ArchTest
    static final ArchRule modelDoesNotDependOnEngine = noClasses()
            .that()
            .resideInAPackage("io.urlcrypt.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.urlcrypt.core.engine..", "io.urlcrypt.core.protect..")
            .because("the data model is shared by every layer");

    @ArchTest
    static final ArchRule strategiesHaveOnlyFinalFields = classes()
            .that()
            .resideInAPackage("io.urlcrypt.core.engine..")
            .should()
            .haveOnlyFinalFields()
            .because("strategies and the engine are shared across request threads");
}
