package com.ciro.jlive;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.fields;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;

@AnalyzeClasses(packages = "com.ciro.jlive", importOptions = ImportOption.DoNotIncludeTests.class)
class JLiveRulesTest {

    // --------------------------------------------------------------------------------
    // 🧱 CAPAS
    // --------------------------------------------------------------------------------

    // 1. El diff solo conoce árboles y ChangedSets, nunca plantillas
    @ArchTest
    static final ArchRule diff_only_sees_trees = noClasses()
            .that().resideInAnyPackage("..jlive.rendered..", "..jlive.diff..")
            .should().dependOnClassesThat().resideInAnyPackage("..jlive.template..", "..jlive.ast..", "..jlive.expr..")
            .because("El parche se calcula sobre el árbol renderizado, sin volver a la plantilla.");

    // 2. Los bindings no dependen de nada del motor
    @ArchTest
    static final ArchRule binding_is_standalone = noClasses()
            .that().resideInAPackage("..jlive.binding..")
            .should().dependOnClassesThat().resideInAnyPackage(
                    "..jlive.template..", "..jlive.diff..", "..jlive.rendered..", "..jlive.ast..", "..jlive.expr..");

    // 3. El parser no conoce el motor de render
    @ArchTest
    static final ArchRule parser_does_not_render = noClasses()
            .that().resideInAnyPackage("..jlive.ast..", "..jlive.expr..", "..jlive.component..")
            .should().dependOnClassesThat().resideInAnyPackage("..jlive.template..", "..jlive.rendered..", "..jlive.diff..");

    // 4. El core no arrastra Jackson ni Caffeine: eso es del runtime
    @ArchTest
    static final ArchRule core_has_no_runtime_libraries = noClasses()
            .should().dependOnClassesThat().resideInAnyPackage("com.fasterxml..", "com.github.benmanes..")
            .because("jlive-core solo depende de SLF4J.");

    // --------------------------------------------------------------------------------
    // 📏 ESTILO
    // --------------------------------------------------------------------------------

    // 5. Los árboles renderizados se comparten entre ciclos: inmutables
    @ArchTest
    static final ArchRule rendered_fields_are_final = fields()
            .that().areDeclaredInClassesThat().resideInAPackage("..jlive.rendered..")
            .should().beFinal();

    // 6. Errores sin checked exceptions
    @ArchTest
    static final ArchRule exceptions_are_unchecked = classes()
            .that().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo(RuntimeException.class);

    @ArchTest
    static final ArchRule no_java_util_logging = NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;

    @ArchTest
    static final ArchRule no_standard_streams = NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;
}
