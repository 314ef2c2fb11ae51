package com.beacon.notification.bulk.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "com.beacon.notification.bulk", importOptions = ImportOption.DoNotIncludeTests.class)
public class BulkWorkerArchitectureTest {

    @ArchTest
    static final ArchRule processorDoesNotUseJdbcDirectly = noClasses()
            .that().resideInAPackage("..bulk.processor..")
            .should().dependOnClassesThat().resideInAPackage("org.springframework.jdbc..")
            .because("job and item state changes go through BulkJobRepository");

    @ArchTest
    static final ArchRule processorDoesNotTouchBroker = noClasses()
            .that().resideInAPackage("..bulk.processor..")
            .should().dependOnClassesThat().resideInAnyPackage("com.rabbitmq.client..", "org.springframework.amqp..")
            .because("acknowledgement belongs to the queue consumer");
}
