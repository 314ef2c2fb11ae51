package com.beacon.notification.service.architecture;

import com.beacon.notification.common.messaging.MessagePublisher;
import com.beacon.notification.service.bulk.BulkJobRunPublisher;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture rules for the notification service.
 * 
 * - Dead-letter administration stays independent of the bulk job domain
 * - Bulk services publish run messages only through {@link BulkJobRunPublisher},
 *   which defers publishing until the transaction commits
 */
@AnalyzeClasses(packages = "com.beacon.notification.service", importOptions = ImportOption.DoNotIncludeTests.class)
public class ServiceArchitectureTest {

    @ArchTest
    static final ArchRule deadLetterDoesNotDependOnBulk = noClasses()
            .that().resideInAPackage("..service.deadletter..")
            .should().dependOnClassesThat().resideInAPackage("..service.bulk..")
            .because("dead-letter administration works on raw queues, not on bulk jobs");

    @ArchTest
    static final ArchRule bulkPublishesOnlyAfterCommit = noClasses()
            .that().resideInAPackage("..service.bulk..")
            .and().doNotHaveFullyQualifiedName(BulkJobRunPublisher.class.getName())
            .should().dependOnClassesThat().areAssignableTo(MessagePublisher.class)
            .because("run messages must not be published before the job row is committed");
}
