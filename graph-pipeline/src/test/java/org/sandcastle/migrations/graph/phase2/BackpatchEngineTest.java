package org.sandcastle.migrations.graph.phase2;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.MigrationHarness;
import org.sandcastle.migrations.graph.MigrationSettings;
import org.sandcastle.migrations.graph.RecordFailure;
import org.sandcastle.migrations.graph.RunStatistics.Counter;
import org.sandcastle.migrations.graph.TestEntities;
import org.sandcastle.migrations.graph.identity.IdentityContinuityResolver;
import org.sandcastle.migrations.graph.ir.EntityType;
import org.sandcastle.migrations.graph.ir.FieldSpec;
import org.sandcastle.migrations.graph.ir.Snapshot;
import org.sandcastle.migrations.graph.ir.SourceRecord;
import org.sandcastle.migrations.graph.ir.UpdatePayload;
import org.sandcastle.migrations.graph.phase1.GraphMaterializer;
import org.sandcastle.migrations.graph.phase2.BackpatchEngine.BackpatchResult;
import org.sandcastle.migrations.graph.store.InMemoryRecordStore.Operation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackpatchEngineTest {

    /** Puts a created record in the target, maps it and snapshots it as Phase 1 would. */
    private static void migrated(MigrationHarness harness, String entityType, String sourceId, String targetId,
                                 Map<String, Object> sourceFields, Map<String, String> written) {
        var targetFields = new HashMap<String, Object>(written);
        targetFields.put("Source", sourceId);
        harness.target.put(entityType, targetId, targetFields);
        harness.identityMap.putIfAbsent(entityType, sourceId, targetId);
        harness.snapshots.appendSnapshot(new Snapshot(entityType, sourceId, targetId,
            new SourceRecord(entityType, sourceId, sourceFields), written));
    }

    @Test
    void droppedOptionalReferenceIsRestored() {
        var harness = new MigrationHarness(MigrationHarness.single(), TestEntities.account(), TestEntities.contact());
        migrated(harness, "Account", "A1", "ACC1", Map.of("Name", "Acme"), Map.of());
        migrated(harness, "Contact", "C1", "CON1", Map.of("LastName", "Boss", "AccountId", "A1"), Map.of("AccountId", "ACC1"));
        migrated(harness, "Contact", "C2", "CON2",
            Map.of("LastName", "Report", "AccountId", "A1", "ReportsToId", "C1"), Map.of("AccountId", "ACC1"));

        BackpatchResult result = new BackpatchEngine(harness.context).backpatch("Contact");

        assertEquals(new BackpatchResult("Contact", 1, 1, 0), result);
        assertEquals("CON1", harness.target.get("Contact", "CON2").orElseThrow().get("ReportsToId"));
        assertEquals(List.of(Map.of("ReportsToId", "CON1")),
            harness.target.callsOf(Operation.BULK_UPDATE, "Contact").get(0).payloads());
    }

    @Test
    void referenceToARecordThatNeverMigratedIsSkipped() {
        var harness = new MigrationHarness(MigrationHarness.single(), TestEntities.account(), TestEntities.contact());
        migrated(harness, "Contact", "C2", "CON2", Map.of("LastName", "Report", "ReportsToId", "C-gone"), Map.of());

        var result = new BackpatchEngine(harness.context).backpatch("Contact");

        assertEquals(new BackpatchResult("Contact", 0, 1, 0), result);
        assertTrue(harness.target.callsOf(Operation.BULK_UPDATE, "Contact").isEmpty());
        assertEquals(1, harness.statistics.get("Contact", Counter.SKIPPED));
    }

    @Test
    void placeholderIsReplacedOnceTheRealRecordExists() {
        var harness = new MigrationHarness(MigrationHarness.single(), TestEntities.account(), TestEntities.contact())
            .withDummies();
        String dummy = harness.dummies.lookup("Account").orElseThrow();
        migrated(harness, "Contact", "C1", "CON1", Map.of("LastName", "Doe", "AccountId", "A1"), Map.of("AccountId", dummy));
        migrated(harness, "Account", "A1", "ACC1", Map.of("Name", "Acme"), Map.of());

        var engine = new BackpatchEngine(harness.context);
        var update = engine.buildUpdate(TestEntities.contact(), harness.snapshots.readSnapshots("Contact").get(0));

        assertEquals(new UpdatePayload("CON1", Map.of("AccountId", "ACC1")), update.orElseThrow());
    }

    @Test
    void immutableReferenceIsNeverPatched() {
        var lineItem = new EntityType("OrderItem", List.of(
            FieldSpec.immutableReference("OrderId", "Order", true),
            FieldSpec.reference("OriginalOrderItemId", "OrderItem", false)));
        var order = new EntityType("Order", List.of(FieldSpec.scalar("Name", true)));
        var harness = new MigrationHarness(MigrationHarness.single(), order, lineItem).withDummies();
        String orderDummy = harness.dummies.lookup("Order").orElseThrow();
        migrated(harness, "Order", "O1", "ORD1", Map.of("Name", "o"), Map.of());
        migrated(harness, "OrderItem", "I1", "ITM1", Map.of("OrderId", "O1"), Map.of("OrderId", orderDummy));
        migrated(harness, "OrderItem", "I2", "ITM2", Map.of("OrderId", "O1", "OriginalOrderItemId", "I1"),
            Map.of("OrderId", orderDummy));

        var engine = new BackpatchEngine(harness.context);
        var result = engine.backpatch("OrderItem");

        assertEquals(new BackpatchResult("OrderItem", 1, 1, 0), result);
        for (var call : harness.target.callsOf(Operation.BULK_UPDATE, "OrderItem")) {
            call.payloads().forEach(p -> assertFalse(p.containsKey("OrderId")));
        }
        assertEquals(orderDummy, harness.target.get("OrderItem", "ITM1").orElseThrow().get("OrderId"));
    }

    @Test
    void continuityReferencesAreLeftAlone() {
        var harness = new MigrationHarness(MigrationHarness.single(),
            Set.of(IdentityContinuityResolver.Policy.keepExisting("User")), Set.of(), TestEntities.account());
        harness.identityMap.putIfAbsent("User", "005A", "005B");
        migrated(harness, "Account", "A1", "ACC1", Map.of("Name", "a", "OwnerId", "005A"), Map.of());

        var update = new BackpatchEngine(harness.context)
            .buildUpdate(TestEntities.account(), harness.snapshots.readSnapshots("Account").get(0));

        assertTrue(update.isEmpty());
    }

    @Test
    void stableNameReferenceIsResolvedAndMissesLeftUnset() {
        var harness = new MigrationHarness(MigrationHarness.single(), Set.of(), Set.of("RecordType"), TestEntities.account());
        harness.target.registerStableName("Account", "012SRC", "012TGT");
        migrated(harness, "Account", "A1", "ACC1", Map.of("Name", "a", "RecordTypeId", "012SRC"), Map.of());
        migrated(harness, "Account", "A2", "ACC2", Map.of("Name", "b", "RecordTypeId", "012UNKNOWN"), Map.of());
        migrated(harness, "Account", "A3", "ACC3", Map.of("Name", "c", "RecordTypeId", "012SRC"),
            Map.of("RecordTypeId", "012TGT"));

        var result = new BackpatchEngine(harness.context).backpatch("Account");

        assertEquals(new BackpatchResult("Account", 1, 2, 0), result);
        assertEquals("012TGT", harness.target.get("Account", "ACC1").orElseThrow().get("RecordTypeId"));
        assertNull(harness.target.get("Account", "ACC2").orElseThrow().get("RecordTypeId"));
    }

    @Test
    void updatesAreBatched() {
        var settings = MigrationSettings.builder().batchSize(2).build();
        var harness = new MigrationHarness(settings, TestEntities.account());
        migrated(harness, "Account", "P", "ACCP", Map.of("Name", "parent"), Map.of());
        for (int i = 1; i <= 3; i++) {
            migrated(harness, "Account", "A" + i, "ACC" + i, Map.of("Name", "a" + i, "ParentId", "P"), Map.of());
        }

        var result = new BackpatchEngine(harness.context).backpatch("Account");

        assertEquals(3, result.updated());
        var bulkSizes = harness.target.callsOf(Operation.BULK_UPDATE, "Account").stream()
            .map(call -> call.payloads().size())
            .collect(Collectors.toList());
        assertEquals(List.of(2, 1), bulkSizes);
    }

    @Test
    void failedBatchFallsBackToRecordsAndThenToFields() {
        var harness = new MigrationHarness(MigrationHarness.single(), TestEntities.account(), TestEntities.contact())
            .withDummies();
        String dummy = harness.dummies.lookup("Account").orElseThrow();
        harness.target.failNextBulkUpdates("Contact", 1);
        harness.target.rejectUpdatesOf("Contact", "ReportsToId");
        migrated(harness, "Account", "A1", "ACC1", Map.of("Name", "Acme"), Map.of());
        migrated(harness, "Contact", "C1", "CON1", Map.of("LastName", "Boss", "AccountId", "A9"), Map.of("AccountId", dummy));
        migrated(harness, "Contact", "C2", "CON2",
            Map.of("LastName", "Report", "AccountId", "A1", "ReportsToId", "C1"), Map.of("AccountId", dummy));
        migrated(harness, "Contact", "C3", "CON3",
            Map.of("LastName", "Peer", "AccountId", "A1"), Map.of("AccountId", dummy));

        var result = new BackpatchEngine(harness.context).backpatch("Contact");

        assertEquals(new BackpatchResult("Contact", 1, 1, 1), result);
        assertEquals("ACC1", harness.target.get("Contact", "CON2").orElseThrow().get("AccountId"));
        assertEquals("ACC1", harness.target.get("Contact", "CON3").orElseThrow().get("AccountId"));
        assertNull(harness.target.get("Contact", "CON2").orElseThrow().get("ReportsToId"));
        RecordFailure failure = harness.statistics.failuresOf("Contact").get(0);
        assertEquals("C2", failure.sourceId());
        assertEquals(RecordFailure.Phase.BACKPATCH, failure.phase());
        assertTrue(failure.message().startsWith("ReportsToId"));
    }

    @Test
    void updatesAlreadyAppliedByAPartiallyFailedBatchAreNotResent() {
        var settings = MigrationSettings.builder().batchSize(3).build();
        var harness = new MigrationHarness(settings, TestEntities.account(), TestEntities.contact()).withDummies();
        String dummy = harness.dummies.lookup("Account").orElseThrow();
        harness.target.reportPartialBulkResults(true);
        harness.target.rejectUpdatesOf("Contact", "ReportsToId");
        migrated(harness, "Account", "A1", "ACC1", Map.of("Name", "Acme"), Map.of());
        migrated(harness, "Contact", "C1", "CON1", Map.of("LastName", "Boss", "AccountId", "A1"), Map.of("AccountId", dummy));
        migrated(harness, "Contact", "C2", "CON2",
            Map.of("LastName", "Report", "AccountId", "A1", "ReportsToId", "C1"), Map.of("AccountId", dummy));
        migrated(harness, "Contact", "C3", "CON3", Map.of("LastName", "Peer", "AccountId", "A1"), Map.of("AccountId", dummy));

        var result = new BackpatchEngine(harness.context).backpatch("Contact");

        assertEquals(new BackpatchResult("Contact", 2, 0, 1), result);
        var singleUpdates = harness.target.callsOf(Operation.UPDATE, "Contact").stream()
            .map(call -> call.payloads().get(0))
            .collect(Collectors.toList());
        assertEquals(List.of(Map.of("AccountId", "ACC1", "ReportsToId", "CON1"),
            Map.of("AccountId", "ACC1"), Map.of("ReportsToId", "CON1")), singleUpdates);
        assertEquals("ACC1", harness.target.get("Contact", "CON1").orElseThrow().get("AccountId"));
        assertEquals("ACC1", harness.target.get("Contact", "CON3").orElseThrow().get("AccountId"));
        assertEquals(List.of("C2"), harness.statistics.failuresOf("Contact").stream()
            .map(RecordFailure::sourceId).collect(Collectors.toList()));
    }

    @Test
    void failureIsReportedUnderTheSnapshotSourceIdEvenWithoutAnIdentityMapping() {
        var harness = new MigrationHarness(MigrationHarness.single(), TestEntities.account());
        harness.target.failNextBulkUpdates("Account", 1);
        harness.target.rejectUpdatesOf("Account", "ParentId");
        migrated(harness, "Account", "P", "ACCP", Map.of("Name", "parent"), Map.of());
        harness.target.put("Account", "ACC1", Map.of("Name", "orphan"));
        harness.snapshots.appendSnapshot(new Snapshot("Account", "A1", "ACC1",
            new SourceRecord("Account", "A1", Map.of("Name", "orphan", "ParentId", "P")), Map.of()));

        var result = new BackpatchEngine(harness.context).backpatch("Account");

        assertEquals(1, result.errored());
        assertEquals("A1", harness.statistics.failuresOf("Account").get(0).sourceId());
    }

    @Test
    void selfReferenceIsCorrectedAfterPhaseOne() {
        var harness = new MigrationHarness(MigrationHarness.single(), TestEntities.account(true)).withDummies();
        harness.source.put("Account", "A1", Map.of("Name", "Loop", "ParentId", "A1"));
        var phaseOne = new GraphMaterializer(harness.context).materialize("Account", "A1");

        new BackpatchEngine(harness.context).backpatch("Account");

        String own = phaseOne.targetId();
        assertEquals(own, harness.target.get("Account", own).orElseThrow().get("ParentId"));
    }

    @Test
    void optionalReferenceDroppedInPhaseOneIsPresentAfterPhaseTwo() {
        var settings = MigrationSettings.builder().batchedCreation(false).resolveSameTypeDependencies(false).build();
        var harness = new MigrationHarness(settings, TestEntities.account()).withDummies();
        harness.source.put("Account", "A1", Map.of("Name", "Child", "ParentId", "A2"));
        harness.source.put("Account", "A2", Map.of("Name", "Parent"));
        var materializer = new GraphMaterializer(harness.context);
        String child = materializer.materialize("Account", "A1").targetId();
        String parent = materializer.materialize("Account", "A2").targetId();
        assertNull(harness.target.get("Account", child).orElseThrow().get("ParentId"));

        var result = new BackpatchEngine(harness.context).backpatch("Account");

        assertEquals(1, result.updated());
        assertEquals(parent, harness.target.get("Account", child).orElseThrow().get("ParentId"));
    }
}
