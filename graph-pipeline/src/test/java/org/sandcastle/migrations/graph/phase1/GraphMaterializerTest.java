package org.sandcastle.migrations.graph.phase1;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.MigrationContext;
import org.sandcastle.migrations.graph.MigrationHarness;
import org.sandcastle.migrations.graph.MigrationSettings;
import org.sandcastle.migrations.graph.RecordFailure;
import org.sandcastle.migrations.graph.RunStatistics.Counter;
import org.sandcastle.migrations.graph.TestEntities;
import org.sandcastle.migrations.graph.ir.EntityType;
import org.sandcastle.migrations.graph.ir.FieldSpec;
import org.sandcastle.migrations.graph.ir.Snapshot;
import org.sandcastle.migrations.graph.ir.SourceRecord;
import org.sandcastle.migrations.graph.phase1.MaterializationTracker.State;
import org.sandcastle.migrations.graph.snapshot.SnapshotStore;
import org.sandcastle.migrations.graph.snapshot.SnapshotStoreException;
import org.sandcastle.migrations.graph.store.InMemoryRecordStore.Operation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GraphMaterializerTest {

    private static MigrationHarness accountsAndContacts(boolean batched, boolean parentRequired) {
        return new MigrationHarness(batched ? MigrationHarness.batched(10) : MigrationHarness.single(),
            TestEntities.account(parentRequired), TestEntities.contact()).withDummies();
    }

    private static List<Map<String, Object>> createdPayloads(MigrationHarness harness, String entityType) {
        return harness.target.callsOf(Operation.CREATE, entityType).stream()
            .map(call -> call.payloads().get(0))
            .collect(Collectors.toList());
    }

    @Test
    void createdRecordIsMappedAndSnapshotted() {
        var harness = accountsAndContacts(false, false);
        harness.source.put("Account", "A1", Map.of("Name", "Acme", "Industry", "Banking"));

        var result = new GraphMaterializer(harness.context).materialize("Account", "A1");

        assertTrue(result.isMapped());
        assertEquals(harness.identityMap.lookup("Account", "A1"), result.target());
        var snapshots = harness.snapshots.readSnapshots("Account");
        assertEquals(1, snapshots.size());
        assertEquals(result.targetId(), snapshots.get(0).targetId());
        assertEquals("Acme", snapshots.get(0).record().get("Name"));
        assertEquals(1, harness.statistics.get("Account", Counter.CREATED));
    }

    @Test
    void materializingTwiceIsIdempotent() {
        var harness = accountsAndContacts(false, false);
        harness.source.put("Account", "A1", Map.of("Name", "Acme"));
        var materializer = new GraphMaterializer(harness.context);

        var first = materializer.materialize("Account", "A1");
        var second = materializer.materialize("Account", "A1");

        assertEquals(first.targetId(), second.targetId());
        assertEquals(1, createdPayloads(harness, "Account").stream().filter(p -> "Acme".equals(p.get("Name"))).count());
        assertEquals(1, harness.snapshots.readSnapshots("Account").size());
    }

    @Test
    void sameTypeDependencyIsCreatedBeforeItsDependent() {
        var harness = accountsAndContacts(false, true);
        harness.source.put("Account", "A1", Map.of("Name", "Parent"));
        harness.source.put("Account", "A2", Map.of("Name", "Child", "ParentId", "A1"));

        new GraphMaterializer(harness.context).materialize("Account", "A2");

        var payloads = createdPayloads(harness, "Account");
        var names = payloads.stream().map(p -> p.get("Name")).collect(Collectors.toList());
        assertEquals(List.of("NO ACCOUNT", "Parent", "Child"), names);
        String a1 = harness.identityMap.lookup("Account", "A1").orElseThrow();
        assertEquals(a1, payloads.get(2).get("ParentId"));
    }

    @Test
    void requiredSelfReferenceUsesThePlaceholderAndTerminates() {
        var harness = accountsAndContacts(false, true);
        harness.source.put("Account", "A1", Map.of("Name", "Loop", "ParentId", "A1"));
        String dummy = harness.dummies.lookup("Account").orElseThrow();

        var result = new GraphMaterializer(harness.context).materialize("Account", "A1");

        assertTrue(result.isMapped());
        assertEquals(dummy, harness.target.get("Account", result.targetId()).orElseThrow().get("ParentId"));
        assertEquals(Map.of("ParentId", dummy), harness.snapshots.readSnapshots("Account").get(0).writtenReferences());
    }

    @Test
    void mutualReferencesStopAtTheRecordAlreadyBeingResolved() {
        var harness = accountsAndContacts(false, false);
        harness.source.put("Account", "A1", Map.of("Name", "One", "ParentId", "A2"));
        harness.source.put("Account", "A2", Map.of("Name", "Two", "ParentId", "A1"));

        var result = new GraphMaterializer(harness.context).materialize("Account", "A1");

        assertTrue(result.isMapped());
        String a2 = harness.identityMap.lookup("Account", "A2").orElseThrow();
        var two = harness.target.get("Account", a2).orElseThrow();
        assertNull(two.get("ParentId"));
        assertEquals(a2, harness.target.get("Account", result.targetId()).orElseThrow().get("ParentId"));
    }

    @Test
    void duplicateNamingAnExistingRecordIsAdopted() {
        var harness = accountsAndContacts(false, false);
        harness.target.uniqueField("Account", "AccountNumber");
        harness.target.put("Account", "ACC-X", Map.of("Name", "Existing", "AccountNumber", "42"));
        harness.source.put("Account", "A3", Map.of("Name", "Acme", "AccountNumber", "42", "ParentId", "A0"));

        var result = new GraphMaterializer(harness.context).materialize("Account", "A3");

        assertEquals(Materialization.mapped("ACC-X"), result);
        assertEquals("ACC-X", harness.identityMap.lookup("Account", "A3").orElseThrow());
        Snapshot snapshot = harness.snapshots.readSnapshots("Account").get(0);
        assertEquals("A3", snapshot.sourceId());
        assertEquals("ACC-X", snapshot.targetId());
        assertTrue(snapshot.writtenReferences().isEmpty());
        assertEquals(1, harness.statistics.get("Account", Counter.ADOPTED));
        assertTrue(harness.statistics.getFailures().isEmpty());
    }

    @Test
    void failedBulkCreateFallsBackToSingleCreatesWithTheSamePayloads() {
        var harness = accountsAndContacts(true, false);
        harness.identityMap.putIfAbsent("Account", "A1", "ACC-T1");
        harness.target.failNextBulkCreates("Contact", 1);
        for (int i = 1; i <= 3; i++) {
            harness.source.put("Contact", "C" + i, Map.of("LastName", "Doe" + i, "AccountId", "A1"));
        }
        var materializer = new GraphMaterializer(harness.context);

        for (int i = 1; i <= 3; i++) {
            assertEquals(State.SUBMITTED, materializer.materialize("Contact", "C" + i).state());
        }
        materializer.flushAll();

        var bulkPayloads = harness.target.callsOf(Operation.BULK_CREATE, "Contact").get(0).payloads();
        assertEquals(bulkPayloads, createdPayloads(harness, "Contact"));
        for (int i = 1; i <= 3; i++) {
            assertTrue(harness.identityMap.contains("Contact", "C" + i));
        }
        assertEquals(0, materializer.pendingCount("Contact"));
        assertEquals(3, harness.target.count("Contact"));
    }

    @Test
    void singleCreateFallbackMapsOnlyWhatSucceeds() {
        var harness = accountsAndContacts(true, false);
        harness.identityMap.putIfAbsent("Account", "A1", "ACC-T1");
        harness.target.rejectCreateWhen("Contact", p -> "Bad".equals(p.get("LastName")));
        harness.source.put("Contact", "C1", Map.of("LastName", "Good", "AccountId", "A1"));
        harness.source.put("Contact", "C2", Map.of("LastName", "Bad", "AccountId", "A1"));
        harness.source.put("Contact", "C3", Map.of("LastName", "Fine", "AccountId", "A1"));
        var materializer = new GraphMaterializer(harness.context);

        List.of("C1", "C2", "C3").forEach(id -> materializer.materialize("Contact", id));
        materializer.flushAll();

        assertTrue(harness.identityMap.contains("Contact", "C1"));
        assertFalse(harness.identityMap.contains("Contact", "C2"));
        assertTrue(harness.identityMap.contains("Contact", "C3"));
        assertEquals(State.FAILED, materializer.stateOf("Contact", "C2"));
        assertTrue(harness.statistics.hasFailure("Contact", "C2"));
        assertEquals(3, createdPayloads(harness, "Contact").size());
    }

    @Test
    void partialBulkResultsAreKeptAndOnlyTheRestIsRetriedSingly() {
        var harness = accountsAndContacts(true, false);
        harness.identityMap.putIfAbsent("Account", "A1", "ACC-T1");
        harness.target.reportPartialBulkResults(true);
        harness.target.rejectCreateWhen("Contact", p -> "Bad".equals(p.get("LastName")));
        harness.source.put("Contact", "C1", Map.of("LastName", "Good", "AccountId", "A1"));
        harness.source.put("Contact", "C2", Map.of("LastName", "Bad", "AccountId", "A1"));
        var materializer = new GraphMaterializer(harness.context);

        materializer.materialize("Contact", "C1");
        materializer.materialize("Contact", "C2");
        materializer.flushAll();

        assertTrue(harness.identityMap.contains("Contact", "C1"));
        assertFalse(harness.identityMap.contains("Contact", "C2"));
        var singles = createdPayloads(harness, "Contact").stream()
            .filter(p -> !"NO CONTACT".equals(p.get("LastName")))
            .collect(Collectors.toList());
        assertEquals(1, singles.size());
        assertEquals("Bad", singles.get(0).get("LastName"));
    }

    @Test
    void pendingReferencedRecordIsFlushedSoTheDependentGetsItsRealId() {
        var harness = accountsAndContacts(true, false);
        harness.source.put("Account", "A1", Map.of("Name", "Acme"));
        harness.source.put("Contact", "C1", Map.of("LastName", "Doe", "AccountId", "A1"));
        var materializer = new GraphMaterializer(harness.context);

        assertEquals(State.SUBMITTED, materializer.materialize("Account", "A1").state());
        materializer.materialize("Contact", "C1");
        materializer.flushAll();

        String a1 = harness.identityMap.lookup("Account", "A1").orElseThrow();
        var bulkContacts = harness.target.callsOf(Operation.BULK_CREATE, "Contact");
        assertEquals(a1, bulkContacts.get(0).payloads().get(0).get("AccountId"));
    }

    @Test
    void missingSourceRecordIsReportedAsFailed() {
        var harness = accountsAndContacts(false, false);

        var result = new GraphMaterializer(harness.context).materialize("Account", "A-missing");

        assertEquals(State.FAILED, result.state());
        assertFalse(harness.identityMap.contains("Account", "A-missing"));
        RecordFailure failure = harness.statistics.failuresOf("Account").get(0);
        assertEquals("A-missing", failure.sourceId());
        assertEquals(RecordFailure.Phase.MATERIALIZE, failure.phase());
    }

    @Test
    void failedRecordIsNotRetriedAndDependentsUseThePlaceholder() {
        var harness = accountsAndContacts(false, false);
        harness.target.rejectCreateWhen("Account", p -> "Broken".equals(p.get("Name")));
        harness.source.put("Account", "A1", Map.of("Name", "Broken"));
        harness.source.put("Contact", "C1", Map.of("LastName", "Doe", "AccountId", "A1"));
        var materializer = new GraphMaterializer(harness.context);

        materializer.materialize("Account", "A1");
        materializer.materialize("Account", "A1");
        var contact = materializer.materialize("Contact", "C1");

        long attempts = createdPayloads(harness, "Account").stream().filter(p -> "Broken".equals(p.get("Name"))).count();
        assertEquals(1, attempts);
        assertEquals(1, harness.statistics.get("Account", Counter.FAILED));
        String dummy = harness.dummies.lookup("Account").orElseThrow();
        assertEquals(dummy, harness.target.get("Contact", contact.targetId()).orElseThrow().get("AccountId"));
    }

    @Test
    void prefetchedRecordsAreNotFetchedAgain() {
        var harness = accountsAndContacts(false, false);
        var prefetched = new SourceRecord("Account", "A1", Map.of("Name", "Acme"));
        var materializer = new GraphMaterializer(harness.context);

        materializer.prefetch(List.of(prefetched));
        var result = materializer.materialize("Account", "A1");

        assertTrue(result.isMapped());
        assertTrue(harness.source.callsOf(Operation.FETCH, "Account").isEmpty());
    }

    @Test
    void everyVisitedRecordEndsUpMappedOrReportedAsFailed() {
        var harness = accountsAndContacts(true, false);
        harness.target.rejectCreateWhen("Account", p -> ((String) p.get("Name")).startsWith("X"));
        harness.source.put("Account", "A1", Map.of("Name", "Good"));
        harness.source.put("Account", "A2", Map.of("Name", "X-bad", "ParentId", "A1"));
        harness.source.put("Account", "A3", Map.of("Name", "Fine", "ParentId", "A2"));
        var materializer = new GraphMaterializer(harness.context);
        var ids = List.of("A3", "A2", "A1", "A4");

        ids.forEach(id -> materializer.materialize("Account", id));
        materializer.flushAll();

        for (String id : ids) {
            boolean mapped = harness.identityMap.contains("Account", id);
            boolean failed = harness.statistics.hasFailure("Account", id);
            assertTrue(mapped ^ failed, id + " mapped=" + mapped + " failed=" + failed);
        }
    }

    @Test
    void requiredRecordTypeWithoutTargetMatchIsLeftUnsetInsteadOfAbortingTheRun() {
        var account = new EntityType("Account", List.of(
            FieldSpec.scalar("Name", true),
            FieldSpec.reference("RecordTypeId", TestEntities.RECORD_TYPE, true)));
        var harness = new MigrationHarness(MigrationHarness.single(), Set.of(), Set.of(TestEntities.RECORD_TYPE), account);
        harness.target.registerStableName("Account", "012SRC", "012TGT");
        harness.source.put("Account", "A1", Map.of("Name", "Known", "RecordTypeId", "012SRC"));
        harness.source.put("Account", "A2", Map.of("Name", "Unknown", "RecordTypeId", "RT-UNKNOWN"));
        var materializer = new GraphMaterializer(harness.context);

        var known = materializer.materialize("Account", "A1");
        var unknown = materializer.materialize("Account", "A2");

        assertEquals("012TGT", harness.target.get("Account", known.targetId()).orElseThrow().get("RecordTypeId"));
        assertTrue(unknown.isMapped());
        assertFalse(harness.target.get("Account", unknown.targetId()).orElseThrow().containsKey("RecordTypeId"));
    }

    @Test
    void targetRejectingTheUnsetRecordTypeFailsOnlyThatRecord() {
        var account = new EntityType("Account", List.of(
            FieldSpec.scalar("Name", true),
            FieldSpec.reference("RecordTypeId", TestEntities.RECORD_TYPE, true)));
        var harness = new MigrationHarness(MigrationHarness.single(), Set.of(), Set.of(TestEntities.RECORD_TYPE), account);
        harness.target.registerStableName("Account", "012SRC", "012TGT");
        harness.target.requireFields("Account", "RecordTypeId");
        harness.source.put("Account", "A1", Map.of("Name", "Unknown", "RecordTypeId", "RT-UNKNOWN"));
        harness.source.put("Account", "A2", Map.of("Name", "Known", "RecordTypeId", "012SRC"));
        var materializer = new GraphMaterializer(harness.context);

        var unknown = materializer.materialize("Account", "A1");
        var known = materializer.materialize("Account", "A2");

        assertEquals(State.FAILED, unknown.state());
        assertEquals(RecordFailure.Phase.MATERIALIZE, harness.statistics.failuresOf("Account").get(0).phase());
        assertTrue(known.isMapped());
    }

    private static MigrationContext withSnapshots(MigrationHarness harness, SnapshotStore snapshots) {
        return MigrationContext.builder()
            .source(harness.source)
            .target(harness.target)
            .metadata(harness.metadata)
            .identityMap(harness.identityMap)
            .dummies(harness.dummies)
            .snapshots(snapshots)
            .statistics(harness.statistics)
            .settings(harness.context.getSettings())
            .build();
    }

    private static final SnapshotStore FULL_DISK = new SnapshotStore() {
        @Override
        public void appendSnapshot(Snapshot snapshot) throws IOException {
            throw new IOException("No space left on device");
        }

        @Override
        public List<Snapshot> readSnapshots(String entityType) {
            return List.of();
        }

        @Override
        public void clearSnapshots() {
            // nothing written, nothing to clear
        }
    };

    @Test
    void snapshotWriteFailureAfterASingleCreateIsNotCountedAsARecordFailure() {
        var harness = accountsAndContacts(false, false);
        harness.source.put("Account", "A1", Map.of("Name", "Acme"));
        var materializer = new GraphMaterializer(withSnapshots(harness, FULL_DISK));

        var thrown = assertThrows(SnapshotStoreException.class, () -> materializer.materialize("Account", "A1"));

        assertTrue(thrown.getCause() instanceof IOException);
        assertFalse(harness.statistics.hasFailure("Account", "A1"));
        assertEquals(0, harness.statistics.get("Account", Counter.FAILED));
    }

    @Test
    void snapshotWriteFailureAfterAnAdoptedDuplicatePropagates() {
        var harness = accountsAndContacts(false, false);
        harness.target.uniqueField("Account", "AccountNumber");
        harness.target.put("Account", "ACC-X", Map.of("Name", "Existing", "AccountNumber", "42"));
        harness.source.put("Account", "A3", Map.of("Name", "Acme", "AccountNumber", "42"));
        var materializer = new GraphMaterializer(withSnapshots(harness, FULL_DISK));

        assertThrows(SnapshotStoreException.class, () -> materializer.materialize("Account", "A3"));
        assertFalse(harness.statistics.hasFailure("Account", "A3"));
    }

    @Test
    void snapshotWriteFailureAfterABulkCreatePropagates() {
        var harness = new MigrationHarness(MigrationSettings.builder().batchedCreation(true).batchSize(10).build(),
            TestEntities.account(), TestEntities.contact()).withDummies();
        harness.source.put("Account", "A1", Map.of("Name", "Acme"));
        var materializer = new GraphMaterializer(withSnapshots(harness, FULL_DISK));

        materializer.materialize("Account", "A1");

        assertThrows(SnapshotStoreException.class, materializer::flushAll);
        assertFalse(harness.statistics.hasFailure("Account", "A1"));
    }
}
