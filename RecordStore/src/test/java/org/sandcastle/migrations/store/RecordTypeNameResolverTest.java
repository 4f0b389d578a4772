package org.sandcastle.migrations.store;

import org.sandcastle.migrations.store.StubApiServer.Reply;
import org.sandcastle.migrations.store.http.ConnectionContext;
import org.sandcastle.migrations.store.http.RestClient;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.sandcastle.migrations.store.StubApiServer.json;
import static org.junit.jupiter.api.Assertions.*;

class RecordTypeNameResolverTest {

    private static final String QUERY = "/services/data/v60.0/query?";

    private StubApiServer sourceServer;
    private StubApiServer targetServer;
    private RecordTypeNameResolver resolver;

    @BeforeEach
    void setUp() {
        sourceServer = new StubApiServer();
        targetServer = new StubApiServer();
        resolver = new RecordTypeNameResolver(
            new RestRecordStore(new RestClient(new ConnectionContext(sourceServer.baseUrl(), "source-token"))),
            new RestRecordStore(new RestClient(new ConnectionContext(targetServer.baseUrl(), "target-token"))));
    }

    @AfterEach
    void tearDown() {
        sourceServer.close();
        targetServer.close();
    }

    @Test
    void recordTypeIsMatchedByDeveloperName() {
        sourceServer.on("GET", QUERY, Reply.ok(json(
            "{'done':true,'records':[{'Id':'012SRC','DeveloperName':'Enterprise'}]}")));
        targetServer.on("GET", QUERY, Reply.ok(json("{'done':true,'records':[{'Id':'012TGT'}]}")));

        StepVerifier.create(resolver.resolveStableName("Account", "012SRC"))
            .expectNext("012TGT")
            .verifyComplete();
        String targetSoql = targetServer.requests().get(0).decodedUri();
        assertTrue(targetSoql.contains("SobjectType = 'Account' AND DeveloperName = 'Enterprise'"), targetSoql);
        assertTrue(sourceServer.requests().get(0).decodedUri().contains("Id = '012SRC'"));
    }

    @Test
    void nameMissingInTargetResolvesEmpty() {
        sourceServer.on("GET", QUERY, Reply.ok(json(
            "{'done':true,'records':[{'Id':'012SRC','DeveloperName':'Legacy'}]}")));
        targetServer.on("GET", QUERY, Reply.ok(json("{'done':true,'records':[]}")));

        StepVerifier.create(resolver.resolveStableName("Account", "012SRC")).verifyComplete();
    }

    @Test
    void unknownSourceRecordTypeNeverAsksTheTarget() {
        sourceServer.on("GET", QUERY, Reply.ok(json("{'done':true,'records':[]}")));

        StepVerifier.create(resolver.resolveStableName("Account", "012GONE")).verifyComplete();
        assertTrue(targetServer.requests().isEmpty());
    }
}
