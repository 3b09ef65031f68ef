package paytask.gateway.ledger;

import paytask.gateway.ledger.dto.GetBlocksArgs;
import paytask.gateway.ledger.dto.QueryBlocksResponse;
import org.junit.jupiter.api.*;

import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class HttpLedgerClientTest {

    private FakeLedgerClient ledger;
    private StubLedgerServer server;
    private HttpLedgerClient client;

    @BeforeEach
    void setUp() {
        ledger = new FakeLedgerClient();
        server = new StubLedgerServer(ledger);
        client = new HttpLedgerClient(server.baseUrl(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void decodesBlocksFromLedger() {
        ledger.transfer(7, "alice", "paytask-gateway", 100, 42);

        QueryBlocksResponse response = client.queryBlocks(GetBlocksArgs.single(7)).join();

        assertEquals(1, response.blocks().size());
        QueryBlocksResponse.Transaction tx = response.blocks().get(0).transaction();
        assertEquals(BigInteger.valueOf(42), tx.memo());
        assertEquals(BigInteger.valueOf(100), tx.operation().transfer().amount().e8s());
        assertEquals(AccountAddress.of("alice").toHex(), tx.operation().transfer().from());
    }

    @Test
    void emptyRangeGivesNoBlocks() {
        QueryBlocksResponse response = client.queryBlocks(GetBlocksArgs.single(99)).join();
        assertTrue(response.blocks().isEmpty());
    }

    @Test
    void ignoresUnknownFieldsAndNonTransferOperations() {
        server.respondWithBody("""
                {
                  "chain_length": 10,
                  "first_block_index": 3,
                  "certificate": null,
                  "blocks": [
                    {"parent_hash": "00", "timestamp": 1,
                     "transaction": {"memo": 5, "created_at_time": null,
                                     "operation": {"Mint": {"to": "ab", "amount": {"e8s": 1}}}}}
                  ]
                }
                """);

        QueryBlocksResponse response = client.queryBlocks(GetBlocksArgs.single(3)).join();

        assertEquals(Long.valueOf(10), response.chainLength());
        assertEquals(1, response.blocks().size());
        assertNull(response.blocks().get(0).transaction().operation().transfer());
    }

    @Test
    void httpErrorFailsWithLedgerException() {
        server.respondWithStatus(502);

        CompletionException error = assertThrows(CompletionException.class,
                () -> client.queryBlocks(GetBlocksArgs.single(1)).join());
        assertInstanceOf(LedgerException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("502"));
    }

    @Test
    void undecodableBodyFailsWithLedgerException() {
        server.respondWithBody("not json");

        CompletionException error = assertThrows(CompletionException.class,
                () -> client.queryBlocks(GetBlocksArgs.single(1)).join());
        assertInstanceOf(LedgerException.class, error.getCause());
    }

    @Test
    void unreachableLedgerFailsWithLedgerException() {
        String url = server.baseUrl();
        server.close();
        HttpLedgerClient offline = new HttpLedgerClient(url, Duration.ofSeconds(2));

        CompletionException error = assertThrows(CompletionException.class,
                () -> offline.queryBlocks(GetBlocksArgs.single(1)).join());
        assertInstanceOf(LedgerException.class, error.getCause());
    }
}
