package paytask.gateway.store;

import paytask.gateway.config.GatewayConfig;
import paytask.gateway.model.OwnerIndexEntry;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOwnerIndexRepositoryTest {

    private static Database db;
    private static JdbcOwnerIndexRepository repo;

    @BeforeAll
    static void setup() {
        GatewayConfig config = GatewayConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-owner-index;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcOwnerIndexRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanIndex() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM owner_tasks");
            conn.commit();
        }
    }

    @Test
    void keepsInsertionOrder() {
        repo.append("alice", "t3");
        repo.append("alice", "t1");
        repo.append("alice", "t2");

        assertEquals(List.of("t3", "t1", "t2"), repo.findTaskIds("alice"));
    }

    @Test
    void unknownOwnerHasEmptyList() {
        assertEquals(List.of(), repo.findTaskIds("nobody"));
    }

    @Test
    void appendIsIdempotent() {
        repo.append("alice", "t1");
        repo.append("alice", "t1");

        assertEquals(List.of("t1"), repo.findTaskIds("alice"));
    }

    @Test
    void ownersAreSeparate() {
        repo.append("alice", "t1");
        repo.append("bob", "t2");

        assertTrue(repo.contains("alice", "t1"));
        assertFalse(repo.contains("alice", "t2"));
        assertEquals(List.of("t2"), repo.findTaskIds("bob"));
    }

    @Test
    void removeEntry() {
        repo.append("alice", "t1");
        repo.append("alice", "t2");

        assertTrue(repo.remove("alice", "t1"));
        assertFalse(repo.remove("alice", "t1"));
        assertFalse(repo.remove("bob", "t2"));
        assertEquals(List.of("t2"), repo.findTaskIds("alice"));
    }

    @Test
    void findAllEntries() {
        repo.append("alice", "t1");
        repo.append("bob", "t2");

        List<OwnerIndexEntry> entries = repo.findAllEntries();
        assertEquals(List.of(new OwnerIndexEntry("alice", "t1"), new OwnerIndexEntry("bob", "t2")), entries);
    }
}
