package paytask.gateway.store;

import paytask.gateway.model.OwnerIndexEntry;
import paytask.gateway.repository.OwnerIndexRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of OwnerIndexRepository.
 * List order is the insertion sequence ({@code seq}); (owner, task_id) is unique.
 */
public class JdbcOwnerIndexRepository implements OwnerIndexRepository {

    private final Database db;

    public JdbcOwnerIndexRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(String owner, String taskId) {
        String sql = """
                    INSERT INTO owner_tasks (owner, task_id)
                    SELECT ?, ? WHERE NOT EXISTS (
                        SELECT 1 FROM owner_tasks WHERE owner = ? AND task_id = ?
                    )
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, owner);
            ps.setString(2, taskId);
            ps.setString(3, owner);
            ps.setString(4, taskId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to index task " + taskId + " for owner " + owner, e);
        }
    }

    @Override
    public List<String> findTaskIds(String owner) {
        String sql = "SELECT task_id FROM owner_tasks WHERE owner = ? ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, owner);
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("task_id"));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks of owner: " + owner, e);
        }
    }

    @Override
    public boolean contains(String owner, String taskId) {
        String sql = "SELECT 1 FROM owner_tasks WHERE owner = ? AND task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, owner);
            ps.setString(2, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up task " + taskId + " for owner " + owner, e);
        }
    }

    @Override
    public boolean remove(String owner, String taskId) {
        String sql = "DELETE FROM owner_tasks WHERE owner = ? AND task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, owner);
            ps.setString(2, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to unindex task " + taskId + " for owner " + owner, e);
        }
    }

    @Override
    public List<OwnerIndexEntry> findAllEntries() {
        String sql = "SELECT owner, task_id FROM owner_tasks ORDER BY seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<OwnerIndexEntry> entries = new ArrayList<>();
            while (rs.next()) {
                entries.add(new OwnerIndexEntry(rs.getString("owner"), rs.getString("task_id")));
            }
            return entries;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list owner index", e);
        }
    }
}
