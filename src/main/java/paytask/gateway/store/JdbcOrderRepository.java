package paytask.gateway.store;

import paytask.gateway.model.PaymentOrder;
import paytask.gateway.model.PaymentStatus;
import paytask.gateway.repository.DuplicateMemoException;
import paytask.gateway.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of OrderRepository.
 * Removal from pending locks the row and lets the DELETE update count pick
 * the single winner among racing callers.
 */
public class JdbcOrderRepository implements OrderRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOrderRepository.class);
    private static final String UNIQUE_VIOLATION = "23505";

    private final Database db;

    public JdbcOrderRepository(Database db) {
        this.db = db;
    }

    @Override
    public void savePending(PaymentOrder order) {
        if (order.status() != PaymentStatus.PENDING) {
            throw new IllegalArgumentException("only PENDING orders can be reserved: " + order);
        }

        String sql = """
                    INSERT INTO pending_orders (memo, order_id, fee, status, payer, paid_at_block, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindOrder(ps, order);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new DuplicateMemoException(order.memo(), e);
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new DuplicateMemoException(order.memo(), e);
            }
            throw new RuntimeException("Failed to save pending order: " + order.memo(), e);
        }
    }

    @Override
    public Optional<PaymentOrder> findPending(long memo) {
        String sql = "SELECT * FROM pending_orders WHERE memo = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, memo);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find pending order: " + memo, e);
        }
    }

    @Override
    public Optional<PaymentOrder> removePendingIfPresent(long memo) {
        try (Connection conn = db.getConnection()) {
            try {
                Optional<PaymentOrder> removed = removePending(conn, memo);
                conn.commit();
                return removed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove pending order: " + memo, e);
        }
    }

    @Override
    public Optional<PaymentOrder> promote(long memo, long paidAtBlock) {
        String deleteSettledSql = "DELETE FROM settled_orders WHERE payer = ?";
        String insertSettledSql = """
                    INSERT INTO settled_orders (memo, order_id, fee, status, payer, paid_at_block, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                Optional<PaymentOrder> removed = removePending(conn, memo);
                if (removed.isEmpty()) {
                    conn.rollback();
                    return Optional.empty();
                }

                PaymentOrder settled = removed.get().completeAt(paidAtBlock);

                try (PreparedStatement del = conn.prepareStatement(deleteSettledSql);
                        PreparedStatement ins = conn.prepareStatement(insertSettledSql)) {
                    del.setString(1, settled.payer());
                    int overwritten = del.executeUpdate();
                    if (overwritten > 0) {
                        log.debug("Overwriting previous settled order of payer {}", settled.payer());
                    }

                    bindOrder(ins, settled);
                    ins.executeUpdate();
                }

                conn.commit();
                return Optional.of(settled);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to promote order: " + memo, e);
        }
    }

    @Override
    public Optional<PaymentOrder> findSettled(String payer) {
        String sql = "SELECT * FROM settled_orders WHERE payer = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, payer);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find settled order for payer: " + payer, e);
        }
    }

    @Override
    public List<PaymentOrder> findAllPending() {
        String sql = "SELECT * FROM pending_orders ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<PaymentOrder> orders = new ArrayList<>();
            while (rs.next()) {
                orders.add(mapRow(rs));
            }
            return orders;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list pending orders", e);
        }
    }

    @Override
    public int countPending() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM pending_orders");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count pending orders", e);
        }
    }

    @Override
    public int countPendingCreatedBefore(Instant cutoff) {
        String sql = "SELECT COUNT(*) FROM pending_orders WHERE created_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count pending orders before " + cutoff, e);
        }
    }

    /**
     * Lock and delete the pending row inside the caller's transaction.
     */
    private Optional<PaymentOrder> removePending(Connection conn, long memo) throws SQLException {
        PaymentOrder order;
        try (PreparedStatement select = conn.prepareStatement(
                "SELECT * FROM pending_orders WHERE memo = ? FOR UPDATE")) {
            select.setLong(1, memo);
            try (ResultSet rs = select.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                order = mapRow(rs);
            }
        }

        try (PreparedStatement delete = conn.prepareStatement("DELETE FROM pending_orders WHERE memo = ?")) {
            delete.setLong(1, memo);
            if (delete.executeUpdate() == 0) {
                return Optional.empty();
            }
        }
        return Optional.of(order);
    }

    private static void bindOrder(PreparedStatement ps, PaymentOrder order) throws SQLException {
        ps.setLong(1, order.memo());
        ps.setString(2, order.orderId());
        ps.setLong(3, order.fee());
        ps.setString(4, order.status().name());
        ps.setString(5, order.payer());
        if (order.paidAtBlock().isPresent()) {
            ps.setLong(6, order.paidAtBlock().getAsLong());
        } else {
            ps.setNull(6, Types.BIGINT);
        }
        ps.setTimestamp(7, Timestamp.from(order.createdAt()));
    }

    private PaymentOrder mapRow(ResultSet rs) throws SQLException {
        return PaymentOrder.builder()
                .memo(rs.getLong("memo"))
                .orderId(rs.getString("order_id"))
                .fee(rs.getLong("fee"))
                .status(PaymentStatus.valueOf(rs.getString("status")))
                .payer(rs.getString("payer"))
                .paidAtBlock(getLongOrNull(rs, "paid_at_block"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
