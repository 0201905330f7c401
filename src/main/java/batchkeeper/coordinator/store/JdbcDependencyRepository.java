package batchkeeper.coordinator.store;

import batchkeeper.coordinator.error.CycleException;
import batchkeeper.coordinator.error.NotFoundException;
import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.DependencyKind;
import batchkeeper.coordinator.repository.DependencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JDBC implementation of DependencyRepository.
 * Cycle detection runs inside the inserting transaction, so a rejected batch leaves no edges behind.
 */
public class JdbcDependencyRepository implements DependencyRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcDependencyRepository.class);

    private final Database db;

    public JdbcDependencyRepository(Database db) {
        this.db = db;
    }

    @Override
    public int addAll(Collection<DependencyEdge> edges) {
        if (edges.isEmpty()) {
            return 0;
        }
        int inserted = db.inTransaction("insert dependency edges", conn -> insertEdges(conn, edges));
        log.debug("Inserted {} of {} dependency edges", inserted, edges.size());
        return inserted;
    }

    @Override
    public List<DependencyEdge> dependenciesOf(String jobId) {
        return db.query("load dependencies of " + jobId, conn -> select(conn,
                "SELECT * FROM dependencies WHERE dependent_id = ? ORDER BY predecessor_id, kind", jobId));
    }

    @Override
    public List<DependencyEdge> dependentsOf(String jobId) {
        return db.query("load dependents of " + jobId, conn -> select(conn,
                "SELECT * FROM dependencies WHERE predecessor_id = ? ORDER BY dependent_id, kind", jobId));
    }

    /**
     * Insert edges on an open transaction. Shared with job creation so a job
     * and its edges commit together.
     */
    static int insertEdges(Connection conn, Collection<DependencyEdge> edges) throws SQLException {
        if (edges.isEmpty()) {
            return 0;
        }
        Set<String> endpoints = new LinkedHashSet<>();
        for (DependencyEdge edge : edges) {
            endpoints.add(edge.dependentId());
            endpoints.add(edge.predecessorId());
        }
        for (String id : endpoints) {
            if (!jobExists(conn, id)) {
                throw new NotFoundException(id);
            }
        }

        // predecessor -> dependents
        Map<String, Set<String>> successors = loadGraph(conn);
        int inserted = 0;

        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO dependencies (dependent_id, predecessor_id, kind) VALUES (?, ?, ?)")) {
            for (DependencyEdge edge : edges) {
                if (edge.isSelfLoop()) {
                    throw new CycleException(edge);
                }
                if (edgeExists(conn, edge)) {
                    continue;
                }
                if (reachable(successors, edge.dependentId(), edge.predecessorId())) {
                    throw new CycleException(edge);
                }
                ps.setString(1, edge.dependentId());
                ps.setString(2, edge.predecessorId());
                ps.setString(3, edge.kind().name());
                ps.executeUpdate();
                successors.computeIfAbsent(edge.predecessorId(), k -> new HashSet<>()).add(edge.dependentId());
                inserted++;
            }
        }
        return inserted;
    }

    static int deleteIncoming(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM dependencies WHERE dependent_id = ?")) {
            ps.setString(1, jobId);
            return ps.executeUpdate();
        }
    }

    private static boolean reachable(Map<String, Set<String>> successors, String from, String target) {
        Deque<String> stack = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            if (seen.add(current)) {
                for (String next : successors.getOrDefault(current, Set.of())) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    private static Map<String, Set<String>> loadGraph(Connection conn) throws SQLException {
        Map<String, Set<String>> successors = new HashMap<>();
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT dependent_id, predecessor_id FROM dependencies")) {
            while (rs.next()) {
                successors.computeIfAbsent(rs.getString("predecessor_id"), k -> new HashSet<>())
                        .add(rs.getString("dependent_id"));
            }
        }
        return successors;
    }

    private static boolean jobExists(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM jobs WHERE id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static boolean edgeExists(Connection conn, DependencyEdge edge) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM dependencies WHERE dependent_id = ? AND predecessor_id = ? AND kind = ?")) {
            ps.setString(1, edge.dependentId());
            ps.setString(2, edge.predecessorId());
            ps.setString(3, edge.kind().name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static List<DependencyEdge> select(Connection conn, String sql, String jobId) throws SQLException {
        List<DependencyEdge> edges = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    edges.add(new DependencyEdge(
                            rs.getString("dependent_id"),
                            rs.getString("predecessor_id"),
                            DependencyKind.valueOf(rs.getString("kind"))));
                }
            }
        }
        return edges;
    }
}
