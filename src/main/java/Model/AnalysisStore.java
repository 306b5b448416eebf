package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Relational copy of one {@link AnalysisResult}. Every save replaces the previous run wholesale.
 */
public class AnalysisStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalysisStore.class);

    public record LinkedDuplicate(String groupKey, String filePath, String recordId, LinkageStatus status) {}

    public record RemovalCandidate(GroupKind groupKind, String groupKey, String filePath, int rank) {}

    public record ConflictedImage(GroupKind groupKind, String groupKey, String filePath, LinkageStatus status) {}

    private static final String[] TABLES = {
            "image_record", "exact_duplicate", "collision_candidate", "similar_image",
            "ranked_member", "linkage_result", "identity_conflict", "external_record"
    };

    private final Connection conn;

    public AnalysisStore(String jdbcUrl) {
        try {
            conn = DriverManager.getConnection(jdbcUrl);
            init();
        } catch (SQLException e) {
            throw new StoreException("Cannot open analysis store at " + jdbcUrl, e);
        }
    }

    public static AnalysisStore openFile(String dbFilePath) {
        return new AnalysisStore("jdbc:h2:file:" + dbFilePath + ";AUTO_SERVER=TRUE");
    }

    private void init() throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS image_record (
                  file_path VARCHAR PRIMARY KEY,
                  content_digest VARCHAR,
                  weak_digest VARCHAR,
                  average_hash VARCHAR,
                  perceptual_hash VARCHAR,
                  x_resolution INT,
                  y_resolution INT,
                  num_unique_colors INT
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS exact_duplicate (
                  group_key VARCHAR NOT NULL,
                  weak_digest VARCHAR NOT NULL,
                  content_digest VARCHAR NOT NULL,
                  file_path VARCHAR NOT NULL
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS collision_candidate (
                  collision_kind VARCHAR NOT NULL,
                  shared_digest VARCHAR NOT NULL,
                  file_path VARCHAR NOT NULL,
                  content_digest VARCHAR NOT NULL,
                  weak_digest VARCHAR NOT NULL
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS similar_image (
                  perceptual_hash VARCHAR NOT NULL,
                  file_path VARCHAR NOT NULL
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS ranked_member (
                  group_kind VARCHAR NOT NULL,
                  group_key VARCHAR NOT NULL,
                  file_path VARCHAR NOT NULL,
                  member_rank INT NOT NULL,
                  ambiguous_best BOOLEAN NOT NULL
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS linkage_result (
                  file_path VARCHAR PRIMARY KEY,
                  code_and_number VARCHAR,
                  record_id VARCHAR,
                  status VARCHAR NOT NULL,
                  via_group_kind VARCHAR,
                  via_group_key VARCHAR
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS identity_conflict (
                  group_kind VARCHAR NOT NULL,
                  group_key VARCHAR NOT NULL,
                  record_id VARCHAR NOT NULL
                )
            """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS external_record (
                  record_id VARCHAR NOT NULL,
                  accession_number VARCHAR,
                  inventory_number VARCHAR,
                  code_and_number VARCHAR NOT NULL
                )
            """);
        }
    }

    public synchronized void save(AnalysisResult result, ExternalRecordTable externalRecords) {
        try {
            conn.setAutoCommit(false);
            try {
                clear();
                insertRecords(result.records());
                insertExactDuplicates(result.exactDuplicates().groups());
                insertCollisions(result.exactDuplicates());
                insertSimilarImages(result.similarityGroups());
                insertRankedMembers(result.rankedGroups());
                insertLinkage(result.linkage());
                insertExternalRecords(externalRecords);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot save analysis result", e);
        }
        log.info("Stored {} image records", result.records().size());
    }

    private void clear() throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String table : TABLES) st.execute("DELETE FROM " + table);
        }
    }

    private void insertRecords(List<ImageRecord> records) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO image_record VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
            for (ImageRecord r : records) {
                ps.setString(1, r.filePath());
                ps.setString(2, r.contentHex());
                ps.setString(3, r.weakHex());
                ps.setString(4, r.averageHex());
                ps.setString(5, r.perceptualHex());
                ps.setObject(6, r.xResolution(), Types.INTEGER);
                ps.setObject(7, r.yResolution(), Types.INTEGER);
                ps.setObject(8, r.numUniqueColors(), Types.INTEGER);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertExactDuplicates(List<DuplicateGroup> groups) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO exact_duplicate VALUES (?, ?, ?, ?)")) {
            for (DuplicateGroup g : groups) {
                for (ImageRecord m : g.members()) {
                    ps.setString(1, g.key());
                    ps.setString(2, g.weakDigest());
                    ps.setString(3, g.contentDigest());
                    ps.setString(4, m.filePath());
                    ps.addBatch();
                }
            }
            ps.executeBatch();
        }
    }

    private void insertCollisions(ExactDuplicateReport report) throws SQLException {
        List<CollisionGroup> all = new ArrayList<>(report.weakCollisions());
        all.addAll(report.strongCollisions());

        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO collision_candidate VALUES (?, ?, ?, ?, ?)")) {
            for (CollisionGroup c : all) {
                for (ImageRecord m : c.members()) {
                    ps.setString(1, c.kind().name());
                    ps.setString(2, c.sharedDigest());
                    ps.setString(3, m.filePath());
                    ps.setString(4, m.contentHex());
                    ps.setString(5, m.weakHex());
                    ps.addBatch();
                }
            }
            ps.executeBatch();
        }
    }

    private void insertSimilarImages(List<SimilarityGroup> groups) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO similar_image VALUES (?, ?)")) {
            for (SimilarityGroup g : groups) {
                for (ImageRecord m : g.members()) {
                    ps.setString(1, g.perceptualHash());
                    ps.setString(2, m.filePath());
                    ps.addBatch();
                }
            }
            ps.executeBatch();
        }
    }

    private void insertRankedMembers(List<RankedGroup> groups) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO ranked_member VALUES (?, ?, ?, ?, ?)")) {
            for (RankedGroup g : groups) {
                boolean ambiguous = g.ambiguousBest();
                for (RankedMember m : g.members()) {
                    ps.setString(1, g.kind().name());
                    ps.setString(2, g.key());
                    ps.setString(3, m.filePath());
                    ps.setInt(4, m.rank());
                    ps.setBoolean(5, ambiguous);
                    ps.addBatch();
                }
            }
            ps.executeBatch();
        }
    }

    private void insertLinkage(LinkageReport linkage) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO linkage_result VALUES (?, ?, ?, ?, ?, ?)")) {
            for (LinkageResult r : linkage.results()) {
                ps.setString(1, r.filePath());
                ps.setString(2, r.codeAndNumber());
                ps.setString(3, r.recordId());
                ps.setString(4, r.status().name());
                ps.setString(5, r.viaGroupKind() == null ? null : r.viaGroupKind().name());
                ps.setString(6, r.viaGroupKey());
                ps.addBatch();
            }
            ps.executeBatch();
        }
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO identity_conflict VALUES (?, ?, ?)")) {
            for (IdentityConflict c : linkage.conflicts()) {
                for (String recordId : c.recordIds()) {
                    ps.setString(1, c.groupKind().name());
                    ps.setString(2, c.groupKey());
                    ps.setString(3, recordId);
                    ps.addBatch();
                }
            }
            ps.executeBatch();
        }
    }

    private void insertExternalRecords(ExternalRecordTable table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO external_record VALUES (?, ?, ?, ?)")) {
            for (ExternalRecord r : table.records()) {
                ps.setString(1, r.recordId());
                ps.setString(2, r.accessionNumber());
                ps.setString(3, r.inventoryNumber());
                ps.setString(4, r.codeAndNumber());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    public synchronized List<LinkedDuplicate> exactDuplicatesWithLinkage() {
        String sql = """
            SELECT d.group_key, d.file_path, l.record_id, l.status
            FROM exact_duplicate d
            JOIN linkage_result l ON l.file_path = d.file_path
            ORDER BY d.group_key, d.file_path
        """;
        List<LinkedDuplicate> out = new ArrayList<>();
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                out.add(new LinkedDuplicate(rs.getString(1), rs.getString(2), rs.getString(3),
                        LinkageStatus.valueOf(rs.getString(4))));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot query exact duplicates", e);
        }
        return out;
    }

    public synchronized List<RemovalCandidate> removalCandidates(GroupKind kind) {
        String sql = """
            SELECT group_key, file_path, member_rank
            FROM ranked_member
            WHERE group_kind = ? AND member_rank > 1
            ORDER BY group_key, member_rank, file_path
        """;
        List<RemovalCandidate> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(new RemovalCandidate(kind, rs.getString(1), rs.getString(2), rs.getInt(3)));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot query removal candidates", e);
        }
        return out;
    }

    public synchronized List<String> ambiguousBestGroups(GroupKind kind) {
        String sql = """
            SELECT group_key
            FROM ranked_member
            WHERE group_kind = ? AND member_rank = 1
            GROUP BY group_key
            HAVING COUNT(*) > 1
            ORDER BY group_key
        """;
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, kind.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot query ambiguous groups", e);
        }
        return out;
    }

    public synchronized List<ConflictedImage> conflictedImages() {
        String sql = """
            SELECT DISTINCT r.group_kind, r.group_key, r.file_path, l.status
            FROM ranked_member r
            JOIN identity_conflict c ON c.group_kind = r.group_kind AND c.group_key = r.group_key
            JOIN linkage_result l ON l.file_path = r.file_path
            ORDER BY r.group_kind, r.group_key, r.file_path
        """;
        List<ConflictedImage> out = new ArrayList<>();
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                out.add(new ConflictedImage(GroupKind.valueOf(rs.getString(1)), rs.getString(2), rs.getString(3),
                        LinkageStatus.valueOf(rs.getString(4))));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot query identity conflicts", e);
        }
        return out;
    }

    public synchronized int count(String table) {
        if (!List.of(TABLES).contains(table)) throw new IllegalArgumentException("Unknown table " + table);
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new StoreException("Cannot count " + table, e);
        }
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Closing analysis store failed", e);
        }
    }
}
