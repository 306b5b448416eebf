package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.Optional;

/**
 * Fingerprints keyed by path, valid only while the file's last-modified time and size are unchanged.
 */
public class FingerprintCache implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FingerprintCache.class);

    public record CachedFingerprint(long lastModified, long fileSize, ImageRecord record) {

        public boolean matches(long lastModified, long fileSize) {
            return this.lastModified == lastModified && this.fileSize == fileSize;
        }
    }

    private final Connection conn;

    public FingerprintCache(String jdbcUrl) {
        try {
            conn = DriverManager.getConnection(jdbcUrl);
            init();
        } catch (SQLException e) {
            throw new StoreException("Cannot open fingerprint cache at " + jdbcUrl, e);
        }
    }

    public static FingerprintCache openFile(String dbFilePath) {
        return new FingerprintCache("jdbc:h2:file:" + dbFilePath + ";AUTO_SERVER=TRUE");
    }

    private void init() throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS image_fingerprint (
                  path VARCHAR PRIMARY KEY,
                  content_digest VARCHAR NOT NULL,
                  weak_digest VARCHAR NOT NULL,
                  average_hash VARCHAR,
                  perceptual_hash VARCHAR,
                  x_resolution INT,
                  y_resolution INT,
                  last_modified BIGINT NOT NULL,
                  file_size BIGINT NOT NULL
                )
            """);
        }
    }

    public synchronized Optional<CachedFingerprint> get(String path) {
        try (PreparedStatement ps = conn.prepareStatement("""
            SELECT content_digest, weak_digest, average_hash, perceptual_hash,
                   x_resolution, y_resolution, last_modified, file_size
            FROM image_fingerprint WHERE path=?
        """)) {
            ps.setString(1, path);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                ImageRecord record = new ImageRecord(
                        path,
                        Fingerprint.ofNullable(FingerprintKind.CONTENT, rs.getString(1)),
                        Fingerprint.ofNullable(FingerprintKind.WEAK_CONTENT, rs.getString(2)),
                        Fingerprint.ofNullable(FingerprintKind.AVERAGE, rs.getString(3)),
                        Fingerprint.ofNullable(FingerprintKind.PERCEPTUAL, rs.getString(4)),
                        rs.getObject(5, Integer.class),
                        rs.getObject(6, Integer.class),
                        null
                );
                return Optional.of(new CachedFingerprint(rs.getLong(7), rs.getLong(8), record));
            }
        } catch (SQLException e) {
            throw new StoreException("Cannot read cached fingerprint of " + path, e);
        }
    }

    /** Unhashed records are never cached, the next run retries them. */
    public synchronized void put(ImageRecord record, long lastModified, long fileSize) {
        if (!record.isHashed()) {
            log.debug("Not caching unhashed record {}", record.filePath());
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement("""
            MERGE INTO image_fingerprint (path, content_digest, weak_digest, average_hash, perceptual_hash,
                                          x_resolution, y_resolution, last_modified, file_size)
            KEY(path) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """)) {
            ps.setString(1, record.filePath());
            ps.setString(2, record.contentHex());
            ps.setString(3, record.weakHex());
            ps.setString(4, record.averageHex());
            ps.setString(5, record.perceptualHex());
            ps.setObject(6, record.xResolution(), Types.INTEGER);
            ps.setObject(7, record.yResolution(), Types.INTEGER);
            ps.setLong(8, lastModified);
            ps.setLong(9, fileSize);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Cannot cache fingerprint of " + record.filePath(), e);
        }
    }

    @Override
    public void close() {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Closing fingerprint cache failed", e);
        }
    }
}
