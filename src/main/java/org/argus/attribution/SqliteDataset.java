package org.argus.attribution;

import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Attribution table stored in SQLite as {@code addresses(ip, org_id, platform)}. Opened read-only;
 * duplicate addresses resolve to the lowest rowid.
 */
public final class SqliteDataset implements AttributionDataset {
    static final String TABLE = "addresses";
    private static final String PROBE_SQL = "SELECT ip, org_id, platform FROM " + TABLE + " LIMIT 1";
    private static final String LOOKUP_SQL = "SELECT org_id, platform FROM " + TABLE
            + " WHERE ip = ? ORDER BY rowid LIMIT 1";

    private final String name;
    private final Connection connection;
    private final PreparedStatement lookup;

    private SqliteDataset(String name, Connection connection, PreparedStatement lookup) {
        this.name = name;
        this.connection = connection;
        this.lookup = lookup;
    }

    public static SqliteDataset open(Path file) throws IOException {
        final var config = new SQLiteConfig();
        config.setReadOnly(true);
        Connection connection = null;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath(), config.toProperties());
            try (var probe = connection.createStatement()) {
                probe.executeQuery(PROBE_SQL).close();
            }
            return new SqliteDataset(IndexedBlobDataset.datasetName(file), connection,
                    connection.prepareStatement(LOOKUP_SQL));
        } catch (SQLException ex) {
            closeQuietly(connection, ex);
            throw new IOException("Unable to open attribution table in " + file + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Attribution> lookup(String address) {
        try {
            lookup.setString(1, address);
            try (var rs = lookup.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Attribution(rs.getString(1), rs.getString(2), name));
            }
        } catch (SQLException ex) {
            throw new IllegalStateException("Attribution lookup failed in dataset " + name, ex);
        }
    }

    @Override
    public void close() {
        try {
            lookup.close();
            connection.close();
        } catch (SQLException ex) {
            System.err.printf("Failed to close attribution dataset %s: %s%n", name, ex.getMessage());
        }
    }

    private static void closeQuietly(Connection connection, SQLException cause) {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }
}
