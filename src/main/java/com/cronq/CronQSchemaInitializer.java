package com.cronq;

import com.cronq.config.CronQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned scripts under {@code cronq/migration} once per
 * database, recording a checksum of each in {@code cronq_schema_migrations}.
 */
@Component
@ConditionalOnProperty(prefix = "cronq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class CronQSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(CronQSchemaInitializer.class);
    private static final String MIGRATIONS = "classpath*:cronq/migration/V*__*.sql";
    private static final Pattern FILE_NAME = Pattern.compile("^V(\\d+)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final long ADVISORY_LOCK_KEY = 4_771_902_316_550_218_113L;

    private final DataSource dataSource;
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public CronQSchemaInitializer(DataSource dataSource, CronQProperties properties) {
        this.dataSource = dataSource;
        this.tablePrefix = normalizePrefix(properties.getDatabase().getTablePrefix());
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        String historyTable = tablePrefix + "cronq_schema_migrations";
        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lock(connection);
            try {
                int applied = migrate(connection, historyTable);
                log.info("CronQ schema is up to date ({} migration(s) applied now)", applied);
            } finally {
                if (locked) {
                    unlock(connection);
                }
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Failed to migrate the CronQ schema", e);
            }
            log.error("Failed to migrate the CronQ schema (continuing because "
                    + "cronq.database.fail-on-migration-error=false)", e);
        }
    }

    private int migrate(Connection connection, String historyTable) throws SQLException, IOException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version INTEGER PRIMARY KEY,
                        description VARCHAR(255) NOT NULL,
                        checksum VARCHAR(64) NOT NULL,
                        installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP
                    )
                    """.formatted(historyTable));
        }

        Map<Integer, String> appliedChecksums = new HashMap<>();
        try (PreparedStatement statement = connection.prepareStatement("SELECT version, checksum FROM " + historyTable);
                ResultSet rows = statement.executeQuery()) {
            while (rows.next()) {
                appliedChecksums.put(rows.getInt("version"), rows.getString("checksum"));
            }
        }

        List<Migration> migrations = readMigrations();
        if (migrations.isEmpty()) {
            throw new IllegalStateException("No CronQ migrations found at " + MIGRATIONS);
        }
        int applied = 0;
        for (Migration migration : migrations) {
            String recorded = appliedChecksums.remove(migration.version());
            if (recorded == null) {
                apply(connection, historyTable, migration);
                applied++;
            } else if (!recorded.equals(migration.checksum())) {
                throw new IllegalStateException("Migration " + migration.fileName() + " changed after it was applied");
            }
        }
        if (!appliedChecksums.isEmpty()) {
            throw new IllegalStateException("Applied migration(s) " + appliedChecksums.keySet()
                    + " are missing from the classpath");
        }
        return applied;
    }

    private void apply(Connection connection, String historyTable, Migration migration) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            byte[] sql = render(migration.sql()).getBytes(StandardCharsets.UTF_8);
            ScriptUtils.executeSqlScript(connection,
                    new EncodedResource(new ByteArrayResource(sql, migration.fileName()), StandardCharsets.UTF_8));
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT INTO " + historyTable + " (version, description, checksum) VALUES (?, ?, ?)")) {
                insert.setInt(1, migration.version());
                insert.setString(2, migration.description());
                insert.setString(3, migration.checksum());
                insert.executeUpdate();
            }
            connection.commit();
            log.info("Applied CronQ migration {}", migration.fileName());
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private List<Migration> readMigrations() throws IOException {
        Resource[] resources = new PathMatchingResourcePatternResolver().getResources(MIGRATIONS);
        List<Migration> migrations = new ArrayList<>();
        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            Matcher matcher = fileName == null ? null : FILE_NAME.matcher(fileName);
            if (matcher == null || !matcher.matches()) {
                throw new IllegalStateException("Migration file '" + fileName + "' must be named V{n}__{description}.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            migrations.add(new Migration(Integer.parseInt(matcher.group(1)), matcher.group(2).replace('_', ' '),
                    fileName, sql, sha256(sql)));
        }
        migrations.sort(Comparator.comparingInt(Migration::version));
        for (int i = 1; i < migrations.size(); i++) {
            if (migrations.get(i).version() == migrations.get(i - 1).version()) {
                throw new IllegalStateException("Duplicate migration version " + migrations.get(i).version());
            }
        }
        return migrations;
    }

    // Scripts are written against unprefixed names.
    String render(String sql) {
        if (tablePrefix.isEmpty()) {
            return sql;
        }
        return sql.replace("idx_cronq_", tablePrefix + "idx_cronq_")
                .replaceAll("\\bcronq_jobs\\b", tablePrefix + "cronq_jobs");
    }

    private boolean lock(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        if (product == null || !product.toLowerCase(Locale.ROOT).contains("postgresql")) {
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private void unlock(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release the CronQ migration lock", e);
        }
    }

    static String normalizePrefix(String prefix) {
        String trimmed = prefix == null ? "" : prefix.trim();
        if (!trimmed.isEmpty() && !IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported cronq.database.table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private static String sha256(String sql) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(sql.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private record Migration(int version, String description, String fileName, String sql, String checksum) {
    }
}
