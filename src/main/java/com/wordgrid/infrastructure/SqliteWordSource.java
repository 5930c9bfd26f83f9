package com.wordgrid.infrastructure;

import com.wordgrid.application.DictionaryLoadException;
import com.wordgrid.application.port.WordSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

/**
 * Word list read from the {@code dict} table of a SQLite database.
 *
 * <p>The database is opened read-only for the duration of a single scan and closed again; the
 * words end up in the in-memory prefix index, so no connection is held afterwards. The connection
 * is configured with:
 * - query_only=ON
 * - busy_timeout=3000
 * - temp_store=MEMORY
 */
@Component
@ConditionalOnProperty(name = "wordgrid.dictionary.source", havingValue = "sqlite")
public class SqliteWordSource implements WordSource {
  private static final Logger log = LoggerFactory.getLogger(SqliteWordSource.class);

  private static final String JDBC_PREFIX = "jdbc:sqlite:";
  private static final String SQL_ALL_WORDS = "SELECT word FROM dict";

  private final String jdbcUrl;

  public SqliteWordSource(@Value("${wordgrid.dictionary-jdbc-url}") String jdbcUrl) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "wordgrid.dictionary-jdbc-url");
  }

  @Override
  public List<String> words() {
    checkFileExists();

    SQLiteConfig cfg = new SQLiteConfig();
    cfg.setReadOnly(true);
    cfg.setOpenMode(SQLiteOpenMode.READONLY);

    List<String> words = new ArrayList<>();
    try (Connection conn = DriverManager.getConnection(jdbcUrl, cfg.toProperties());
        Statement s = conn.createStatement()) {
      s.execute("PRAGMA query_only=ON");
      s.execute("PRAGMA busy_timeout=3000");
      s.execute("PRAGMA temp_store=MEMORY");
      try (ResultSet rs = s.executeQuery(SQL_ALL_WORDS)) {
        while (rs.next()) {
          String w = rs.getString(1);
          if (w != null) words.add(w);
        }
      }
    } catch (SQLException e) {
      throw new DictionaryLoadException(
          "Cannot read dictionary DB " + jdbcUrl + ": " + e.getMessage(), e);
    }
    log.debug("Read {} rows from {}", words.size(), jdbcUrl);
    return words;
  }

  @Override
  public String describe() {
    return jdbcUrl;
  }

  /** File URLs must point at an existing database; SQLite would otherwise report a vague error. */
  private void checkFileExists() {
    if (!jdbcUrl.startsWith(JDBC_PREFIX)) return;
    String path = jdbcUrl.substring(JDBC_PREFIX.length());
    if (path.startsWith(":")) return;
    Path db = Path.of(path).toAbsolutePath().normalize();
    if (Files.notExists(db)) {
      throw new DictionaryLoadException("Dictionary DB not found: " + db);
    }
  }
}
