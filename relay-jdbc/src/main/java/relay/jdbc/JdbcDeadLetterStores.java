package relay.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import relay.jdbc.dialect.Dialects;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Factories for ready-made {@link JdbcDeadLetterStore}s.
 */
public final class JdbcDeadLetterStores {

  private JdbcDeadLetterStores() {
  }

  /**
   * Creates a store backed by an embedded H2 database file. H2 appends its own
   * {@code .mv.db} suffix to {@code path}; missing parent directories are created.
   *
   * @param path database file path without suffix, e.g. {@code data/dlq/dlq}
   * @return a store writing to {@value TableNames#DEFAULT_TABLE}
   * @throws UncheckedIOException if the parent directory cannot be created
   */
  public static JdbcDeadLetterStore fileBacked(Path path) {
    return fileBacked(path, TableNames.DEFAULT_TABLE);
  }

  public static JdbcDeadLetterStore fileBacked(Path path, String tableName) {
    Objects.requireNonNull(path, "path");
    Path absolute = path.toAbsolutePath();
    Path parent = absolute.getParent();
    if (parent != null) {
      try {
        Files.createDirectories(parent);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to create dead-letter directory " + parent, e);
      }
    }
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:file:" + absolute);
    return JdbcDeadLetterStore.builder(dataSource)
        .tableName(tableName)
        .dialect(Dialects.get("h2"))
        .build();
  }
}
