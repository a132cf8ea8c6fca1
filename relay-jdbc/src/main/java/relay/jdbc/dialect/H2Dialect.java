package relay.jdbc.dialect;

import java.util.List;

/**
 * H2 dialect. Backs the file-based default store and the tests.
 */
public final class H2Dialect extends AbstractDialect {

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String idColumn() {
    return "BIGINT AUTO_INCREMENT PRIMARY KEY";
  }

  @Override
  protected String textType() {
    return "CHARACTER VARYING";
  }
}
