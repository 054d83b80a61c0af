package db.migration;

import com.schedulinglinks.aggregator.crawl.model.UsState;
import java.sql.PreparedStatement;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V2__seed_states extends BaseJavaMigration {

  @Override
  public void migrate(Context context) throws Exception {
    String sql = "INSERT INTO states (state_id, name) VALUES (?, ?)";
    try (PreparedStatement ps = context.getConnection().prepareStatement(sql)) {
      for (UsState state : UsState.values()) {
        ps.setInt(1, state.id());
        ps.setString(2, state.code());
        ps.addBatch();
      }
      ps.executeBatch();
    }
  }
}
