package net.hearth.adapter.jdbc.repo;

import net.hearth.adapter.jdbc.JdbcUtil;
import net.hearth.adapter.jdbc.TxContext;
import net.hearth.adapter.jdbc.TxRunner;
import net.hearth.adapter.jdbc.mapper.RowMappers;
import net.hearth.core.model.WarmRun;
import net.hearth.core.spi.WarmRunRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Run history in {@code TB_WARM_RUN}. Each call runs in (or joins) a {@link TxRunner#required} transaction. */
public final class JdbcWarmRunRepository implements WarmRunRepository {
    static final int ERROR_MAX = 4000;

    private final TxRunner tx;

    public JdbcWarmRunRepository(TxRunner tx) {
        this.tx = tx;
    }

    @Override
    public long save(WarmRun run) throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.required().prepareStatement(
                    """
                    INSERT INTO TB_WARM_RUN(SOURCE_ID, NAMESPACE, TRIGGER_TYPE, STATUS, KEY_COUNT, STARTED_AT, FINISHED_AT, ERROR_MSG)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """, new String[]{"ID"})) {
                ps.setString(1, run.sourceId());
                ps.setString(2, run.namespace());
                ps.setString(3, run.trigger().name());
                ps.setString(4, run.status().name());
                ps.setInt(5, run.keyCount());
                ps.setTimestamp(6, JdbcUtil.ts(run.startedAt()));
                ps.setTimestamp(7, JdbcUtil.ts(run.finishedAt()));
                ps.setString(8, JdbcUtil.clip(run.error(), ERROR_MAX));
                ps.executeUpdate();
                try (ResultSet k = ps.getGeneratedKeys()) {
                    if (!k.next()) throw new IllegalStateException("No id generated for warm run of " + run.sourceId());
                    return k.getLong(1);
                }
            }
        });
    }

    @Override
    public List<WarmRun> findRecent(String sourceId, int limit) throws Exception {
        if (limit <= 0) return List.of();
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.required().prepareStatement(
                    """
                    SELECT * FROM TB_WARM_RUN
                     WHERE SOURCE_ID = ?
                     ORDER BY STARTED_AT DESC, ID DESC
                    """)) {
                ps.setString(1, sourceId);
                ps.setMaxRows(limit);
                try (ResultSet rs = ps.executeQuery()) {
                    var out = new ArrayList<WarmRun>();
                    while (rs.next()) out.add(RowMappers.toWarmRun(rs));
                    return out;
                }
            }
        });
    }

    @Override
    public int purgeFinishedBefore(Instant threshold) throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.required().prepareStatement(
                    "DELETE FROM TB_WARM_RUN WHERE FINISHED_AT < ?")) {
                ps.setTimestamp(1, JdbcUtil.ts(threshold));
                return ps.executeUpdate();
            }
        });
    }
}
