package net.hearth.adapter.jdbc.mapper;

import net.hearth.adapter.jdbc.JdbcUtil;
import net.hearth.core.model.WarmRun;
import net.hearth.core.model.WarmStatus;
import net.hearth.core.model.WarmTrigger;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- WarmRun ---
    public static WarmRun toWarmRun(ResultSet rs) throws SQLException {
        return new WarmRun(
                rs.getLong("ID"),
                rs.getString("SOURCE_ID"),
                rs.getString("NAMESPACE"),
                WarmTrigger.valueOf(rs.getString("TRIGGER_TYPE")),
                WarmStatus.valueOf(rs.getString("STATUS")),
                rs.getInt("KEY_COUNT"),
                rs.getTimestamp("STARTED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT")),
                rs.getString("ERROR_MSG")
        );
    }
}
