package net.hearth.core.registry;

import net.hearth.core.cron.CronExpression;
import net.hearth.core.model.WarmingSource;
import net.hearth.core.schedule.TimezoneInfo;

/**
 * A source accepted by the registry: its definition, the parsed schedule (null unless scheduled)
 * and the timezone snapshot taken at registration.
 */
public record RegisteredSource(WarmingSource source, CronExpression cron, TimezoneInfo zone) {

    public String id() { return source.id(); }

    public boolean scheduled() { return cron != null; }
}
