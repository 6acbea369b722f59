package net.hearth.integration.spring.cron;

import com.cronutils.descriptor.CronDescriptor;
import com.cronutils.model.Cron;
import net.hearth.core.cron.CronExpression;
import net.hearth.core.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/** Human-readable schedule text for startup logs, e.g. "every 5 minutes (at least PT5M apart)". */
public final class ScheduleDescriber {
    private static final Logger log = LoggerFactory.getLogger(ScheduleDescriber.class);

    private final CronDescriptor descriptor;

    public ScheduleDescriber() {
        this(Locale.UK);
    }

    public ScheduleDescriber(Locale locale) {
        this.descriptor = CronDescriptor.instance(locale);
    }

    public String describe(CronExpression expr) {
        String text = descriptor.describe(parse(expr));
        Duration min = Duration.ofMillis(ScheduleCalculator.minimumIntervalMs(expr));
        return text + " (at least " + min + " apart)";
    }

    // steps and ranges read better as written; macros and syntax cron-utils rejects go in normalized form
    private static Cron parse(CronExpression expr) {
        if (!expr.source().startsWith("@")) {
            try {
                return CronUtilsCalculator.PARSER.parse(expr.source());
            } catch (IllegalArgumentException e) {
                log.debug("cron-utils rejects '{}', describing normalized form: {}", expr.source(), e.getMessage());
            }
        }
        return CronUtilsCalculator.PARSER.parse(expr.format());
    }
}
