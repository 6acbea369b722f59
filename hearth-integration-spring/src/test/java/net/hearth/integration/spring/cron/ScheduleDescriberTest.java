package net.hearth.integration.spring.cron;

import net.hearth.core.cron.CronParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleDescriberTest {

    private final ScheduleDescriber describer = new ScheduleDescriber();

    @Test
    void describes_schedule_with_minimum_spacing() {
        assertThat(describer.describe(CronParser.parse("*/5 * * * *")))
                .isNotBlank()
                .endsWith("(at least PT5M apart)");
        assertThat(describer.describe(CronParser.parse("@daily")))
                .endsWith("(at least PT24H apart)");
    }
}
