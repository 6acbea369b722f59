package net.hearth.core.registry;

import net.hearth.core.error.CronParseException;
import net.hearth.core.error.CycleException;
import net.hearth.core.error.DuplicateSourceException;
import net.hearth.core.error.InvalidSourceException;
import net.hearth.core.error.ScheduleException;
import net.hearth.core.error.SourceInUseException;
import net.hearth.core.error.UnknownSourceException;
import net.hearth.core.model.WarmingSource;
import net.hearth.core.model.WarmingStrategy;
import net.hearth.core.schedule.ScheduleCalculator;
import net.hearth.core.schedule.TimezoneInfo;
import net.hearth.core.spi.Fetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SourceRegistryTest {

    private static final Fetcher EMPTY = Map::of;

    SourceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SourceRegistry(() -> Instant.parse("2024-06-01T00:00:00Z"), ZoneId.of("Asia/Seoul"),
                new ScheduleCalculator());
    }

    private static WarmingSource src(String id, String... deps) {
        return WarmingSource.builder(id).fetcher(EMPTY).dependsOn(deps).build();
    }

    @Test
    void warm_order_is_dependencies_first() {
        registry.register(src("C"));
        registry.register(src("B", "C"));
        registry.register(src("A", "B"));

        assertEquals(List.of("C", "B", "A"), registry.resolveWarmOrder("A"));
        assertEquals(List.of("C"), registry.resolveWarmOrder("C"));
    }

    @Test
    void diamond_lists_shared_dependency_once() {
        registry.register(src("base"));
        registry.register(src("left", "base"));
        registry.register(src("right", "base"));
        registry.register(src("top", "left", "right"));

        List<String> order = registry.resolveWarmOrder("top");
        assertThat(order).containsExactly("base", "left", "right", "top");
    }

    @Test
    void self_dependency_is_a_cycle() {
        var ex = assertThrows(CycleException.class, () -> registry.register(src("A", "A")));
        assertEquals(List.of("A", "A"), ex.path());
        assertEquals(0, registry.size());
    }

    @Test
    void cycle_through_existing_source_is_rejected_and_registry_unchanged() {
        registry.register(src("A"));
        registry.register(src("B", "A"));
        int before = registry.size();

        var ex = assertThrows(CycleException.class, () -> registry.register(src("C", "B", "C")));
        assertEquals(List.of("C", "C"), ex.path());
        assertThrows(DuplicateSourceException.class, () -> registry.register(src("A", "B")));
        assertEquals(before, registry.size());
        assertEquals(List.of("A", "B"), registry.resolveWarmOrder("B"));
    }

    @Test
    void unknown_dependency_is_rejected() {
        var ex = assertThrows(UnknownSourceException.class, () -> registry.register(src("A", "ghost")));
        assertEquals("ghost", ex.sourceId());
        assertTrue(registry.find("A").isEmpty());
    }

    @Test
    void bad_schedules_are_rejected() {
        assertThrows(CronParseException.class, () -> registry.register(
                WarmingSource.builder("bad").fetcher(EMPTY).schedule("61 * * * *").build()));
        assertThrows(ScheduleException.class, () -> registry.register(
                WarmingSource.builder("never").fetcher(EMPTY).schedule("0 0 31 2 *").build()));
        assertEquals(0, registry.size());
    }

    @Test
    void source_validation() {
        assertThrows(InvalidSourceException.class, () -> WarmingSource.builder("x").build());
        assertThrows(InvalidSourceException.class, () -> WarmingSource.builder(" ").fetcher(EMPTY).build());
        assertThrows(InvalidSourceException.class,
                () -> WarmingSource.builder("x").fetcher(EMPTY).strategy(WarmingStrategy.SCHEDULED).build());
        assertThrows(InvalidSourceException.class, () -> WarmingSource.builder("x").fetcher(EMPTY).ttlSeconds(-1).build());

        var s = WarmingSource.builder("x").fetcher(EMPTY).build();
        assertEquals("x", s.name());
        assertEquals(WarmingSource.DEFAULT_NAMESPACE, s.namespace());
    }

    @Test
    void scheduled_source_gets_parsed_cron_and_default_zone() {
        var reg = registry.register(WarmingSource.builder("s").fetcher(EMPTY).schedule("@hourly").build());
        assertTrue(reg.scheduled());
        assertEquals("@hourly", reg.cron().source());
        assertEquals(new TimezoneInfo("Asia/Seoul", 540), reg.zone());

        var pinned = registry.register(WarmingSource.builder("p").fetcher(EMPTY).schedule("@daily")
                .timezone(TimezoneInfo.utc()).build());
        assertEquals(TimezoneInfo.utc(), pinned.zone());
    }

    @Test
    void remove_refuses_while_dependents_exist() {
        registry.register(src("base"));
        registry.register(src("child", "base"));

        var ex = assertThrows(SourceInUseException.class, () -> registry.remove("base"));
        assertEquals(Set.of("child"), ex.dependents());

        registry.remove("child");
        registry.remove("base");
        assertEquals(0, registry.size());
        assertThrows(UnknownSourceException.class, () -> registry.remove("base"));
    }

    @Test
    void dependents_and_clear() {
        registry.register(src("a"));
        registry.register(src("b", "a"));
        registry.register(src("c", "a"));
        assertEquals(Set.of("b", "c"), registry.dependentsOf("a"));

        assertEquals(List.of("a", "b", "c"), registry.clear());
        assertTrue(registry.all().isEmpty());
        assertThrows(UnknownSourceException.class, () -> registry.get("a"));
    }
}
