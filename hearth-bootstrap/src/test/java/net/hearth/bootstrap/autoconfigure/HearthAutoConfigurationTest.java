package net.hearth.bootstrap.autoconfigure;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.hearth.bootstrap.catalog.CatalogRegistrar;
import net.hearth.core.model.SourceStatus;
import net.hearth.core.model.WarmStatus;
import net.hearth.core.registry.RegisteredSource;
import net.hearth.core.registry.SourceRegistry;
import net.hearth.core.schedule.ScheduleCalculator;
import net.hearth.core.service.WarmRunRecorder;
import net.hearth.core.service.WarmingScheduler;
import net.hearth.core.spi.CacheWriter;
import net.hearth.core.spi.CronCalculator;
import net.hearth.core.spi.Fetcher;
import net.hearth.core.spi.WarmRunRepository;
import net.hearth.integration.spring.cron.CronUtilsCalculator;
import net.hearth.integration.spring.sched.HearthSchedulers;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

class HearthAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HearthAutoConfiguration.class))
            .withPropertyValues("hearth.scheduler.tick-delay-ms=3600000");

    @Configuration(proxyBeanMethods = false)
    static class CacheBeans {
        final Map<String, Object> cache = new ConcurrentHashMap<>();

        @Bean
        CacheWriter cacheWriter() {
            return (ns, k, v, ttl) -> cache.put(ns + ":" + k, v);
        }

        @Bean
        Fetcher categories() {
            return () -> Map.of("all", "a,b,c");
        }

        @Bean
        Fetcher productsFetcher() {
            return () -> Map.of("p1", "apple");
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class DataSourceBeans {
        @Bean(destroyMethod = "close")
        DataSource dataSource() {
            HikariConfig cfg = new HikariConfig();
            cfg.setJdbcUrl("jdbc:h2:mem:hearth-boot;MODE=Oracle;DB_CLOSE_DELAY=-1");
            cfg.setUsername("sa");
            cfg.setPassword("");
            cfg.setMaximumPoolSize(2);
            var ds = new HikariDataSource(cfg);
            Flyway.configure().dataSource(ds).locations("classpath:db/migration/oracle").load().migrate();
            return ds;
        }
    }

    @Test
    void engine_beans_without_cache_writer_but_no_scheduler() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(SourceRegistry.class);
            assertThat(ctx.getBean(CronCalculator.class)).isInstanceOf(ScheduleCalculator.class);
            assertThat(ctx).doesNotHaveBean(WarmingScheduler.class);
            assertThat(ctx).doesNotHaveBean(HearthSchedulers.class);
            assertThat(ctx).doesNotHaveBean(CatalogRegistrar.class);
        });
    }

    @Test
    void master_switch_turns_everything_off() {
        runner.withUserConfiguration(CacheBeans.class)
                .withPropertyValues("hearth.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(SourceRegistry.class);
                    assertThat(ctx).doesNotHaveBean(WarmingScheduler.class);
                });
    }

    @Test
    void cron_utils_calculator_is_selectable() {
        runner.withPropertyValues("hearth.scheduler.calculator=cron-utils")
                .run(ctx -> assertThat(ctx.getBean(CronCalculator.class)).isInstanceOf(CronUtilsCalculator.class));
    }

    @Test
    void scheduler_driver_can_be_disabled() {
        runner.withUserConfiguration(CacheBeans.class)
                .withPropertyValues("hearth.scheduler.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(WarmingScheduler.class);
                    assertThat(ctx).doesNotHaveBean(HearthSchedulers.class);
                });
    }

    @Test
    void catalog_registers_sources_in_dependency_order() {
        runner.withUserConfiguration(CacheBeans.class)
                .withPropertyValues(
                        "hearth.zone=Asia/Seoul",
                        "hearth.catalog.sources[0].id=products",
                        "hearth.catalog.sources[0].namespace=catalog",
                        "hearth.catalog.sources[0].ttl=10m",
                        "hearth.catalog.sources[0].schedule=*/5 * * * *",
                        "hearth.catalog.sources[0].fetcher=productsFetcher",
                        "hearth.catalog.sources[0].dependencies[0]=categories",
                        "hearth.catalog.sources[0].backoff.max-retries=2",
                        "hearth.catalog.sources[0].jitter.max-percent=0.05",
                        "hearth.catalog.sources[1].id=categories")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(HearthSchedulers.class);
                    ctx.getBean("hearthCatalogRunner", ApplicationRunner.class).run(new DefaultApplicationArguments());

                    WarmingScheduler scheduler = ctx.getBean(WarmingScheduler.class);
                    assertThat(scheduler.registry().all()).extracting(RegisteredSource::id)
                            .containsExactly("categories", "products");

                    var products = scheduler.registry().get("products");
                    assertThat(products.source().ttlSeconds()).isEqualTo(600);
                    assertThat(products.source().backoff().maxRetries()).isEqualTo(2);
                    assertThat(products.zone().name()).isEqualTo("Asia/Seoul");
                    assertThat(scheduler.status("products")).map(SourceStatus::nextRunAt).isPresent();

                    assertThat(scheduler.warmNow("products").join().status()).isEqualTo(WarmStatus.SUCCEEDED);
                    var cache = ctx.getBean(CacheBeans.class).cache;
                    assertThat(cache).containsEntry("catalog:p1", "apple").containsEntry("default:all", "a,b,c");
                });
    }

    @Test
    void history_records_runs_when_enabled() {
        runner.withUserConfiguration(CacheBeans.class, DataSourceBeans.class)
                .withPropertyValues("hearth.history.enabled=true",
                        "hearth.catalog.sources[0].id=categories")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(WarmRunRecorder.class);
                    ctx.getBean("hearthCatalogRunner", ApplicationRunner.class).run(new DefaultApplicationArguments());

                    ctx.getBean(WarmingScheduler.class).warmNow("categories").join();

                    var runs = ctx.getBean(WarmRunRepository.class).findRecent("categories", 5);
                    assertThat(runs).hasSize(1);
                    assertThat(runs.get(0).keyCount()).isEqualTo(1);
                });
    }

    @Test
    void history_is_off_by_default() {
        runner.withUserConfiguration(CacheBeans.class, DataSourceBeans.class)
                .run(ctx -> assertThat(ctx).doesNotHaveBean(WarmRunRepository.class));
    }
}
