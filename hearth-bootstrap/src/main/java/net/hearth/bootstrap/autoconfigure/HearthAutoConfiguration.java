package net.hearth.bootstrap.autoconfigure;

import net.hearth.bootstrap.catalog.CatalogRegistrar;
import net.hearth.bootstrap.props.HearthProperties;
import net.hearth.core.registry.SourceRegistry;
import net.hearth.core.schedule.ScheduleCalculator;
import net.hearth.core.service.WarmingScheduler;
import net.hearth.core.spi.CacheWriter;
import net.hearth.core.spi.Clock;
import net.hearth.core.spi.CronCalculator;
import net.hearth.core.spi.WarmRunRepository;
import net.hearth.core.spi.WarmingListener;
import net.hearth.integration.spring.HearthSpringConfig;
import net.hearth.integration.spring.cron.CronUtilsCalculator;
import net.hearth.integration.spring.cron.ScheduleDescriber;
import net.hearth.integration.spring.sched.HearthSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import javax.sql.DataSource;
import java.time.ZoneId;
import java.util.stream.Collectors;

@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@ConditionalOnProperty(prefix = "hearth", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(HearthProperties.class)
public class HearthAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(HearthAutoConfiguration.class);

    // --- SPI defaults ---

    @Bean
    @ConditionalOnMissingBean
    public Clock hearthClock() {
        return Clock.system();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronCalculator cronCalculator(HearthProperties props) {
        return switch (props.getScheduler().getCalculator()) {
            case CRON_UTILS -> new CronUtilsCalculator();
            case BUILTIN -> new ScheduleCalculator();
        };
    }

    // --- engine ---

    @Bean
    @ConditionalOnMissingBean
    public SourceRegistry sourceRegistry(Clock clock, CronCalculator calculator, HearthProperties props) {
        return new SourceRegistry(clock, ZoneId.of(props.getZone()), calculator);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CacheWriter.class)
    public WarmingScheduler warmingScheduler(SourceRegistry registry,
                                             CronCalculator calculator,
                                             Clock clock,
                                             CacheWriter cacheWriter,
                                             ObjectProvider<WarmingListener> listeners,
                                             HearthProperties props) {
        var s = props.getScheduler();
        return WarmingScheduler.builder()
                .registry(registry)
                .calculator(calculator)
                .clock(clock)
                .cacheWriter(cacheWriter)
                .listeners(listeners.orderedStream().toList())
                .workerThreads(s.getWorkerThreads())
                .fetchTimeout(s.getFetchTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleDescriber scheduleDescriber() {
        return new ScheduleDescriber();
    }

    // --- tick driver ---
    // member classes are parsed before this class's own beans, so they key off the user's CacheWriter

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnBean(CacheWriter.class)
    @ConditionalOnProperty(prefix = "hearth.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {

        @Bean
        public HearthSchedulers hearthSchedulers(WarmingScheduler scheduler,
                                                 ObjectProvider<WarmRunRepository> history,
                                                 Clock clock,
                                                 HearthProperties props) {
            var s = new HearthSchedulers(scheduler, history.getIfAvailable(), clock);
            s.setRetention(props.getHistory().getRetention());
            return s;
        }
    }

    // --- run history (JDBC) ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnProperty(prefix = "hearth.history", name = "enabled", havingValue = "true")
    @Import(HearthSpringConfig.class)
    static class HistoryConfiguration {
    }

    // --- catalog ---

    @Bean
    @ConditionalOnBean(CacheWriter.class)
    public CatalogRegistrar catalogRegistrar(WarmingScheduler scheduler,
                                             BeanFactory beans,
                                             ScheduleDescriber describer,
                                             Clock clock) {
        return new CatalogRegistrar(scheduler, beans, describer, clock);
    }

    @Bean
    @ConditionalOnBean(CatalogRegistrar.class)
    @ConditionalOnProperty(prefix = "hearth.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner hearthCatalogRunner(CatalogRegistrar registrar, HearthProperties props) {
        log.debug("Hearth catalog:\n{}", props.getCatalog().getSources().stream()
                .map(HearthProperties.SourceDef::toString).collect(Collectors.joining("\n")));
        return args -> registrar.register(props.getCatalog());
    }
}
