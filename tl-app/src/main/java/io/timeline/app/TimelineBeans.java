package io.timeline.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.timeline.core.HlcClock;
import io.timeline.store.EventStoreFactory;
import io.timeline.store.InMemoryEventStore;
import io.timeline.store.JsonLinesEventStore;
import io.timeline.store.jdbc.EventDataType;
import io.timeline.store.jdbc.JdbcEventStore;
import io.timeline.store.jdbc.SqlDialect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;

/**
 * Backend selection by profile: {@code inmem} (also the default), {@code file} or {@code jdbc}.
 */
@Configuration
@PropertySource("classpath:timeline.properties")
public class TimelineBeans {

    @Bean
    HlcClock hlcClock(Environment env) {
        return new HlcClock(Clock.systemUTC(), env.getProperty("timeline.node"));
    }

    @Bean
    ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @Profile({"inmem", "default"})
    EventStoreFactory inMemoryStores() {
        return InMemoryEventStore::new;
    }

    @Bean
    @Profile("file")
    EventStoreFactory fileStores(Environment env, ObjectMapper json) {
        var path = Path.of(env.getRequiredProperty("timeline.file.path"));
        return processor -> new JsonLinesEventStore(path, json, processor);
    }

    @Bean
    @Profile("jdbc")
    DataSource dataSource(Environment env) {
        var ds = new DriverManagerDataSource(env.getRequiredProperty("timeline.jdbc.url"));
        ds.setUsername(env.getProperty("timeline.jdbc.username"));
        ds.setPassword(env.getProperty("timeline.jdbc.password"));
        return ds;
    }

    @Bean
    @Profile("jdbc")
    EventStoreFactory jdbcStores(DataSource dataSource, Environment env, ObjectMapper json) {
        var dialect = SqlDialect.valueOf(env.getProperty("timeline.jdbc.dialect", "POSTGRES").toUpperCase(Locale.ROOT));
        var dataType = EventDataType.valueOf(env.getProperty("timeline.jdbc.data-type", "TEXT").toUpperCase(Locale.ROOT));
        return processor -> JdbcEventStore.open(dataSource, dialect, dataType, json, processor);
    }

    @Bean(initMethod = "init", destroyMethod = "dispose")
    CounterView counterView(EventStoreFactory stores) {
        return new CounterView(stores);
    }
}
