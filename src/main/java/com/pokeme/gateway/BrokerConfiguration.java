package com.pokeme.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pokeme.gateway.http.JsonBodyReader;
import com.pokeme.gateway.http.LoopbackOriginFilter;
import com.pokeme.lifecycle.BrokerShutdown;
import com.pokeme.lifecycle.IdleWatchdog;
import com.pokeme.notify.LoggingNotifier;
import com.pokeme.notify.Notifier;
import com.pokeme.observability.BrokerMetrics;
import com.pokeme.shared.config.ConfigLoader;
import com.pokeme.shared.config.PokemeConfig;
import com.pokeme.store.RequestStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BrokerConfiguration {

    @Bean
    public PokemeConfig pokemeConfig(@Value("${pokeme.config:}") String configPath) {
        return ConfigLoader.load(configPath);
    }

    @Bean
    public RequestStore requestStore(PokemeConfig config) {
        return new RequestStore(config.limits(), Clock.systemUTC());
    }

    @Bean
    public BrokerMetrics brokerMetrics(RequestStore store) {
        var metrics = new BrokerMetrics();
        metrics.bindPendingGauge(store);
        return metrics;
    }

    @Bean
    public Notifier notifier() {
        return new LoggingNotifier();
    }

    @Bean
    public JsonBodyReader jsonBodyReader(ObjectMapper objectMapper, PokemeConfig config) {
        return new JsonBodyReader(objectMapper, config.limits().maxBodyBytes());
    }

    @Bean
    public LoopbackOriginFilter loopbackOriginFilter() {
        return new LoopbackOriginFilter();
    }

    @Bean
    public BrokerShutdown brokerShutdown(ConfigurableApplicationContext context) {
        return new BrokerShutdown(context::close);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public IdleWatchdog idleWatchdog(RequestStore store, PokemeConfig config, BrokerShutdown shutdown) {
        return new IdleWatchdog(store, config.watchdog(), () -> shutdown.request("idle timeout"));
    }
}
