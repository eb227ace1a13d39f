package com.calcifer.config;

import com.calcifer.backend.ExecutionBackends;
import com.calcifer.backend.LocalBackend;
import com.calcifer.backend.RemoteBackend;
import com.calcifer.backend.ssh.CredentialResolver;
import com.calcifer.backend.ssh.SessionFactory;
import com.calcifer.backend.ssh.SshjSessionFactory;
import com.calcifer.core.engine.ProvisioningEngine;
import com.calcifer.core.events.EventBus;
import com.calcifer.core.metrics.CalciferMetrics;
import com.calcifer.core.registry.TaskRegistry;
import com.calcifer.core.task.TaskHarness;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CalciferConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public CredentialResolver credentialResolver() {
        return new CredentialResolver();
    }

    @Bean
    public SessionFactory sessionFactory(CalciferProperties properties, CredentialResolver credentialResolver) {
        return new SshjSessionFactory(properties.getSsh(), credentialResolver);
    }

    @Bean
    public ExecutionBackends executionBackends(CalciferProperties properties) {
        int seconds = properties.getSsh().getCommandTimeoutSeconds();
        Duration commandTimeout = seconds > 0 ? Duration.ofSeconds(seconds) : null;
        return new ExecutionBackends(new LocalBackend(commandTimeout), new RemoteBackend(commandTimeout));
    }

    @Bean
    public ProvisioningEngine provisioningEngine(TaskRegistry taskRegistry,
                                                 ExecutionBackends executionBackends,
                                                 TaskHarness taskHarness,
                                                 SessionFactory sessionFactory,
                                                 EventBus eventBus,
                                                 @Autowired(required = false) CalciferMetrics metrics,
                                                 CalciferProperties properties) {
        return new ProvisioningEngine(taskRegistry, executionBackends, taskHarness, sessionFactory,
                eventBus, metrics, properties.getMaxParallel());
    }
}
