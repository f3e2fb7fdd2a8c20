package com.example.dataflow.config;

import com.example.dataflow.core.RefreshPipeline;
import com.example.dataflow.repository.JdbcTableMetadataRepository;
import com.example.dataflow.service.RefreshJobManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
@ConditionalOnProperty(prefix = "dataflow.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerConfig {

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RefreshJobManager refreshJobManager(JdbcTableMetadataRepository tableMetadataRepository,
                                               RefreshPipeline refreshPipeline,
                                               DataflowProperties properties) {
        DataflowProperties.Scheduler scheduler = properties.getScheduler();
        return new RefreshJobManager(tableMetadataRepository, refreshPipeline,
                                     scheduler.getReconcileInterval(),
                                     scheduler.getInitialDelay(),
                                     scheduler.getShutdownLogInterval(),
                                     TimeUnit.SECONDS);
    }
}
