package com.foreman.core.engine;

import com.foreman.config.ForemanProperties;
import com.foreman.core.persistence.ProjectStore;
import com.foreman.core.persistence.SessionIdGenerator;
import com.foreman.core.qualitygate.QualityGate;
import com.foreman.core.qualitygate.QualityPredicates;
import com.foreman.core.report.Reporter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the coordinator collaborators. Each bean backs off when the application
 * supplies its own, which is how custom quality predicates and executors are plugged in.
 */
@Configuration
public class CoordinatorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public QualityPredicates qualityPredicates() {
        return QualityPredicates.defaults();
    }

    @Bean
    public QualityGate qualityGate(QualityPredicates qualityPredicates, ForemanProperties properties) {
        return new QualityGate(qualityPredicates, properties.getRetryCeiling());
    }

    @Bean
    public Reporter reporter(ProjectStore projectStore, Clock clock, ForemanProperties properties) {
        return new Reporter(projectStore, clock, properties.getStaleAfter());
    }

    @Bean
    public SessionIdGenerator sessionIdGenerator(Clock clock) {
        return new SessionIdGenerator(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentExecutor agentExecutor() {
        return new LoggingAgentExecutor();
    }
}
