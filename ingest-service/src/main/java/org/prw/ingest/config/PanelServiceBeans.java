package org.prw.ingest.config;

import org.prw.data.panel.PanelRules;
import org.prw.processing.panel.PanelAssignmentEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PanelServiceBeans {
    private static final Logger log = LoggerFactory.getLogger(PanelServiceBeans.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PanelRules panelRules(PanelRulesConfig rulesConfig) {
        PanelRules rules = rulesConfig.toPanelRules();
        log.info("Loaded reference tables: {}", rules);
        return rules;
    }

    @Bean
    public PanelAssignmentEngine panelAssignmentEngine(PanelRules rules, PanelServiceConfig config) {
        return new PanelAssignmentEngine(rules, config.isStripTrailingIds(), config.getPanelThreads());
    }
}
