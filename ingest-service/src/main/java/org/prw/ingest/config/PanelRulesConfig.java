package org.prw.ingest.config;

import org.prw.data.panel.PanelRules;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference tables for empanelment, bound from "prw.rules.*".
 *
 * Providers are bound as a list of name/location pairs rather than a map because provider
 * names carry commas and brackets, which Spring would strip from map keys.
 */
@ConfigurationProperties(prefix = "prw.rules")
public class PanelRulesConfig {

    public static class ProviderLocation {
        private String provider;
        private String location;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    private List<String> pedsDepartments = new ArrayList<>();
    private List<String> wellVisitTypes = new ArrayList<>();
    private List<String> wellVisitKeywords = new ArrayList<>();
    private List<ProviderLocation> providers = new ArrayList<>();
    private List<String> excludedEncounterTypes = new ArrayList<>();
    private String pediatricsSentinel = PanelRules.DEFAULT_PEDIATRICS_SENTINEL;

    /**
     * @throws IllegalStateException if a provider entry is incomplete or listed twice
     */
    public PanelRules toPanelRules() {
        Map<String, String> providerToLocation = new LinkedHashMap<>();
        for (ProviderLocation entry : providers) {
            if (entry.getProvider() == null || entry.getProvider().isBlank()
                || entry.getLocation() == null || entry.getLocation().isBlank()) {
                throw new IllegalStateException("prw.rules.providers entries need both provider and location");
            }
            if (providerToLocation.put(entry.getProvider(), entry.getLocation()) != null) {
                throw new IllegalStateException("Provider listed twice in prw.rules.providers: " + entry.getProvider());
            }
        }
        return PanelRules.builder()
            .pedsDepartments(pedsDepartments)
            .wellVisitTypes(wellVisitTypes)
            .wellVisitKeywords(wellVisitKeywords)
            .providerToLocation(providerToLocation)
            .excludedEncounterTypes(excludedEncounterTypes)
            .pediatricsSentinel(pediatricsSentinel)
            .build();
    }

    public List<String> getPedsDepartments() {
        return pedsDepartments;
    }

    public void setPedsDepartments(List<String> pedsDepartments) {
        this.pedsDepartments = pedsDepartments;
    }

    public List<String> getWellVisitTypes() {
        return wellVisitTypes;
    }

    public void setWellVisitTypes(List<String> wellVisitTypes) {
        this.wellVisitTypes = wellVisitTypes;
    }

    public List<String> getWellVisitKeywords() {
        return wellVisitKeywords;
    }

    public void setWellVisitKeywords(List<String> wellVisitKeywords) {
        this.wellVisitKeywords = wellVisitKeywords;
    }

    public List<ProviderLocation> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderLocation> providers) {
        this.providers = providers;
    }

    public List<String> getExcludedEncounterTypes() {
        return excludedEncounterTypes;
    }

    public void setExcludedEncounterTypes(List<String> excludedEncounterTypes) {
        this.excludedEncounterTypes = excludedEncounterTypes;
    }

    public String getPediatricsSentinel() {
        return pediatricsSentinel;
    }

    public void setPediatricsSentinel(String pediatricsSentinel) {
        this.pediatricsSentinel = pediatricsSentinel;
    }
}
