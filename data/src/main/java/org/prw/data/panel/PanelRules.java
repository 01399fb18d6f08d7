package org.prw.data.panel;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Immutable reference tables driving the empanelment cascade.
 * <p>
 * Department, type and provider lookups are exact string matches. Well-visit keywords are
 * case-insensitive regular expressions searched anywhere in the diagnosis text.
 */
public final class PanelRules {

    public static final String DEFAULT_PEDIATRICS_SENTINEL = "PEDIATRICS";
    public static final String COMPLETED_STATUS = "Completed";

    private final ImmutableSet<String> pedsDepartments;
    private final ImmutableSet<String> wellVisitTypes;
    private final ImmutableList<Pattern> wellVisitKeywords;
    private final ImmutableMap<String, String> providerToLocation;
    private final ImmutableSet<String> excludedEncounterTypes;
    private final String pediatricsSentinel;

    private PanelRules(Builder builder) {
        this.pedsDepartments = ImmutableSet.copyOf(builder.pedsDepartments);
        this.wellVisitTypes = ImmutableSet.copyOf(builder.wellVisitTypes);
        this.wellVisitKeywords = builder.wellVisitKeywords.stream()
            .map(keyword -> Pattern.compile(keyword, Pattern.CASE_INSENSITIVE))
            .collect(ImmutableList.toImmutableList());
        this.providerToLocation = ImmutableMap.copyOf(builder.providerToLocation);
        this.excludedEncounterTypes = ImmutableSet.copyOf(builder.excludedEncounterTypes);
        this.pediatricsSentinel = builder.pediatricsSentinel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPedsDepartment(String department) {
        return department != null && pedsDepartments.contains(department);
    }

    /**
     * A well visit is recognized either by its encounter type or by a keyword in the diagnosis text.
     */
    public boolean isWellVisit(String encounterType, String diagnosisText) {
        if (encounterType != null && wellVisitTypes.contains(encounterType)) {
            return true;
        }
        if (diagnosisText == null || diagnosisText.isEmpty()) {
            return false;
        }
        for (Pattern keyword : wellVisitKeywords) {
            if (keyword.matcher(diagnosisText).find()) {
                return true;
            }
        }
        return false;
    }

    public boolean isRecognizedProvider(String provider) {
        return provider != null && providerToLocation.containsKey(provider);
    }

    /**
     * @return the provider's clinic location, or null if the provider is not recognized
     */
    public String locationFor(String provider) {
        return provider == null ? null : providerToLocation.get(provider);
    }

    public boolean isExcludedEncounterType(String encounterType) {
        return encounterType != null && excludedEncounterTypes.contains(encounterType);
    }

    public String getPediatricsSentinel() {
        return pediatricsSentinel;
    }

    public ImmutableSet<String> getPedsDepartments() {
        return pedsDepartments;
    }

    public ImmutableSet<String> getWellVisitTypes() {
        return wellVisitTypes;
    }

    public ImmutableMap<String, String> getProviderToLocation() {
        return providerToLocation;
    }

    public ImmutableSet<String> getExcludedEncounterTypes() {
        return excludedEncounterTypes;
    }

    /**
     * Returns a copy whose department, type and provider names have been passed through
     * {@code normalizer}, so lookups keep matching encounters cleaned the same way.
     * Locations and keywords are left as they are.
     */
    public PanelRules mapNames(UnaryOperator<String> normalizer) {
        Map<String, String> providers = new LinkedHashMap<>();
        providerToLocation.forEach((provider, location) -> providers.putIfAbsent(normalizer.apply(provider), location));
        return builder()
            .pedsDepartments(pedsDepartments.stream().map(normalizer).toList())
            .wellVisitTypes(wellVisitTypes.stream().map(normalizer).toList())
            .wellVisitKeywords(wellVisitKeywords.stream().map(Pattern::pattern).toList())
            .providerToLocation(providers)
            .excludedEncounterTypes(excludedEncounterTypes.stream().map(normalizer).toList())
            .pediatricsSentinel(pediatricsSentinel)
            .build();
    }

    @Override
    public String toString() {
        return "PanelRules{pedsDepartments=" + pedsDepartments.size()
            + ", wellVisitTypes=" + wellVisitTypes.size()
            + ", wellVisitKeywords=" + wellVisitKeywords.size()
            + ", providers=" + providerToLocation.size()
            + ", excludedEncounterTypes=" + excludedEncounterTypes.size()
            + ", pediatricsSentinel=" + pediatricsSentinel + "}";
    }

    public static final class Builder {
        private Collection<String> pedsDepartments = ImmutableSet.of();
        private Collection<String> wellVisitTypes = ImmutableSet.of();
        private Collection<String> wellVisitKeywords = ImmutableList.of();
        private Map<String, String> providerToLocation = ImmutableMap.of();
        private Collection<String> excludedEncounterTypes = ImmutableSet.of();
        private String pediatricsSentinel = DEFAULT_PEDIATRICS_SENTINEL;

        private Builder() {
        }

        public Builder pedsDepartments(Collection<String> pedsDepartments) {
            this.pedsDepartments = pedsDepartments;
            return this;
        }

        public Builder wellVisitTypes(Collection<String> wellVisitTypes) {
            this.wellVisitTypes = wellVisitTypes;
            return this;
        }

        public Builder wellVisitKeywords(Collection<String> wellVisitKeywords) {
            this.wellVisitKeywords = wellVisitKeywords;
            return this;
        }

        public Builder providerToLocation(Map<String, String> providerToLocation) {
            this.providerToLocation = providerToLocation;
            return this;
        }

        public Builder excludedEncounterTypes(Collection<String> excludedEncounterTypes) {
            this.excludedEncounterTypes = excludedEncounterTypes;
            return this;
        }

        public Builder pediatricsSentinel(String pediatricsSentinel) {
            this.pediatricsSentinel = pediatricsSentinel;
            return this;
        }

        public PanelRules build() {
            if (pediatricsSentinel == null || pediatricsSentinel.isBlank()) {
                throw new IllegalArgumentException("Pediatrics sentinel must not be blank");
            }
            return new PanelRules(this);
        }
    }
}
