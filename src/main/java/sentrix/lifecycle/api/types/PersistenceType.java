package sentrix.lifecycle.api.types;

/**
 * How long a breeding-site category physically tends to remain unresolved, ordered by typical lifespan.
 */
public enum PersistenceType {
    /** Hours to days (puddles, pooled water). */
    TRANSIENT("Hours to days"),
    /** Days to weeks (loose trash that gets collected). */
    SHORT_TERM("Days to weeks"),
    /** Weeks to months (small potholes). */
    MEDIUM_TERM("Weeks to months"),
    /** Months to years (road defects needing public works). */
    LONG_TERM("Months to years"),
    /** Until intervention. No breeding-site type maps here yet. */
    PERMANENT("Permanent until intervention");

    private final String typicalLifespan;

    PersistenceType(String typicalLifespan) {
        this.typicalLifespan = typicalLifespan;
    }

    public String typicalLifespan() {
        return typicalLifespan;
    }

    /**
     * Whether current weather changes how long a site of this class persists. Only standing water dries out or
     * refills on a timescale the validity model cares about.
     */
    public boolean isWeatherDependent() {
        return this == TRANSIENT;
    }

    public boolean requiresFrequentMonitoring() {
        return this == TRANSIENT;
    }

    public boolean requiresStructuralIntervention() {
        return this == LONG_TERM || this == PERMANENT;
    }
}
