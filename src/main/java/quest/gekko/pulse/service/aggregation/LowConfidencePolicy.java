package quest.gekko.pulse.service.aggregation;

import quest.gekko.pulse.exception.PipelineConfigurationException;

import java.util.Locale;

/**
 * What happens to rows whose confidence is under the configured floor.
 */
public enum LowConfidencePolicy {
    /** Counted and bucketed, left out of mean and stddev. */
    COUNT_ONLY,
    /** Dropped from the aggregate entirely. */
    EXCLUDE;

    public static LowConfidencePolicy parse(String value) {
        if (value == null || value.isBlank()) return COUNT_ONLY;
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Unknown low-confidence policy: " + value);
        }
    }
}
