package org.spindlecheck.runtime.model.variants;

import java.util.Locale;

/**
 * Tags the available kinetochore variants and binds each one to its configuration key.
 */
public enum VariantType {
    FAULTY_SENSOR("faultySensor", new FaultySensorVariant()),
    UNSTABLE_BOUNDARY("unstableBoundary", new UnstableBoundaryVariant()),
    HYPERSTABLE("hyperstable", new HyperstableVariant()),
    ELEVATED_MISATTACHMENT_RISK("elevatedMisattachmentRisk", new ElevatedMisattachmentRiskVariant());

    private final String configKey;
    private final IKinetochoreVariant variant;

    VariantType(String configKey, IKinetochoreVariant variant) {
        this.configKey = configKey;
        this.variant = variant;
    }

    /**
     * @return the key under {@code spindlecheck.variants} that lists the pairs of this type
     */
    public String getConfigKey() {
        return configKey;
    }

    /**
     * @return the shared, stateless variant instance
     */
    public IKinetochoreVariant getVariant() {
        return variant;
    }

    /**
     * Looks up a variant by its configuration key, case-insensitively.
     * @param key the configuration key
     * @return the matching type
     * @throws IllegalArgumentException if no variant uses this key
     */
    public static VariantType fromConfigKey(String key) {
        for (VariantType type : values()) {
            if (type.configKey.toLowerCase(Locale.ROOT).equals(key.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown kinetochore variant: " + key);
    }
}
