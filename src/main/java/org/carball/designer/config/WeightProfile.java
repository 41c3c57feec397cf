package org.carball.designer.config;

import lombok.Getter;

/**
 * Preset cost weightings for common cluster situations.
 */
@Getter
public enum WeightProfile {

    BALANCED("balanced", "Equal weighting of network, skew and storage", 1.0, 1.0, 1.0),

    NETWORK_BOUND("network-bound", "Favour designs that keep operations on a single node", 2.0, 1.0, 0.5),

    HOTSPOT_AVERSE("hotspot-averse", "Penalize transient load imbalance heavily", 1.0, 3.0, 0.5),

    MEMORY_CONSTRAINED("memory-constrained", "Working set must fit in a tight memory budget", 1.0, 0.5, 3.0);

    private final String name;
    private final String description;
    private final double weightNetwork;
    private final double weightSkew;
    private final double weightDisk;

    WeightProfile(String name, String description,
                  double weightNetwork, double weightSkew, double weightDisk) {
        this.name = name;
        this.description = description;
        this.weightNetwork = weightNetwork;
        this.weightSkew = weightSkew;
        this.weightDisk = weightDisk;
    }

    /**
     * Copies this profile's weights onto the builder.
     */
    public CostModelConfig.CostModelConfigBuilder applyTo(CostModelConfig.CostModelConfigBuilder builder) {
        return builder
                .profileName(name)
                .weightNetwork(weightNetwork)
                .weightSkew(weightSkew)
                .weightDisk(weightDisk);
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static WeightProfile fromName(String name) {
        for (WeightProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new InvalidConfigurationException("Unknown weight profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    /**
     * Returns a comma-separated list of available profile names.
     */
    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (WeightProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }
}
