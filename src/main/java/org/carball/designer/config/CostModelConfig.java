package org.carball.designer.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Cluster constraints and cost weights for one evaluation session.
 * Cluster fields have no defaults and must be supplied; weights default to equal weighting.
 */
@Value
@Builder(toBuilder = true)
@Slf4j
public class CostModelConfig {

    // Cluster constraints
    long maxMemoryBytes;

    int skewIntervals;

    int addressSizeBits;

    int nodeCount;

    // Cost weights
    @Builder.Default
    double weightNetwork = 1.0;

    @Builder.Default
    double weightSkew = 1.0;

    @Builder.Default
    double weightDisk = 1.0;

    // Profile information
    @Builder.Default
    String profileName = "balanced";

    /**
     * Rejects settings the cost model cannot work with and logs warnings for suspicious ones.
     *
     * @throws InvalidConfigurationException if a cluster value is non-positive or the weights are unusable
     */
    public void validate() {
        if (nodeCount <= 0) {
            throw new InvalidConfigurationException("Node count must be positive, got " + nodeCount);
        }
        if (skewIntervals <= 0) {
            throw new InvalidConfigurationException("Skew interval count must be positive, got " + skewIntervals);
        }
        if (maxMemoryBytes <= 0) {
            throw new InvalidConfigurationException("Max memory must be positive, got " + maxMemoryBytes);
        }
        if (addressSizeBits <= 0) {
            throw new InvalidConfigurationException("Address size must be positive, got " + addressSizeBits);
        }
        if (weightNetwork < 0 || weightSkew < 0 || weightDisk < 0) {
            throw new InvalidConfigurationException(String.format(
                    "Cost weights must not be negative (network=%.2f, skew=%.2f, disk=%.2f)",
                    weightNetwork, weightSkew, weightDisk));
        }
        if (weightNetwork + weightSkew + weightDisk <= 0) {
            throw new InvalidConfigurationException("Cost weights must not sum to zero");
        }

        if (addressSizeBits != 32 && addressSizeBits != 64) {
            log.warn("Unusual address size of {} bits; index overhead estimates assume 32 or 64", addressSizeBits);
        }
        if (nodeCount == 1) {
            log.warn("Single node cluster: network and skew costs cannot distinguish designs");
        }

        log.debug("Using cost model config - Nodes: {}, Intervals: {}, Memory: {}, Profile: {}",
                nodeCount, skewIntervals, maxMemoryBytes, profileName);
    }

    /**
     * Bytes each index entry is assumed to take, one address per indexed document.
     */
    public int getIndexEntryBytes() {
        return Math.max(1, addressSizeBits / 8);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Nodes: %d | Intervals: %d | Memory: %d bytes | Weights: %.2f/%.2f/%.2f",
                profileName, nodeCount, skewIntervals, maxMemoryBytes,
                weightNetwork, weightSkew, weightDisk);
    }
}
