package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mutable-by-copy attribute bag stored with each channel.
 *
 * @param onboardingStatus backfill progress, absent before onboarding was requested
 * @param name human-readable channel name once known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelAttributes(
        @JsonProperty("onboarding_status") OnboardingStatus onboardingStatus,
        @JsonProperty("name") String name) {

    public static ChannelAttributes empty() {
        return new ChannelAttributes(null, null);
    }

    /**
     * Overlays the non-null fields of {@code patch} on top of this bag.
     */
    public ChannelAttributes merge(ChannelAttributes patch) {
        if (patch == null) {
            return this;
        }
        return new ChannelAttributes(
                patch.onboardingStatus() != null ? patch.onboardingStatus() : onboardingStatus,
                patch.name() != null ? patch.name() : name);
    }
}
