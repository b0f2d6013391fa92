package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.constants.CampaignStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Locale;
import java.util.Map;

/**
 * Per-platform translation table used by the generic adapter: call-to-action codes,
 * status values in both directions, metric names and the insights lookback window.
 */
@Getter
@Builder
public class PlatformVocabulary {

    @Singular("callToAction")
    private final Map<String, String> callsToAction;

    private final String defaultCallToAction;

    @Singular("outboundStatus")
    private final Map<CampaignStatus, String> outboundStatuses;

    private final String defaultOutboundStatus;

    @Singular("inboundStatus")
    private final Map<String, CampaignStatus> inboundStatuses;

    @Builder.Default
    private final CampaignStatus defaultInboundStatus = CampaignStatus.DRAFT;

    @Singular
    private final Map<String, String> metrics;

    private final int lookbackDays;

    /** Caller CTA code (e.g. "apply_now") to the platform constant */
    public String callToAction(String code) {
        if (code == null) {
            return defaultCallToAction;
        }
        return callsToAction.getOrDefault(code.trim().toLowerCase(Locale.ROOT), defaultCallToAction);
    }

    public String toPlatformStatus(CampaignStatus status) {
        if (status == null) {
            return defaultOutboundStatus;
        }
        return outboundStatuses.getOrDefault(status, defaultOutboundStatus);
    }

    /** Always lands inside the six-value status enum */
    public CampaignStatus fromPlatformStatus(String platformStatus) {
        if (platformStatus == null) {
            return defaultInboundStatus;
        }
        return inboundStatuses.getOrDefault(platformStatus.toUpperCase(Locale.ROOT), defaultInboundStatus);
    }

    public String metric(String name) {
        return metrics.getOrDefault(name, name);
    }
}
