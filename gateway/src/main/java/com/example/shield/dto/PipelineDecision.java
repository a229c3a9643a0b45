package com.example.shield.dto;

import com.example.shield.model.ClientIdentity;
import com.example.shield.model.PipelineStage;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PipelineDecision {
    String requestId;
    boolean admitted;
    /** Stage that produced the verdict. */
    PipelineStage decidedAt;
    ClientIdentity client;
    RateLimitResult rateLimit;
    ThreatScanResult threat;
    SecurityFailure failure;
    boolean failedOpen;

    public PipelineStage getOutcome() {
        return admitted ? PipelineStage.ADMITTED : PipelineStage.REJECTED;
    }
}
