package com.example.shield.dto;

import com.example.shield.model.Severity;
import com.example.shield.model.ThreatCategory;

import java.util.List;
import java.util.Set;

public record ThreatScanResult(boolean suspicious,
                               List<String> matchedPatterns,
                               Set<ThreatCategory> categories,
                               Severity severity) {

    public static ThreatScanResult clean() {
        return new ThreatScanResult(false, List.of(), Set.of(), null);
    }
}
