package com.example.shield.dto;

import com.example.shield.model.SecurityEventType;
import com.example.shield.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Event reported by the protected application through the admin API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SecurityEventReport {
    private SecurityEventType type;
    private Severity severity;  // defaults to the type's severity when absent
    private String sourceIp;
    private String userAgent;
    private String userId;
    private Map<String, Object> details;
}
