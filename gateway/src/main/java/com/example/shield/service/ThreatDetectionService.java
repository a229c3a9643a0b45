package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.RequestContext;
import com.example.shield.dto.ThreatScanResult;
import com.example.shield.model.ScanTarget;
import com.example.shield.model.Severity;
import com.example.shield.model.ThreatCategory;
import com.example.shield.model.ThreatPattern;
import com.example.shield.util.JsonStringCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.shield.model.ScanTarget.BODY;
import static com.example.shield.model.ScanTarget.PATH;
import static com.example.shield.model.ScanTarget.QUERY;
import static com.example.shield.model.ScanTarget.USER_AGENT;
import static com.example.shield.model.ThreatCategory.ATTACK_PATH;
import static com.example.shield.model.ThreatCategory.PATH_TRAVERSAL;
import static com.example.shield.model.ThreatCategory.PROTOCOL_ABUSE;
import static com.example.shield.model.ThreatCategory.SQL_INJECTION;
import static com.example.shield.model.ThreatCategory.SUSPICIOUS_USER_AGENT;
import static com.example.shield.model.ThreatCategory.XSS_ATTEMPT;

/**
 * Signature-based request inspection. Path and query are checked both raw
 * and URL-decoded; JSON bodies are checked field by field. The scan only
 * classifies; whether to block is the caller's decision.
 */
@Service
@Slf4j
public class ThreatDetectionService {

    static final String OVERSIZED_FIELD = "oversized_field";

    public static final List<ThreatPattern> PATTERNS = List.of(
            ThreatPattern.of("path_traversal", PATH_TRAVERSAL, "\\.\\.[/\\\\]", PATH, QUERY),
            ThreatPattern.of("encoded_path_traversal", PATH_TRAVERSAL, "%2e%2e", PATH, QUERY),

            ThreatPattern.of("wordpress_admin_probe", ATTACK_PATH, "/wp-(?:admin|config\\.php)", PATH),
            ThreatPattern.of("phpmyadmin_probe", ATTACK_PATH, "/phpmyadmin", PATH),
            ThreatPattern.of("env_file_probe", ATTACK_PATH, "/\\.env(?:$|[/.?])", PATH),
            ThreatPattern.of("php_config_probe", ATTACK_PATH, "/(?:config|admin)\\.php", PATH),
            ThreatPattern.of("git_directory_probe", ATTACK_PATH, "/\\.git/", PATH),
            ThreatPattern.of("system_file_probe", ATTACK_PATH, "/etc/passwd|/proc/version", PATH, QUERY),

            ThreatPattern.of("union_select", SQL_INJECTION, "\\bunion\\s+(?:all\\s+)?select\\b", QUERY, BODY),
            ThreatPattern.of("tautology_or", SQL_INJECTION, "\\bor\\s+1\\s*=\\s*1\\b", QUERY, BODY),
            ThreatPattern.of("tautology_and", SQL_INJECTION, "\\band\\s+1\\s*=\\s*1\\b", QUERY, BODY),
            ThreatPattern.of("quoted_or", SQL_INJECTION, "'\\s*or\\s*'", QUERY),
            ThreatPattern.of("quoted_and", SQL_INJECTION, "'\\s*and\\s*'", QUERY),
            ThreatPattern.of("drop_table", SQL_INJECTION, "\\bdrop\\s+table\\b", QUERY, BODY),
            ThreatPattern.of("insert_into", SQL_INJECTION, "\\binsert\\s+into\\b", QUERY),
            ThreatPattern.of("update_set", SQL_INJECTION, "\\bupdate\\s+\\w+\\s+set\\b", QUERY),
            ThreatPattern.of("delete_from", SQL_INJECTION, "\\bdelete\\s+from\\b", QUERY),
            ThreatPattern.of("sql_comment_terminator", SQL_INJECTION, "'\\s*;\\s*--", QUERY, BODY),

            ThreatPattern.of("script_tag", XSS_ATTEMPT, "<\\s*script", PATH, QUERY, BODY),
            ThreatPattern.of("event_handler_attribute", XSS_ATTEMPT, "[<\"'\\s/]on[a-z]{3,}\\s*=", QUERY, BODY),
            ThreatPattern.of("embedded_frame", XSS_ATTEMPT, "<\\s*(?:iframe|object|embed)\\b", PATH, QUERY),
            ThreatPattern.of("script_evaluation", XSS_ATTEMPT, "\\b(?:eval|expression)\\s*\\(", QUERY, BODY),

            ThreatPattern.of("javascript_scheme", PROTOCOL_ABUSE, "javascript\\s*:", PATH, QUERY, BODY),
            ThreatPattern.of("vbscript_scheme", PROTOCOL_ABUSE, "vbscript\\s*:", PATH, QUERY, BODY),
            ThreatPattern.of("data_uri_markup", PROTOCOL_ABUSE, "data:\\s*text/html|data:[^,\\s]*,\\s*<", QUERY, BODY),

            ThreatPattern.of("attack_tool_user_agent", SUSPICIOUS_USER_AGENT,
                    "sqlmap|nikto|nmap|masscan|acunetix|nessus|dirbuster|gobuster|wpscan|zgrab", USER_AGENT),
            ThreatPattern.of("automation_user_agent", SUSPICIOUS_USER_AGENT,
                    "bot|crawler|spider|scanner|curl|wget|python", USER_AGENT));

    private final int maxBodyBytes;
    private final int maxFieldLength;

    public ThreatDetectionService(ShieldProperties properties) {
        this.maxBodyBytes = properties.getThreat().getMaxBodyBytes();
        this.maxFieldLength = properties.getThreat().getMaxFieldLength();
    }

    public ThreatScanResult scan(RequestContext request) {
        return scan(request.getPath(), request.getRawQuery(), request.userAgent(),
                request.getBody(), isFormEncoded(request));
    }

    public ThreatScanResult scan(String path, String rawQuery, String userAgent, byte[] body) {
        return scan(path, rawQuery, userAgent, body, false);
    }

    private ThreatScanResult scan(String path, String rawQuery, String userAgent, byte[] body, boolean formEncoded) {
        Findings findings = new Findings();
        scanEncoded(path, PATH, findings);
        scanEncoded(rawQuery, QUERY, findings);
        scanValue(userAgent, USER_AGENT, findings);
        scanBody(body, formEncoded, findings);
        return findings.toResult();
    }

    private void scanEncoded(String raw, ScanTarget target, Findings findings) {
        if (raw == null || raw.isEmpty()) {
            return;
        }
        scanValue(raw, target, findings);
        String decoded = decode(raw);
        if (!decoded.equals(raw)) {
            scanValue(decoded, target, findings);
            // one more pass catches double encoding such as %252e%252e
            String twice = decode(decoded);
            if (!twice.equals(decoded)) {
                scanValue(twice, target, findings);
            }
        }
    }

    private void scanBody(byte[] body, boolean formEncoded, Findings findings) {
        if (body == null || body.length == 0) {
            return;
        }
        if (body.length > maxBodyBytes) {
            log.debug("Body of {} bytes exceeds scan limit {}, skipping body scan", body.length, maxBodyBytes);
            return;
        }
        if (formEncoded) {
            scanValue(decode(new String(body, StandardCharsets.UTF_8)), BODY, findings);
            return;
        }
        for (Map.Entry<String, String> field : JsonStringCollector.collect(body).entrySet()) {
            String value = field.getValue();
            if (value.length() > maxFieldLength) {
                findings.add(OVERSIZED_FIELD, ThreatCategory.OVERSIZED_FIELD);
            }
            scanValue(value, BODY, findings);
        }
    }

    private void scanValue(String value, ScanTarget target, Findings findings) {
        if (value == null || value.isEmpty()) {
            return;
        }
        for (ThreatPattern pattern : PATTERNS) {
            if (pattern.appliesTo(target) && pattern.matches(value)) {
                findings.add(pattern.name(), pattern.category());
            }
        }
    }

    private static boolean isFormEncoded(RequestContext request) {
        MediaType contentType = request.getHeaders().getContentType();
        return contentType != null && MediaType.APPLICATION_FORM_URLENCODED.isCompatibleWith(contentType);
    }

    static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // malformed escapes: scan the raw form only
            return value;
        }
    }

    private static final class Findings {
        private final Set<String> patterns = new LinkedHashSet<>();
        private final Set<ThreatCategory> categories = EnumSet.noneOf(ThreatCategory.class);
        private Severity severity;

        void add(String patternName, ThreatCategory category) {
            patterns.add(patternName);
            categories.add(category);
            severity = severity == null ? category.getSeverity() : Severity.max(severity, category.getSeverity());
        }

        ThreatScanResult toResult() {
            if (patterns.isEmpty()) {
                return ThreatScanResult.clean();
            }
            return new ThreatScanResult(true, new ArrayList<>(patterns), Set.copyOf(categories), severity);
        }
    }
}
