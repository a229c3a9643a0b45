package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.RequestContext;
import com.example.shield.dto.ThreatScanResult;
import com.example.shield.model.Severity;
import com.example.shield.model.ThreatCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ThreatDetectionServiceTest {

    private static final String BROWSER = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 Chrome/124.0";

    private final ThreatDetectionService detector = new ThreatDetectionService(new ShieldProperties());

    private static byte[] json(String body) {
        return body.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testPathTraversalIsMediumOrHigher() {
        ThreatScanResult result = detector.scan("/files/../../../etc/passwd", null, BROWSER, null);

        assertThat(result.suspicious()).isTrue();
        assertThat(result.severity().isAtLeast(Severity.MEDIUM)).isTrue();
        assertThat(result.categories()).contains(ThreatCategory.PATH_TRAVERSAL);
    }

    @Test
    void testEncodedTraversalInQuery() {
        ThreatScanResult result = detector.scan("/api/files", "name=%2e%2e%2f%2e%2e%2fsecrets", BROWSER, null);

        assertThat(result.matchedPatterns()).contains("encoded_path_traversal", "path_traversal");
    }

    @Test
    void testDoubleEncodedTraversalInQuery() {
        ThreatScanResult result = detector.scan("/api/files", "name=%252e%252e%252fetc", BROWSER, null);

        assertThat(result.categories()).contains(ThreatCategory.PATH_TRAVERSAL);
    }

    @Test
    void testTautologyInQueryIsHigh() {
        ThreatScanResult result = detector.scan("/api/search", "q=%27%20OR%201%3D1", BROWSER, null);

        assertThat(result.suspicious()).isTrue();
        assertThat(result.severity()).isEqualTo(Severity.HIGH);
        assertThat(result.categories()).contains(ThreatCategory.SQL_INJECTION);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "q=1 UNION SELECT password FROM users",
            "id=1%3B%20DROP%20TABLE%20users",
            "name=x' or 'a'='a"
    })
    void testSqlInjectionShapes(String query) {
        assertThat(detector.scan("/api/search", query, BROWSER, null).categories())
                .contains(ThreatCategory.SQL_INJECTION);
    }

    @Test
    void testCleanRequest() {
        ThreatScanResult result = detector.scan("/api/articles", "q=hello%20world&page=2", BROWSER, null);

        assertThat(result.suspicious()).isFalse();
        assertThat(result.matchedPatterns()).isEmpty();
        assertThat(result.severity()).isNull();
    }

    @Test
    void testOrdinaryParametersNotMistakenForHandlers() {
        assertThat(detector.scan("/api/articles", "regional=1&one=2&section=news", BROWSER, null).suspicious())
                .isFalse();
    }

    @Test
    void testScriptInJsonBody() {
        byte[] body = json("{\"title\":\"Hi\",\"content\":{\"html\":\"<script>alert(1)</script>\"}}");

        ThreatScanResult result = detector.scan("/api/articles", null, BROWSER, body);

        assertThat(result.severity()).isEqualTo(Severity.HIGH);
        assertThat(result.matchedPatterns()).contains("script_tag");
    }

    @Test
    void testJavascriptSchemeIsProtocolAbuse() {
        byte[] body = json("{\"link\":\"javascript:alert(document.cookie)\"}");

        assertThat(detector.scan("/api/articles", null, BROWSER, body).categories())
                .contains(ThreatCategory.PROTOCOL_ABUSE);
    }

    @Test
    void testDataUriWithMarkup() {
        assertThat(detector.scan("/api/preview", "src=data:text/html,%3Ch1%3Ehi", BROWSER, null).categories())
                .containsExactly(ThreatCategory.PROTOCOL_ABUSE);
    }

    @Test
    void testOversizedFieldIsLow() {
        byte[] body = json("{\"content\":\"" + "a".repeat(10_001) + "\"}");

        ThreatScanResult result = detector.scan("/api/articles", null, BROWSER, body);

        assertThat(result.matchedPatterns()).containsExactly("oversized_field");
        assertThat(result.severity()).isEqualTo(Severity.LOW);
    }

    @Test
    void testProseInBodyIsNotSqlInjection() {
        byte[] body = json("{\"content\":\"Select the best option, then insert into the form and update the settings.\"}");

        assertThat(detector.scan("/api/articles", null, BROWSER, body).suspicious()).isFalse();
    }

    @Test
    void testFormEncodedBodyIsScanned() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.set(HttpHeaders.USER_AGENT, BROWSER);
        RequestContext request = RequestContext.builder()
                .method(HttpMethod.POST)
                .path("/api/comments")
                .headers(headers)
                .body(json("comment=%3Cscript%3Esteal()%3C%2Fscript%3E"))
                .build();

        assertThat(detector.scan(request).categories()).contains(ThreatCategory.XSS_ATTEMPT);
    }

    @Test
    void testOversizedBodyIsNotScanned() {
        ShieldProperties properties = new ShieldProperties();
        properties.getThreat().setMaxBodyBytes(16);
        ThreatDetectionService small = new ThreatDetectionService(properties);

        byte[] body = json("{\"content\":\"<script>alert(1)</script>\"}");

        assertThat(small.scan("/api/articles", null, BROWSER, body).suspicious()).isFalse();
    }

    @Test
    void testScannerUserAgentIsLow() {
        ThreatScanResult result = detector.scan("/api/articles", null, "sqlmap/1.7.2#stable", null);

        assertThat(result.suspicious()).isTrue();
        assertThat(result.severity()).isEqualTo(Severity.LOW);
        assertThat(result.matchedPatterns()).contains("attack_tool_user_agent");
    }

    @Test
    void testAttackPathProbe() {
        ThreatScanResult result = detector.scan("/wp-admin/install.php", null, BROWSER, null);

        assertThat(result.categories()).containsExactly(ThreatCategory.ATTACK_PATH);
        assertThat(result.severity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void testMalformedEscapesDoNotBreakScan() {
        ThreatScanResult result = detector.scan("/api/search", "q=%zz%2e%2e/", BROWSER, null);

        assertThat(result.categories()).contains(ThreatCategory.PATH_TRAVERSAL);
    }
}
