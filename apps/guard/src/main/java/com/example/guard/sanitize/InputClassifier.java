package com.example.guard.sanitize;

import com.example.guard.alert.AlertBus;
import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.web.util.HtmlUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects injection payloads in free-text input and produces a sanitized value.
 *
 * <p>Detection runs on the raw input and again on the sanitized value; the share of
 * threats that sanitization removed is reported as the confidence.
 */
@Slf4j
public class InputClassifier {

    private static final Map<String, Pattern> THREAT_RULES = new LinkedHashMap<>();
    private static final Map<String, Pattern> BYPASS_RULES = new LinkedHashMap<>();

    private static final Set<String> CRITICAL_RULES = Set.of("script_injection", "sql_injection", "command_injection");
    private static final Set<String> HIGH_RULES = Set.of("javascript_protocol", "iframe_injection", "path_traversal");
    private static final Set<String> MEDIUM_RULES = Set.of("html_injection", "on_event_handlers");

    private static final Map<String, String> RECOMMENDATIONS = Map.of(
            "script_injection", "Remove all script tags and validate input server-side",
            "javascript_protocol", "Use only allowed protocols (http, https, mailto, tel)",
            "sql_injection", "Use parameterized queries and validate input",
            "path_traversal", "Validate file paths and use allowlists",
            "html_injection", "Escape HTML entities or use allowlisted tags only",
            "command_injection", "Validate input and use safe APIs instead of shell commands");
    private static final String DEFAULT_RECOMMENDATION = "Validate and sanitize input according to expected format";

    private static final Set<String> ALLOWED_PROTOCOLS = Set.of("http", "https", "mailto", "tel", "ftp", "ftps");
    private static final Pattern URL_ATTRIBUTE = Pattern.compile("(?i)(?:href|src|action)\\s*=\\s*[\"']?([^\"'\\s>]+)");
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HTML = Pattern.compile("<[^>]*>");
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern VIETNAMESE_PHONE = Pattern.compile("^(\\+84|84|0)[35789][0-9]{8}$");

    static {
        THREAT_RULES.put("script_injection", Pattern.compile("(?is)<script\\b[^<]*(?:(?!</script>)<[^<]*)*</script>"));
        THREAT_RULES.put("javascript_protocol", Pattern.compile("(?i)javascript\\s*:"));
        THREAT_RULES.put("vbscript_protocol", Pattern.compile("(?i)vbscript\\s*:"));
        THREAT_RULES.put("data_protocol", Pattern.compile("(?i)data\\s*:"));
        THREAT_RULES.put("on_event_handlers", Pattern.compile("(?i)\\bon\\w+\\s*="));
        THREAT_RULES.put("style_expression", Pattern.compile("(?i)expression\\s*\\("));
        THREAT_RULES.put("iframe_injection", Pattern.compile("(?i)<iframe\\b[^>]*>"));
        THREAT_RULES.put("object_embed", Pattern.compile("(?i)<(object|embed)\\b[^>]*>"));
        THREAT_RULES.put("sql_union", Pattern.compile("(?i)(\\bunion\\b.*\\bselect\\b)|(\\bselect\\b.*\\bunion\\b)"));
        THREAT_RULES.put("sql_injection", Pattern.compile(
                "(?i)('\\s*(or|and)\\s*'?\\d+|'\\s*(or|and)\\s*'?\\w+\\s*=\\s*'?\\w*'?)"));
        THREAT_RULES.put("sql_comments", Pattern.compile("(--|#|/\\*|\\*/)"));
        THREAT_RULES.put("path_traversal", Pattern.compile("\\.\\.[/\\\\]"));
        THREAT_RULES.put("absolute_path", Pattern.compile("^[/\\\\]"));
        THREAT_RULES.put("html_injection", HTML);
        THREAT_RULES.put("xml_injection", Pattern.compile("(?i)<\\?xml\\b[^>]*>"));
        THREAT_RULES.put("cdata_injection", Pattern.compile("(?is)<!\\[CDATA\\[.*?]]>"));
        // shell command sequences only; single punctuation marks are covered by shell_metacharacters
        THREAT_RULES.put("command_injection", Pattern.compile(
                "(?i)[;&|`]\\s*(?:rm|cat|ls|wget|curl|nc|bash|sh|powershell|chmod|whoami)\\b|\\$\\([^)]*\\)|`[^`]+`"));
        THREAT_RULES.put("shell_metacharacters", Pattern.compile("[<>|&;`]"));
        THREAT_RULES.put("ldap_injection", Pattern.compile("[()=*!&|]"));
        THREAT_RULES.put("email_injection", Pattern.compile("(?i)[\\r\\n]+(to|cc|bcc|subject):"));
        THREAT_RULES.put("base64_suspicious", Pattern.compile("(?i)(?:data:.*base64|base64.*data:)"));
        THREAT_RULES.put("encoded_script", Pattern.compile("(?i)%3c%73%63%72%69%70%74|%3cscript"));
        THREAT_RULES.put("unicode_bypass", Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]"));

        BYPASS_RULES.put("polyglot_protocol", Pattern.compile("(?i)javascript:|data:|vbscript:"));
        BYPASS_RULES.put("obfuscated_javascript", Pattern.compile("(?i)j\\s*a\\s*v\\s*a\\s*s\\s*c\\s*r\\s*i\\s*p\\s*t\\s*:"));
        BYPASS_RULES.put("html_entity", Pattern.compile("(?i)&#x?[0-9a-f]+;?"));
        BYPASS_RULES.put("css_injection", Pattern.compile("(?i)expression\\s*\\(|@import|javascript\\s*:"));
        BYPASS_RULES.put("svg_injection", Pattern.compile("(?is)<svg[^>]*>.*?</svg>"));
        BYPASS_RULES.put("template_injection", Pattern.compile("\\{\\{.*?}}|\\$\\{.*?}"));
        BYPASS_RULES.put("server_side_include", Pattern.compile("(?i)<!--#(exec|include|echo|config)"));
    }

    private final MarkupCleaner markupCleaner;
    private final AlertBus alertBus;
    private final Clock clock;
    private final Map<ThreatCategory, AtomicLong> threatCounts = new EnumMap<>(ThreatCategory.class);

    public InputClassifier(MarkupCleaner markupCleaner, AlertBus alertBus, Clock clock) {
        this.markupCleaner = markupCleaner;
        this.alertBus = alertBus;
        this.clock = clock;
        for (ThreatCategory category : ThreatCategory.values()) {
            threatCounts.put(category, new AtomicLong());
        }
    }

    public ClassificationResult classify(@Nullable String text) {
        return classify(text, InputContext.GUEST);
    }

    public ClassificationResult classify(@Nullable String text, InputContext context) {
        if (text == null || text.isEmpty()) {
            return ClassificationResult.clean("");
        }
        List<InputThreat> threats = detect(text);

        String sanitized = baseSanitize(text);
        if (HTML.matcher(sanitized).find()) {
            sanitized = markupCleaner.clean(sanitized);
        }
        sanitized = applyContext(sanitized, context);

        List<InputThreat> residual = detect(sanitized);
        double confidence = threats.isEmpty()
                ? 1.0
                : Math.max(0.0, (threats.size() - residual.size()) / (double) threats.size());

        threats.forEach(threat -> threatCounts.get(threat.category()).incrementAndGet());
        return new ClassificationResult(residual.isEmpty(), sanitized, threats, residual, confidence);
    }

    /**
     * Classifies the input and raises a suspicious-activity alert when the worst
     * threat found is high or critical.
     */
    public ClassificationResult classifyAndReport(String identifier, String endpoint, @Nullable String text,
                                                  InputContext context) {
        ClassificationResult result = classify(text, context);
        result.highestSeverity()
                .filter(severity -> severity.isAtLeast(Severity.HIGH))
                .ifPresent(severity -> report(identifier, endpoint, result, severity));
        return result;
    }

    public ClassificationResult classifyEmail(@Nullable String email) {
        String sanitized = email == null ? "" : baseSanitize(email);
        if (EMAIL.matcher(sanitized).matches()) {
            return ClassificationResult.clean(sanitized);
        }
        InputThreat threat = new InputThreat(ThreatCategory.MALFORMED, Severity.MEDIUM, "invalid_email",
                email == null ? "" : email, "Use valid email format: user@domain.com");
        return new ClassificationResult(false, sanitized, List.of(threat), List.of(threat), 0.0);
    }

    public ClassificationResult classifyPhone(@Nullable String phone) {
        String sanitized = phone == null ? "" : phone.replaceAll("[^\\d+]", "");
        if (VIETNAMESE_PHONE.matcher(sanitized).matches()) {
            return ClassificationResult.clean(sanitized);
        }
        InputThreat threat = new InputThreat(ThreatCategory.MALFORMED, Severity.LOW, "invalid_phone",
                phone == null ? "" : phone, "Use Vietnamese phone number format: +84xxxxxxxxx");
        return new ClassificationResult(false, sanitized, List.of(threat), List.of(threat), 0.0);
    }

    public ClassificationResult classifyUrl(@Nullable String url) {
        String scheme = schemeOf(url);
        if (scheme != null && ALLOWED_PROTOCOLS.contains(scheme)) {
            return ClassificationResult.clean(url);
        }
        InputThreat threat = new InputThreat(ThreatCategory.SUSPICIOUS, Severity.HIGH, "dangerous_protocol",
                scheme != null ? scheme : String.valueOf(url), "Use only allowed protocols: http, https, mailto, tel");
        return new ClassificationResult(false, "", List.of(threat), List.of(threat), 0.0);
    }

    public Map<ThreatCategory, Long> threatCounts() {
        Map<ThreatCategory, Long> counts = new EnumMap<>(ThreatCategory.class);
        threatCounts.forEach((category, count) -> counts.put(category, count.get()));
        return counts;
    }

    List<InputThreat> detect(String input) {
        List<InputThreat> threats = new ArrayList<>();
        THREAT_RULES.forEach((rule, pattern) -> {
            Matcher matcher = pattern.matcher(input);
            if (matcher.find()) {
                threats.add(new InputThreat(ThreatCategory.ofRule(rule), severityOf(rule), rule,
                        matcher.group(), RECOMMENDATIONS.getOrDefault(rule, DEFAULT_RECOMMENDATION)));
            }
        });
        BYPASS_RULES.forEach((rule, pattern) -> {
            Matcher matcher = pattern.matcher(input);
            if (matcher.find()) {
                threats.add(new InputThreat(ThreatCategory.SUSPICIOUS, Severity.MEDIUM, rule,
                        matcher.group(), "Remove or escape suspicious content"));
            }
        });
        return threats;
    }

    private void report(String identifier, String endpoint, ClassificationResult result, Severity severity) {
        Set<String> categories = new LinkedHashSet<>();
        Set<String> rules = new LinkedHashSet<>();
        result.threats().forEach(threat -> {
            categories.add(threat.category().value());
            rules.add(threat.rule());
        });
        log.warn("Malicious input from {} on {}: {}", StringSanitizer.forLog(identifier),
                StringSanitizer.forLog(endpoint), rules);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("threatCategories", List.copyOf(categories));
        metadata.put("threatRules", List.copyOf(rules));
        metadata.put("confidence", result.confidence());
        alertBus.publish(new SecurityAlert(AlertType.SUSPICIOUS_ACTIVITY, severity, identifier, endpoint,
                "Malicious input detected", clock.instant(), metadata));
    }

    private String baseSanitize(String input) {
        String sanitized = input.replace("\0", "");
        sanitized = WHITESPACE.matcher(sanitized).replaceAll(" ").trim();
        sanitized = CONTROL_CHARACTERS.matcher(sanitized).replaceAll("");
        sanitized = HtmlUtils.htmlUnescape(sanitized);
        return stripUnsafeUrls(sanitized);
    }

    private String stripUnsafeUrls(String input) {
        Matcher matcher = URL_ATTRIBUTE.matcher(input);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String scheme = schemeOf(matcher.group(1));
            String replacement = scheme != null && ALLOWED_PROTOCOLS.contains(scheme) ? matcher.group() : "";
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String applyContext(String input, InputContext context) {
        return switch (context) {
            case GUEST -> input.replaceAll("[<>\"'&]", "");
            case USER -> HtmlUtils.htmlEscape(input);
            case ADMIN -> markupCleaner.clean(input);
        };
    }

    @Nullable
    private static String schemeOf(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String scheme = new URI(url.trim()).getScheme();
            return scheme != null ? scheme.toLowerCase(Locale.ROOT) : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static Severity severityOf(String rule) {
        if (CRITICAL_RULES.contains(rule)) {
            return Severity.CRITICAL;
        }
        if (HIGH_RULES.contains(rule)) {
            return Severity.HIGH;
        }
        if (MEDIUM_RULES.contains(rule)) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
