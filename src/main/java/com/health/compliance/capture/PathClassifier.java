package com.health.compliance.capture;

import com.health.compliance.config.CaptureConfig;
import com.health.compliance.model.AccessType;
import com.health.compliance.model.ActivityEventType;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides what an observed operation is: whether it is audited at all, whether it touches
 * protected health information, which resource it targets and which patient it concerns.
 */
@Component
public class PathClassifier {

    private static final Pattern NUMERIC_ID = Pattern.compile("^\\d+$");
    private static final Pattern UUID_ID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final CaptureConfig config;
    private final List<Pattern> auditedPaths;
    private final List<Pattern> excludedPaths;
    private final List<Pattern> protectedPaths;
    private final List<Pattern> authPaths;
    private final List<Pattern> loginPaths;
    private final List<Pattern> logoutPaths;

    public PathClassifier(CaptureConfig config) {
        this.config = config;
        this.auditedPaths = compile(config.getAuditedPaths());
        this.excludedPaths = compile(config.getExcludedPaths());
        this.protectedPaths = compile(config.getProtectedPaths());
        this.authPaths = compile(config.getAuthPaths());
        this.loginPaths = compile(config.getLoginPaths());
        this.logoutPaths = compile(config.getLogoutPaths());
    }

    /**
     * True if the operation must leave no record: excluded explicitly, or outside the audited paths.
     */
    public boolean isExcluded(String path) {
        if (anyMatch(excludedPaths, path)) return true;
        return !auditedPaths.isEmpty() && !anyMatch(auditedPaths, path);
    }

    public boolean isProtected(String path) {
        return anyMatch(protectedPaths, path);
    }

    public boolean isAuthPath(String path) {
        return anyMatch(authPaths, path);
    }

    public boolean isLoginPath(String path) {
        return anyMatch(loginPaths, path) && !isLogoutPath(path);
    }

    public boolean isLogoutPath(String path) {
        return anyMatch(logoutPaths, path);
    }

    /**
     * /api/{type}/{id}/... gives (type, id). The id is the first of the next two segments
     * that is numeric or a UUID; otherwise empty.
     */
    public ResourceRef parseResource(String path) {
        String[] parts = segments(path);
        if (parts.length < 2 || !"api".equalsIgnoreCase(parts[0])) {
            return ResourceRef.UNKNOWN;
        }
        String type = parts[1].toLowerCase(Locale.ROOT);
        for (int i = 2; i <= 3 && i < parts.length; i++) {
            if (isIdentifier(parts[i])) {
                return new ResourceRef(type, parts[i]);
            }
        }
        return new ResourceRef(type, "");
    }

    public ActivityEventType activityTypeOf(String method, String path) {
        if (isLogoutPath(path)) return ActivityEventType.LOGOUT;
        if (isLoginPath(path)) return ActivityEventType.LOGIN;
        return ActivityEventType.fromMethod(method);
    }

    public AccessType accessTypeOf(String method, String path) {
        List<String> parts = Arrays.asList(segments(path != null ? path.toLowerCase(Locale.ROOT) : null));
        if (parts.contains("export")) return AccessType.EXPORT;
        if (parts.contains("share")) return AccessType.SHARE;
        if (parts.contains("print")) return AccessType.PRINT;
        return AccessType.fromMethod(method);
    }

    /**
     * Patient id, looked up in order: the path segment after a subject marker, the query
     * parameters, the payload. Null when none resolves.
     */
    public String resolveSubject(String path, Map<String, String> queryParams, Map<String, Object> payload) {
        String[] parts = segments(path);
        for (int i = 0; i < parts.length - 1; i++) {
            if (config.getSubjectPathMarkers().contains(parts[i].toLowerCase(Locale.ROOT)) && isIdentifier(parts[i + 1])) {
                return parts[i + 1];
            }
        }
        if (queryParams != null) {
            for (String key : config.getSubjectParamKeys()) {
                String value = queryParams.get(key);
                if (value != null && !value.isBlank()) return value.trim();
            }
        }
        if (payload != null) {
            for (String key : config.getSubjectParamKeys()) {
                Object value = payload.get(key);
                if (value != null && !String.valueOf(value).isBlank()) return String.valueOf(value).trim();
            }
        }
        return null;
    }

    /**
     * Reason header first, then query parameter. Null when neither is present; a reason sent
     * empty comes back empty.
     */
    public String resolveReason(Map<String, String> headers, Map<String, String> queryParams) {
        String header = headerValue(headers, config.getReasonHeader());
        if (header != null && !header.isBlank()) return header;
        String param = queryParams != null ? queryParams.get(config.getReasonParam()) : null;
        return param != null ? param : header;
    }

    /**
     * First X-Forwarded-For hop, else the connection address.
     */
    public String resolveClientIp(Map<String, String> headers, String remoteAddress) {
        String forwarded = headerValue(headers, "X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return remoteAddress;
    }

    static boolean isIdentifier(String segment) {
        return NUMERIC_ID.matcher(segment).matches() || UUID_ID.matcher(segment).matches();
    }

    private static String headerValue(Map<String, String> headers, String name) {
        if (headers == null) return null;
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) return entry.getValue();
        }
        return null;
    }

    /**
     * Path segments with their original case; callers lower-case what they classify on.
     */
    private static String[] segments(String path) {
        if (path == null) return new String[0];
        String trimmed = path.replaceAll("^/+|/+$", "");
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/+");
    }

    private static boolean anyMatch(List<Pattern> patterns, String path) {
        if (path == null) return false;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(path).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compile(List<String> regexes) {
        return regexes.stream().map(Pattern::compile).toList();
    }
}
