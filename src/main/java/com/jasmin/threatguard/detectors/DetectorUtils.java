package com.jasmin.threatguard.detectors;

import com.jasmin.threatguard.extractors.ExtractUtils;
import com.jasmin.threatguard.models.SecurityEvent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.regex.Pattern;

public class DetectorUtils {
    private static final DateTimeFormatter MINUTE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd:HH:mm");
    private static final DateTimeFormatter HOUR_FMT = DateTimeFormatter.ofPattern("yyyyMMddHH");

    // Built-in path normalization patterns (UUIDs, numeric IDs)
    private static final List<Pattern> NORMALIZE_PATTERNS = List.of(
            Pattern.compile("/[0-9a-fA-F-]{36}(?=/|$)"),  // UUID
            Pattern.compile("/[0-9]{2,}(?=/|$)")          // numeric IDs
    );

    private DetectorUtils() {
    }

    /**
     * Returns a non-null, non-blank string.
     * If the input is null or blank, returns "unknown".
     */
    public static String nullSafe(String s) {
        return (s == null || s.isBlank()) ? "unknown" : s;
    }

    /**
     * Returns a lowercased copy of the input using {@link Locale#ROOT}.
     * If {@code s} is {@code null} or blank, returns the empty string.
     */
    public static String safeLower(String s) {
        return (s == null || s.isBlank()) ? "" : s.toLowerCase(Locale.ROOT);
    }

    /** Minute bucket id used by the decision counters, UTC. */
    public static String minuteKey(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC).format(MINUTE_FMT);
    }

    public static String minuteKey(LocalDateTime dateTime) {
        return dateTime.format(MINUTE_FMT);
    }

    /** Hour bucket id used by the per-user request counters, UTC. */
    public static String hourKey(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC).format(HOUR_FMT);
    }

    /** Replaces UUID and numeric path segments so that one endpoint maps to one counter. */
    public static String normalizePath(String path) {
        String out = path == null || path.isBlank() ? "/" : path;
        for (Pattern p : NORMALIZE_PATTERNS) {
            out = p.matcher(out).replaceAll("/:id");
        }
        return out;
    }

    /**
     * Returns the first non-blank value of the first header whose name matches
     * (case-insensitive) any of the provided {@code names}, in the order they are given,
     * or {@code ""} if none.
     */
    public static String firstHeaderMatch(SecurityEvent e, List<String> names) {
        if (e == null || e.getHeaders() == null || names == null || names.isEmpty()) {
            return "";
        }
        Map<String, List<String>> lookup = new HashMap<>();
        e.getHeaders().forEach((k, v) -> {
            if (k != null) lookup.put(k.toLowerCase(Locale.ROOT), v);
        });

        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            List<String> vals = lookup.get(name.toLowerCase(Locale.ROOT));
            if (vals == null) continue;
            for (String v : vals) {
                if (v != null && !v.isBlank()) return v.trim();
            }
        }
        return "";
    }

    public static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] out = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(out.length * 2);
            for (byte b : out) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Appends the URL-decoded form of an {@code application/x-www-form-urlencoded} body, so that encoded payloads
     * are matched as well. Other bodies are returned as is.
     */
    public static String withDecodedForm(String body, String contentType) {
        if (body == null || contentType == null
                || !contentType.toLowerCase(Locale.ROOT).contains("application/x-www-form-urlencoded")) {
            return body;
        }
        String decoded = ExtractUtils.urlDecode(body);
        return decoded.equals(body) ? body : body + "\n" + decoded;
    }

    public static boolean matchesAnyPrefix(String path, Collection<String> prefixes) {
        if (path == null) return false;
        for (String p : prefixes) {
            if (path.startsWith(p)) return true;
        }
        return false;
    }
}
