package com.jasmin.threatguard.extractors;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedCaseInsensitiveMap;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.function.Function;

@Component
@RequiredArgsConstructor
public class ExtractUtils {

    private final ExtractorProperties config;

    /**
     * Resolves a request property by trying its configured rules in order. The first non-blank value wins.
     *
     * @param attributes request attribute lookup, used by {@link ExtractSource#ATTRIBUTE} rules
     */
    public String getProperty(
            String propertyName,
            Map<String, List<String>> headers,
            Map<String, List<String>> queryParams,
            Map<String, String> cookies,
            byte[] body,
            Function<String, Object> attributes
    ) {
        List<ExtractRule> rules = config.getRules().getOrDefault(propertyName, Collections.emptyList());
        if (rules.isEmpty()) {
            return null;
        }

        Map<String, List<String>> ciHeaders = new LinkedCaseInsensitiveMap<>();
        if (headers != null) headers.forEach(ciHeaders::put);

        Map<String, Object> bodyJson = null;
        Map<String, List<String>> bodyForm = null;

        for (ExtractRule rule : rules) {
            String val = null;

            switch (rule.getSource()) {
                case HEADER:
                    val = first(ciHeaders.get(rule.getKey()));
                    break;
                case COOKIE:
                    val = cookies == null ? null : cookies.get(rule.getKey());
                    break;
                case BODY_JSON:
                    if (bodyJson == null) bodyJson = JsonUtils.parseObject(body);
                    if (bodyJson != null && bodyJson.containsKey(rule.getKey())) {
                        val = Objects.toString(bodyJson.get(rule.getKey()), null);
                    }
                    break;
                case BODY_FORM:
                    if (bodyForm == null) bodyForm = parseForm(body);
                    val = first(bodyForm.get(rule.getKey()));
                    break;
                case QUERY:
                    val = queryParams == null ? null : first(queryParams.get(rule.getKey()));
                    break;
                case ATTRIBUTE:
                    val = attributes == null ? null : Objects.toString(attributes.apply(rule.getKey()), null);
                    break;
                default:
                    break;
            }

            if (val != null && !val.isBlank()) return truncate(val.trim(), rule.getMaxLength());
        }
        return null;
    }

    private static String truncate(String value, Integer maxLength) {
        if (maxLength == null || maxLength <= 0 || value.length() <= maxLength) return value;
        return value.substring(0, maxLength);
    }

    /** First address of an x-forwarded-for style list, without the IPv4-mapped IPv6 prefix. */
    public static String clientAddress(String value) {
        if (value == null || value.isBlank()) return null;
        int comma = value.indexOf(',');
        String v = comma > 0 ? value.substring(0, comma).trim() : value.trim();
        return v.startsWith("::ffff:") ? v.substring(7) : v;
    }

    private static String first(List<String> list) {
        if (list == null) return null;
        for (String v : list) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static Map<String, List<String>> parseForm(byte[] body) {
        if (body == null || body.length == 0) return new LinkedHashMap<>();
        return parseQuery(new String(body, StandardCharsets.UTF_8));
    }

    /** Parses an {@code a=1&b=2} string into decoded, multi-valued parameters. */
    public static Map<String, List<String>> parseQuery(String s) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        if (s == null || s.isEmpty()) return map;
        for (String pair : s.split("&")) {
            if (pair.isEmpty()) continue;
            String[] kv = pair.split("=", 2);
            String k = urlDecode(kv[0]);
            String v = kv.length > 1 ? urlDecode(kv[1]) : "";
            map.computeIfAbsent(k, _k -> new ArrayList<>()).add(v);
        }
        return map;
    }

    /** URL-decodes the value, returning it unchanged when it is not valid percent-encoding. */
    public static String urlDecode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }
}
