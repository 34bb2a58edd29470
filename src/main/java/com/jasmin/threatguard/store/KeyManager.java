package com.jasmin.threatguard.store;

import java.util.Locale;

/**
 * Key namespaces of the shared state store.
 */
public class KeyManager {
    public static final String DDOS_GLOBAL = "ddos:global";
    public static final String DDOS_UNIQUE_IPS = "ddos:unique_ips";
    public static final String DDOS_EMERGENCY_MODE = "ddos:emergency_mode";
    public static final String DDOS_TIGHT_LIMITS = "ddos:tight_limits";
    public static final String DDOS_ATTEMPTS_PATTERN = "ddos_attempts:*";

    private KeyManager() {
    }

    public static String blockedIp(String ip) {
        return "blocked_ip:" + ip;
    }

    public static String ddosIp(String ip) {
        return "ddos:ip:" + ip;
    }

    public static String slowConnections(String ip) {
        return "slowloris:" + ip;
    }

    public static String httpFlood(String ip, String endpoint) {
        return "http_flood:" + ip + ":" + endpoint;
    }

    public static String ddosAttempts(String ip) {
        return "ddos_attempts:" + ip;
    }

    public static String rateLimitViolations(String ip) {
        return "rate_limit_violations:" + ip;
    }

    public static String challenge(String ip) {
        return "challenge:" + ip;
    }

    public static String challengePassed(String ip) {
        return "challenge_passed:" + ip;
    }

    public static String geoBlock(String countryCode) {
        return "geo_block:" + countryCode.toUpperCase(Locale.ROOT);
    }

    public static String credentialStuffingEmails(String ip) {
        return "credential_stuffing:" + ip + ":emails";
    }

    public static String botLastRequest(String ip) {
        return "bot_detection:" + ip;
    }

    public static String userRequests(String userId, String hourBucket) {
        return "user_requests:" + userId + ":" + hourBucket;
    }

    public static String sensitiveAccess(String userId) {
        return "sensitive_access:" + userId;
    }

    public static String getThreatsKey(String minuteKey) {
        return "threats:" + minuteKey;
    }

    public static String getEventsKey(String minuteKey) {
        return "events:" + minuteKey;
    }

    public static String getThreatTypeKey(String code, String minuteKey) {
        return "threat:" + code + ":" + minuteKey;
    }
}
