package com.jasmin.threatguard.constants;

public class Constants {
    // Terminal verdict codes, in pipeline order
    public static final String PAYLOAD_TOO_LARGE = "PAYLOAD_TOO_LARGE";
    public static final String IP_BLOCKED = "IP_BLOCKED";
    public static final String EMERGENCY_MODE = "EMERGENCY_MODE";
    public static final String GEO_BLOCKED = "GEO_BLOCKED";
    public static final String DDOS_DETECTED = "DDOS_DETECTED";
    public static final String CHALLENGE_REQUIRED = "CHALLENGE_REQUIRED";
    public static final String INVALID_CHALLENGE = "INVALID_CHALLENGE";
    public static final String WAF_BLOCKED = "WAF_BLOCKED";
    public static final String SQL_INJECTION = "SQL_INJECTION";
    public static final String XSS = "XSS";
    public static final String PATH_TRAVERSAL = "PATH_TRAVERSAL";
    public static final String COMMAND_INJECTION = "COMMAND_INJECTION";
    public static final String LDAP_INJECTION = "LDAP_INJECTION";
    public static final String BOT_DETECTED = "BOT_DETECTED";
    public static final String HIGH_THREAT_SCORE = "HIGH_THREAT_SCORE";
    public static final String CREDENTIAL_STUFFING_DETECTED = "CREDENTIAL_STUFFING_DETECTED";
    public static final String ANOMALY_DETECTED = "ANOMALY_DETECTED";
    public static final String ACCOUNT_TAKEOVER_SUSPECTED = "ACCOUNT_TAKEOVER_SUSPECTED";

    public static final String CHALLENGE_HEADER = "X-Challenge-Response";
    public static final String COUNTRY_HEADER = "CF-IPCountry";
    public static final String RATE_LIMIT_LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";

    // Authenticated admin user id, set for operator API handlers
    public static final String OPERATOR_ATTRIBUTE = "threatguard.operatorId";

    // Block reasons
    public static final String REASON_DDOS = "ddos_ip_threshold";
    public static final String REASON_WAF_CRITICAL = "waf_critical_violation";
    public static final String REASON_HIGH_THREAT_SCORE = "high_threat_score";
    public static final String REASON_CREDENTIAL_STUFFING = "credential_stuffing";
    public static final String REASON_CRITICAL_INTRUSION = "critical_intrusion";

    private Constants() {
    }
}
