package com.jasmin.threatguard.detectors.waf;

public enum RuleCategory {
    SQL_INJECTION,
    XSS,
    PATH_TRAVERSAL,
    COMMAND_INJECTION,
    LDAP_INJECTION,
    XXE,
    SSRF,
    NOSQL_INJECTION,
    HEADER_INJECTION,
    MALICIOUS_UPLOAD
}
