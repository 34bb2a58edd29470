package com.jasmin.threatguard.services.intrusion;

import com.jasmin.threatguard.constants.Constants;
import com.jasmin.threatguard.models.Severity;

public enum InjectionType {
    SQL_INJECTION(Constants.SQL_INJECTION, Severity.CRITICAL),
    XSS(Constants.XSS, Severity.HIGH),
    PATH_TRAVERSAL(Constants.PATH_TRAVERSAL, Severity.HIGH),
    COMMAND_INJECTION(Constants.COMMAND_INJECTION, Severity.CRITICAL),
    LDAP_INJECTION(Constants.LDAP_INJECTION, Severity.HIGH);

    private final String code;
    private final Severity severity;

    InjectionType(String code, Severity severity) {
        this.code = code;
        this.severity = severity;
    }

    public String code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }
}
