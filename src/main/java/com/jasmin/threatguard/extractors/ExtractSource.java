package com.jasmin.threatguard.extractors;

public enum ExtractSource {
    QUERY,         // Extract from query parameters
    HEADER,        // Extract from HTTP headers
    COOKIE,        // Extract from request cookies
    BODY_JSON,     // Extract from JSON body
    BODY_FORM,     // Extract from form data in the body
    ATTRIBUTE;     // Extract from a request attribute set by the identity layer
}
