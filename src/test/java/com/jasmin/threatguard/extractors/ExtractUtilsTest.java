package com.jasmin.threatguard.extractors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractUtilsTest {

    private ExtractUtils extractUtils;

    @BeforeEach
    void setUp() {
        ExtractorProperties props = new ExtractorProperties();
        props.getRules().put("client-ip", List.of(
                new ExtractRule(ExtractSource.HEADER, "X-Forwarded-For"),
                new ExtractRule(ExtractSource.HEADER, "X-Real-IP")));
        props.getRules().put("email", List.of(
                new ExtractRule(ExtractSource.BODY_JSON, "email"),
                new ExtractRule(ExtractSource.BODY_FORM, "email")));
        props.getRules().put("user-id", List.of(
                new ExtractRule(ExtractSource.ATTRIBUTE, "userId"),
                new ExtractRule(ExtractSource.HEADER, "X-User-Id")));
        props.getRules().put("session-id", List.of(
                new ExtractRule(ExtractSource.COOKIE, "session_id"),
                new ExtractRule(ExtractSource.QUERY, "sid")));
        extractUtils = new ExtractUtils(props);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void headersAreMatchedCaseInsensitivelyInRuleOrder() {
        Map<String, List<String>> headers = Map.of(
                "x-real-ip", List.of("10.0.0.2"),
                "x-forwarded-for", List.of("203.0.113.5, 10.0.0.1"));

        String value = extractUtils.getProperty("client-ip", headers, null, null, null, null);

        assertThat(value).isEqualTo("203.0.113.5, 10.0.0.1");
        assertThat(ExtractUtils.clientAddress(value)).isEqualTo("203.0.113.5");
    }

    @Test
    void valuesAreCutToTheRuleMaxLength() {
        ExtractorProperties props = new ExtractorProperties();
        props.getRules().put("user-agent", List.of(new ExtractRule(ExtractSource.HEADER, "User-Agent", 10)));
        ExtractUtils bounded = new ExtractUtils(props);

        String value = bounded.getProperty("user-agent",
                Map.of("User-Agent", List.of("  Mozilla/5.0 (X11; Linux x86_64)")), null, null, null, null);

        assertThat(value).isEqualTo("Mozilla/5.");
    }

    @Test
    void blankValuesFallThroughToTheNextRule() {
        Map<String, List<String>> headers = Map.of(
                "X-Forwarded-For", List.of("  "),
                "X-Real-IP", List.of("10.0.0.2"));

        assertThat(extractUtils.getProperty("client-ip", headers, null, null, null, null)).isEqualTo("10.0.0.2");
    }

    @Test
    void emailComesFromJsonOrFormBody() {
        assertThat(extractUtils.getProperty("email", null, null, null,
                bytes("{\"email\":\" a@example.com \",\"password\":\"x\"}"), null)).isEqualTo("a@example.com");
        assertThat(extractUtils.getProperty("email", null, null, null,
                bytes("email=b%40example.com&password=x"), null)).isEqualTo("b@example.com");
        assertThat(extractUtils.getProperty("email", null, null, null, null, null)).isNull();
    }

    @Test
    void attributeWinsOverHeader() {
        Map<String, List<String>> headers = Map.of("X-User-Id", List.of("from-header"));

        assertThat(extractUtils.getProperty("user-id", headers, null, null, null,
                name -> "userId".equals(name) ? 42L : null)).isEqualTo("42");
        assertThat(extractUtils.getProperty("user-id", headers, null, null, null, name -> null)).isEqualTo("from-header");
    }

    @Test
    void cookieThenQuery() {
        assertThat(extractUtils.getProperty("session-id", null, Map.of("sid", List.of("q-1")),
                Map.of("session_id", "c-1"), null, null)).isEqualTo("c-1");
        assertThat(extractUtils.getProperty("session-id", null, Map.of("sid", List.of("q-1")),
                Map.of(), null, null)).isEqualTo("q-1");
    }

    @Test
    void unknownPropertyResolvesToNull() {
        assertThat(extractUtils.getProperty("country", Map.of("CF-IPCountry", List.of("DE")), null, null, null, null)).isNull();
    }

    @Test
    void clientAddressStripsTheMappedIpv6Prefix() {
        assertThat(ExtractUtils.clientAddress("::ffff:192.0.2.7")).isEqualTo("192.0.2.7");
        assertThat(ExtractUtils.clientAddress(" ")).isNull();
    }

    @Test
    void queryParsingDecodesAndKeepsRepeatedKeys() {
        Map<String, List<String>> params = ExtractUtils.parseQuery("q=union%20select&tag=a&tag=b&flag&bad=%zz");

        assertThat(params.get("q")).containsExactly("union select");
        assertThat(params.get("tag")).containsExactly("a", "b");
        assertThat(params.get("flag")).containsExactly("");
        assertThat(params.get("bad")).containsExactly("%zz");
        assertThat(ExtractUtils.parseQuery(null)).isEmpty();
    }
}
