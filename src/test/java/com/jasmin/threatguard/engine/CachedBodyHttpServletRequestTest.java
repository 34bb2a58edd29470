package com.jasmin.threatguard.engine;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CachedBodyHttpServletRequestTest {

    private static MockHttpServletRequest requestWithBody(String body) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/orders");
        request.setContent(body.getBytes(StandardCharsets.UTF_8));
        return request;
    }

    @Test
    void bodyWithinTheLimitCanBeReadRepeatedly() throws IOException {
        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(requestWithBody("name=ok"), 7);

        assertThat(cached.isOversized()).isFalse();
        assertThat(new String(cached.getBody(), StandardCharsets.UTF_8)).isEqualTo("name=ok");
        assertThat(cached.getInputStream().readAllBytes()).isEqualTo(cached.getBody());
        assertThat(cached.getReader().readLine()).isEqualTo("name=ok");
        assertThat(cached.getContentLength()).isEqualTo(7);
    }

    @Test
    void readingStopsOneByteAfterTheLimit() throws IOException {
        MockHttpServletRequest request = requestWithBody("0123456789");

        CachedBodyHttpServletRequest cached = new CachedBodyHttpServletRequest(request, 4);

        assertThat(cached.isOversized()).isTrue();
        assertThat(cached.getBody()).isEmpty();
        // the rest of the client stream is left unread
        assertThat(request.getInputStream().readAllBytes()).hasSize(5);
    }
}
