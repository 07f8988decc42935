package com.tokenvault.backend.auth.support;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientInfoResolverTest {

    private final ClientInfoResolver resolver = new ClientInfoResolver();

    @Test
    @DisplayName("X-Forwarded-For 가 있으면 첫 번째 주소")
    void forwarded_for_wins() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setRemoteAddr("10.0.0.1");
        req.addHeader("X-Forwarded-For", " 198.51.100.7 , 10.0.0.2");
        req.addHeader("X-Real-IP", "192.0.2.1");

        assertThat(resolver.clientIp(req)).isEqualTo("198.51.100.7");
    }

    @Test
    @DisplayName("X-Forwarded-For 가 없으면 X-Real-IP, 둘 다 없으면 remoteAddr")
    void falls_back_to_real_ip_then_remote_addr() {
        MockHttpServletRequest withRealIp = new MockHttpServletRequest();
        withRealIp.setRemoteAddr("10.0.0.1");
        withRealIp.addHeader("X-Real-IP", "192.0.2.1");

        MockHttpServletRequest bare = new MockHttpServletRequest();
        bare.setRemoteAddr("10.0.0.1");

        assertThat(resolver.clientIp(withRealIp)).isEqualTo("192.0.2.1");
        assertThat(resolver.clientIp(bare)).isEqualTo("10.0.0.1");
    }

    @Test
    @DisplayName("User-Agent 가 비어 있으면 기기 정보는 null")
    void device_info_from_user_agent() {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.addHeader(HttpHeaders.USER_AGENT, "Mozilla/5.0 (X11; Linux x86_64)");

        assertThat(resolver.deviceInfo(req)).isEqualTo("Mozilla/5.0 (X11; Linux x86_64)");
        assertThat(resolver.deviceInfo(new MockHttpServletRequest())).isNull();
    }
}
