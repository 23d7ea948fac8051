package io.mersel.services.yin.web.config;

import io.mersel.services.yin.infrastructure.diagnostics.YinMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RateLimitConfig.RateLimitFilter birim testleri.
 */
@DisplayName("RateLimitConfig")
class RateLimitConfigTest {

    private SimpleMeterRegistry registry;
    private YinMetrics yinMetrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        yinMetrics = new YinMetrics(registry);
    }

    private static MockHttpServletRequest printRequest(String remoteAddr) {
        var request = new MockHttpServletRequest("POST", "/v1/yin");
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    @Test
    @DisplayName("limit_asilinca_429 — third request from same IP rejected")
    void limit_asilinca_429() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(true, 2, false, yinMetrics);

        for (int i = 0; i < 2; i++) {
            var response = new MockHttpServletResponse();
            filter.doFilterInternal(printRequest("10.0.0.1"), response, new MockFilterChain());
            assertThat(response.getStatus()).isEqualTo(200);
        }

        var response = new MockHttpServletResponse();
        var chain = new MockFilterChain();
        filter.doFilterInternal(printRequest("10.0.0.1"), response, chain);

        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("0");
        assertThat(response.getContentAsString()).contains("Rate limit exceeded");
        assertThat(chain.getRequest()).isNull();
        assertThat(registry.get("yin_rate_limit_exceeded_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("farkli_ip_ayri_sayilir — counters are per client")
    void farkli_ip_ayri_sayilir() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(true, 1, false, yinMetrics);

        filter.doFilterInternal(printRequest("10.0.0.1"), new MockHttpServletResponse(), new MockFilterChain());
        var response = new MockHttpServletResponse();
        filter.doFilterInternal(printRequest("10.0.0.2"), response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("1");
    }

    @Test
    @DisplayName("proxy_modu_xff — first X-Forwarded-For address is the client")
    void proxy_modu_xff() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(true, 1, true, yinMetrics);

        var first = printRequest("192.168.1.1");
        first.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        filter.doFilterInternal(first, new MockHttpServletResponse(), new MockFilterChain());

        var second = printRequest("192.168.1.1");
        second.addHeader("X-Forwarded-For", "203.0.113.8, 10.0.0.1");
        var response = new MockHttpServletResponse();
        filter.doFilterInternal(second, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("devre_disi — disabled filter passes everything")
    void devre_disi() throws Exception {
        var filter = new RateLimitConfig.RateLimitFilter(false, 0, false, yinMetrics);
        var response = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter.doFilterInternal(printRequest("10.0.0.1"), response, chain);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeader("X-RateLimit-Limit")).isNull();
        assertThat(chain.getRequest()).isNotNull();
    }
}
