package io.mersel.services.yin.web.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SecurityHeaderConfig birim testleri.
 * <p>
 * Güvenlik başlıklarının (CSP, X-Frame-Options, X-Content-Type-Options, Referrer-Policy)
 * tüm yanıtlara doğru şekilde eklendiğini test eder.
 */
@DisplayName("SecurityHeaderConfig")
class SecurityHeaderConfigTest {

    @Test
    @DisplayName("filter_tum_guvenlik_basliklarini_ekler — CSP, DENY, nosniff, no-referrer")
    void filter_tum_guvenlik_basliklarini_ekler() throws Exception {
        var filter = new SecurityHeaderConfig.SecurityHeaderFilter(SecurityHeaderConfig.DEFAULT_CSP);
        var response = new MockHttpServletResponse();

        filter.doFilterInternal(new MockHttpServletRequest(), response, new MockFilterChain());

        assertThat(response.getHeader("Content-Security-Policy")).isEqualTo("default-src 'none'; frame-ancestors 'none'");
        assertThat(response.getHeader("X-Frame-Options")).isEqualTo("DENY");
        assertThat(response.getHeader("X-Content-Type-Options")).isEqualTo("nosniff");
        assertThat(response.getHeader("Referrer-Policy")).isEqualTo("no-referrer");
    }

    @Test
    @DisplayName("filter_ozel_csp — custom policy applied")
    void filter_ozel_csp() throws Exception {
        var filter = new SecurityHeaderConfig.SecurityHeaderFilter("default-src 'self'");
        var response = new MockHttpServletResponse();

        filter.doFilterInternal(new MockHttpServletRequest(), response, new MockFilterChain());

        assertThat(response.getHeader("Content-Security-Policy")).isEqualTo("default-src 'self'");
    }

    @Test
    @DisplayName("filter_zinciri_devam_ettirir — request reaches chain")
    void filter_zinciri_devam_ettirir() throws Exception {
        var filter = new SecurityHeaderConfig.SecurityHeaderFilter(SecurityHeaderConfig.DEFAULT_CSP);
        var request = new MockHttpServletRequest();
        var chain = new MockFilterChain();

        filter.doFilterInternal(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }
}
