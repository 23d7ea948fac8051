package io.mersel.services.yin.web.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Güvenlik response header'larını ekler.
 * <p>
 * Spring Security kullanılmadığından CSP, X-Frame-Options ve
 * X-Content-Type-Options basit bir servlet filter ile eklenir.
 * <p>
 * CSP politikası {@code yin.security.csp} property'si ile özelleştirilebilir.
 */
@Configuration
public class SecurityHeaderConfig {

    static final String DEFAULT_CSP = "default-src 'none'; frame-ancestors 'none'";

    @Value("${yin.security.csp:${YIN_SECURITY_CSP:" + DEFAULT_CSP + "}}")
    private String contentSecurityPolicy;

    @Bean
    FilterRegistrationBean<SecurityHeaderFilter> securityHeaderFilter() {
        var filter = new SecurityHeaderFilter(contentSecurityPolicy);
        var bean = new FilterRegistrationBean<>(filter);
        bean.addUrlPatterns("/*");
        bean.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return bean;
    }

    /**
     * Güvenlik header'larını tüm yanıtlara ekler.
     */
    static class SecurityHeaderFilter extends OncePerRequestFilter {

        private final String csp;

        SecurityHeaderFilter(String csp) {
            this.csp = csp;
        }

        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                       FilterChain filterChain) throws ServletException, IOException {
            response.setHeader("Content-Security-Policy", csp);
            response.setHeader("X-Frame-Options", "DENY");
            response.setHeader("X-Content-Type-Options", "nosniff");
            response.setHeader("Referrer-Policy", "no-referrer");
            filterChain.doFilter(request, response);
        }
    }
}
