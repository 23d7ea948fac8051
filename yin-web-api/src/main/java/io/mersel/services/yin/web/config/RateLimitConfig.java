package io.mersel.services.yin.web.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.yin.infrastructure.diagnostics.YinMetrics;
import io.mersel.services.yin.web.dto.ErrorResponse;
import io.mersel.services.yin.web.infrastructure.JsonResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * IP bazlı rate limiting ({@code /v1/yin}).
 * <p>
 * İstemci IP'si varsayılan olarak yalnızca TCP bağlantısının uzak adresinden alınır;
 * {@code behind-proxy=true} ise sırasıyla {@code X-Forwarded-For} (ilk IP),
 * {@code X-Real-IP} ve {@code remoteAddr} kullanılır.
 * <p>
 * Env:
 * <ul>
 *   <li>{@code YIN_RATE_LIMIT_ENABLED}: rate limiting açık/kapalı (varsayılan: true)</li>
 *   <li>{@code YIN_RATE_LIMIT_PRINT}: /v1/yin için dakikada max istek (varsayılan: 60)</li>
 *   <li>{@code YIN_RATE_LIMIT_BEHIND_PROXY}: reverse proxy arkasında mı? (varsayılan: false)</li>
 * </ul>
 */
@Configuration
public class RateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

    @Value("${yin.rate-limit.enabled:${YIN_RATE_LIMIT_ENABLED:true}}")
    private boolean enabled;

    @Value("${yin.rate-limit.print:${YIN_RATE_LIMIT_PRINT:60}}")
    private int printLimit;

    @Value("${yin.rate-limit.behind-proxy:${YIN_RATE_LIMIT_BEHIND_PROXY:false}}")
    private boolean behindProxy;

    @Bean
    FilterRegistrationBean<RateLimitFilter> rateLimitFilter(YinMetrics yinMetrics) {
        var filter = new RateLimitFilter(enabled, printLimit, behindProxy, yinMetrics);
        var bean = new FilterRegistrationBean<>(filter);
        bean.addUrlPatterns("/v1/yin");
        bean.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);

        if (enabled) {
            log.info("Rate limiting aktif: yin {}/dk, proxy modu: {} (IP bazlı)",
                    printLimit, behindProxy ? "AÇIK" : "KAPALI");
        } else {
            log.info("Rate limiting devre dışı (YIN_RATE_LIMIT_ENABLED=false)");
        }

        return bean;
    }

    /**
     * Caffeine cache ile dakika penceresi uygulayan filter.
     * Limit aşıldığında 429 Too Many Requests döner.
     */
    static class RateLimitFilter extends OncePerRequestFilter {

        private static final Logger filterLog = LoggerFactory.getLogger(RateLimitFilter.class);

        private final boolean enabled;
        private final int limit;
        private final boolean behindProxy;
        private final YinMetrics yinMetrics;

        private final Cache<String, AtomicInteger> counts = Caffeine.newBuilder()
                .maximumSize(50_000)
                .expireAfterWrite(Duration.ofMinutes(1))
                .build();

        RateLimitFilter(boolean enabled, int limit, boolean behindProxy, YinMetrics yinMetrics) {
            this.enabled = enabled;
            this.limit = limit;
            this.behindProxy = behindProxy;
            this.yinMetrics = yinMetrics;
        }

        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                       FilterChain filterChain) throws ServletException, IOException {
            if (!enabled || !request.getRequestURI().startsWith("/v1/yin")) {
                filterChain.doFilter(request, response);
                return;
            }

            String clientIp = resolveClientIp(request);
            AtomicInteger counter = counts.get(clientIp, k -> new AtomicInteger(0));
            int current = counter.incrementAndGet();

            response.setHeader("X-RateLimit-Limit", String.valueOf(limit));
            response.setHeader("X-RateLimit-Remaining", String.valueOf(Math.max(0, limit - current)));

            if (current > limit) {
                yinMetrics.recordRateLimitExceeded("print");
                JsonResponseWriter.write(response, HttpStatus.TOO_MANY_REQUESTS.value(),
                        new ErrorResponse("Rate limit exceeded",
                                "Dakika başına maksimum " + limit + " istek. Lütfen bekleyin."));
                return;
            }

            filterChain.doFilter(request, response);
        }

        private String resolveClientIp(HttpServletRequest request) {
            if (!behindProxy) {
                return request.getRemoteAddr();
            }

            String xff = request.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                String clientIp = xff.split(",")[0].trim();
                filterLog.trace("Proxy modu: X-Forwarded-For → {}", clientIp);
                return clientIp;
            }

            String realIp = request.getHeader("X-Real-IP");
            if (realIp != null && !realIp.isBlank()) {
                return realIp.trim();
            }

            return request.getRemoteAddr();
        }
    }
}
