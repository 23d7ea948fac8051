package io.mersel.services.yin.infrastructure.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * YIN yazıcı servisi özel metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılan tüm uygulama metriklerini yönetir.
 */
@Component
public class YinMetrics {

    public static final String METER_NAME = "yin-printer-service";

    private final MeterRegistry registry;

    public YinMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Yazdırma metrikleri kaydet.
     *
     * @param kind        "module" veya "submodule"
     * @param verified    Çıktı Saxon ile doğrulandı mı
     * @param durationMs  İşlem süresi (milisaniye)
     * @param outputBytes Çıktı boyutu (byte)
     */
    public void recordPrint(String kind, boolean verified, long durationMs, int outputBytes) {
        Counter.builder("yin_prints_total")
                .tag("kind", kind)
                .tag("verified", String.valueOf(verified))
                .description("Toplam yazdırma sayısı")
                .register(registry)
                .increment();

        Timer.builder("yin_print_duration")
                .tag("kind", kind)
                .description("Yazdırma süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));

        registry.summary("yin_print_output_bytes", "kind", kind)
                .record(outputBytes);
    }

    /**
     * Hata metrikleri kaydet.
     *
     * @param operation "read", "print" veya "verify"
     */
    public void recordError(String operation) {
        Counter.builder("yin_errors_total")
                .tag("operation", operation)
                .description("Toplam hata sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Rate limit aşımı metrikleri kaydet.
     *
     * @param endpoint "print"
     */
    public void recordRateLimitExceeded(String endpoint) {
        Counter.builder("yin_rate_limit_exceeded_total")
                .tag("endpoint", endpoint)
                .description("Rate limit aşım sayısı")
                .register(registry)
                .increment();
    }
}
