package io.mersel.services.yin.web;

import io.mersel.services.yin.infrastructure.config.InfrastructureConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * MERSEL YIN Printer Service - Ana uygulama giriş noktası.
 * <p>
 * YANG şema modellerini YIN (XML) biçiminde yazdıran servis.
 */
@SpringBootApplication
@Import(InfrastructureConfig.class)
public class YinServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(YinServiceApplication.class, args);
    }
}
