package io.mersel.services.yin.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (yazıcılar, okuyucu, Saxon doğrulayıcı, metrikler) otomatik tarar.
 * Yazıcı yapılandırma özelliklerini etkinleştirir.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.yin.infrastructure")
@EnableConfigurationProperties(YinPrinterProperties.class)
public class InfrastructureConfig {
}
