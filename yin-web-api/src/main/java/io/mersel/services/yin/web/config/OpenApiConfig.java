package io.mersel.services.yin.web.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI dokümantasyon yapılandırması.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI yinServiceOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("MERSEL YIN Printer Service API")
                        .description("""
                                YANG şema modellerini YIN (XML) biçiminde yazdıran servis.
                                
                                ## Özellikler
                                - **Modül ve alt modül yazdırma**: RFC 6020 YIN eşlemesine göre
                                - **Önek çözümleme**: Modüller arası referanslar içe aktarım önekleriyle yazılır
                                - **Çıktı doğrulama**: Üretilen belge isteğe bağlı olarak Saxon HE ile ayrıştırılır
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Mersel")
                                .url("https://mersel.io")))
                .servers(List.of(
                        new Server().url("/").description("Yerel sunucu")
                ));
    }
}
