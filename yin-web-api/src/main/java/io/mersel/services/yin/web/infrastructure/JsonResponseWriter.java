package io.mersel.services.yin.web.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;

import java.io.IOException;

/**
 * Servlet filter'larında JSON yanıt yazmak için yardımcı sınıf.
 * <p>
 * Filter katmanında {@code ResponseEntity} serileştirmesi kullanılamaz; bu sınıf
 * Jackson {@link ObjectMapper} ile nesneyi doğrudan {@code HttpServletResponse}'a yazar.
 */
public final class JsonResponseWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonResponseWriter() {
    }

    /**
     * @param response HTTP yanıtı
     * @param status   HTTP durum kodu (ör: 429)
     * @param body     Serileştirilecek nesne
     * @throws IOException yazma hatası
     */
    public static void write(HttpServletResponse response, int status, Object body) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        MAPPER.writeValue(response.getOutputStream(), body);
    }
}
