package io.mersel.services.yin.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Filter katmanındaki hata yanıtı modeli.
 * <p>
 * Örnek çıktı:
 * <pre>
 * {"error": "Rate limit exceeded", "message": "Dakika başına maksimum 60 istek. Lütfen bekleyin."}
 * </pre>
 *
 * @param error   Hata kategorisi
 * @param message Kullanıcıya gösterilecek açıklayıcı mesaj
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message) {
}
