package io.mersel.services.yin.web.infrastructure;

import io.mersel.services.yin.application.interfaces.ISchemaModelReader.SchemaModelException;
import io.mersel.services.yin.application.interfaces.ISchemaPrinter.SchemaPrintException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.net.URI;

/**
 * Global hata yöneticisi, RFC 7807 Problem Details.
 * <p>
 * Tüm controller'lardan çıkan istisnaları tutarlı bir JSON formatta döner:
 * <pre>
 * {
 *   "type": "https://mersel.io/yin/errors/print-failed",
 *   "title": "Yazdırma Başarısız",
 *   "status": 422,
 *   "detail": "module \"example\" içinde must ifadesi çevrilemedi: ..."
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_BASE_URI = "https://mersel.io/yin/errors/";

    /**
     * Şema belgesi okunamadı → 400 Bad Request.
     */
    @ExceptionHandler(SchemaModelException.class)
    public ProblemDetail handleSchemaModelException(SchemaModelException ex) {
        log.warn("Şema belgesi hatası: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "schema-invalid"));
        problem.setTitle("Geçersiz Şema Belgesi");
        return problem;
    }

    /**
     * Model yazdırılamadı → 422 Unprocessable Entity.
     */
    @ExceptionHandler(SchemaPrintException.class)
    public ProblemDetail handleSchemaPrintException(SchemaPrintException ex) {
        log.warn("Yazdırma hatası: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "print-failed"));
        problem.setTitle("Yazdırma Başarısız");
        return problem;
    }

    /**
     * Belge boyutu aşımı → 413 Payload Too Large.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ProblemDetail handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Belge boyutu aşımı: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.PAYLOAD_TOO_LARGE,
                "Şema belgesi izin verilen boyutu aşıyor (" + ex.getMaxUploadSize() / 1024 + " KB)");
        problem.setType(URI.create(ERROR_BASE_URI + "payload-too-large"));
        problem.setTitle("Belge Boyutu Aşımı");
        return problem;
    }

    /**
     * Desteklenmeyen içerik tipi → 415 Unsupported Media Type.
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ProblemDetail handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Desteklenmeyen içerik tipi: {}", ex.getContentType());
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Şema belgesi application/json olarak gönderilmeli");
        problem.setType(URI.create(ERROR_BASE_URI + "unsupported-media-type"));
        problem.setTitle("Desteklenmeyen İçerik Tipi");
        return problem;
    }

    /**
     * Genel istek hatası → 400 Bad Request.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Geçersiz parametre: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create(ERROR_BASE_URI + "bad-request"));
        problem.setTitle("Geçersiz İstek");
        return problem;
    }

    /**
     * Beklenmeyen hata → 500 Internal Server Error.
     */
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex) {
        log.error("Beklenmeyen hata: {}", ex.getMessage(), ex);
        var problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Beklenmeyen bir hata oluştu. Lütfen tekrar deneyin.");
        problem.setType(URI.create(ERROR_BASE_URI + "internal-error"));
        problem.setTitle("Sunucu Hatası");
        return problem;
    }
}
