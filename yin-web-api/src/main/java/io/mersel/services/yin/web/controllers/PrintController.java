package io.mersel.services.yin.web.controllers;

import io.mersel.services.yin.application.interfaces.ISchemaModelReader;
import io.mersel.services.yin.application.interfaces.ISchemaModelReader.SchemaModelException;
import io.mersel.services.yin.application.interfaces.ISchemaPrinter;
import io.mersel.services.yin.application.interfaces.ISchemaPrinter.SchemaPrintException;
import io.mersel.services.yin.application.models.PrintResult;
import io.mersel.services.yin.application.models.SchemaModule;
import io.mersel.services.yin.infrastructure.config.YinPrinterProperties;
import io.mersel.services.yin.infrastructure.diagnostics.YinMetrics;
import io.mersel.services.yin.web.infrastructure.YinHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * YIN yazdırma endpoint'i.
 * <p>
 * JSON şema belgesini okur, belgede adı verilen modülü YIN olarak yazdırır ve
 * metadata'yı {@code X-Yin-*} response header'larında döner.
 * <p>
 * Hata durumunda RFC 7807 {@code application/problem+json} formatında yanıt döner.
 *
 * <h3>Başarılı Yanıt Örneği</h3>
 * <pre>
 * HTTP/1.1 200 OK
 * Content-Type: application/yin+xml; charset=utf-8
 * X-Yin-Module: example
 * X-Yin-Duration-Ms: 2
 * X-Yin-Output-Size: 1834
 * X-Yin-Verified: true
 * </pre>
 */
@RestController
@RequestMapping("/v1")
@Tag(name = "YIN", description = "YANG şema modellerini YIN (XML) olarak yazdırma")
public class PrintController {

    private static final Logger log = LoggerFactory.getLogger(PrintController.class);
    static final MediaType APPLICATION_YIN_XML = new MediaType("application", "yin+xml", StandardCharsets.UTF_8);

    private final ISchemaModelReader modelReader;
    private final ISchemaPrinter schemaPrinter;
    private final YinPrinterProperties properties;
    private final YinMetrics yinMetrics;

    public PrintController(ISchemaModelReader modelReader,
                           ISchemaPrinter schemaPrinter,
                           YinPrinterProperties properties,
                           YinMetrics yinMetrics) {
        this.modelReader = modelReader;
        this.schemaPrinter = schemaPrinter;
        this.properties = properties;
        this.yinMetrics = yinMetrics;
    }

    @Operation(
            summary = "YIN Yazdırma",
            description = """
                    JSON şema belgesindeki modülü (veya alt modülü) YIN belgesi olarak yazdırır.
                    
                    **Başarılı yanıt:** `200 OK` + `application/yin+xml` body + `X-Yin-*` metadata header'ları.
                    
                    Belge, yazdırılacak modülün adını (`module`) ve referans verilen tüm modülleri
                    (`modules`) içerir. Modüller arası referanslar modül adıyla nitelenir (`ietf-yang-types:counter32`).
                    """,
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Yazdırma başarılı, YIN belgesi",
                            content = @Content(mediaType = "application/yin+xml"),
                            headers = {
                                    @Header(name = YinHeaders.MODULE, description = "Yazdırılan modül adı", schema = @Schema(type = "string")),
                                    @Header(name = YinHeaders.DURATION_MS, description = "İşlem süresi (ms)", schema = @Schema(type = "integer")),
                                    @Header(name = YinHeaders.OUTPUT_SIZE, description = "Çıktı boyutu (byte)", schema = @Schema(type = "integer")),
                                    @Header(name = YinHeaders.VERIFIED, description = "Çıktı Saxon ile doğrulandı mı", schema = @Schema(type = "boolean"))
                            }
                    ),
                    @ApiResponse(responseCode = "400", description = "Şema belgesi okunamadı veya bir referans çözümlenemedi", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "413", description = "Şema belgesi çok büyük", content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "422", description = "Model yazdırılamadı (çözümlenemeyen ifade veya önek)", content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping(value = "/yin", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> print(@RequestBody(required = false) byte[] document)
            throws SchemaModelException, SchemaPrintException {

        // ── Girdi doğrulama ────────────────────────────────────────────
        if (document == null || document.length == 0) {
            throw new IllegalArgumentException("Şema belgesi boş olamaz");
        }
        if (document.length > properties.getMaxDocumentSizeBytes()) {
            throw new MaxUploadSizeExceededException(properties.getMaxDocumentSizeBytes());
        }

        SchemaModule module;
        try {
            module = modelReader.read(new ByteArrayInputStream(document));
        } catch (SchemaModelException e) {
            yinMetrics.recordError("read");
            throw e;
        }

        log.info("Yazdırma isteği: {} ({} byte şema belgesi)", module, document.length);

        // ── Yazdırma (SchemaPrintException fırlarsa GlobalExceptionHandler yakalar) ──
        PrintResult result = schemaPrinter.render(module);
        byte[] body = result.getContent().getBytes(StandardCharsets.UTF_8);

        // ── HTTP yanıtı oluştur ────────────────────────────────────────
        var headers = new HttpHeaders();
        headers.setContentType(APPLICATION_YIN_XML);
        // CRLF sanitize, HTTP Response Splitting koruması
        headers.set(YinHeaders.MODULE, result.getModuleName().replaceAll("[\\r\\n]", " "));
        headers.set(YinHeaders.DURATION_MS, String.valueOf(result.getDurationMs()));
        headers.set(YinHeaders.OUTPUT_SIZE, String.valueOf(body.length));
        headers.set(YinHeaders.VERIFIED, String.valueOf(result.isVerified()));

        return new ResponseEntity<>(body, headers, HttpStatus.OK);
    }
}
