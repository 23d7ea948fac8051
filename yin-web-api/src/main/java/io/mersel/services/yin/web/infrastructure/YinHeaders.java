package io.mersel.services.yin.web.infrastructure;

/**
 * YIN Service özel HTTP response header sabitleri.
 * <p>
 * Yazdırma endpoint'i başarılı yanıtlarda {@code application/yin+xml} body ile birlikte
 * bu header'ları döner.
 *
 * <pre>
 * HTTP/1.1 200 OK
 * Content-Type: application/yin+xml; charset=utf-8
 * X-Yin-Module: ietf-interfaces
 * X-Yin-Duration-Ms: 3
 * X-Yin-Output-Size: 12840
 * X-Yin-Verified: false
 *
 * &lt;?xml version="1.0" encoding="UTF-8"?&gt;...
 * </pre>
 */
public final class YinHeaders {

    private YinHeaders() {
    }

    /** Yazdırılan modül veya alt modülün adı. */
    public static final String MODULE = "X-Yin-Module";

    /** İşlem süresi (milisaniye). */
    public static final String DURATION_MS = "X-Yin-Duration-Ms";

    /** Çıktı boyutu (byte). */
    public static final String OUTPUT_SIZE = "X-Yin-Output-Size";

    /** Çıktı Saxon ile doğrulandı mı? ({@code true} / {@code false}) */
    public static final String VERIFIED = "X-Yin-Verified";
}
