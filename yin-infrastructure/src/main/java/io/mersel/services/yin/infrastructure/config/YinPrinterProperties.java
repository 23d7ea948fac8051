package io.mersel.services.yin.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * YIN yazıcı yapılandırma özellikleri.
 * <p>
 * {@code yin.printer} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code verify-output}: Üretilen belge Saxon ile ayrıştırılarak doğrulansın mı (varsayılan: false)</li>
 *   <li>{@code max-document-size-kb}: Kabul edilen en büyük şema belgesi (pozitif olmalı, varsayılan: 1024)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "yin.printer")
public class YinPrinterProperties {

    private static final Logger log = LoggerFactory.getLogger(YinPrinterProperties.class);

    static final int DEFAULT_MAX_DOCUMENT_SIZE_KB = 1024;

    private boolean verifyOutput = false;
    private int maxDocumentSizeKb = DEFAULT_MAX_DOCUMENT_SIZE_KB;

    @PostConstruct
    void validate() {
        if (maxDocumentSizeKb <= 0) {
            log.warn("max-document-size-kb değeri pozitif olmalı (verilen: {}), varsayılan {} KB kullanılıyor",
                    maxDocumentSizeKb, DEFAULT_MAX_DOCUMENT_SIZE_KB);
            maxDocumentSizeKb = DEFAULT_MAX_DOCUMENT_SIZE_KB;
        }
    }

    public boolean isVerifyOutput() {
        return verifyOutput;
    }

    public void setVerifyOutput(boolean verifyOutput) {
        this.verifyOutput = verifyOutput;
    }

    public int getMaxDocumentSizeKb() {
        return maxDocumentSizeKb;
    }

    public void setMaxDocumentSizeKb(int maxDocumentSizeKb) {
        this.maxDocumentSizeKb = maxDocumentSizeKb;
    }

    /** {@code max-document-size-kb} byte cinsinden. */
    public long getMaxDocumentSizeBytes() {
        return maxDocumentSizeKb * 1024L;
    }
}
