package io.mersel.services.yin.application.interfaces;

import io.mersel.services.yin.application.models.PrintResult;
import io.mersel.services.yin.application.models.SchemaModule;

import java.io.IOException;
import java.io.Writer;

/**
 * YIN yazıcı servisi arayüzü.
 * <p>
 * Ayrıştırılmış ve doğrulanmış bir modülü (veya alt modülü) YIN XML belgesi olarak yazar.
 * Model salt okunur kullanılır; yazıcı hiçbir alanını değiştirmez.
 */
public interface ISchemaPrinter {

    /**
     * Modülü YIN olarak çıktıya yazar.
     * <p>
     * Belge önce tamamen bellekte üretilir, ardından çıktıya tek seferde yazılır;
     * yazdırma hatasında çıktıya hiçbir şey yazılmaz.
     *
     * @param module Yazdırılacak modül veya alt modül
     * @param out    Karakter çıktısı (kapatılmaz)
     * @throws SchemaPrintException Bir ifade veya önek çözümlenemediğinde
     * @throws IOException          Çıktıya yazma hatasında (olduğu gibi iletilir)
     */
    void print(SchemaModule module, Writer out) throws SchemaPrintException, IOException;

    /**
     * Modülü YIN olarak üretir ve metadata ile birlikte döner.
     *
     * @param module Yazdırılacak modül veya alt modül
     * @return Yazdırma sonucu (belge + metadata)
     * @throws SchemaPrintException Bir ifade veya önek çözümlenemediğinde ya da çıktı doğrulaması başarısız olduğunda
     */
    PrintResult render(SchemaModule module) throws SchemaPrintException;

    /**
     * Yazdırma başarısız olduğunda fırlatılan istisna.
     * Controller bu istisnayı {@code 422 Unprocessable Entity} olarak çevirir.
     */
    class SchemaPrintException extends Exception {
        public SchemaPrintException(String message) {
            super(message);
        }

        public SchemaPrintException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
