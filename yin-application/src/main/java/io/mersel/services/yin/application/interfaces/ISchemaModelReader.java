package io.mersel.services.yin.application.interfaces;

import io.mersel.services.yin.application.models.SchemaModule;

import java.io.InputStream;

/**
 * Şema belgesinden (JSON) yazdırılabilir modül modeli kuran okuyucu.
 */
public interface ISchemaModelReader {

    /**
     * Belgeyi okur ve yazdırılacak modülü, referans verdiği tüm modüllerle bağlanmış olarak döner.
     *
     * @param document Şema belgesi
     * @return Belgenin {@code module} alanında adı verilen modül
     * @throws SchemaModelException Belge okunamadığında veya bir referans çözümlenemediğinde
     */
    SchemaModule read(InputStream document) throws SchemaModelException;

    /**
     * Şema belgesi geçersiz olduğunda fırlatılan istisna.
     * Controller bu istisnayı {@code 400 Bad Request} olarak çevirir.
     */
    class SchemaModelException extends Exception {
        public SchemaModelException(String message) {
            super(message);
        }

        public SchemaModelException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
