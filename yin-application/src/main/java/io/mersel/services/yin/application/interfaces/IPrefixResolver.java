package io.mersel.services.yin.application.interfaces;

import io.mersel.services.yin.application.models.SchemaModule;

/**
 * Modüller arası referanslar için önek çözümleyici.
 * <p>
 * Arama sırası: referans veren modülün kendi {@code import} listesi, ardından
 * dahil ettiği alt modüllerin {@code import} listeleri.
 */
public interface IPrefixResolver {

    /**
     * Tanımlayan modüle ait bir adın referans veren modülde alacağı öneki döner.
     *
     * @param referencingModule Referansı içeren (yazdırılan) modül
     * @param definingModule    Adı tanımlayan modül
     * @return Aynı ana modülse boş string, aksi halde yerel önek
     * @throws PrefixResolutionException Hiçbir içe aktarım tanımlayan modüle ulaşmıyorsa
     */
    String resolve(SchemaModule referencingModule, SchemaModule definingModule)
            throws PrefixResolutionException;

    /**
     * {@link #resolve(SchemaModule, SchemaModule)} ile aynı; tanımlayan modül adıyla verilir.
     */
    String resolve(SchemaModule referencingModule, String definingModuleName)
            throws PrefixResolutionException;

    /**
     * Önek çözümlenemediğinde fırlatılan istisna. Mesaj iki modülü de adlandırır.
     */
    class PrefixResolutionException extends Exception {
        public PrefixResolutionException(String message) {
            super(message);
        }
    }
}
