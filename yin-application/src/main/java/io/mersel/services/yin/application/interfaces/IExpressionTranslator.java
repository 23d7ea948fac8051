package io.mersel.services.yin.application.interfaces;

import io.mersel.services.yin.application.enums.ExpressionKind;
import io.mersel.services.yin.application.models.SchemaModule;

/**
 * İç kodlamadaki ifadeleri YIN'de görünen önekli biçime çevirir.
 * <p>
 * İç kodlamada düğüm adları modül adlarıyla nitelenir
 * ({@code /ietf-interfaces:interfaces}); dış biçimde yazdırılan modülün
 * o modül için kullandığı önek yer alır ({@code /if:interfaces}).
 */
public interface IExpressionTranslator {

    /**
     * İfadeyi çevirir.
     *
     * @param module     İfadeyi içeren (yazdırılan) modül
     * @param expression İç kodlamadaki ifade
     * @param kind       Koşul ({@code when}/{@code must}) veya şema düğüm yolu
     * @return Önekli ifade
     * @throws ExpressionTranslationException İfade çözümlenemediğinde
     */
    String translate(SchemaModule module, String expression, ExpressionKind kind)
            throws ExpressionTranslationException;

    /**
     * İfade çevrilemediğinde fırlatılan istisna.
     */
    class ExpressionTranslationException extends Exception {
        public ExpressionTranslationException(String message) {
            super(message);
        }

        public ExpressionTranslationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
