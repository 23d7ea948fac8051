package io.mersel.services.yin.application.models;

/**
 * Değer uzayı kısıtı ({@code range}, {@code length}, {@code pattern}) veya {@code must} koşulu.
 *
 * @param expression   Kısıt ifadesi (must için iç kodlamadaki XPath)
 * @param description  Opsiyonel açıklama
 * @param reference    Opsiyonel referans
 * @param errorAppTag  Opsiyonel {@code error-app-tag}
 * @param errorMessage Opsiyonel {@code error-message}
 */
public record Restriction(
        String expression,
        String description,
        String reference,
        String errorAppTag,
        String errorMessage
) {

    public static Restriction of(String expression) {
        return new Restriction(expression, null, null, null, null);
    }
}
