package io.mersel.services.yin.application.models;

/**
 * {@code when} koşulu.
 *
 * @param condition   İç kodlamadaki XPath koşulu
 * @param description Opsiyonel açıklama
 * @param reference   Opsiyonel referans
 */
public record When(String condition, String description, String reference) {

    public static When of(String condition) {
        return new When(condition, null, null);
    }
}
