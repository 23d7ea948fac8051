package io.mersel.services.yin.application.models;

/**
 * Modül revizyonu.
 *
 * @param date        {@code YYYY-MM-DD}
 * @param description Opsiyonel açıklama
 * @param reference   Opsiyonel referans
 */
public record Revision(String date, String description, String reference) {

    public static Revision of(String date) {
        return new Revision(date, null, null);
    }
}
