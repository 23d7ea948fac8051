package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.Status;

/**
 * Bir {@code enumeration} tipinin tek değeri. Değer her zaman açık olarak yazılır.
 */
public record EnumEntry(String name, int value, Status status, String description, String reference) {

    public static EnumEntry of(String name, int value) {
        return new EnumEntry(name, value, null, null, null);
    }
}
