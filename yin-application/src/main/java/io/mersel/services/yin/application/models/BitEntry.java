package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.Status;

/**
 * Bir {@code bits} tipinin tek biti. Pozisyon her zaman açık olarak yazılır.
 */
public record BitEntry(String name, long position, Status status, String description, String reference) {

    public static BitEntry of(String name, long position) {
        return new BitEntry(name, position, null, null, null);
    }
}
