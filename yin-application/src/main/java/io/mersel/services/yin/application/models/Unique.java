package io.mersel.services.yin.application.models;

import java.util.List;

/**
 * {@code unique} ifadesi: tekil olması gereken alt düğüm yolları.
 */
public record Unique(List<String> expressions) {

    public Unique {
        expressions = List.copyOf(expressions);
    }

    public static Unique of(String... expressions) {
        return new Unique(List.of(expressions));
    }
}
