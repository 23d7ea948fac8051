package io.mersel.services.yin.application.enums;

/**
 * {@code deviate} türleri.
 */
public enum DeviateKind {

    NOT_SUPPORTED("not-supported"),
    ADD("add"),
    REPLACE("replace"),
    DELETE("delete");

    private final String value;

    DeviateKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DeviateKind fromValue(String value) {
        for (DeviateKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Geçersiz deviate değeri: " + value);
    }
}
