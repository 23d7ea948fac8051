package io.mersel.services.yin.application.enums;

/**
 * YANG {@code status} değerleri.
 * <p>
 * Modelde {@code null} "açıkça belirtilmemiş" anlamına gelir; bu durumda
 * {@code status} elemanı yazılmaz.
 */
public enum Status {

    CURRENT("current"),
    DEPRECATED("deprecated"),
    OBSOLETE("obsolete");

    private final String value;

    Status(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Status fromValue(String value) {
        for (Status status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Geçersiz status değeri: " + value);
    }
}
