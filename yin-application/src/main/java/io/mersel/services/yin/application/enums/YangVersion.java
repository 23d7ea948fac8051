package io.mersel.services.yin.application.enums;

/**
 * Modülün {@code yang-version} değeri.
 */
public enum YangVersion {

    V1("1"),
    V1_1("1.1");

    private final String value;

    YangVersion(String value) {
        this.value = value;
    }

    /** Çıktıda kullanılan değer ({@code 1} veya {@code 1.1}). */
    public String getValue() {
        return value;
    }

    public static YangVersion fromValue(String value) {
        for (YangVersion version : values()) {
            if (version.value.equals(value)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Geçersiz yang-version değeri: " + value);
    }
}
