package io.mersel.services.yin.application.enums;

/**
 * NETCONF erişim kontrolü ({@code ietf-netconf-acm}) eklenti bayrakları.
 * <p>
 * Bir düğümde yerel olarak set edilmiş ve üst düğümde bulunmayan her bayrak
 * {@code <nacm:default-deny-write/>} biçiminde yazılır.
 */
public enum AccessControl {

    DEFAULT_DENY_WRITE("default-deny-write"),
    DEFAULT_DENY_ALL("default-deny-all");

    /** Eklentiyi tanımlayan modülün adı. */
    public static final String MODULE_NAME = "ietf-netconf-acm";

    private final String keyword;

    AccessControl(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static AccessControl fromKeyword(String keyword) {
        for (AccessControl flag : values()) {
            if (flag.keyword.equals(keyword)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Geçersiz erişim kontrolü bayrağı: " + keyword);
    }
}
