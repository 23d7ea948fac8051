package io.mersel.services.yin.application.enums;

/**
 * YANG yerleşik tip türleri.
 * <p>
 * Türetilmiş (typedef) tipler de çözümlenmiş temel türlerini taşır; yazıcının
 * kendi kendine kapanma kararı bu türe göre verilir.
 */
public enum BaseType {

    BINARY("binary"),
    BITS("bits"),
    BOOLEAN("boolean"),
    DECIMAL64("decimal64"),
    EMPTY("empty"),
    ENUMERATION("enumeration"),
    IDENTITYREF("identityref"),
    INSTANCE_IDENTIFIER("instance-identifier"),
    LEAFREF("leafref"),
    STRING("string"),
    UNION("union"),
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    UINT8("uint8"),
    UINT16("uint16"),
    UINT32("uint32"),
    UINT64("uint64");

    private final String keyword;

    BaseType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Yerleşik tip adına karşılık gelen türü döner.
     *
     * @return eşleşme yoksa {@code null}
     */
    public static BaseType fromKeyword(String keyword) {
        for (BaseType type : values()) {
            if (type.keyword.equals(keyword)) {
                return type;
            }
        }
        return null;
    }
}
