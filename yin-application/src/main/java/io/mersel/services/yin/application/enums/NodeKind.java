package io.mersel.services.yin.application.enums;

/**
 * Şema ağacındaki düğüm türleri.
 * <p>
 * Her tür YIN çıktısında tek bir elemana karşılık gelir. Yazıcı, bir üst düğümün
 * hangi alt düğüm türlerine izin verdiğini {@code EnumSet<NodeKind>} maskesi ile belirler.
 */
public enum NodeKind {

    CONTAINER("container"),
    CHOICE("choice"),
    CASE("case"),
    LEAF("leaf"),
    LEAF_LIST("leaf-list"),
    LIST("list"),
    ANYXML("anyxml"),
    USES("uses"),
    GROUPING("grouping"),
    AUGMENT("augment"),
    RPC("rpc"),
    INPUT("input"),
    OUTPUT("output"),
    NOTIFICATION("notification");

    private final String keyword;

    NodeKind(String keyword) {
        this.keyword = keyword;
    }

    /** YIN eleman adı (ör: {@code leaf-list}). */
    public String getKeyword() {
        return keyword;
    }

    public static NodeKind fromKeyword(String keyword) {
        for (NodeKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Geçersiz düğüm türü: " + keyword);
    }
}
