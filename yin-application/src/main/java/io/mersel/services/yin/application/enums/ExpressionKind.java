package io.mersel.services.yin.application.enums;

/**
 * Çevrilecek ifadenin türü.
 */
public enum ExpressionKind {

    /** {@code when} / {@code must} XPath koşulu. */
    CONDITION,

    /** {@code augment}, {@code deviation}, {@code refine} hedefi ve leafref yolu. */
    SCHEMA_NODE_PATH
}
