package io.mersel.services.yin.application.models;

/**
 * {@code import} ifadesi.
 *
 * @param module       İçe aktarılan modül
 * @param prefix       Yerel önek
 * @param revisionDate Opsiyonel revizyon tarihi
 * @param external     {@code true} ise içe aktarım bu modülde yazılmaz ve namespace'i bildirilmez
 */
public record ModuleImport(YangModule module, String prefix, String revisionDate, boolean external) {

    public static ModuleImport of(YangModule module, String prefix) {
        return new ModuleImport(module, prefix, null, false);
    }
}
