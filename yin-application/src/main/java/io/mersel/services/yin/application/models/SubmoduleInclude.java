package io.mersel.services.yin.application.models;

/**
 * {@code include} ifadesi.
 *
 * @param submodule    Dahil edilen alt modül
 * @param revisionDate Opsiyonel revizyon tarihi
 * @param external     {@code true} ise bu modülde yazılmaz
 */
public record SubmoduleInclude(YangSubmodule submodule, String revisionDate, boolean external) {

    public static SubmoduleInclude of(YangSubmodule submodule) {
        return new SubmoduleInclude(submodule, null, false);
    }
}
