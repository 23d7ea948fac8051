package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.BaseType;

import java.util.Objects;

/**
 * Bir leaf, leaf-list, typedef veya union üyesinin tipi.
 *
 * @param base   Çözümlenmiş temel tür
 * @param name   Yazılacak tip adı (yerleşik tip adı veya typedef adı)
 * @param module Typedef'i tanımlayan modül; yerleşik tiplerde {@code null}
 * @param info   Türe özgü içerik; içeriği olmayan türlerde {@code null}
 */
public record SchemaType(BaseType base, String name, SchemaModule module, TypeInfo info) {

    public SchemaType {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(name, "name");
    }

    public static SchemaType builtin(BaseType base) {
        return new SchemaType(base, base.getKeyword(), null, null);
    }

    public static SchemaType builtin(BaseType base, TypeInfo info) {
        return new SchemaType(base, base.getKeyword(), null, info);
    }

    public static SchemaType derived(String name, SchemaModule module, BaseType base, TypeInfo info) {
        return new SchemaType(base, name, module, info);
    }
}
