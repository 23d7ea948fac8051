package io.mersel.services.yin.application.models;

import java.util.List;

/**
 * Tip türüne özgü içerik.
 * <p>
 * {@code boolean} ve {@code empty} türleri içerik taşımaz ({@code null}).
 */
public sealed interface TypeInfo
        permits TypeInfo.NumericInfo, TypeInfo.StringInfo, TypeInfo.BinaryInfo, TypeInfo.Decimal64Info,
        TypeInfo.EnumerationInfo, TypeInfo.BitsInfo, TypeInfo.IdentityrefInfo, TypeInfo.LeafrefInfo,
        TypeInfo.InstanceIdentifierInfo, TypeInfo.UnionInfo {

    /** Tam sayı türleri; {@code range} opsiyoneldir. */
    record NumericInfo(Restriction range) implements TypeInfo {
    }

    /** {@code string}; uzunluk ve desenler opsiyoneldir. */
    record StringInfo(Restriction length, List<Restriction> patterns) implements TypeInfo {
        public StringInfo {
            patterns = patterns == null ? List.of() : List.copyOf(patterns);
        }
    }

    record BinaryInfo(Restriction length) implements TypeInfo {
    }

    record Decimal64Info(int fractionDigits, Restriction range) implements TypeInfo {
    }

    record EnumerationInfo(List<EnumEntry> entries) implements TypeInfo {
        public EnumerationInfo {
            entries = List.copyOf(entries);
        }
    }

    record BitsInfo(List<BitEntry> bits) implements TypeInfo {
        public BitsInfo {
            bits = List.copyOf(bits);
        }
    }

    record IdentityrefInfo(Identity base) implements TypeInfo {
    }

    /** Yol iç kodlamada tutulur. */
    record LeafrefInfo(String path) implements TypeInfo {
    }

    /** {@code requireInstance}: {@code null} belirtilmemiş, aksi halde açık değer. */
    record InstanceIdentifierInfo(Boolean requireInstance) implements TypeInfo {
    }

    record UnionInfo(List<SchemaType> types) implements TypeInfo {
        public UnionInfo {
            types = List.copyOf(types);
        }
    }
}
