package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.enums.ExpressionKind;
import io.mersel.services.yin.application.enums.Status;
import io.mersel.services.yin.application.interfaces.IExpressionTranslator;
import io.mersel.services.yin.application.interfaces.IExpressionTranslator.ExpressionTranslationException;
import io.mersel.services.yin.application.interfaces.IPrefixResolver;
import io.mersel.services.yin.application.interfaces.IPrefixResolver.PrefixResolutionException;
import io.mersel.services.yin.application.interfaces.ISchemaPrinter.SchemaPrintException;
import io.mersel.services.yin.application.models.BitEntry;
import io.mersel.services.yin.application.models.EnumEntry;
import io.mersel.services.yin.application.models.Feature;
import io.mersel.services.yin.application.models.Restriction;
import io.mersel.services.yin.application.models.SchemaModule;
import io.mersel.services.yin.application.models.SchemaStatement;
import io.mersel.services.yin.application.models.SchemaType;
import io.mersel.services.yin.application.models.TypeInfo.BinaryInfo;
import io.mersel.services.yin.application.models.TypeInfo.BitsInfo;
import io.mersel.services.yin.application.models.TypeInfo.Decimal64Info;
import io.mersel.services.yin.application.models.TypeInfo.EnumerationInfo;
import io.mersel.services.yin.application.models.TypeInfo.IdentityrefInfo;
import io.mersel.services.yin.application.models.TypeInfo.InstanceIdentifierInfo;
import io.mersel.services.yin.application.models.TypeInfo.LeafrefInfo;
import io.mersel.services.yin.application.models.TypeInfo.NumericInfo;
import io.mersel.services.yin.application.models.TypeInfo.StringInfo;
import io.mersel.services.yin.application.models.TypeInfo.UnionInfo;
import io.mersel.services.yin.application.models.Typedef;
import io.mersel.services.yin.application.models.When;
import org.springframework.stereotype.Component;

/**
 * Kısıtları, tipleri ve tip benzeri alt ifadeleri ({@code when}, {@code must},
 * {@code if-feature}, {@code typedef}) yazar.
 * <p>
 * Her eleman için önce alt ifade olup olmadığı hesaplanır; yoksa eleman kendi kendine
 * kapanır, varsa açılır, alt ifadeler bir derinlik içeride yazılır ve kapatılır.
 */
@Component
public class YinTypePrinter {

    private final IExpressionTranslator expressionTranslator;
    private final IPrefixResolver prefixResolver;

    public YinTypePrinter(IExpressionTranslator expressionTranslator, IPrefixResolver prefixResolver) {
        this.expressionTranslator = expressionTranslator;
        this.prefixResolver = prefixResolver;
    }

    // ── Ortak alt ifadeler ──────────────────────────────────────────

    /** {@code <elem><text>…</text></elem>}; {@code text} {@code null} ise hiçbir şey yazmaz. */
    void printText(YinOutput out, int level, String elem, String text) {
        if (text != null) {
            out.text(level, elem, "text", text);
        }
    }

    /** {@code status}, {@code description}, {@code reference} (bu sırayla). */
    void printCommon(YinOutput out, int level, Status status, String description, String reference) {
        if (status != null) {
            out.open(level, "status", "value", status.getValue(), true);
        }
        printText(out, level, "description", description);
        printText(out, level, "reference", reference);
    }

    void printCommon(YinOutput out, int level, SchemaStatement statement) {
        printCommon(out, level, statement.getStatus(), statement.getDescription(), statement.getReference());
    }

    // ── Kısıtlar ───────────────────────────────────────────────────

    static boolean hasRestrictionSubstatements(Restriction restriction) {
        return restriction.description() != null || restriction.reference() != null
                || restriction.errorAppTag() != null || restriction.errorMessage() != null;
    }

    /**
     * {@code range}, {@code length} veya {@code pattern} kısıtı.
     */
    void printRestriction(YinOutput out, int level, String elem, Restriction restriction) {
        boolean close = !hasRestrictionSubstatements(restriction);

        out.open(level, elem, "value", restriction.expression(), close);
        if (!close) {
            printRestrictionSubstatements(out, level + 1, restriction);
            out.close(level, elem);
        }
    }

    /** description, reference, error-app-tag, error-message (bu sırayla). */
    private void printRestrictionSubstatements(YinOutput out, int level, Restriction restriction) {
        printText(out, level, "description", restriction.description());
        printText(out, level, "reference", restriction.reference());
        if (restriction.errorAppTag() != null) {
            out.open(level, "error-app-tag", "value", restriction.errorAppTag(), true);
        }
        if (restriction.errorMessage() != null) {
            out.text(level, "error-message", "value", restriction.errorMessage());
        }
    }

    void printMust(YinOutput out, int level, SchemaModule module, Restriction must) throws SchemaPrintException {
        boolean close = !hasRestrictionSubstatements(must);
        String condition = translate(module, must.expression(), ExpressionKind.CONDITION, "must");

        out.open(level, "must", "condition", condition, close);
        if (!close) {
            printRestrictionSubstatements(out, level + 1, must);
            out.close(level, "must");
        }
    }

    void printWhen(YinOutput out, int level, SchemaModule module, When when) throws SchemaPrintException {
        boolean close = when.description() == null && when.reference() == null;
        String condition = translate(module, when.condition(), ExpressionKind.CONDITION, "when");

        out.open(level, "when", "condition", condition, close);
        if (!close) {
            printText(out, level + 1, "description", when.description());
            printText(out, level + 1, "reference", when.reference());
            out.close(level, "when");
        }
    }

    void printIfFeature(YinOutput out, int level, SchemaModule module, Feature feature)
            throws SchemaPrintException {
        out.open(level, "if-feature", "name", qualify(module, feature.getModule(), feature.getName()), true);
    }

    // ── Tipler ─────────────────────────────────────────────────────

    /**
     * Tip elemanının alt ifadesi var mı?
     * <p>
     * decimal64, enumeration, identityref, bits, union ve leafref içerikleriyle birlikte
     * her zaman açılır. Yerel içerik taşımayan türetilmiş tip referansları kapanır.
     */
    static boolean hasTypeSubstatements(SchemaType type) {
        var info = type.info();
        return switch (type.base()) {
            case BINARY -> info instanceof BinaryInfo binary && binary.length() != null;
            case INSTANCE_IDENTIFIER -> info instanceof InstanceIdentifierInfo inst && inst.requireInstance() != null;
            case INT8, INT16, INT32, INT64, UINT8, UINT16, UINT32, UINT64 ->
                    info instanceof NumericInfo numeric && numeric.range() != null;
            case STRING -> info instanceof StringInfo string
                    && (string.length() != null || !string.patterns().isEmpty());
            case DECIMAL64 -> info instanceof Decimal64Info;
            case ENUMERATION -> info instanceof EnumerationInfo enumeration && !enumeration.entries().isEmpty();
            case BITS -> info instanceof BitsInfo bits && !bits.bits().isEmpty();
            case IDENTITYREF -> info instanceof IdentityrefInfo identityref && identityref.base() != null;
            case LEAFREF -> info instanceof LeafrefInfo leafref && leafref.path() != null;
            case UNION -> info instanceof UnionInfo union && !union.types().isEmpty();
            case BOOLEAN, EMPTY -> false;
        };
    }

    /**
     * Tipi yazar; union üyeleri aynı metotla özyinelemeli yazılır.
     *
     * @param module Tipi içeren (yazdırılan) modül; önekler buna göre belirlenir
     */
    void printType(YinOutput out, int level, SchemaModule module, SchemaType type) throws SchemaPrintException {
        boolean close = !hasTypeSubstatements(type);

        out.open(level, "type", "name", qualify(module, type.module(), type.name()), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        var info = type.info();
        if (info instanceof BinaryInfo binary) {
            printRestriction(out, inner, "length", binary.length());
        } else if (info instanceof BitsInfo bits) {
            for (BitEntry bit : bits.bits()) {
                out.open(inner, "bit", "name", bit.name(), false);
                printCommon(out, inner + 1, bit.status(), bit.description(), bit.reference());
                out.number(inner + 1, "position", "value", bit.position());
                out.close(inner, "bit");
            }
        } else if (info instanceof Decimal64Info decimal) {
            out.number(inner, "fraction-digits", "value", decimal.fractionDigits());
            if (decimal.range() != null) {
                printRestriction(out, inner, "range", decimal.range());
            }
        } else if (info instanceof EnumerationInfo enumeration) {
            for (EnumEntry entry : enumeration.entries()) {
                out.open(inner, "enum", "name", entry.name(), false);
                printCommon(out, inner + 1, entry.status(), entry.description(), entry.reference());
                out.number(inner + 1, "value", "value", entry.value());
                out.close(inner, "enum");
            }
        } else if (info instanceof IdentityrefInfo identityref) {
            var base = identityref.base();
            out.open(inner, "base", "name", qualify(module, base.getModule(), base.getName()), true);
        } else if (info instanceof InstanceIdentifierInfo inst) {
            out.open(inner, "require-instance", "value", String.valueOf(inst.requireInstance()), true);
        } else if (info instanceof NumericInfo numeric) {
            printRestriction(out, inner, "range", numeric.range());
        } else if (info instanceof LeafrefInfo leafref) {
            out.open(inner, "path", "value",
                    translate(module, leafref.path(), ExpressionKind.SCHEMA_NODE_PATH, "type \"" + type.name() + "\" path"),
                    true);
        } else if (info instanceof StringInfo string) {
            if (string.length() != null) {
                printRestriction(out, inner, "length", string.length());
            }
            for (Restriction pattern : string.patterns()) {
                printRestriction(out, inner, "pattern", pattern);
            }
        } else if (info instanceof UnionInfo union) {
            for (SchemaType member : union.types()) {
                printType(out, inner, module, member);
            }
        }

        out.close(level, "type");
    }

    /** Typedef'in her zaman bir tipi olduğundan eleman her zaman açılır. */
    void printTypedef(YinOutput out, int level, SchemaModule module, Typedef typedef) throws SchemaPrintException {
        out.open(level, "typedef", "name", typedef.getName(), false);

        int inner = level + 1;
        printCommon(out, inner, typedef);
        printType(out, inner, module, typedef.getType());
        if (typedef.getUnits() != null) {
            out.open(inner, "units", "name", typedef.getUnits(), true);
        }
        if (typedef.getDefaultValue() != null) {
            out.open(inner, "default", "value", typedef.getDefaultValue(), true);
        }

        out.close(level, "typedef");
    }

    // ── Çözümleme yardımcıları ─────────────────────────────────────

    /**
     * Başka modülde tanımlı bir adı {@code önek:ad} biçimine getirir.
     *
     * @param definingModule {@code null} ise ad olduğu gibi döner (yerleşik tipler)
     */
    String qualify(SchemaModule module, SchemaModule definingModule, String name) throws SchemaPrintException {
        if (definingModule == null) {
            return name;
        }
        try {
            String prefix = prefixResolver.resolve(module, definingModule);
            return prefix.isEmpty() ? name : prefix + ":" + name;
        } catch (PrefixResolutionException e) {
            throw new SchemaPrintException("\"" + name + "\" referansı yazdırılamadı: " + e.getMessage(), e);
        }
    }

    /**
     * Modül adıyla verilen bir eklenti modülünün önekini döner (yazdırılan modülün kendisiyse kendi öneki).
     */
    String prefixOf(SchemaModule module, String moduleName) throws SchemaPrintException {
        if (module.mainModule().getName().equals(moduleName)) {
            return module.getPrefix();
        }
        try {
            return prefixResolver.resolve(module, moduleName);
        } catch (PrefixResolutionException e) {
            throw new SchemaPrintException(e.getMessage(), e);
        }
    }

    /**
     * İfadeyi çevirir; başarısızlığı hangi ifadenin yazılamadığını belirten bir
     * {@link SchemaPrintException} olarak iletir.
     */
    String translate(SchemaModule module, String expression, ExpressionKind kind, String statement)
            throws SchemaPrintException {
        try {
            return expressionTranslator.translate(module, expression, kind);
        } catch (ExpressionTranslationException e) {
            throw new SchemaPrintException(
                    module + " içinde " + statement + " ifadesi çevrilemedi: " + e.getMessage(), e);
        }
    }
}
