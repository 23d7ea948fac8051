package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.enums.ExpressionKind;
import io.mersel.services.yin.application.interfaces.ISchemaPrinter;
import io.mersel.services.yin.application.models.AugmentNode;
import io.mersel.services.yin.application.models.Deviate;
import io.mersel.services.yin.application.models.Deviation;
import io.mersel.services.yin.application.models.Feature;
import io.mersel.services.yin.application.models.Identity;
import io.mersel.services.yin.application.models.ModuleImport;
import io.mersel.services.yin.application.models.NotificationNode;
import io.mersel.services.yin.application.models.PrintResult;
import io.mersel.services.yin.application.models.Restriction;
import io.mersel.services.yin.application.models.Revision;
import io.mersel.services.yin.application.models.RpcNode;
import io.mersel.services.yin.application.models.SchemaModule;
import io.mersel.services.yin.application.models.SchemaNode;
import io.mersel.services.yin.application.models.SubmoduleInclude;
import io.mersel.services.yin.application.models.Typedef;
import io.mersel.services.yin.application.models.Unique;
import io.mersel.services.yin.application.models.YangModule;
import io.mersel.services.yin.application.models.YangSubmodule;
import io.mersel.services.yin.infrastructure.config.YinPrinterProperties;
import io.mersel.services.yin.infrastructure.diagnostics.YinMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Modül ve alt modülleri YIN XML belgesi olarak yazan servis.
 * <p>
 * Belge sırası: XML bildirimi, başlık ({@code yang-version}, {@code namespace}/{@code prefix}
 * veya {@code belongs-to}), bağlantılar ({@code import}, {@code include}), meta bilgiler,
 * revizyonlar, gövde (feature, identity, typedef, deviation, veri düğümleri) ve augment'ler.
 * <p>
 * Belge önce bellekte üretilir; bir ifade veya önek çözümlenemezse hiçbir çıktı yazılmaz.
 */
@Service
public class YinSchemaPrinter implements ISchemaPrinter {

    private static final Logger log = LoggerFactory.getLogger(YinSchemaPrinter.class);

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    private static final String DEVIATED_MARKER = "<!-- DEVIATED -->";

    /** Namespace bloğu girintisi: {@code <module } ve {@code <submodule } uzunlukları. */
    private static final int MODULE_NAMESPACE_INDENT = 8;
    private static final int SUBMODULE_NAMESPACE_INDENT = 11;

    private final YinNodePrinter nodePrinter;
    private final YinTypePrinter typePrinter;
    private final YinOutputVerifier outputVerifier;
    private final YinPrinterProperties properties;
    private final YinMetrics metrics;

    public YinSchemaPrinter(YinNodePrinter nodePrinter,
                            YinTypePrinter typePrinter,
                            YinOutputVerifier outputVerifier,
                            YinPrinterProperties properties,
                            YinMetrics metrics) {
        this.nodePrinter = nodePrinter;
        this.typePrinter = typePrinter;
        this.outputVerifier = outputVerifier;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public void print(SchemaModule module, Writer out) throws SchemaPrintException, IOException {
        String document = serialize(module);
        out.write(document);
        out.flush();
    }

    @Override
    public PrintResult render(SchemaModule module) throws SchemaPrintException {
        long startTime = System.nanoTime();
        String kind = module.isSubmodule() ? "submodule" : "module";

        String document;
        try {
            document = serialize(module);
        } catch (SchemaPrintException e) {
            metrics.recordError("print");
            log.warn("{} yazdırılamadı: {}", module, e.getMessage());
            throw e;
        }

        boolean verified = false;
        if (properties.isVerifyOutput()) {
            try {
                outputVerifier.verify(document, module.getName());
            } catch (SchemaPrintException e) {
                metrics.recordError("verify");
                throw e;
            }
            verified = true;
        }

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        int outputBytes = document.getBytes(StandardCharsets.UTF_8).length;

        metrics.recordPrint(kind, verified, durationMs, outputBytes);
        log.info("{} YIN olarak yazdırıldı ({} byte, {} ms, doğrulama: {})",
                module, outputBytes, durationMs, verified ? "yapıldı" : "kapalı");

        return PrintResult.builder()
                .content(document)
                .moduleName(module.getName())
                .submodule(module.isSubmodule())
                .verified(verified)
                .durationMs(durationMs)
                .outputBytes(outputBytes)
                .build();
    }

    // ── Belge ──────────────────────────────────────────────────────

    private String serialize(SchemaModule module) throws SchemaPrintException {
        var out = new YinOutput();
        String root = module.isSubmodule() ? "submodule" : "module";

        out.line(XML_DECLARATION);
        if (module.isDeviated()) {
            out.line(DEVIATED_MARKER);
        }
        out.line("<" + root + " name=\"" + XmlTextEscaper.escapeAttribute(module.getName()) + "\"");
        printNamespaces(out, module);
        out.line(">");

        int level = 1;
        printHeader(out, level, module);
        printLinkage(out, level, module);
        printMeta(out, level, module);
        printRevisions(out, level, module);
        printBody(out, level, module);

        out.line("</" + root + ">");
        return out.toString();
    }

    /**
     * YIN ad alanı, modülün kendi ad alanı (yalnızca modüllerde) ve harici olmayan her
     * içe aktarımın ad alanı; her öznitelik ayrı satırda.
     */
    private void printNamespaces(YinOutput out, SchemaModule module) {
        String indent = " ".repeat(module.isSubmodule() ? SUBMODULE_NAMESPACE_INDENT : MODULE_NAMESPACE_INDENT);

        out.raw(indent + "xmlns=\"" + YinOutputVerifier.YIN_NAMESPACE + "\"");
        if (module instanceof YangModule main) {
            out.raw("\n" + indent + namespaceAttribute(main.getPrefix(), main.getNamespace()));
        }
        for (ModuleImport imp : module.getImports()) {
            if (imp.external()) {
                continue;
            }
            out.raw("\n" + indent + namespaceAttribute(imp.prefix(), imp.module().getNamespace()));
        }
    }

    private static String namespaceAttribute(String prefix, String uri) {
        return "xmlns:" + prefix + "=\"" + XmlTextEscaper.escapeAttribute(uri) + "\"";
    }

    private void printHeader(YinOutput out, int level, SchemaModule module) {
        if (module.getVersion() != null) {
            out.open(level, "yang-version", "value", module.getVersion().getValue(), true);
        }
        if (module instanceof YangSubmodule submodule) {
            out.open(level, "belongs-to", "module", submodule.getBelongsTo().getName(), false);
            out.open(level + 1, "prefix", "value", submodule.getPrefix(), true);
            out.close(level, "belongs-to");
        } else if (module instanceof YangModule main) {
            out.open(level, "namespace", "uri", main.getNamespace(), true);
            out.open(level, "prefix", "value", main.getPrefix(), true);
        }
    }

    private void printLinkage(YinOutput out, int level, SchemaModule module) {
        for (ModuleImport imp : module.getImports()) {
            if (imp.external()) {
                continue;
            }
            out.open(level, "import", "module", imp.module().getName(), false);
            out.open(level + 1, "prefix", "value", imp.prefix(), true);
            if (imp.revisionDate() != null) {
                out.open(level + 1, "revision-date", "date", imp.revisionDate(), true);
            }
            out.close(level, "import");
        }
        for (SubmoduleInclude inc : module.getIncludes()) {
            if (inc.external()) {
                continue;
            }
            boolean close = inc.revisionDate() == null;
            out.open(level, "include", "module", inc.submodule().getName(), close);
            if (!close) {
                out.open(level + 1, "revision-date", "date", inc.revisionDate(), true);
                out.close(level, "include");
            }
        }
    }

    private void printMeta(YinOutput out, int level, SchemaModule module) {
        typePrinter.printText(out, level, "organization", module.getOrganization());
        typePrinter.printText(out, level, "contact", module.getContact());
        typePrinter.printText(out, level, "description", module.getDescription());
        typePrinter.printText(out, level, "reference", module.getReference());
    }

    private void printRevisions(YinOutput out, int level, SchemaModule module) {
        for (Revision revision : module.getRevisions()) {
            boolean close = revision.description() == null && revision.reference() == null;
            out.open(level, "revision", "date", revision.date(), close);
            if (!close) {
                typePrinter.printText(out, level + 1, "description", revision.description());
                typePrinter.printText(out, level + 1, "reference", revision.reference());
                out.close(level, "revision");
            }
        }
    }

    private void printBody(YinOutput out, int level, SchemaModule module) throws SchemaPrintException {
        for (Feature feature : module.getFeatures()) {
            printFeature(out, level, module, feature);
        }
        for (Identity identity : module.getIdentities()) {
            printIdentity(out, level, module, identity);
        }
        for (Typedef typedef : module.getTypedefs()) {
            typePrinter.printTypedef(out, level, module, typedef);
        }
        for (Deviation deviation : module.getDeviations()) {
            printDeviation(out, level, module, deviation);
        }

        for (SchemaNode node : module.getData()) {
            if (node.getModule() != module) {
                log.debug("{} {} modülüne ait, bu belgede yazılmıyor", node, node.getModule());
                continue;
            }
            switch (node.getKind()) {
                case RPC -> nodePrinter.printRpc(out, level, (RpcNode) node);
                case NOTIFICATION -> nodePrinter.printNotification(out, level, (NotificationNode) node);
                default -> nodePrinter.print(out, level, node, YinNodePrinter.DATA_MASK);
            }
        }

        for (AugmentNode augment : module.getAugments()) {
            nodePrinter.printAugment(out, level, augment);
        }
    }

    // ── Tanımlar ───────────────────────────────────────────────────

    private void printFeature(YinOutput out, int level, SchemaModule module, Feature feature)
            throws SchemaPrintException {
        boolean close = !StatementDefaults.hasCommon(feature) && feature.getIfFeatures().isEmpty();

        out.open(level, "feature", "name", feature.getName(), close);
        if (close) {
            return;
        }
        typePrinter.printCommon(out, level + 1, feature);
        for (Feature dependency : feature.getIfFeatures()) {
            typePrinter.printIfFeature(out, level + 1, module, dependency);
        }
        out.close(level, "feature");
    }

    private void printIdentity(YinOutput out, int level, SchemaModule module, Identity identity)
            throws SchemaPrintException {
        Identity base = identity.getBase();
        boolean close = !StatementDefaults.hasCommon(identity) && base == null;

        out.open(level, "identity", "name", identity.getName(), close);
        if (close) {
            return;
        }
        typePrinter.printCommon(out, level + 1, identity);
        if (base != null) {
            out.open(level + 1, "base", "name", typePrinter.qualify(module, base.getModule(), base.getName()), true);
        }
        out.close(level, "identity");
    }

    private void printDeviation(YinOutput out, int level, SchemaModule module, Deviation deviation)
            throws SchemaPrintException {
        String target = typePrinter.translate(module, deviation.getTargetPath(),
                ExpressionKind.SCHEMA_NODE_PATH, "deviation \"" + deviation.getTargetPath() + "\"");
        boolean close = deviation.getDescription() == null && deviation.getReference() == null
                && deviation.getDeviates().isEmpty();

        out.open(level, "deviation", "target-node", target, close);
        if (close) {
            return;
        }

        int inner = level + 1;
        typePrinter.printText(out, inner, "description", deviation.getDescription());
        typePrinter.printText(out, inner, "reference", deviation.getReference());
        for (Deviate deviate : deviation.getDeviates()) {
            printDeviate(out, inner, module, deviate);
        }

        out.close(level, "deviation");
    }

    static boolean hasDeviateSubstatements(Deviate deviate) {
        return deviate.getConfig() != null || deviate.getMandatory() != null
                || deviate.getDefaultValue() != null || deviate.getMinElements() != null
                || deviate.getMaxElements() != null || !deviate.getMusts().isEmpty()
                || !deviate.getUniques().isEmpty() || deviate.getType() != null
                || deviate.getUnits() != null;
    }

    /**
     * config, mandatory, default, min-elements, max-elements, must, unique, type, units.
     * Üst sınır her zaman bu deviate girdisinin kendi değeridir.
     */
    private void printDeviate(YinOutput out, int level, SchemaModule module, Deviate deviate)
            throws SchemaPrintException {
        boolean close = !hasDeviateSubstatements(deviate);

        out.open(level, "deviate", "value", deviate.getKind().getValue(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        if (deviate.getConfig() != null) {
            out.open(inner, "config", "value", deviate.getConfig().toString(), true);
        }
        if (deviate.getMandatory() != null) {
            out.open(inner, "mandatory", "value", deviate.getMandatory().toString(), true);
        }
        if (deviate.getDefaultValue() != null) {
            out.open(inner, "default", "value", deviate.getDefaultValue(), true);
        }
        if (deviate.getMinElements() != null) {
            out.number(inner, "min-elements", "value", deviate.getMinElements());
        }
        if (deviate.getMaxElements() != null) {
            nodePrinter.printMaxElements(out, inner, deviate.getMaxElements());
        }
        for (Restriction must : deviate.getMusts()) {
            typePrinter.printMust(out, inner, module, must);
        }
        for (Unique unique : deviate.getUniques()) {
            nodePrinter.printUnique(out, inner, unique);
        }
        if (deviate.getType() != null) {
            typePrinter.printType(out, inner, module, deviate.getType());
        }
        if (deviate.getUnits() != null) {
            out.open(inner, "units", "name", deviate.getUnits(), true);
        }

        out.close(level, "deviate");
    }
}
