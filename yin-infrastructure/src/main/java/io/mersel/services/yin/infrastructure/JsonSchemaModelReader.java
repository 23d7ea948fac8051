package io.mersel.services.yin.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mersel.services.yin.application.enums.AccessControl;
import io.mersel.services.yin.application.enums.BaseType;
import io.mersel.services.yin.application.enums.DeviateKind;
import io.mersel.services.yin.application.enums.NodeKind;
import io.mersel.services.yin.application.enums.Status;
import io.mersel.services.yin.application.enums.YangVersion;
import io.mersel.services.yin.application.interfaces.ISchemaModelReader;
import io.mersel.services.yin.application.models.AnyxmlNode;
import io.mersel.services.yin.application.models.AugmentNode;
import io.mersel.services.yin.application.models.BitEntry;
import io.mersel.services.yin.application.models.CaseNode;
import io.mersel.services.yin.application.models.ChoiceNode;
import io.mersel.services.yin.application.models.ContainerNode;
import io.mersel.services.yin.application.models.Deviate;
import io.mersel.services.yin.application.models.Deviation;
import io.mersel.services.yin.application.models.EnumEntry;
import io.mersel.services.yin.application.models.Feature;
import io.mersel.services.yin.application.models.GroupingNode;
import io.mersel.services.yin.application.models.Identity;
import io.mersel.services.yin.application.models.InputOutputNode;
import io.mersel.services.yin.application.models.LeafListNode;
import io.mersel.services.yin.application.models.LeafNode;
import io.mersel.services.yin.application.models.ListNode;
import io.mersel.services.yin.application.models.ModuleImport;
import io.mersel.services.yin.application.models.NotificationNode;
import io.mersel.services.yin.application.models.Refine;
import io.mersel.services.yin.application.models.Restriction;
import io.mersel.services.yin.application.models.Revision;
import io.mersel.services.yin.application.models.RpcNode;
import io.mersel.services.yin.application.models.SchemaModule;
import io.mersel.services.yin.application.models.SchemaNode;
import io.mersel.services.yin.application.models.SchemaStatement;
import io.mersel.services.yin.application.models.SchemaType;
import io.mersel.services.yin.application.models.SubmoduleInclude;
import io.mersel.services.yin.application.models.TypeInfo;
import io.mersel.services.yin.application.models.Typedef;
import io.mersel.services.yin.application.models.Unique;
import io.mersel.services.yin.application.models.UsesNode;
import io.mersel.services.yin.application.models.When;
import io.mersel.services.yin.application.models.YangModule;
import io.mersel.services.yin.application.models.YangSubmodule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * JSON şema belgesinden modül modeli kurar.
 * <p>
 * Belge biçimi:
 * <pre>
 * {
 *   "module": "example",
 *   "modules": [
 *     {"name": "example", "prefix": "ex", "namespace": "urn:example", "data": [ ... ]},
 *     {"name": "example-types", "prefix": "ext", "namespace": "urn:example:types", "typedefs": [ ... ]},
 *     {"name": "example-sub", "submodule": true, "belongsTo": "example", "prefix": "ex"}
 *   ]
 * }
 * </pre>
 * Modüller arası referanslar iç kodlamadaki gibi modül adıyla nitelenir ({@code "example-types:percent"});
 * niteleyicisiz referans aynı ana modülü gösterir. Bir düğüm {@code "module"} alanıyla farklı bir
 * sahip modül bildirebilir.
 * <p>
 * Okuma üç geçişte yapılır: modüller, feature/identity bildirimleri, ardından bunlara referans
 * veren her şey. Böylece referanslar belgedeki sıradan bağımsızdır.
 */
@Component
public class JsonSchemaModelReader implements ISchemaModelReader {

    private static final Logger log = LoggerFactory.getLogger(JsonSchemaModelReader.class);

    /** Türetilmiş tip zincirinin en fazla izlenecek uzunluğu. */
    private static final int MAX_TYPEDEF_DEPTH = 32;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public SchemaModule read(InputStream document) throws SchemaModelException {
        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (IOException e) {
            throw new SchemaModelException("Şema belgesi okunamadı: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaModelException("Şema belgesi bir JSON nesnesi olmalı");
        }

        String target = requiredText(root, "module", "belge");
        JsonNode modules = root.path("modules");
        if (!modules.isArray() || modules.isEmpty()) {
            throw new SchemaModelException("Şema belgesinde 'modules' listesi boş veya eksik");
        }

        try {
            var context = new ReadContext();
            context.createModules(modules);
            context.declareDefinitions();
            context.linkModules();

            SchemaModule module = context.module(target);
            log.debug("Şema belgesi okundu: {} ({} modül)", module, context.modules.size());
            return module;
        } catch (IllegalArgumentException e) {
            throw new SchemaModelException("Şema belgesi geçersiz: " + e.getMessage(), e);
        }
    }

    /**
     * Tek bir okuma işleminin durumu; bileşen kendisi durumsuz kalır.
     */
    private final class ReadContext {

        private final Map<String, SchemaModule> modules = new LinkedHashMap<>();
        private final Map<SchemaModule, JsonNode> sources = new LinkedHashMap<>();

        // ── 1. geçiş: modüller ─────────────────────────────────────

        void createModules(JsonNode modulesJson) throws SchemaModelException {
            List<JsonNode> submodules = new ArrayList<>();
            for (JsonNode json : modulesJson) {
                if (json.path("submodule").asBoolean(false)) {
                    submodules.add(json);
                    continue;
                }
                String name = requiredText(json, "name", "modül");
                register(json, new YangModule(name,
                        requiredText(json, "prefix", "modül \"" + name + "\""),
                        requiredText(json, "namespace", "modül \"" + name + "\"")));
            }
            for (JsonNode json : submodules) {
                String name = requiredText(json, "name", "alt modül");
                String belongsTo = requiredText(json, "belongsTo", "alt modül \"" + name + "\"");
                if (!(modules.get(belongsTo) instanceof YangModule main)) {
                    throw new SchemaModelException(
                            "Alt modül \"" + name + "\" bilinmeyen modüle ait: " + belongsTo);
                }
                register(json, new YangSubmodule(name, main,
                        requiredText(json, "prefix", "alt modül \"" + name + "\"")));
            }
        }

        private void register(JsonNode json, SchemaModule module) throws SchemaModelException {
            if (modules.putIfAbsent(module.getName(), module) != null) {
                throw new SchemaModelException("Modül birden fazla kez tanımlanmış: " + module.getName());
            }
            sources.put(module, json);

            String version = optionalText(json, "yangVersion");
            if (version != null) {
                module.setVersion(YangVersion.fromValue(version));
            }
            module.setDeviated(json.path("deviated").asBoolean(false));
            module.setOrganization(optionalText(json, "organization"));
            module.setContact(optionalText(json, "contact"));
            module.setDescription(optionalText(json, "description"));
            module.setReference(optionalText(json, "reference"));
        }

        // ── 2. geçiş: bildirimler ──────────────────────────────────

        void declareDefinitions() throws SchemaModelException {
            for (var entry : sources.entrySet()) {
                SchemaModule module = entry.getKey();
                for (JsonNode json : entry.getValue().path("features")) {
                    var feature = new Feature(requiredText(json, "name", "feature"), module);
                    readCommon(feature, json);
                    module.getFeatures().add(feature);
                }
                for (JsonNode json : entry.getValue().path("identities")) {
                    var identity = new Identity(requiredText(json, "name", "identity"), module);
                    readCommon(identity, json);
                    module.getIdentities().add(identity);
                }
            }
        }

        // ── 3. geçiş: referanslar ve ağaç ─────────────────────────

        void linkModules() throws SchemaModelException {
            for (SchemaModule module : modules.values()) {
                JsonNode json = sources.get(module);
                readLinkage(module, json);

                for (JsonNode revision : json.path("revisions")) {
                    module.getRevisions().add(new Revision(requiredText(revision, "date", "revision"),
                            optionalText(revision, "description"), optionalText(revision, "reference")));
                }
                for (JsonNode featureJson : json.path("features")) {
                    Feature feature = findFeature(module, featureJson.path("name").asText());
                    for (JsonNode ref : featureJson.path("ifFeatures")) {
                        feature.getIfFeatures().add(lookupFeature(module, ref.asText()));
                    }
                }
                for (JsonNode identityJson : json.path("identities")) {
                    String base = optionalText(identityJson, "base");
                    if (base != null) {
                        findIdentity(module, identityJson.path("name").asText())
                                .setBase(lookupIdentity(module, base));
                    }
                }
                for (JsonNode typedef : json.path("typedefs")) {
                    module.getTypedefs().add(readTypedef(module, typedef));
                }
                for (JsonNode deviation : json.path("deviations")) {
                    module.getDeviations().add(readDeviation(module, deviation));
                }
                for (JsonNode nodeJson : json.path("data")) {
                    module.addData(readNode(module, nodeJson));
                }
                for (JsonNode augment : json.path("augments")) {
                    SchemaNode node = readNode(module, augment, NodeKind.AUGMENT);
                    module.getAugments().add((AugmentNode) node);
                }
            }
        }

        private void readLinkage(SchemaModule module, JsonNode json) throws SchemaModelException {
            for (JsonNode imp : json.path("imports")) {
                String name = requiredText(imp, "module", "import");
                if (!(modules.get(name) instanceof YangModule imported)) {
                    throw new SchemaModelException(module + " bilinmeyen modülü içe aktarıyor: " + name);
                }
                module.getImports().add(new ModuleImport(imported,
                        requiredText(imp, "prefix", "import \"" + name + "\""),
                        optionalText(imp, "revisionDate"),
                        imp.path("external").asBoolean(false)));
            }
            for (JsonNode inc : json.path("includes")) {
                String name = requiredText(inc, "submodule", "include");
                if (!(modules.get(name) instanceof YangSubmodule included)) {
                    throw new SchemaModelException(module + " bilinmeyen alt modülü dahil ediyor: " + name);
                }
                module.getIncludes().add(new SubmoduleInclude(included,
                        optionalText(inc, "revisionDate"), inc.path("external").asBoolean(false)));
            }
        }

        // ── Düğümler ───────────────────────────────────────────────

        private SchemaNode readNode(SchemaModule parentModule, JsonNode json) throws SchemaModelException {
            return readNode(parentModule, json, NodeKind.fromKeyword(requiredText(json, "kind", "düğüm")));
        }

        private SchemaNode readNode(SchemaModule parentModule, JsonNode json, NodeKind kind)
                throws SchemaModelException {
            String owner = optionalText(json, "module");
            SchemaModule module = owner != null ? module(owner) : parentModule;

            SchemaNode node = switch (kind) {
                case CONTAINER -> {
                    var container = new ContainerNode(nodeName(json, kind), module);
                    container.setPresence(optionalText(json, "presence"));
                    yield container;
                }
                case CHOICE -> {
                    var choice = new ChoiceNode(nodeName(json, kind), module);
                    choice.setDefaultCase(optionalText(json, "default"));
                    yield choice;
                }
                case CASE -> new CaseNode(nodeName(json, kind), module);
                case LEAF -> {
                    var leaf = new LeafNode(nodeName(json, kind), module);
                    leaf.setType(readType(module, json.path("type")));
                    leaf.setUnits(optionalText(json, "units"));
                    leaf.setDefaultValue(optionalText(json, "default"));
                    yield leaf;
                }
                case LEAF_LIST -> {
                    var leafList = new LeafListNode(nodeName(json, kind), module);
                    leafList.setType(readType(module, json.path("type")));
                    leafList.setUnits(optionalText(json, "units"));
                    leafList.setMinElements(json.path("minElements").asInt(0));
                    leafList.setMaxElements(json.path("maxElements").asInt(0));
                    leafList.setUserOrdered("user".equals(optionalText(json, "orderedBy")));
                    yield leafList;
                }
                case LIST -> {
                    var list = new ListNode(nodeName(json, kind), module);
                    for (JsonNode key : json.path("keys")) {
                        list.getKeys().add(key.asText());
                    }
                    list.getUniques().addAll(readUniques(json.path("uniques")));
                    list.setMinElements(json.path("minElements").asInt(0));
                    list.setMaxElements(json.path("maxElements").asInt(0));
                    list.setUserOrdered("user".equals(optionalText(json, "orderedBy")));
                    yield list;
                }
                case ANYXML -> new AnyxmlNode(nodeName(json, kind), module);
                case USES -> readUses(module, json);
                case GROUPING -> new GroupingNode(nodeName(json, kind), module);
                case AUGMENT -> new AugmentNode(requiredText(json, "target", "augment"), module);
                case RPC -> new RpcNode(nodeName(json, kind), module);
                case INPUT -> InputOutputNode.input(module);
                case OUTPUT -> InputOutputNode.output(module);
                case NOTIFICATION -> new NotificationNode(nodeName(json, kind), module);
            };

            readCommon(node, json);
            readNodeCommon(node, module, json);

            for (JsonNode child : json.path("children")) {
                node.addChild(readNode(module, child));
            }
            return node;
        }

        private String nodeName(JsonNode json, NodeKind kind) throws SchemaModelException {
            return requiredText(json, "name", kind.getKeyword());
        }

        private void readNodeCommon(SchemaNode node, SchemaModule module, JsonNode json) throws SchemaModelException {
            if (json.has("config")) {
                node.setConfig(json.get("config").asBoolean());
            }
            if (json.has("mandatory")) {
                node.setMandatory(json.get("mandatory").asBoolean());
            }
            if (json.has("when")) {
                node.setWhen(readWhen(json.get("when")));
            }
            for (JsonNode ref : json.path("ifFeatures")) {
                node.getIfFeatures().add(lookupFeature(module, ref.asText()));
            }
            for (JsonNode must : json.path("musts")) {
                node.getMusts().add(readRestriction(must));
            }
            for (JsonNode typedef : json.path("typedefs")) {
                node.getTypedefs().add(readTypedef(module, typedef));
            }
            for (JsonNode flag : json.path("accessControl")) {
                node.getAccessControl().add(AccessControl.fromKeyword(flag.asText()));
            }
        }

        private UsesNode readUses(SchemaModule module, JsonNode json) throws SchemaModelException {
            String grouping = requiredText(json, "grouping", "uses");
            int colon = grouping.indexOf(':');

            UsesNode uses;
            if (colon < 0) {
                uses = new UsesNode(grouping, module);
            } else {
                uses = new UsesNode(grouping.substring(colon + 1), module);
                SchemaModule groupingModule = module(grouping.substring(0, colon));
                if (groupingModule.mainModule() != module.mainModule()) {
                    uses.setGroupingModule(groupingModule);
                }
            }

            for (JsonNode refine : json.path("refines")) {
                uses.getRefines().add(readRefine(refine));
            }
            for (JsonNode augment : json.path("augments")) {
                uses.addAugment((AugmentNode) readNode(module, augment, NodeKind.AUGMENT));
            }
            return uses;
        }

        private Refine readRefine(JsonNode json) throws SchemaModelException {
            String targetKind = optionalText(json, "targetKind");
            var refine = new Refine(requiredText(json, "target", "refine"),
                    targetKind != null ? NodeKind.fromKeyword(targetKind) : null);

            if (json.has("config")) {
                refine.setConfig(json.get("config").asBoolean());
            }
            if (json.has("mandatory")) {
                refine.setMandatory(json.get("mandatory").asBoolean());
            }
            refine.setStatus(readStatus(json));
            refine.setDescription(optionalText(json, "description"));
            refine.setReference(optionalText(json, "reference"));
            for (JsonNode must : json.path("musts")) {
                refine.getMusts().add(readRestriction(must));
            }
            refine.setDefaultValue(optionalText(json, "default"));
            refine.setPresence(optionalText(json, "presence"));
            refine.setMinElements(optionalInt(json, "minElements"));
            refine.setMaxElements(readMaxElements(json));
            return refine;
        }

        private Deviation readDeviation(SchemaModule module, JsonNode json) throws SchemaModelException {
            var deviation = new Deviation(requiredText(json, "target", "deviation"));
            deviation.setDescription(optionalText(json, "description"));
            deviation.setReference(optionalText(json, "reference"));

            for (JsonNode deviateJson : json.path("deviates")) {
                var deviate = new Deviate(DeviateKind.fromValue(requiredText(deviateJson, "kind", "deviate")));
                if (deviateJson.has("config")) {
                    deviate.setConfig(deviateJson.get("config").asBoolean());
                }
                if (deviateJson.has("mandatory")) {
                    deviate.setMandatory(deviateJson.get("mandatory").asBoolean());
                }
                deviate.setDefaultValue(optionalText(deviateJson, "default"));
                deviate.setMinElements(optionalInt(deviateJson, "minElements"));
                deviate.setMaxElements(readMaxElements(deviateJson));
                for (JsonNode must : deviateJson.path("musts")) {
                    deviate.getMusts().add(readRestriction(must));
                }
                deviate.getUniques().addAll(readUniques(deviateJson.path("uniques")));
                if (deviateJson.has("type")) {
                    deviate.setType(readType(module, deviateJson.get("type")));
                }
                deviate.setUnits(optionalText(deviateJson, "units"));
                deviation.getDeviates().add(deviate);
            }
            return deviation;
        }

        /** {@code "unbounded"} veya {@code 0} sınırsız demektir. */
        private Integer readMaxElements(JsonNode json) {
            JsonNode max = json.get("maxElements");
            if (max == null || max.isNull()) {
                return null;
            }
            return "unbounded".equals(max.asText()) ? 0 : max.asInt();
        }

        private List<Unique> readUniques(JsonNode json) {
            List<Unique> uniques = new ArrayList<>();
            for (JsonNode unique : json) {
                List<String> expressions = new ArrayList<>();
                if (unique.isArray()) {
                    unique.forEach(expression -> expressions.add(expression.asText()));
                } else {
                    expressions.addAll(List.of(unique.asText().trim().split("\\s+")));
                }
                uniques.add(new Unique(expressions));
            }
            return uniques;
        }

        // ── Tipler ─────────────────────────────────────────────────

        private Typedef readTypedef(SchemaModule module, JsonNode json) throws SchemaModelException {
            String name = requiredText(json, "name", "typedef");
            var typedef = new Typedef(name, module, readType(module, json.path("type")));
            readCommon(typedef, json);
            typedef.setUnits(optionalText(json, "units"));
            typedef.setDefaultValue(optionalText(json, "default"));
            return typedef;
        }

        /**
         * Tip referansı. Yerleşik ad yerleşik tipi, diğer adlar bir typedef'i gösterir;
         * türetilmiş tipin temel tipi {@code "base"} alanından veya typedef zincirinden bulunur.
         */
        private SchemaType readType(SchemaModule module, JsonNode json) throws SchemaModelException {
            if (json.isMissingNode() || json.isNull()) {
                return null;
            }
            if (json.isTextual()) {
                return readType(module, objectMapper.createObjectNode().put("name", json.asText()));
            }

            String name = requiredText(json, "name", "type");
            int colon = name.indexOf(':');
            BaseType builtin = colon < 0 ? BaseType.fromKeyword(name) : null;
            if (builtin != null) {
                return SchemaType.builtin(builtin, readTypeInfo(module, builtin, json));
            }

            String localName = colon < 0 ? name : name.substring(colon + 1);
            SchemaModule target = colon < 0 ? module.mainModule() : module(name.substring(0, colon));
            SchemaModule definingModule = typedefOwner(target, localName);

            BaseType base;
            String explicitBase = optionalText(json, "base");
            if (explicitBase != null) {
                base = BaseType.fromKeyword(explicitBase);
                if (base == null) {
                    throw new SchemaModelException("Tip \"" + name + "\" için geçersiz temel tip: " + explicitBase);
                }
            } else {
                base = typedefBase(definingModule, localName, 0);
            }

            return SchemaType.derived(localName, definingModule, base, readTypeInfo(module, base, json));
        }

        /**
         * Typedef'i tanımlayan modül veya alt modül; modül seviyesinde bulunamazsa hedef modülün kendisi.
         */
        private SchemaModule typedefOwner(SchemaModule target, String name) {
            for (SchemaModule candidate : sameMainModule(target)) {
                if (typedefJson(candidate, name) != null) {
                    return candidate;
                }
            }
            return target;
        }

        private BaseType typedefBase(SchemaModule module, String name, int depth) throws SchemaModelException {
            if (depth > MAX_TYPEDEF_DEPTH) {
                throw new SchemaModelException("Typedef zinciri çok uzun veya döngüsel: " + name);
            }
            JsonNode typedef = typedefJson(module, name);
            if (typedef == null) {
                throw new SchemaModelException(module + " içinde typedef \"" + name
                        + "\" bulunamadı; iç içe typedef referanslarında \"base\" belirtilmeli");
            }

            JsonNode type = typedef.path("type");
            String typeName = type.isTextual() ? type.asText() : type.path("name").asText(null);
            if (typeName == null) {
                throw new SchemaModelException("Typedef \"" + name + "\" için tip belirtilmemiş");
            }
            String explicitBase = type.isObject() ? optionalText(type, "base") : null;
            if (explicitBase != null) {
                BaseType base = BaseType.fromKeyword(explicitBase);
                if (base == null) {
                    throw new SchemaModelException("Typedef \"" + name + "\" için geçersiz temel tip: " + explicitBase);
                }
                return base;
            }

            int colon = typeName.indexOf(':');
            if (colon < 0) {
                BaseType builtin = BaseType.fromKeyword(typeName);
                if (builtin != null) {
                    return builtin;
                }
                return typedefBase(typedefOwner(module.mainModule(), typeName), typeName, depth + 1);
            }
            String localName = typeName.substring(colon + 1);
            return typedefBase(typedefOwner(module(typeName.substring(0, colon)), localName), localName, depth + 1);
        }

        private JsonNode typedefJson(SchemaModule module, String name) {
            for (JsonNode typedef : sources.get(module).path("typedefs")) {
                if (name.equals(typedef.path("name").asText())) {
                    return typedef;
                }
            }
            return null;
        }

        /**
         * Tipe özgü kısıtlar; hiçbiri verilmemişse {@code null} (türetilmiş tip referansları için).
         */
        private TypeInfo readTypeInfo(SchemaModule module, BaseType base, JsonNode json) throws SchemaModelException {
            return switch (base) {
                case BINARY -> json.has("length") ? new TypeInfo.BinaryInfo(readRestriction(json.get("length"))) : null;
                case BITS -> json.has("bits") ? new TypeInfo.BitsInfo(readBits(json.get("bits"))) : null;
                case BOOLEAN, EMPTY -> null;
                case DECIMAL64 -> json.has("fractionDigits")
                        ? new TypeInfo.Decimal64Info(json.get("fractionDigits").asInt(),
                                json.has("range") ? readRestriction(json.get("range")) : null)
                        : null;
                case ENUMERATION -> json.has("enums") ? new TypeInfo.EnumerationInfo(readEnums(json.get("enums"))) : null;
                case IDENTITYREF -> json.has("identity")
                        ? new TypeInfo.IdentityrefInfo(lookupIdentity(module, json.get("identity").asText()))
                        : null;
                case INSTANCE_IDENTIFIER -> json.has("requireInstance")
                        ? new TypeInfo.InstanceIdentifierInfo(json.get("requireInstance").asBoolean())
                        : null;
                case LEAFREF -> json.has("path") ? new TypeInfo.LeafrefInfo(json.get("path").asText()) : null;
                case STRING -> {
                    List<Restriction> patterns = new ArrayList<>();
                    for (JsonNode pattern : json.path("patterns")) {
                        patterns.add(readRestriction(pattern));
                    }
                    Restriction length = json.has("length") ? readRestriction(json.get("length")) : null;
                    yield length != null || !patterns.isEmpty() ? new TypeInfo.StringInfo(length, patterns) : null;
                }
                case UNION -> {
                    if (!json.has("types")) {
                        yield null;
                    }
                    List<SchemaType> members = new ArrayList<>();
                    for (JsonNode member : json.get("types")) {
                        members.add(readType(module, member));
                    }
                    yield new TypeInfo.UnionInfo(members);
                }
                case INT8, INT16, INT32, INT64, UINT8, UINT16, UINT32, UINT64 ->
                        json.has("range") ? new TypeInfo.NumericInfo(readRestriction(json.get("range"))) : null;
            };
        }

        /** Değeri verilmeyen enum bir önceki değerin bir fazlasını alır (ilk için 0). */
        private List<EnumEntry> readEnums(JsonNode json) throws SchemaModelException {
            List<EnumEntry> entries = new ArrayList<>();
            int next = 0;
            for (JsonNode entry : json) {
                int value = entry.has("value") ? entry.get("value").asInt() : next;
                entries.add(new EnumEntry(requiredText(entry, "name", "enum"), value, readStatus(entry),
                        optionalText(entry, "description"), optionalText(entry, "reference")));
                next = value + 1;
            }
            return entries;
        }

        private List<BitEntry> readBits(JsonNode json) throws SchemaModelException {
            List<BitEntry> bits = new ArrayList<>();
            long next = 0;
            for (JsonNode bit : json) {
                long position = bit.has("position") ? bit.get("position").asLong() : next;
                bits.add(new BitEntry(requiredText(bit, "name", "bit"), position, readStatus(bit),
                        optionalText(bit, "description"), optionalText(bit, "reference")));
                next = position + 1;
            }
            return bits;
        }

        // ── Referans çözümleme ─────────────────────────────────────

        SchemaModule module(String name) throws SchemaModelException {
            SchemaModule module = modules.get(name);
            if (module == null) {
                throw new SchemaModelException("Bilinmeyen modül: " + name);
            }
            return module;
        }

        /** Verilen modülün ana modülü ve ona ait tüm alt modüller. */
        private List<SchemaModule> sameMainModule(SchemaModule module) {
            List<SchemaModule> result = new ArrayList<>();
            for (SchemaModule candidate : modules.values()) {
                if (candidate.mainModule() == module.mainModule()) {
                    result.add(candidate);
                }
            }
            return result;
        }

        private Feature lookupFeature(SchemaModule referencing, String reference) throws SchemaModelException {
            return lookup(referencing, reference, "feature", SchemaModule::getFeatures);
        }

        private Identity lookupIdentity(SchemaModule referencing, String reference) throws SchemaModelException {
            return lookup(referencing, reference, "identity", SchemaModule::getIdentities);
        }

        private Feature findFeature(SchemaModule module, String name) throws SchemaModelException {
            return lookup(module, module.getName() + ":" + name, "feature", SchemaModule::getFeatures);
        }

        private Identity findIdentity(SchemaModule module, String name) throws SchemaModelException {
            return lookup(module, module.getName() + ":" + name, "identity", SchemaModule::getIdentities);
        }

        /**
         * {@code "modül:ad"} veya {@code "ad"} referansını çözer; ad, hedef ana modülde ve
         * alt modüllerinde aranır.
         */
        private <T extends SchemaStatement> T lookup(SchemaModule referencing, String reference, String what,
                                                     Function<SchemaModule, List<T>> definitions)
                throws SchemaModelException {
            int colon = reference.indexOf(':');
            SchemaModule target = colon < 0 ? referencing : module(reference.substring(0, colon));
            String name = colon < 0 ? reference : reference.substring(colon + 1);

            for (SchemaModule candidate : sameMainModule(target)) {
                for (T definition : definitions.apply(candidate)) {
                    if (definition.getName().equals(name)) {
                        return definition;
                    }
                }
            }
            throw new SchemaModelException(
                    referencing + " içinde çözümlenemeyen " + what + " referansı: " + reference);
        }
    }

    // ── Ortak alanlar ──────────────────────────────────────────────

    private static void readCommon(SchemaStatement statement, JsonNode json) {
        statement.setStatus(readStatus(json));
        statement.setDescription(optionalText(json, "description"));
        statement.setReference(optionalText(json, "reference"));
    }

    private static Status readStatus(JsonNode json) {
        String status = optionalText(json, "status");
        return status != null ? Status.fromValue(status) : null;
    }

    private static When readWhen(JsonNode json) throws SchemaModelException {
        if (json.isTextual()) {
            return When.of(json.asText());
        }
        return new When(requiredText(json, "condition", "when"),
                optionalText(json, "description"), optionalText(json, "reference"));
    }

    /** Düz metin ({@code "1..10"}) veya alt ifadeli nesne. */
    private static Restriction readRestriction(JsonNode json) throws SchemaModelException {
        if (json.isTextual()) {
            return Restriction.of(json.asText());
        }
        return new Restriction(requiredText(json, "expression", "kısıt"),
                optionalText(json, "description"),
                optionalText(json, "reference"),
                optionalText(json, "errorAppTag"),
                optionalText(json, "errorMessage"));
    }

    private static String optionalText(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer optionalInt(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }

    private static String requiredText(JsonNode json, String field, String owner) throws SchemaModelException {
        String value = optionalText(json, field);
        if (value == null || value.isBlank()) {
            throw new SchemaModelException(owner + " için '" + field + "' alanı zorunlu");
        }
        return value;
    }
}
