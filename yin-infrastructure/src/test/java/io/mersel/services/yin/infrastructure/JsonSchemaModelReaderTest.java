package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.enums.AccessControl;
import io.mersel.services.yin.application.enums.BaseType;
import io.mersel.services.yin.application.enums.NodeKind;
import io.mersel.services.yin.application.enums.YangVersion;
import io.mersel.services.yin.application.interfaces.ISchemaModelReader.SchemaModelException;
import io.mersel.services.yin.application.models.ContainerNode;
import io.mersel.services.yin.application.models.LeafNode;
import io.mersel.services.yin.application.models.ListNode;
import io.mersel.services.yin.application.models.SchemaModule;
import io.mersel.services.yin.application.models.TypeInfo;
import io.mersel.services.yin.application.models.UsesNode;
import io.mersel.services.yin.application.models.YangModule;
import io.mersel.services.yin.application.models.YangSubmodule;
import io.mersel.services.yin.infrastructure.config.YinPrinterProperties;
import io.mersel.services.yin.infrastructure.diagnostics.YinMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonSchemaModelReader birim testleri.
 * <p>
 * {@code schemas/example-system.json} dört modüllük bir belgedir: ana modül, alt modülü,
 * typedef/grouping modülü ve NACM modülü.
 */
@DisplayName("JsonSchemaModelReader")
class JsonSchemaModelReaderTest {

    private final JsonSchemaModelReader reader = new JsonSchemaModelReader();

    private SchemaModule readFixture() throws SchemaModelException, IOException {
        try (InputStream in = getClass().getResourceAsStream("/schemas/example-system.json")) {
            assertThat(in).as("test fixture").isNotNull();
            return reader.read(in);
        }
    }

    private SchemaModule read(String json) throws SchemaModelException {
        return reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    // ── Model kurulumu ────────────────────────────────────────────────

    @Nested
    @DisplayName("Model kurulumu")
    class ModelConstruction {

        @Test
        @DisplayName("Hedef modül başlık ve bağlantı bilgileriyle okunmalı")
        void readsHeaderAndLinkage() throws Exception {
            var module = (YangModule) readFixture();

            assertThat(module.getName()).isEqualTo("example-system");
            assertThat(module.getNamespace()).isEqualTo("urn:example:system");
            assertThat(module.getVersion()).isEqualTo(YangVersion.V1_1);
            assertThat(module.getImports()).extracting(imp -> imp.prefix()).containsExactly("et", "nacm");
            assertThat(module.getIncludes()).hasSize(1);
            assertThat(module.getIncludes().get(0).submodule().getBelongsTo()).isSameAs(module);
            assertThat(module.getRevisions()).singleElement()
                    .satisfies(revision -> assertThat(revision.date()).isEqualTo("2024-05-01"));
        }

        @Test
        @DisplayName("Feature ve identity referansları nesnelere bağlanmalı")
        void resolvesDefinitions() throws Exception {
            var module = readFixture();

            var sshKeys = module.getFeatures().get(1);
            assertThat(sshKeys.getIfFeatures()).containsExactly(module.getFeatures().get(0));
            assertThat(module.getIdentities().get(1).getBase()).isSameAs(module.getIdentities().get(0));
        }

        @Test
        @DisplayName("Türetilmiş tipin temel türü typedef zincirinden çözülmeli")
        void resolvesTypedefChain() throws Exception {
            var module = readFixture();
            var system = (ContainerNode) module.getData().get(0);
            var load = (LeafNode) system.getChildren().get(1);

            assertThat(load.getType().name()).isEqualTo("percent");
            assertThat(load.getType().base()).isEqualTo(BaseType.UINT8);
            assertThat(load.getType().module().getName()).isEqualTo("example-types");
            assertThat(load.getType().info()).isNull();
            assertThat(load.getConfig()).isFalse();
        }

        @Test
        @DisplayName("List sınırları, NACM bayrakları ve identityref okunmalı")
        void readsListDetails() throws Exception {
            var module = readFixture();
            var user = (ListNode) module.getData().get(0).getChildren().get(2);

            assertThat(user.getKeys()).containsExactly("name");
            assertThat(user.getMaxElements()).isZero();
            assertThat(user.getAccessControl()).containsExactly(AccessControl.DEFAULT_DENY_WRITE);

            var auth = (LeafNode) user.getChildren().get(1);
            assertThat(auth.getType().info()).isInstanceOf(TypeInfo.IdentityrefInfo.class);
            assertThat(auth.getIfFeatures()).extracting(f -> f.getName()).containsExactly("ssh");
            assertThat(auth.getParent()).isSameAs(user);
        }

        @Test
        @DisplayName("Başka modüldeki grouping için uses grouping modülünü taşımalı")
        void readsForeignUses() throws Exception {
            var module = readFixture();
            var uses = (UsesNode) module.getData().get(0).getChildren().get(3);

            assertThat(uses.getKind()).isEqualTo(NodeKind.USES);
            assertThat(uses.getName()).isEqualTo("endpoint");
            assertThat(uses.getGroupingModule().getName()).isEqualTo("example-types");
        }

        @Test
        @DisplayName("uses içindeki augment üst düğüm olarak uses'e bağlanmalı")
        void linksUsesAugmentToUses() throws Exception {
            var module = read("""
                    {"module": "a", "modules": [{"name": "a", "prefix": "a", "namespace": "urn:a",
                      "data": [{"kind": "container", "name": "c", "children": [
                        {"kind": "uses", "grouping": "g", "augments": [
                          {"target": "tls", "children": [{"kind": "leaf", "name": "cert", "type": "string"}]}]}]}]}]}
                    """);
            var uses = (UsesNode) module.getData().get(0).getChildren().get(0);
            var augment = uses.getAugments().get(0);

            assertThat(augment.getParent()).isSameAs(uses);
            assertThat(augment.getChildren().get(0).getParent()).isSameAs(augment);
        }

        @Test
        @DisplayName("Alt modül hedeflenirse YangSubmodule dönmeli")
        void readsSubmoduleTarget() throws Exception {
            SchemaModule submodule = read("""
                    {"module": "a-sub", "modules": [
                      {"name": "a", "prefix": "a", "namespace": "urn:a", "includes": [{"submodule": "a-sub"}]},
                      {"name": "a-sub", "submodule": true, "belongsTo": "a", "prefix": "a"}
                    ]}
                    """);

            assertThat(submodule).isInstanceOf(YangSubmodule.class);
            assertThat(submodule.mainModule().getName()).isEqualTo("a");
        }

        @Test
        @DisplayName("Enum değerleri verilmezse bir önceki değerden devam etmeli")
        void enumValuesAutoIncrement() throws Exception {
            var module = read("""
                    {"module": "a", "modules": [{"name": "a", "prefix": "a", "namespace": "urn:a", "data": [
                      {"kind": "leaf", "name": "state", "type": {"name": "enumeration", "enums": [
                        {"name": "up"}, {"name": "down", "value": 5}, {"name": "testing"}
                      ]}}
                    ]}]}
                    """);

            var info = (TypeInfo.EnumerationInfo) ((LeafNode) module.getData().get(0)).getType().info();
            assertThat(info.entries()).extracting(e -> e.value()).containsExactly(0, 5, 6);
        }
    }

    // ── Hatalı belgeler ───────────────────────────────────────────────

    @Nested
    @DisplayName("Hatalı belgeler")
    class InvalidDocuments {

        @Test
        @DisplayName("Bozuk JSON SchemaModelException fırlatmalı")
        void malformedJson() {
            assertThatThrownBy(() -> read("{\"module\": "))
                    .isInstanceOf(SchemaModelException.class)
                    .hasMessageContaining("okunamadı");
        }

        @Test
        @DisplayName("Eksik modules listesi reddedilmeli")
        void missingModules() {
            assertThatThrownBy(() -> read("{\"module\": \"a\"}"))
                    .isInstanceOf(SchemaModelException.class)
                    .hasMessageContaining("modules");
        }

        @Test
        @DisplayName("Bilinmeyen düğüm türü reddedilmeli")
        void unknownKind() {
            assertThatThrownBy(() -> read("""
                    {"module": "a", "modules": [{"name": "a", "prefix": "a", "namespace": "urn:a",
                      "data": [{"kind": "anydata", "name": "x"}]}]}
                    """))
                    .isInstanceOf(SchemaModelException.class)
                    .hasMessageContaining("anydata");
        }

        @Test
        @DisplayName("Çözümlenemeyen feature referansı reddedilmeli")
        void danglingFeature() {
            assertThatThrownBy(() -> read("""
                    {"module": "a", "modules": [{"name": "a", "prefix": "a", "namespace": "urn:a",
                      "data": [{"kind": "leaf", "name": "x", "ifFeatures": ["missing"]}]}]}
                    """))
                    .isInstanceOf(SchemaModelException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("Başka modüldeki typedef'in geçersiz temel tipi reddedilmeli")
        void invalidForeignTypedefBase() {
            assertThatThrownBy(() -> read("""
                    {"module": "a", "modules": [
                      {"name": "a", "prefix": "a", "namespace": "urn:a",
                       "imports": [{"module": "b", "prefix": "b"}],
                       "data": [{"kind": "leaf", "name": "x", "type": "b:t"}]},
                      {"name": "b", "prefix": "b", "namespace": "urn:b",
                       "typedefs": [{"name": "t", "type": {"name": "u", "base": "bogus"}}]}]}
                    """))
                    .isInstanceOf(SchemaModelException.class)
                    .hasMessageContaining("bogus");
        }

        @Test
        @DisplayName("Bilinmeyen modül import'u ve hedef modül reddedilmeli")
        void unknownModules() {
            assertThatThrownBy(() -> read("""
                    {"module": "a", "modules": [{"name": "a", "prefix": "a", "namespace": "urn:a",
                      "imports": [{"module": "b", "prefix": "b"}]}]}
                    """))
                    .isInstanceOf(SchemaModelException.class)
                    .hasMessageContaining("b");
            assertThatThrownBy(() -> read("""
                    {"module": "z", "modules": [{"name": "a", "prefix": "a", "namespace": "urn:a"}]}
                    """))
                    .isInstanceOf(SchemaModelException.class)
                    .hasMessageContaining("Bilinmeyen modül: z");
        }
    }

    // ── Uçtan uca ─────────────────────────────────────────────────────

    @Test
    @DisplayName("Okunan modül beklenen önekli YIN elemanlarıyla yazdırılmalı")
    void readAndPrint() throws Exception {
        var resolver = new ImportPrefixResolver();
        var typePrinter = new YinTypePrinter(new SchemaExpressionTranslator(resolver), resolver);
        var properties = new YinPrinterProperties();
        properties.setVerifyOutput(true);
        var printer = new YinSchemaPrinter(new YinNodePrinter(typePrinter), typePrinter,
                new YinOutputVerifier(), properties, new YinMetrics(new SimpleMeterRegistry()));

        var result = printer.render(readFixture());
        String yin = result.getContent();

        assertThat(result.isVerified()).isTrue();
        assertThat(yin).containsSubsequence(
                "xmlns:sys=\"urn:example:system\"",
                "xmlns:et=\"urn:example:types\"",
                "xmlns:nacm=\"urn:ietf:params:xml:ns:yang:ietf-netconf-acm\">",
                "<include module=\"example-system-ntp\"/>",
                "<organization>",
                "<feature name=\"ssh\">",
                "<feature name=\"ssh-keys\">",
                "<if-feature name=\"ssh\"/>",
                "<identity name=\"password\">",
                "<base name=\"auth-method\"/>",
                "<typedef name=\"hostname\">",
                "<deviation target-node=\"/et:counters\">",
                "<max-elements value=\"16\"/>",
                "<leaf name=\"hostname\">",
                "<type name=\"hostname\"/>",
                "<config value=\"false\"/>",
                "<type name=\"et:percent\"/>",
                "<list name=\"user\">",
                "<nacm:default-deny-write/>",
                "<type name=\"identityref\">",
                "<uses name=\"et:endpoint\"/>",
                "<rpc name=\"reboot\">",
                "<range value=\"0..3600\"/>");
        assertThat(yin).doesNotContain("ntp\">").doesNotContain("max-elements value=\"unbounded\"");
    }
}
