package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.enums.AccessControl;
import io.mersel.services.yin.application.enums.BaseType;
import io.mersel.services.yin.application.enums.NodeKind;
import io.mersel.services.yin.application.interfaces.ISchemaPrinter.SchemaPrintException;
import io.mersel.services.yin.application.models.AugmentNode;
import io.mersel.services.yin.application.models.CaseNode;
import io.mersel.services.yin.application.models.ChoiceNode;
import io.mersel.services.yin.application.models.ContainerNode;
import io.mersel.services.yin.application.models.Feature;
import io.mersel.services.yin.application.models.GroupingNode;
import io.mersel.services.yin.application.models.InputOutputNode;
import io.mersel.services.yin.application.models.LeafListNode;
import io.mersel.services.yin.application.models.LeafNode;
import io.mersel.services.yin.application.models.ListNode;
import io.mersel.services.yin.application.models.ModuleImport;
import io.mersel.services.yin.application.models.Refine;
import io.mersel.services.yin.application.models.Restriction;
import io.mersel.services.yin.application.models.RpcNode;
import io.mersel.services.yin.application.models.SchemaNode;
import io.mersel.services.yin.application.models.SchemaType;
import io.mersel.services.yin.application.models.Unique;
import io.mersel.services.yin.application.models.UsesNode;
import io.mersel.services.yin.application.models.YangModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * YinNodePrinter birim testleri.
 */
@DisplayName("YinNodePrinter")
class YinNodePrinterTest {

    private YinNodePrinter nodePrinter;
    private YangModule module;
    private YinOutput out;

    @BeforeEach
    void setUp() {
        var resolver = new ImportPrefixResolver();
        var typePrinter = new YinTypePrinter(new SchemaExpressionTranslator(resolver), resolver);
        nodePrinter = new YinNodePrinter(typePrinter);

        module = new YangModule("example", "ex", "urn:example");
        out = new YinOutput();
    }

    private String print(SchemaNode node) throws SchemaPrintException {
        nodePrinter.print(out, 0, node, YinNodePrinter.DATA_MASK);
        return out.toString();
    }

    // ── Veri düğümleri ────────────────────────────────────────────────

    @Nested
    @DisplayName("Veri düğümleri")
    class DataNodes {

        @Test
        @DisplayName("Tipli leaf açılmalı, tip içeride kapanmalı")
        void leafWithType() throws SchemaPrintException {
            var leaf = new LeafNode("x", module, SchemaType.builtin(BaseType.STRING));

            assertThat(print(leaf)).isEqualTo("""
                    <leaf name="x">
                      <type name="string"/>
                    </leaf>
                    """);
        }

        @Test
        @DisplayName("Leaf alt ifadeleri sabit sırada yazılmalı")
        void leafSubstatementOrder() throws SchemaPrintException {
            var feature = new Feature("ssh", module);
            var leaf = new LeafNode("port", module, SchemaType.builtin(BaseType.UINT16));
            leaf.getIfFeatures().add(feature);
            leaf.getMusts().add(Restriction.of(". != 0"));
            leaf.setMandatory(true);
            leaf.setDescription("Port numarası");
            leaf.setUnits("port");
            leaf.setDefaultValue("22");

            assertThat(print(leaf)).isEqualTo("""
                    <leaf name="port">
                      <if-feature name="ssh"/>
                      <must condition=". != 0"/>
                      <mandatory value="true"/>
                      <description>
                        <text>Port numarası</text>
                      </description>
                      <type name="uint16"/>
                      <units name="port"/>
                      <default value="22"/>
                    </leaf>
                    """);
        }

        @Test
        @DisplayName("Boş container kendi kendine kapanmalı")
        void emptyContainerSelfCloses() throws SchemaPrintException {
            assertThat(print(new ContainerNode("empty", module))).isEqualTo("<container name=\"empty\"/>\n");
        }

        @Test
        @DisplayName("config yalnızca devralınandan farklıysa yazılmalı")
        void configOnlyWhenDiffers() throws SchemaPrintException {
            var state = new ContainerNode("state", module);
            state.setConfig(false);
            var counter = state.addChild(new LeafNode("counter", module, SchemaType.builtin(BaseType.UINT32)));
            counter.setConfig(false);

            assertThat(print(state)).isEqualTo("""
                    <container name="state">
                      <config value="false"/>
                      <leaf name="counter">
                        <type name="uint32"/>
                      </leaf>
                    </container>
                    """);
        }

        @Test
        @DisplayName("List key, unique, sınırlar ve ordered-by sırasıyla yazılmalı")
        void listSubstatements() throws SchemaPrintException {
            var list = new ListNode("server", module);
            list.getKeys().add("name");
            list.getUniques().add(Unique.of("ip", "port"));
            list.setMinElements(1);
            list.setMaxElements(8);
            list.setUserOrdered(true);
            list.addChild(new LeafNode("name", module, SchemaType.builtin(BaseType.STRING)));

            assertThat(print(list)).isEqualTo("""
                    <list name="server">
                      <key value="name"/>
                      <unique tag="ip port"/>
                      <min-elements value="1"/>
                      <max-elements value="8"/>
                      <ordered-by value="user"/>
                      <leaf name="name">
                        <type name="string"/>
                      </leaf>
                    </list>
                    """);
        }

        @Test
        @DisplayName("Sınırsız leaf-list max-elements yazmamalı")
        void leafListUnboundedOmitsMax() throws SchemaPrintException {
            var leafList = new LeafListNode("dns", module, SchemaType.builtin(BaseType.STRING));

            assertThat(print(leafList)).doesNotContain("max-elements").doesNotContain("min-elements");
        }

        @Test
        @DisplayName("Başka modülün eklediği çocuklar atlanmalı")
        void foreignChildrenSkipped() throws SchemaPrintException {
            var other = new YangModule("example-ext", "ext", "urn:example:ext");
            var container = new ContainerNode("system", module);
            container.addChild(new LeafNode("extra", other, SchemaType.builtin(BaseType.STRING)));

            assertThat(print(container)).isEqualTo("<container name=\"system\"/>\n");
        }

        @Test
        @DisplayName("Choice içindeki case'ler CHOICE_MASK ile yazılmalı")
        void choiceWithCases() throws SchemaPrintException {
            var choice = new ChoiceNode("transport", module);
            choice.setDefaultCase("tcp");
            choice.addChild(new CaseNode("tcp", module));
            choice.addChild(new LeafNode("udp", module));

            assertThat(print(choice)).isEqualTo("""
                    <choice name="transport">
                      <default value="tcp"/>
                      <case name="tcp"/>
                      <leaf name="udp"/>
                    </choice>
                    """);
        }

        @Test
        @DisplayName("Maskede olmayan tür sessizce atlanmalı")
        void kindOutsideMaskSkipped() throws SchemaPrintException {
            nodePrinter.print(out, 0, new CaseNode("c", module), YinNodePrinter.DATA_MASK);

            assertThat(out.toString()).isEmpty();
        }
    }

    // ── Eklenti ve gruplama ───────────────────────────────────────────

    @Nested
    @DisplayName("NACM, uses ve augment")
    class ExtensionsAndGroupings {

        @Test
        @DisplayName("NACM bayrağı import önekiyle yazılmalı, üstte varsa çocukta tekrarlanmamalı")
        void accessControl() throws SchemaPrintException {
            var nacm = new YangModule("ietf-netconf-acm", "nacm", "urn:ietf:params:xml:ns:yang:ietf-netconf-acm");
            module.getImports().add(ModuleImport.of(nacm, "nacm"));
            var container = new ContainerNode("secrets", module);
            container.getAccessControl().add(AccessControl.DEFAULT_DENY_WRITE);
            var leaf = container.addChild(new LeafNode("key", module));
            leaf.getAccessControl().add(AccessControl.DEFAULT_DENY_WRITE);

            assertThat(print(container)).isEqualTo("""
                    <container name="secrets">
                      <nacm:default-deny-write/>
                      <leaf name="key"/>
                    </container>
                    """);
        }

        @Test
        @DisplayName("NACM import edilmemişse SchemaPrintException fırlatmalı")
        void accessControlWithoutImport() {
            var container = new ContainerNode("secrets", module);
            container.getAccessControl().add(AccessControl.DEFAULT_DENY_ALL);

            assertThatThrownBy(() -> print(container))
                    .isInstanceOf(SchemaPrintException.class)
                    .hasMessageContaining("ietf-netconf-acm");
        }

        @Test
        @DisplayName("Başka modüldeki grouping'e uses önekli ad ile kapanmalı")
        void usesForeignGrouping() throws SchemaPrintException {
            var groupings = new YangModule("groupings", "grp", "urn:groupings");
            module.getImports().add(ModuleImport.of(groupings, "g"));
            var uses = new UsesNode("grp", module);
            uses.setGroupingModule(groupings);

            assertThat(print(uses)).isEqualTo("<uses name=\"g:grp\"/>\n");
        }

        @Test
        @DisplayName("uses refine ve augment içermeli; refine max 0 unbounded yazmalı")
        void usesWithRefineAndAugment() throws SchemaPrintException {
            var uses = new UsesNode("endpoint", module);
            var refine = new Refine("servers", NodeKind.LIST);
            refine.setMaxElements(0);
            uses.getRefines().add(refine);
            uses.getRefines().add(new Refine("address", NodeKind.LEAF));
            var augment = new AugmentNode("tls", module);
            augment.addChild(new LeafNode("cert", module));
            uses.addAugment(augment);

            assertThat(print(uses)).isEqualTo("""
                    <uses name="endpoint">
                      <refine target-node="servers">
                        <max-elements value="unbounded"/>
                      </refine>
                      <refine target-node="address"/>
                      <augment target-node="tls">
                        <leaf name="cert"/>
                      </augment>
                    </uses>
                    """);
        }

        @Test
        @DisplayName("uses içindeki augment üst uses'in NACM bayrağını ve config değerini devralmalı")
        void usesAugmentInheritsFromUses() throws SchemaPrintException {
            var nacm = new YangModule("ietf-netconf-acm", "nacm", "urn:ietf:params:xml:ns:yang:ietf-netconf-acm");
            module.getImports().add(ModuleImport.of(nacm, "nacm"));
            var container = new ContainerNode("state", module);
            container.setConfig(false);
            var uses = container.addChild(new UsesNode("endpoint", module));
            uses.getAccessControl().add(AccessControl.DEFAULT_DENY_WRITE);
            var augment = uses.addAugment(new AugmentNode("tls", module));
            augment.getAccessControl().add(AccessControl.DEFAULT_DENY_WRITE);
            var leaf = augment.addChild(new LeafNode("cert", module));
            leaf.setConfig(false);

            assertThat(augment.getParent()).isSameAs(uses);
            assertThat(print(container)).isEqualTo("""
                    <container name="state">
                      <config value="false"/>
                      <uses name="endpoint">
                        <nacm:default-deny-write/>
                        <augment target-node="tls">
                          <leaf name="cert"/>
                        </augment>
                      </uses>
                    </container>
                    """);
        }

        @Test
        @DisplayName("Grouping çocukları modüle göre süzülmemeli")
        void groupingChildrenNotFiltered() throws SchemaPrintException {
            var other = new YangModule("example-ext", "ext", "urn:example:ext");
            var grouping = new GroupingNode("g", module);
            grouping.addChild(new LeafNode("shared", other));

            assertThat(print(grouping)).isEqualTo("""
                    <grouping name="g">
                      <leaf name="shared"/>
                    </grouping>
                    """);
        }
    }

    // ── RPC ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("RPC input/output özniteliksiz yazılmalı, boş output kapanmalı")
    void rpcInputOutput() throws SchemaPrintException {
        var rpc = new RpcNode("reboot", module);
        var input = rpc.addChild(InputOutputNode.input(module));
        input.addChild(new LeafNode("delay", module, SchemaType.builtin(BaseType.UINT32)));
        rpc.addChild(InputOutputNode.output(module));

        nodePrinter.printRpc(out, 0, rpc);

        assertThat(out.toString()).isEqualTo("""
                <rpc name="reboot">
                  <input>
                    <leaf name="delay">
                      <type name="uint32"/>
                    </leaf>
                  </input>
                  <output/>
                </rpc>
                """);
    }

    @Test
    @DisplayName("printMaxElements — 0 unbounded, diğerleri sayı")
    void printMaxElements() {
        nodePrinter.printMaxElements(out, 0, 0);
        nodePrinter.printMaxElements(out, 0, 5);

        assertThat(out.toString()).isEqualTo("""
                <max-elements value="unbounded"/>
                <max-elements value="5"/>
                """);
    }
}
