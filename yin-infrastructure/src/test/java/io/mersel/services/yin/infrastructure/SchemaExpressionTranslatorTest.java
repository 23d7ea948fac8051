package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.enums.ExpressionKind;
import io.mersel.services.yin.application.interfaces.IExpressionTranslator.ExpressionTranslationException;
import io.mersel.services.yin.application.models.ModuleImport;
import io.mersel.services.yin.application.models.YangModule;
import io.mersel.services.yin.application.models.YangSubmodule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SchemaExpressionTranslator birim testleri.
 */
@DisplayName("SchemaExpressionTranslator")
class SchemaExpressionTranslatorTest {

    private SchemaExpressionTranslator translator;
    private YangModule module;

    @BeforeEach
    void setUp() {
        translator = new SchemaExpressionTranslator(new ImportPrefixResolver());
        module = new YangModule("example", "ex", "urn:example");
        var interfaces = new YangModule("ietf-interfaces", "if", "urn:ietf:params:xml:ns:yang:ietf-interfaces");
        module.getImports().add(ModuleImport.of(interfaces, "if"));
    }

    @Test
    @DisplayName("Modül adları önekle değiştirilmeli")
    void translate_schemaPath() throws ExpressionTranslationException {
        String result = translator.translate(module,
                "/ietf-interfaces:interfaces/ietf-interfaces:interface", ExpressionKind.SCHEMA_NODE_PATH);

        assertThat(result).isEqualTo("/if:interfaces/if:interface");
    }

    @Test
    @DisplayName("Yazdırılan modülün adı kendi önekine çevrilmeli")
    void translate_ownModule() throws ExpressionTranslationException {
        String result = translator.translate(module, "../example:enabled = 'true'", ExpressionKind.CONDITION);

        assertThat(result).isEqualTo("../ex:enabled = 'true'");
    }

    @Test
    @DisplayName("Öneksiz yol adımları önceki adımın modülünü devralmalı, predicate içi hariç")
    void translate_inheritsModuleOutsidePredicates() throws ExpressionTranslationException {
        String result = translator.translate(module,
                "/example:a/b[c = current()]/d", ExpressionKind.SCHEMA_NODE_PATH);

        assertThat(result).isEqualTo("/ex:a/ex:b[c = current()]/ex:d");
    }

    @Test
    @DisplayName("Koşul ifadelerinde öneksiz adlar olduğu gibi kalmalı")
    void translate_conditionDoesNotInherit() throws ExpressionTranslationException {
        String result = translator.translate(module, "/example:a/b", ExpressionKind.CONDITION);

        assertThat(result).isEqualTo("/ex:a/b");
    }

    @Test
    @DisplayName("Metin sabitleri ve eksen ayraçları değişmemeli")
    void translate_literalsAndAxes() throws ExpressionTranslationException {
        assertThat(translator.translate(module, "name = 'example:x'", ExpressionKind.CONDITION))
                .isEqualTo("name = 'example:x'");
        assertThat(translator.translate(module, "ancestor::example:x", ExpressionKind.CONDITION))
                .isEqualTo("ancestor::ex:x");
    }

    @Test
    @DisplayName("Alt modülde ana modülün adı belongs-to önekine çevrilmeli")
    void translate_inSubmodule() throws ExpressionTranslationException {
        var submodule = new YangSubmodule("example-sub", module, "ex");

        assertThat(translator.translate(submodule, "/example:a", ExpressionKind.SCHEMA_NODE_PATH))
                .isEqualTo("/ex:a");
    }

    @Test
    @DisplayName("Çözümlenemeyen modül adı için ExpressionTranslationException fırlatmalı")
    void translate_unknownModule() {
        assertThatThrownBy(() -> translator.translate(module, "/foo:bar", ExpressionKind.SCHEMA_NODE_PATH))
                .isInstanceOf(ExpressionTranslationException.class)
                .hasMessageContaining("foo");
    }

    @Test
    @DisplayName("Kapatılmamış metin sabiti ve boş ifade reddedilmeli")
    void translate_malformed() {
        assertThatThrownBy(() -> translator.translate(module, "name = 'eth0", ExpressionKind.CONDITION))
                .isInstanceOf(ExpressionTranslationException.class)
                .hasMessageContaining("Kapatılmamış");
        assertThatThrownBy(() -> translator.translate(module, " ", ExpressionKind.CONDITION))
                .isInstanceOf(ExpressionTranslationException.class);
    }
}
