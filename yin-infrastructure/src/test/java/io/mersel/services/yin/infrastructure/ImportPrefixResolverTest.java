package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.interfaces.IPrefixResolver.PrefixResolutionException;
import io.mersel.services.yin.application.models.ModuleImport;
import io.mersel.services.yin.application.models.SubmoduleInclude;
import io.mersel.services.yin.application.models.YangModule;
import io.mersel.services.yin.application.models.YangSubmodule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ImportPrefixResolver birim testleri.
 */
@DisplayName("ImportPrefixResolver")
class ImportPrefixResolverTest {

    private final ImportPrefixResolver resolver = new ImportPrefixResolver();

    private YangModule module;
    private YangSubmodule submodule;
    private YangModule types;
    private YangModule inet;

    @BeforeEach
    void setUp() {
        module = new YangModule("example", "ex", "urn:example");
        submodule = new YangSubmodule("example-sub", module, "ex");
        types = new YangModule("example-types", "et", "urn:example:types");
        inet = new YangModule("ietf-inet-types", "inet", "urn:ietf:params:xml:ns:yang:ietf-inet-types");

        module.getImports().add(ModuleImport.of(types, "t"));
        module.getIncludes().add(SubmoduleInclude.of(submodule));
        submodule.getImports().add(ModuleImport.of(inet, "inet"));
    }

    @Test
    @DisplayName("Aynı ana modüle ait tanımlar için boş önek dönmeli")
    void resolve_sameMainModule() throws PrefixResolutionException {
        assertThat(resolver.resolve(module, module)).isEmpty();
        assertThat(resolver.resolve(module, submodule)).isEmpty();
        assertThat(resolver.resolve(submodule, module)).isEmpty();
    }

    @Test
    @DisplayName("İçe aktarılan modül için import öneki dönmeli, modülün kendi öneki değil")
    void resolve_importPrefix() throws PrefixResolutionException {
        assertThat(resolver.resolve(module, types)).isEqualTo("t");
        assertThat(resolver.resolve(module, "example-types")).isEqualTo("t");
    }

    @Test
    @DisplayName("Dahil edilen alt modülün içe aktarımları da aranmalı")
    void resolve_throughInclude() throws PrefixResolutionException {
        assertThat(resolver.resolve(module, inet)).isEqualTo("inet");
    }

    @Test
    @DisplayName("Import edilmemiş modül için PrefixResolutionException fırlatmalı")
    void resolve_missingImport() {
        assertThatThrownBy(() -> resolver.resolve(module, "ietf-yang-types"))
                .isInstanceOf(PrefixResolutionException.class)
                .hasMessageContaining("ietf-yang-types")
                .hasMessageContaining("example");
    }
}
