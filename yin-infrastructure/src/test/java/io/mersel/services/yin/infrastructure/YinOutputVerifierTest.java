package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.interfaces.ISchemaPrinter.SchemaPrintException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * YinOutputVerifier birim testleri.
 */
@DisplayName("YinOutputVerifier")
class YinOutputVerifierTest {

    private final YinOutputVerifier verifier = new YinOutputVerifier();

    @Test
    @DisplayName("YIN ad alanındaki iyi biçimli belge kabul edilmeli")
    void verify_validDocument() {
        String yin = """
                <?xml version="1.0" encoding="UTF-8"?>
                <module name="a"
                        xmlns="urn:ietf:params:xml:ns:yang:yin:1"
                        xmlns:a="urn:a">
                  <namespace uri="urn:a"/>
                  <prefix value="a"/>
                </module>
                """;

        assertThatCode(() -> verifier.verify(yin, "a")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("İyi biçimli olmayan belge SchemaPrintException fırlatmalı")
    void verify_malformed() {
        assertThatThrownBy(() -> verifier.verify("<module name=\"a\">", "a"))
                .isInstanceOf(SchemaPrintException.class)
                .hasMessageContaining("geçerli XML değil");
    }

    @Test
    @DisplayName("Kök eleman YIN ad alanında değilse reddedilmeli")
    void verify_wrongNamespace() {
        assertThatThrownBy(() -> verifier.verify("<module xmlns=\"urn:other\"/>", "a"))
                .isInstanceOf(SchemaPrintException.class)
                .hasMessageContaining("urn:other");
    }
}
