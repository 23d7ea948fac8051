package io.mersel.services.yin.infrastructure.diagnostics;

import io.mersel.services.yin.application.enums.BaseType;
import io.mersel.services.yin.application.interfaces.ISchemaPrinter;
import io.mersel.services.yin.application.models.ContainerNode;
import io.mersel.services.yin.application.models.LeafNode;
import io.mersel.services.yin.application.models.SchemaType;
import io.mersel.services.yin.application.models.YangModule;
import io.mersel.services.yin.infrastructure.YinOutputVerifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.StringWriter;

/**
 * YIN yazıcı sağlık kontrolü.
 * <p>
 * Küçük bir deneme modülünü yazdırır ve çıktıyı Saxon HE ile ayrıştırır.
 */
@Component
public class YinPrinterHealthCheck implements HealthIndicator {

    private final ISchemaPrinter schemaPrinter;
    private final YinOutputVerifier outputVerifier;

    public YinPrinterHealthCheck(ISchemaPrinter schemaPrinter, YinOutputVerifier outputVerifier) {
        this.schemaPrinter = schemaPrinter;
        this.outputVerifier = outputVerifier;
    }

    @Override
    public Health health() {
        try {
            var writer = new StringWriter();
            schemaPrinter.print(probeModule(), writer);
            outputVerifier.verify(writer.toString(), "health-probe");

            return Health.up()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("version", net.sf.saxon.Version.getProductVersion())
                    .withDetail("probeBytes", writer.getBuffer().length())
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("engine", "Saxon HE")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }

    private static YangModule probeModule() {
        var module = new YangModule("health-probe", "hp", "urn:mersel:yin:health-probe");
        var container = module.addData(new ContainerNode("probe", module));
        container.addChild(new LeafNode("status", module, SchemaType.builtin(BaseType.STRING)));
        return module;
    }
}
