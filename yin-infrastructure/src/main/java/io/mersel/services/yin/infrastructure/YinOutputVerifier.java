package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.interfaces.ISchemaPrinter.SchemaPrintException;
import net.sf.saxon.s9api.DocumentBuilder;
import net.sf.saxon.s9api.Processor;
import net.sf.saxon.s9api.SaxonApiException;
import net.sf.saxon.s9api.XdmNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.xml.transform.stream.StreamSource;
import java.io.StringReader;

/**
 * Üretilen YIN belgesini Saxon HE ile ayrıştırarak doğrular.
 * <p>
 * Belgenin iyi biçimli olduğunu ve kök elemanın YIN ad alanında bulunduğunu kontrol eder.
 */
@Component
public class YinOutputVerifier {

    private static final Logger log = LoggerFactory.getLogger(YinOutputVerifier.class);

    public static final String YIN_NAMESPACE = "urn:ietf:params:xml:ns:yang:yin:1";

    /** Tekrar tekrar oluşturmamak için sınıf seviyesinde tutulan Processor */
    private final Processor processor = new Processor(false);

    /**
     * @param content YIN belgesi
     * @param source  Hata mesajında kullanılacak modül adı
     * @throws SchemaPrintException Belge ayrıştırılamazsa veya kök eleman YIN değilse
     */
    public void verify(String content, String source) throws SchemaPrintException {
        try {
            DocumentBuilder builder = processor.newDocumentBuilder();
            XdmNode document = builder.build(new StreamSource(new StringReader(content)));

            String namespace = processor.newXPathCompiler()
                    .evaluateSingle("namespace-uri(/*)", document)
                    .getStringValue();
            if (!YIN_NAMESPACE.equals(namespace)) {
                throw new SchemaPrintException(
                        source + " çıktısının kök elemanı YIN ad alanında değil: " + namespace);
            }
        } catch (SaxonApiException e) {
            log.warn("{} çıktısı ayrıştırılamadı: {}", source, e.getMessage());
            throw new SchemaPrintException(source + " çıktısı geçerli XML değil: " + e.getMessage(), e);
        }
    }
}
