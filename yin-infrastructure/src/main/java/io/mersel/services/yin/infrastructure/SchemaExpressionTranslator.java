package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.enums.ExpressionKind;
import io.mersel.services.yin.application.interfaces.IExpressionTranslator;
import io.mersel.services.yin.application.interfaces.IPrefixResolver;
import io.mersel.services.yin.application.interfaces.IPrefixResolver.PrefixResolutionException;
import io.mersel.services.yin.application.models.SchemaModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Modül adıyla nitelenmiş ifadeleri önekli biçime çevirir.
 * <p>
 * Örnek: {@code /ietf-interfaces:interfaces/ietf-interfaces:interface[ietf-interfaces:name='eth0']}
 * → {@code /if:interfaces/if:interface[if:name='eth0']}
 * <ul>
 *   <li>Yazdırılan ana modülün adı kendi önekine çevrilir.</li>
 *   <li>Diğer modül adları {@link IPrefixResolver} ile içe aktarım öneklerine çevrilir.</li>
 *   <li>Tırnak içindeki metinler ve {@code ::} eksen ayraçları olduğu gibi kalır.</li>
 *   <li>{@link ExpressionKind#SCHEMA_NODE_PATH} için köşeli parantez dışındaki öneksiz adımlar
 *       bir önceki adımın modülünü devralır ({@code /a:x/y} → {@code /pa:x/pa:y}).</li>
 * </ul>
 */
@Component
public class SchemaExpressionTranslator implements IExpressionTranslator {

    private static final Logger log = LoggerFactory.getLogger(SchemaExpressionTranslator.class);

    private final IPrefixResolver prefixResolver;

    public SchemaExpressionTranslator(IPrefixResolver prefixResolver) {
        this.prefixResolver = prefixResolver;
    }

    @Override
    public String translate(SchemaModule module, String expression, ExpressionKind kind)
            throws ExpressionTranslationException {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionTranslationException("Boş ifade çevrilemez");
        }

        boolean path = kind == ExpressionKind.SCHEMA_NODE_PATH;
        var out = new StringBuilder(expression.length() + 16);
        String inheritedModule = null;
        int predicateDepth = 0;
        int n = expression.length();
        int i = 0;

        while (i < n) {
            char c = expression.charAt(i);

            if (c == '\'' || c == '"') {
                int end = expression.indexOf(c, i + 1);
                if (end < 0) {
                    throw new ExpressionTranslationException(
                            "Kapatılmamış metin sabiti (" + (i + 1) + ". karakter): " + expression);
                }
                out.append(expression, i, end + 1);
                i = end + 1;
                continue;
            }

            if (isNameStart(c)) {
                int j = i;
                while (j < n && isNameChar(expression.charAt(j))) {
                    j++;
                }
                String name = expression.substring(i, j);

                if (isPrefixSeparator(expression, j)) {
                    out.append(prefixFor(module, name, expression)).append(':');
                    if (path && predicateDepth == 0) {
                        inheritedModule = name;
                    }
                    i = j + 1;
                    continue;
                }

                if (path && predicateDepth == 0 && inheritedModule != null && isPathStep(expression, i)) {
                    out.append(prefixFor(module, inheritedModule, expression)).append(':');
                }
                out.append(name);
                i = j;
                continue;
            }

            if (c == '[') {
                predicateDepth++;
            } else if (c == ']' && predicateDepth > 0) {
                predicateDepth--;
            }
            out.append(c);
            i++;
        }

        String result = out.toString();
        if (log.isTraceEnabled()) {
            log.trace("İfade çevrildi ({}): {} → {}", kind, expression, result);
        }
        return result;
    }

    private String prefixFor(SchemaModule module, String moduleName, String expression)
            throws ExpressionTranslationException {
        if (module.mainModule().getName().equals(moduleName)) {
            return module.getPrefix();
        }
        try {
            return prefixResolver.resolve(module, moduleName);
        } catch (PrefixResolutionException e) {
            throw new ExpressionTranslationException(
                    "İfadedeki \"" + moduleName + "\" modülü çözümlenemedi: " + expression, e);
        }
    }

    /** {@code name:x} veya {@code name:*}; {@code name::} (eksen) değil. */
    private static boolean isPrefixSeparator(String expression, int index) {
        if (index + 1 >= expression.length() || expression.charAt(index) != ':') {
            return false;
        }
        char next = expression.charAt(index + 1);
        return next != ':' && (isNameStart(next) || next == '*');
    }

    /** Ad bir yol adımı mı? Başta veya hemen önünde {@code /} varsa. */
    private static boolean isPathStep(String expression, int index) {
        return index == 0 || expression.charAt(index - 1) == '/';
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
