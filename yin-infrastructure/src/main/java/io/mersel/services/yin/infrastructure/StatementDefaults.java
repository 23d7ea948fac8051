package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.enums.AccessControl;
import io.mersel.services.yin.application.enums.Status;
import io.mersel.services.yin.application.models.SchemaNode;
import io.mersel.services.yin.application.models.SchemaStatement;

import java.util.EnumSet;
import java.util.Set;

/**
 * Varsayılan değerlerden farklı olduğu için açıkça yazılması gereken alt ifadelerin kararları.
 * <p>
 * Tüm düğüm türleri bu kararları buradan alır; hem "kendi kendine kapanabilir mi" kontrolü
 * hem de yazma işlemi aynı metotları kullanır.
 */
final class StatementDefaults {

    private StatementDefaults() {}

    /**
     * Yazılacak {@code config} değeri.
     *
     * @param own       Düğümün çözümlenmiş değeri ({@code null}: uygulanamaz)
     * @param inherited Üst düğümlerden devralınan değer
     * @return Yazılacak değer; devralınanla aynıysa {@code null}
     */
    static Boolean configToPrint(Boolean own, boolean inherited) {
        if (own == null || own == inherited) {
            return null;
        }
        return own;
    }

    static Boolean configToPrint(SchemaNode node) {
        return configToPrint(node.getConfig(), inheritedConfig(node.getParent()));
    }

    /**
     * Config değeri çözümlenmiş en yakın üst düğümün değeri; yoksa {@code true}.
     */
    static boolean inheritedConfig(SchemaNode parent) {
        for (SchemaNode p = parent; p != null; p = p.getParent()) {
            if (p.getConfig() != null) {
                return p.getConfig();
            }
        }
        return true;
    }

    /**
     * Düğümde set edilmiş, üst düğümde olmayan erişim kontrolü bayrakları.
     */
    static Set<AccessControl> accessControlToPrint(SchemaNode node) {
        if (node.getAccessControl().isEmpty()) {
            return Set.of();
        }
        var flags = EnumSet.copyOf(node.getAccessControl());
        if (node.getParent() != null) {
            flags.removeAll(node.getParent().getAccessControl());
        }
        return flags;
    }

    /** {@code status}, {@code description} veya {@code reference} var mı? */
    static boolean hasCommon(Status status, String description, String reference) {
        return status != null || description != null || reference != null;
    }

    static boolean hasCommon(SchemaStatement statement) {
        return hasCommon(statement.getStatus(), statement.getDescription(), statement.getReference());
    }

    /** {@link #hasCommon(SchemaStatement)} artı yazılacak {@code config} / {@code mandatory}. */
    static boolean hasDataCommon(SchemaNode node) {
        return configToPrint(node) != null || node.getMandatory() != null || hasCommon(node);
    }
}
