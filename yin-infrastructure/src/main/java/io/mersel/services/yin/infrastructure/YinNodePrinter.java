package io.mersel.services.yin.infrastructure;

import io.mersel.services.yin.application.enums.AccessControl;
import io.mersel.services.yin.application.enums.ExpressionKind;
import io.mersel.services.yin.application.enums.NodeKind;
import io.mersel.services.yin.application.interfaces.ISchemaPrinter.SchemaPrintException;
import io.mersel.services.yin.application.models.AnyxmlNode;
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
import io.mersel.services.yin.application.models.NotificationNode;
import io.mersel.services.yin.application.models.Refine;
import io.mersel.services.yin.application.models.Restriction;
import io.mersel.services.yin.application.models.RpcNode;
import io.mersel.services.yin.application.models.SchemaModule;
import io.mersel.services.yin.application.models.SchemaNode;
import io.mersel.services.yin.application.models.Typedef;
import io.mersel.services.yin.application.models.Unique;
import io.mersel.services.yin.application.models.UsesNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

import static io.mersel.services.yin.application.enums.NodeKind.ANYXML;
import static io.mersel.services.yin.application.enums.NodeKind.CASE;
import static io.mersel.services.yin.application.enums.NodeKind.CHOICE;
import static io.mersel.services.yin.application.enums.NodeKind.CONTAINER;
import static io.mersel.services.yin.application.enums.NodeKind.GROUPING;
import static io.mersel.services.yin.application.enums.NodeKind.INPUT;
import static io.mersel.services.yin.application.enums.NodeKind.LEAF;
import static io.mersel.services.yin.application.enums.NodeKind.LEAF_LIST;
import static io.mersel.services.yin.application.enums.NodeKind.LIST;
import static io.mersel.services.yin.application.enums.NodeKind.OUTPUT;
import static io.mersel.services.yin.application.enums.NodeKind.USES;

/**
 * Şema düğümlerini türlerine göre YIN elemanı olarak yazar.
 * <p>
 * {@link #print(YinOutput, int, SchemaNode, Set)} yalnızca izin verilen türleri yazar,
 * diğerlerini sessizce atlar. Her tür alt ifadelerini sabit bir sırada yazar; hiçbir alt
 * ifadesi yoksa eleman kendi kendine kapanır.
 */
@Component
public class YinNodePrinter {

    private static final Logger log = LoggerFactory.getLogger(YinNodePrinter.class);

    /** Modül gövdesi, container, list, grouping, input/output ve notification altında. */
    static final Set<NodeKind> DATA_MASK =
            EnumSet.of(CHOICE, CONTAINER, LEAF, LEAF_LIST, LIST, USES, GROUPING, ANYXML);

    static final Set<NodeKind> CASE_MASK =
            EnumSet.of(CHOICE, CONTAINER, LEAF, LEAF_LIST, LIST, USES, ANYXML);

    static final Set<NodeKind> CHOICE_MASK =
            EnumSet.of(CONTAINER, LEAF, LEAF_LIST, LIST, ANYXML, CASE);

    static final Set<NodeKind> AUGMENT_MASK =
            EnumSet.of(CHOICE, CONTAINER, LEAF, LEAF_LIST, LIST, USES, ANYXML, CASE);

    static final Set<NodeKind> RPC_MASK = EnumSet.of(GROUPING, INPUT, OUTPUT);

    private final YinTypePrinter typePrinter;

    public YinNodePrinter(YinTypePrinter typePrinter) {
        this.typePrinter = typePrinter;
    }

    /**
     * Düğümü türü {@code mask} içindeyse yazar.
     *
     * @param level Düğüm elemanının derinliği
     */
    void print(YinOutput out, int level, SchemaNode node, Set<NodeKind> mask) throws SchemaPrintException {
        if (!mask.contains(node.getKind())) {
            log.trace("{} bu konumda yazılmıyor, atlandı", node);
            return;
        }

        switch (node.getKind()) {
            case CONTAINER -> printContainer(out, level, (ContainerNode) node);
            case CHOICE -> printChoice(out, level, (ChoiceNode) node);
            case CASE -> printCase(out, level, (CaseNode) node);
            case LEAF -> printLeaf(out, level, (LeafNode) node);
            case LEAF_LIST -> printLeafList(out, level, (LeafListNode) node);
            case LIST -> printList(out, level, (ListNode) node);
            case ANYXML -> printAnyxml(out, level, (AnyxmlNode) node);
            case USES -> printUses(out, level, (UsesNode) node);
            case GROUPING -> printGrouping(out, level, (GroupingNode) node);
            case AUGMENT -> printAugment(out, level, (AugmentNode) node);
            case RPC -> printRpc(out, level, (RpcNode) node);
            case INPUT, OUTPUT -> printInputOutput(out, level, (InputOutputNode) node);
            case NOTIFICATION -> printNotification(out, level, (NotificationNode) node);
        }
    }

    // ── Veri düğümleri ─────────────────────────────────────────────

    private void printContainer(YinOutput out, int level, ContainerNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && node.getWhen() == null
                && node.getIfFeatures().isEmpty() && node.getMusts().isEmpty()
                && node.getPresence() == null && !StatementDefaults.hasDataCommon(node)
                && node.getTypedefs().isEmpty() && !hasChildren(node, DATA_MASK, true);

        out.open(level, "container", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        printWhen(out, inner, node);
        printIfFeatures(out, inner, node);
        printMusts(out, inner, node);
        if (node.getPresence() != null) {
            out.open(inner, "presence", "value", node.getPresence(), true);
        }
        printDataCommon(out, inner, node);
        printTypedefs(out, inner, node);
        printChildren(out, inner, node, DATA_MASK, true);

        out.close(level, "container");
    }

    private void printChoice(YinOutput out, int level, ChoiceNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && node.getDefaultCase() == null
                && !StatementDefaults.hasDataCommon(node) && node.getIfFeatures().isEmpty()
                && node.getWhen() == null && !hasChildren(node, CHOICE_MASK, true);

        out.open(level, "choice", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        if (node.getDefaultCase() != null) {
            out.open(inner, "default", "value", node.getDefaultCase(), true);
        }
        printDataCommon(out, inner, node);
        printIfFeatures(out, inner, node);
        printWhen(out, inner, node);
        printChildren(out, inner, node, CHOICE_MASK, true);

        out.close(level, "choice");
    }

    private void printCase(YinOutput out, int level, CaseNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && !StatementDefaults.hasDataCommon(node)
                && node.getIfFeatures().isEmpty() && node.getWhen() == null
                && !hasChildren(node, CASE_MASK, true);

        out.open(level, "case", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        printDataCommon(out, inner, node);
        printIfFeatures(out, inner, node);
        printWhen(out, inner, node);
        printChildren(out, inner, node, CASE_MASK, true);

        out.close(level, "case");
    }

    private void printLeaf(YinOutput out, int level, LeafNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && node.getWhen() == null
                && node.getIfFeatures().isEmpty() && node.getMusts().isEmpty()
                && !StatementDefaults.hasDataCommon(node) && node.getType() == null
                && node.getUnits() == null && node.getDefaultValue() == null;

        out.open(level, "leaf", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        printWhen(out, inner, node);
        printIfFeatures(out, inner, node);
        printMusts(out, inner, node);
        printDataCommon(out, inner, node);
        if (node.getType() != null) {
            typePrinter.printType(out, inner, node.getModule(), node.getType());
        }
        if (node.getUnits() != null) {
            out.open(inner, "units", "name", node.getUnits(), true);
        }
        if (node.getDefaultValue() != null) {
            out.open(inner, "default", "value", node.getDefaultValue(), true);
        }

        out.close(level, "leaf");
    }

    private void printLeafList(YinOutput out, int level, LeafListNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && node.getWhen() == null
                && node.getIfFeatures().isEmpty() && node.getMusts().isEmpty()
                && !StatementDefaults.hasDataCommon(node) && node.getType() == null
                && node.getUnits() == null && node.getMinElements() <= 0
                && node.getMaxElements() <= 0 && !node.isUserOrdered();

        out.open(level, "leaf-list", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        printWhen(out, inner, node);
        printIfFeatures(out, inner, node);
        printMusts(out, inner, node);
        printDataCommon(out, inner, node);
        if (node.getType() != null) {
            typePrinter.printType(out, inner, node.getModule(), node.getType());
        }
        if (node.getUnits() != null) {
            out.open(inner, "units", "name", node.getUnits(), true);
        }
        printElementBounds(out, inner, node.getMinElements(), node.getMaxElements(), node.isUserOrdered());

        out.close(level, "leaf-list");
    }

    private void printList(YinOutput out, int level, ListNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && node.getWhen() == null
                && node.getIfFeatures().isEmpty() && node.getMusts().isEmpty()
                && node.getKeys().isEmpty() && node.getUniques().isEmpty()
                && !StatementDefaults.hasDataCommon(node) && node.getMinElements() <= 0
                && node.getMaxElements() <= 0 && !node.isUserOrdered()
                && node.getTypedefs().isEmpty() && !hasChildren(node, DATA_MASK, true);

        out.open(level, "list", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        printWhen(out, inner, node);
        printIfFeatures(out, inner, node);
        printMusts(out, inner, node);
        if (!node.getKeys().isEmpty()) {
            out.open(inner, "key", "value", String.join(" ", node.getKeys()), true);
        }
        for (Unique unique : node.getUniques()) {
            printUnique(out, inner, unique);
        }
        printDataCommon(out, inner, node);
        printElementBounds(out, inner, node.getMinElements(), node.getMaxElements(), node.isUserOrdered());
        printTypedefs(out, inner, node);
        printChildren(out, inner, node, DATA_MASK, true);

        out.close(level, "list");
    }

    private void printAnyxml(YinOutput out, int level, AnyxmlNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && !StatementDefaults.hasDataCommon(node)
                && node.getIfFeatures().isEmpty() && node.getMusts().isEmpty() && node.getWhen() == null;

        out.open(level, "anyxml", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        printDataCommon(out, inner, node);
        printIfFeatures(out, inner, node);
        printMusts(out, inner, node);
        printWhen(out, inner, node);

        out.close(level, "anyxml");
    }

    // ── Gruplama ve genişletme ─────────────────────────────────────

    private void printGrouping(YinOutput out, int level, GroupingNode node) throws SchemaPrintException {
        boolean close = !StatementDefaults.hasCommon(node) && node.getTypedefs().isEmpty()
                && !hasChildren(node, DATA_MASK, false);

        out.open(level, "grouping", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        typePrinter.printCommon(out, inner, node);
        printTypedefs(out, inner, node);
        printChildren(out, inner, node, DATA_MASK, false);

        out.close(level, "grouping");
    }

    private void printUses(YinOutput out, int level, UsesNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && !StatementDefaults.hasCommon(node)
                && node.getIfFeatures().isEmpty() && node.getWhen() == null
                && node.getRefines().isEmpty() && node.getAugments().isEmpty();

        String name = typePrinter.qualify(node.getModule(), node.getGroupingModule(), node.getName());
        out.open(level, "uses", "name", name, close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        typePrinter.printCommon(out, inner, node);
        printIfFeatures(out, inner, node);
        printWhen(out, inner, node);
        for (Refine refine : node.getRefines()) {
            printRefine(out, inner, node.getModule(), refine);
        }
        for (AugmentNode augment : node.getAugments()) {
            printAugment(out, inner, augment);
        }

        out.close(level, "uses");
    }

    /**
     * Üst düzey veya {@code uses} altındaki {@code augment}. Hedef yol yazdırılan modülün
     * önekleriyle çevrilir; çocuklar modüle göre süzülmez.
     */
    void printAugment(YinOutput out, int level, AugmentNode node) throws SchemaPrintException {
        boolean close = !hasAccessControl(node) && !StatementDefaults.hasCommon(node)
                && node.getIfFeatures().isEmpty() && node.getWhen() == null
                && !hasChildren(node, AUGMENT_MASK, false);

        String target = typePrinter.translate(node.getModule(), node.getTargetPath(),
                ExpressionKind.SCHEMA_NODE_PATH, "augment \"" + node.getTargetPath() + "\"");
        out.open(level, "augment", "target-node", target, close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printAccessControl(out, inner, node);
        typePrinter.printCommon(out, inner, node);
        printIfFeatures(out, inner, node);
        printWhen(out, inner, node);
        printChildren(out, inner, node, AUGMENT_MASK, false);

        out.close(level, "augment");
    }

    static boolean hasRefineSubstatements(Refine refine) {
        return refine.getConfig() != null || refine.getMandatory() != null
                || StatementDefaults.hasCommon(refine.getStatus(), refine.getDescription(), refine.getReference())
                || !refine.getMusts().isEmpty() || hasRefineTargetSubstatement(refine);
    }

    /** Hedef türüne özgü alt ifade: leaf/choice için default, container için presence, listeler için sınırlar. */
    private static boolean hasRefineTargetSubstatement(Refine refine) {
        if (refine.getTargetKind() == null) {
            return false;
        }
        return switch (refine.getTargetKind()) {
            case LEAF, CHOICE -> refine.getDefaultValue() != null;
            case CONTAINER -> refine.getPresence() != null;
            case LIST, LEAF_LIST -> refine.getMinElements() != null || refine.getMaxElements() != null;
            default -> false;
        };
    }

    private void printRefine(YinOutput out, int level, SchemaModule module, Refine refine)
            throws SchemaPrintException {
        boolean close = !hasRefineSubstatements(refine);

        String target = typePrinter.translate(module, refine.getTargetPath(),
                ExpressionKind.SCHEMA_NODE_PATH, "refine \"" + refine.getTargetPath() + "\"");
        out.open(level, "refine", "target-node", target, close);
        if (close) {
            return;
        }

        int inner = level + 1;
        if (refine.getConfig() != null) {
            out.open(inner, "config", "value", refine.getConfig().toString(), true);
        }
        if (refine.getMandatory() != null) {
            out.open(inner, "mandatory", "value", refine.getMandatory().toString(), true);
        }
        typePrinter.printCommon(out, inner, refine.getStatus(), refine.getDescription(), refine.getReference());
        for (Restriction must : refine.getMusts()) {
            typePrinter.printMust(out, inner, module, must);
        }
        if (hasRefineTargetSubstatement(refine)) {
            switch (refine.getTargetKind()) {
                case LEAF, CHOICE -> out.open(inner, "default", "value", refine.getDefaultValue(), true);
                case CONTAINER -> out.open(inner, "presence", "value", refine.getPresence(), true);
                default -> {
                    if (refine.getMinElements() != null) {
                        out.number(inner, "min-elements", "value", refine.getMinElements());
                    }
                    if (refine.getMaxElements() != null) {
                        printMaxElements(out, inner, refine.getMaxElements());
                    }
                }
            }
        }

        out.close(level, "refine");
    }

    // ── RPC ve bildirimler ─────────────────────────────────────────

    void printRpc(YinOutput out, int level, RpcNode node) throws SchemaPrintException {
        boolean close = !StatementDefaults.hasCommon(node) && node.getIfFeatures().isEmpty()
                && node.getTypedefs().isEmpty() && !hasChildren(node, RPC_MASK, true);

        out.open(level, "rpc", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        typePrinter.printCommon(out, inner, node);
        printIfFeatures(out, inner, node);
        printTypedefs(out, inner, node);
        printChildren(out, inner, node, RPC_MASK, true);

        out.close(level, "rpc");
    }

    private void printInputOutput(YinOutput out, int level, InputOutputNode node) throws SchemaPrintException {
        boolean close = node.getTypedefs().isEmpty() && !hasChildren(node, DATA_MASK, true);
        String elem = node.isInput() ? "input" : "output";

        out.open(level, elem, close);
        if (close) {
            return;
        }

        int inner = level + 1;
        printTypedefs(out, inner, node);
        printChildren(out, inner, node, DATA_MASK, true);

        out.close(level, elem);
    }

    void printNotification(YinOutput out, int level, NotificationNode node) throws SchemaPrintException {
        boolean close = !StatementDefaults.hasCommon(node) && node.getIfFeatures().isEmpty()
                && node.getTypedefs().isEmpty() && !hasChildren(node, DATA_MASK, true);

        out.open(level, "notification", "name", node.getName(), close);
        if (close) {
            return;
        }

        int inner = level + 1;
        typePrinter.printCommon(out, inner, node);
        printIfFeatures(out, inner, node);
        printTypedefs(out, inner, node);
        printChildren(out, inner, node, DATA_MASK, true);

        out.close(level, "notification");
    }

    // ── Paylaşılan alt ifadeler ────────────────────────────────────

    /** {@code <unique tag="a b"/>} */
    void printUnique(YinOutput out, int level, Unique unique) {
        out.open(level, "unique", "tag", String.join(" ", unique.expressions()), true);
    }

    /** {@code 0} sınırsız demektir. */
    void printMaxElements(YinOutput out, int level, int max) {
        if (max == 0) {
            out.open(level, "max-elements", "value", "unbounded", true);
        } else {
            out.number(level, "max-elements", "value", max);
        }
    }

    private void printElementBounds(YinOutput out, int level, int min, int max, boolean userOrdered) {
        if (min > 0) {
            out.number(level, "min-elements", "value", min);
        }
        if (max > 0) {
            out.number(level, "max-elements", "value", max);
        }
        if (userOrdered) {
            out.open(level, "ordered-by", "value", "user", true);
        }
    }

    /**
     * Çocukları yazar.
     *
     * @param ownOnly {@code true} ise başka modüle ait çocuklar (ör. augment ile eklenenler) atlanır
     */
    private void printChildren(YinOutput out, int level, SchemaNode parent, Set<NodeKind> mask, boolean ownOnly)
            throws SchemaPrintException {
        for (SchemaNode child : parent.getChildren()) {
            if (ownOnly && !isOwnChild(parent, child)) {
                log.trace("{} başka modüle ait ({}), atlandı", child, child.getModule());
                continue;
            }
            print(out, level, child, mask);
        }
    }

    private static boolean hasChildren(SchemaNode parent, Set<NodeKind> mask, boolean ownOnly) {
        for (SchemaNode child : parent.getChildren()) {
            if (mask.contains(child.getKind()) && (!ownOnly || isOwnChild(parent, child))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isOwnChild(SchemaNode parent, SchemaNode child) {
        return child.getModule() == parent.getModule();
    }

    private static boolean hasAccessControl(SchemaNode node) {
        return !StatementDefaults.accessControlToPrint(node).isEmpty();
    }

    /**
     * NACM eklenti elemanları; önek {@code ietf-netconf-acm} modülünün yazdırılan modüldeki önekidir.
     */
    private void printAccessControl(YinOutput out, int level, SchemaNode node) throws SchemaPrintException {
        Set<AccessControl> flags = StatementDefaults.accessControlToPrint(node);
        if (flags.isEmpty()) {
            return;
        }
        String prefix = typePrinter.prefixOf(node.getModule(), AccessControl.MODULE_NAME);
        for (AccessControl flag : flags) {
            out.open(level, prefix + ":" + flag.getKeyword(), true);
        }
    }

    /** config, mandatory, status, description, reference */
    private void printDataCommon(YinOutput out, int level, SchemaNode node) {
        Boolean config = StatementDefaults.configToPrint(node);
        if (config != null) {
            out.open(level, "config", "value", config.toString(), true);
        }
        if (node.getMandatory() != null) {
            out.open(level, "mandatory", "value", node.getMandatory().toString(), true);
        }
        typePrinter.printCommon(out, level, node);
    }

    private void printWhen(YinOutput out, int level, SchemaNode node) throws SchemaPrintException {
        if (node.getWhen() != null) {
            typePrinter.printWhen(out, level, node.getModule(), node.getWhen());
        }
    }

    private void printIfFeatures(YinOutput out, int level, SchemaNode node) throws SchemaPrintException {
        for (Feature feature : node.getIfFeatures()) {
            typePrinter.printIfFeature(out, level, node.getModule(), feature);
        }
    }

    private void printMusts(YinOutput out, int level, SchemaNode node) throws SchemaPrintException {
        for (Restriction must : node.getMusts()) {
            typePrinter.printMust(out, level, node.getModule(), must);
        }
    }

    private void printTypedefs(YinOutput out, int level, SchemaNode node) throws SchemaPrintException {
        for (Typedef typedef : node.getTypedefs()) {
            typePrinter.printTypedef(out, level, node.getModule(), typedef);
        }
    }
}
