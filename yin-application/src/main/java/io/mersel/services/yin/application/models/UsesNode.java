package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code uses} düğümü. Adı kullanılan grouping'in adıdır.
 */
public final class UsesNode extends SchemaNode {

    /** Grouping'i tanımlayan modül; {@code null} ise uses ile aynı modül kabul edilir. */
    private SchemaModule groupingModule;
    private final List<Refine> refines = new ArrayList<>();
    private final List<AugmentNode> augments = new ArrayList<>();

    public UsesNode(String groupingName, SchemaModule module) {
        super(groupingName, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USES;
    }

    public SchemaModule getGroupingModule() {
        return groupingModule;
    }

    public void setGroupingModule(SchemaModule groupingModule) {
        this.groupingModule = groupingModule;
    }

    public List<Refine> getRefines() {
        return refines;
    }

    public List<AugmentNode> getAugments() {
        return Collections.unmodifiableList(augments);
    }

    /**
     * uses içinde tanımlı augment ekler; üst düğümü bu uses olur.
     *
     * @return eklenen augment
     */
    public AugmentNode addAugment(AugmentNode augment) {
        adopt(augment);
        augments.add(augment);
        return augment;
    }
}
