package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.AccessControl;
import io.mersel.services.yin.application.enums.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Şema ağacındaki bir düğüm.
 * <p>
 * Düğüm türleri kapalı bir kümedir; her tür kendi alt sınıfıyla temsil edilir ve
 * {@link #getKind()} ile ayırt edilir. Üst düğüm ve modül referansları sahiplik
 * taşımaz, yalnızca alt düğümler ağaç boyunca aşağı doğru dolaşılır.
 * <p>
 * {@code when}, {@code must}, {@code typedef}, {@code config} ve {@code mandatory}
 * alanları yalnızca dilbilgisinin izin verdiği türlerde doldurulur; yazıcı her tür
 * için yalnızca o türün alt ifadelerini yazar.
 */
public abstract sealed class SchemaNode extends SchemaStatement
        permits ContainerNode, ChoiceNode, CaseNode, LeafNode, LeafListNode, ListNode, AnyxmlNode,
        UsesNode, GroupingNode, AugmentNode, RpcNode, InputOutputNode, NotificationNode {

    private SchemaNode parent;
    private final List<SchemaNode> children = new ArrayList<>();
    private final Set<AccessControl> accessControl = EnumSet.noneOf(AccessControl.class);
    private final List<Feature> ifFeatures = new ArrayList<>();
    private final List<Restriction> musts = new ArrayList<>();
    private final List<Typedef> typedefs = new ArrayList<>();
    private When when;

    /** Çözümlenmiş config değeri; {@code null} ise bu düğüm için anlamsızdır (grouping, rpc vb.). */
    private Boolean config;

    /** Açıkça belirtilmiş mandatory değeri; {@code null} ise belirtilmemiştir. */
    private Boolean mandatory;

    protected SchemaNode(String name, SchemaModule module) {
        super(name, module);
    }

    public abstract NodeKind getKind();

    /**
     * Alt düğüm ekler ve üst düğüm referansını bu düğüme bağlar.
     *
     * @return eklenen düğüm
     */
    public <T extends SchemaNode> T addChild(T child) {
        adopt(child);
        children.add(child);
        return child;
    }

    /** Alt düğüm listesi dışında tutulan düğümlerin (uses içindeki augment) üst düğümünü bağlar. */
    protected final void adopt(SchemaNode node) {
        node.parent = this;
    }

    /** Üst düğüm; modül seviyesindeki düğümler için {@code null}. */
    public SchemaNode getParent() {
        return parent;
    }

    public List<SchemaNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Set<AccessControl> getAccessControl() {
        return accessControl;
    }

    public List<Feature> getIfFeatures() {
        return ifFeatures;
    }

    public List<Restriction> getMusts() {
        return musts;
    }

    public List<Typedef> getTypedefs() {
        return typedefs;
    }

    public When getWhen() {
        return when;
    }

    public void setWhen(When when) {
        this.when = when;
    }

    public Boolean getConfig() {
        return config;
    }

    public void setConfig(Boolean config) {
        this.config = config;
    }

    public Boolean getMandatory() {
        return mandatory;
    }

    public void setMandatory(Boolean mandatory) {
        this.mandatory = mandatory;
    }

    @Override
    public String toString() {
        return getKind().getKeyword() + " \"" + getName() + "\"";
    }
}
