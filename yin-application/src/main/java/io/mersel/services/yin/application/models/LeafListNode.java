package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code leaf-list} düğümü.
 */
public final class LeafListNode extends SchemaNode {

    private SchemaType type;
    private String units;
    private int minElements;

    /** {@code 0} sınırsız anlamına gelir. */
    private int maxElements;
    private boolean userOrdered;

    public LeafListNode(String name, SchemaModule module) {
        super(name, module);
    }

    public LeafListNode(String name, SchemaModule module, SchemaType type) {
        super(name, module);
        this.type = type;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LEAF_LIST;
    }

    public SchemaType getType() {
        return type;
    }

    public void setType(SchemaType type) {
        this.type = type;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        this.units = units;
    }

    public int getMinElements() {
        return minElements;
    }

    public void setMinElements(int minElements) {
        this.minElements = minElements;
    }

    public int getMaxElements() {
        return maxElements;
    }

    public void setMaxElements(int maxElements) {
        this.maxElements = maxElements;
    }

    public boolean isUserOrdered() {
        return userOrdered;
    }

    public void setUserOrdered(boolean userOrdered) {
        this.userOrdered = userOrdered;
    }
}
