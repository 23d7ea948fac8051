package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code leaf} düğümü. Her leaf bir tip taşır.
 */
public final class LeafNode extends SchemaNode {

    private SchemaType type;
    private String units;
    private String defaultValue;

    public LeafNode(String name, SchemaModule module) {
        super(name, module);
    }

    public LeafNode(String name, SchemaModule module, SchemaType type) {
        super(name, module);
        this.type = type;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LEAF;
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

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }
}
