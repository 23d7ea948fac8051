package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code grouping} tanımı.
 */
public final class GroupingNode extends SchemaNode {

    public GroupingNode(String name, SchemaModule module) {
        super(name, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GROUPING;
    }
}
