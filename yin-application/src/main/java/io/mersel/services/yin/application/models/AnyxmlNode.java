package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code anyxml} düğümü.
 */
public final class AnyxmlNode extends SchemaNode {

    public AnyxmlNode(String name, SchemaModule module) {
        super(name, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ANYXML;
    }
}
