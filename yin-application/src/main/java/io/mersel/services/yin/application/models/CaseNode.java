package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code case} düğümü.
 */
public final class CaseNode extends SchemaNode {

    public CaseNode(String name, SchemaModule module) {
        super(name, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CASE;
    }
}
