package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code container} düğümü.
 */
public final class ContainerNode extends SchemaNode {

    /** {@code presence} açıklaması; {@code null} ise non-presence container. */
    private String presence;

    public ContainerNode(String name, SchemaModule module) {
        super(name, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONTAINER;
    }

    public String getPresence() {
        return presence;
    }

    public void setPresence(String presence) {
        this.presence = presence;
    }
}
