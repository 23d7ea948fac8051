package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code notification} tanımı.
 */
public final class NotificationNode extends SchemaNode {

    public NotificationNode(String name, SchemaModule module) {
        super(name, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NOTIFICATION;
    }
}
