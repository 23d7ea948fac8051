package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code augment} ifadesi.
 * <p>
 * Hedef yol iç kodlamada tutulur (düğüm adları modül adlarıyla nitelenir) ve
 * yazdırılırken önek biçimine çevrilir.
 */
public final class AugmentNode extends SchemaNode {

    public AugmentNode(String targetPath, SchemaModule module) {
        super(targetPath, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.AUGMENT;
    }

    public String getTargetPath() {
        return getName();
    }
}
