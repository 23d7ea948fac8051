package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code choice} düğümü.
 */
public final class ChoiceNode extends SchemaNode {

    /** Varsayılan case adı; {@code null} ise tanımlı değil. */
    private String defaultCase;

    public ChoiceNode(String name, SchemaModule module) {
        super(name, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CHOICE;
    }

    public String getDefaultCase() {
        return defaultCase;
    }

    public void setDefaultCase(String defaultCase) {
        this.defaultCase = defaultCase;
    }
}
