package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * Bir {@code rpc} içindeki {@code input} veya {@code output} gövdesi.
 */
public final class InputOutputNode extends SchemaNode {

    private final boolean input;

    private InputOutputNode(boolean input, SchemaModule module) {
        super(input ? "input" : "output", module);
        this.input = input;
    }

    public static InputOutputNode input(SchemaModule module) {
        return new InputOutputNode(true, module);
    }

    public static InputOutputNode output(SchemaModule module) {
        return new InputOutputNode(false, module);
    }

    @Override
    public NodeKind getKind() {
        return input ? NodeKind.INPUT : NodeKind.OUTPUT;
    }

    public boolean isInput() {
        return input;
    }
}
