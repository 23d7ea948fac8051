package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

/**
 * {@code rpc} tanımı. Alt düğümleri {@code grouping}, {@code input} ve {@code output} olabilir.
 */
public final class RpcNode extends SchemaNode {

    public RpcNode(String name, SchemaModule module) {
        super(name, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RPC;
    }
}
