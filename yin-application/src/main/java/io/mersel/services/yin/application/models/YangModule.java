package io.mersel.services.yin.application.models;

/**
 * Ana modül.
 */
public final class YangModule extends SchemaModule {

    private final String namespace;

    public YangModule(String name, String prefix, String namespace) {
        super(name, prefix);
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }

    @Override
    public YangModule mainModule() {
        return this;
    }

    @Override
    public boolean isSubmodule() {
        return false;
    }
}
