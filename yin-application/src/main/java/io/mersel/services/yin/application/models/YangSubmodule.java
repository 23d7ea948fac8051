package io.mersel.services.yin.application.models;

/**
 * Alt modül. Kendi namespace'i yoktur; ait olduğu modülün önekini kullanır.
 */
public final class YangSubmodule extends SchemaModule {

    private final YangModule belongsTo;

    public YangSubmodule(String name, YangModule belongsTo, String prefix) {
        super(name, prefix);
        this.belongsTo = belongsTo;
    }

    public YangModule getBelongsTo() {
        return belongsTo;
    }

    @Override
    public YangModule mainModule() {
        return belongsTo;
    }

    @Override
    public boolean isSubmodule() {
        return true;
    }
}
