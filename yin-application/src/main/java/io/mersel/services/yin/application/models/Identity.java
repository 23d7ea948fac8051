package io.mersel.services.yin.application.models;

/**
 * {@code identity} tanımı.
 */
public class Identity extends SchemaStatement {

    private Identity base;

    public Identity(String name, SchemaModule module) {
        super(name, module);
    }

    /** Temel identity; {@code null} ise tanımlı değil. */
    public Identity getBase() {
        return base;
    }

    public void setBase(Identity base) {
        this.base = base;
    }

    @Override
    public String toString() {
        return "identity \"" + getName() + "\"";
    }
}
