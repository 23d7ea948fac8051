package io.mersel.services.yin.application.models;

/**
 * {@code typedef} tanımı.
 */
public class Typedef extends SchemaStatement {

    private final SchemaType type;
    private String units;
    private String defaultValue;

    public Typedef(String name, SchemaModule module, SchemaType type) {
        super(name, module);
        this.type = type;
    }

    public SchemaType getType() {
        return type;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        this.units = units;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    @Override
    public String toString() {
        return "typedef \"" + getName() + "\"";
    }
}
