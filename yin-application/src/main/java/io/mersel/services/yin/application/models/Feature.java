package io.mersel.services.yin.application.models;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code feature} tanımı.
 */
public class Feature extends SchemaStatement {

    private final List<Feature> ifFeatures = new ArrayList<>();

    public Feature(String name, SchemaModule module) {
        super(name, module);
    }

    /** Bu feature'ın bağlı olduğu diğer feature'lar. */
    public List<Feature> getIfFeatures() {
        return ifFeatures;
    }

    @Override
    public String toString() {
        return "feature \"" + getName() + "\"";
    }
}
