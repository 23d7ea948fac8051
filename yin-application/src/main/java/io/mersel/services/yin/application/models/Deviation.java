package io.mersel.services.yin.application.models;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code deviation} ifadesi. Hedef yol iç kodlamada tutulur.
 */
public class Deviation {

    private final String targetPath;
    private String description;
    private String reference;
    private final List<Deviate> deviates = new ArrayList<>();

    public Deviation(String targetPath) {
        this.targetPath = targetPath;
    }

    public String getTargetPath() {
        return targetPath;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getReference() {
        return reference;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    public List<Deviate> getDeviates() {
        return deviates;
    }

    @Override
    public String toString() {
        return "deviation \"" + targetPath + "\"";
    }
}
