package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;
import io.mersel.services.yin.application.enums.Status;

import java.util.ArrayList;
import java.util.List;

/**
 * Bir {@code uses} içindeki {@code refine} ifadesi.
 * <p>
 * {@code default}, {@code presence} ve eleman sınırları hedef düğümün türüne göre yazılır.
 */
public class Refine {

    private final String targetPath;
    private final NodeKind targetKind;
    private Boolean config;
    private Boolean mandatory;
    private Status status;
    private String description;
    private String reference;
    private final List<Restriction> musts = new ArrayList<>();
    private String defaultValue;
    private String presence;
    private Integer minElements;

    /** {@code 0} sınırsız ({@code unbounded}) anlamına gelir, {@code null} belirtilmemiş. */
    private Integer maxElements;

    public Refine(String targetPath, NodeKind targetKind) {
        this.targetPath = targetPath;
        this.targetKind = targetKind;
    }

    public String getTargetPath() {
        return targetPath;
    }

    public NodeKind getTargetKind() {
        return targetKind;
    }

    public Boolean getConfig() {
        return config;
    }

    public void setConfig(Boolean config) {
        this.config = config;
    }

    public Boolean getMandatory() {
        return mandatory;
    }

    public void setMandatory(Boolean mandatory) {
        this.mandatory = mandatory;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
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

    public List<Restriction> getMusts() {
        return musts;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    public String getPresence() {
        return presence;
    }

    public void setPresence(String presence) {
        this.presence = presence;
    }

    public Integer getMinElements() {
        return minElements;
    }

    public void setMinElements(Integer minElements) {
        this.minElements = minElements;
    }

    public Integer getMaxElements() {
        return maxElements;
    }

    public void setMaxElements(Integer maxElements) {
        this.maxElements = maxElements;
    }

    @Override
    public String toString() {
        return "refine \"" + targetPath + "\"";
    }
}
