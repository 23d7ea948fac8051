package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.DeviateKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Bir {@code deviation} içindeki tek {@code deviate} girdisi.
 */
public class Deviate {

    private final DeviateKind kind;
    private Boolean config;
    private Boolean mandatory;
    private String defaultValue;
    private Integer minElements;

    /** {@code 0} sınırsız ({@code unbounded}) anlamına gelir, {@code null} belirtilmemiş. */
    private Integer maxElements;
    private final List<Restriction> musts = new ArrayList<>();
    private final List<Unique> uniques = new ArrayList<>();
    private SchemaType type;
    private String units;

    public Deviate(DeviateKind kind) {
        this.kind = kind;
    }

    public DeviateKind getKind() {
        return kind;
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

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
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

    public List<Restriction> getMusts() {
        return musts;
    }

    public List<Unique> getUniques() {
        return uniques;
    }

    public SchemaType getType() {
        return type;
    }

    public void setType(SchemaType type) {
        this.type = type;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        this.units = units;
    }
}
