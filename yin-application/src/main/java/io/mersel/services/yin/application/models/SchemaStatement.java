package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.Status;

/**
 * Adı, sahibi olan modülü ve ortak açıklayıcı alt ifadeleri olan her YANG ifadesinin tabanı.
 * <p>
 * Modül referansı sahiplik taşımaz; ağaç modül tarafından sahiplenilir.
 */
public abstract class SchemaStatement {

    private final String name;
    private final SchemaModule module;

    /** {@code null} ise status açıkça belirtilmemiştir. */
    private Status status;
    private String description;
    private String reference;

    protected SchemaStatement(String name, SchemaModule module) {
        this.name = name;
        this.module = module;
    }

    public String getName() {
        return name;
    }

    /** İfadeyi tanımlayan modül (alt modülde tanımlandıysa alt modülün kendisi). */
    public SchemaModule getModule() {
        return module;
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
}
