package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.YangVersion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Modül veya alt modül.
 * <p>
 * Şema ağacının sahibidir: üst seviye düğümler, augment'ler ve tüm tanımlar burada tutulur.
 * Liste alanları model kurulurken doldurulur; yazıcı modeli yalnızca okur.
 */
public abstract sealed class SchemaModule permits YangModule, YangSubmodule {

    private final String name;
    private final String prefix;
    private YangVersion version;
    private boolean deviated;
    private String organization;
    private String contact;
    private String description;
    private String reference;

    private final List<Revision> revisions = new ArrayList<>();
    private final List<ModuleImport> imports = new ArrayList<>();
    private final List<SubmoduleInclude> includes = new ArrayList<>();
    private final List<Feature> features = new ArrayList<>();
    private final List<Identity> identities = new ArrayList<>();
    private final List<Typedef> typedefs = new ArrayList<>();
    private final List<Deviation> deviations = new ArrayList<>();
    private final List<SchemaNode> data = new ArrayList<>();
    private final List<AugmentNode> augments = new ArrayList<>();

    protected SchemaModule(String name, String prefix) {
        this.name = name;
        this.prefix = prefix;
    }

    /** Modülün kendisi veya alt modülün ait olduğu modül. */
    public abstract YangModule mainModule();

    public abstract boolean isSubmodule();

    /**
     * Üst seviye veri, rpc veya notification düğümü ekler.
     *
     * @return eklenen düğüm
     */
    public <T extends SchemaNode> T addData(T node) {
        data.add(node);
        return node;
    }

    public String getName() {
        return name;
    }

    /** Modül öneki; alt modülde {@code belongs-to} içindeki önek. */
    public String getPrefix() {
        return prefix;
    }

    /** {@code null} ise {@code yang-version} açıkça belirtilmemiştir. */
    public YangVersion getVersion() {
        return version;
    }

    public void setVersion(YangVersion version) {
        this.version = version;
    }

    /** Başka modüllerdeki deviation'lar bu modüle uygulandı mı? */
    public boolean isDeviated() {
        return deviated;
    }

    public void setDeviated(boolean deviated) {
        this.deviated = deviated;
    }

    public String getOrganization() {
        return organization;
    }

    public void setOrganization(String organization) {
        this.organization = organization;
    }

    public String getContact() {
        return contact;
    }

    public void setContact(String contact) {
        this.contact = contact;
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

    public List<Revision> getRevisions() {
        return revisions;
    }

    public List<ModuleImport> getImports() {
        return imports;
    }

    public List<SubmoduleInclude> getIncludes() {
        return includes;
    }

    public List<Feature> getFeatures() {
        return features;
    }

    public List<Identity> getIdentities() {
        return identities;
    }

    public List<Typedef> getTypedefs() {
        return typedefs;
    }

    public List<Deviation> getDeviations() {
        return deviations;
    }

    /** Üst seviye düğümler, eklenme sırasıyla. */
    public List<SchemaNode> getData() {
        return Collections.unmodifiableList(data);
    }

    public List<AugmentNode> getAugments() {
        return augments;
    }

    @Override
    public String toString() {
        return (isSubmodule() ? "submodule \"" : "module \"") + name + "\"";
    }
}
