package io.mersel.services.yin.application.models;

import io.mersel.services.yin.application.enums.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code list} düğümü.
 */
public final class ListNode extends SchemaNode {

    /** Anahtar leaf adları, tanım sırasıyla. */
    private final List<String> keys = new ArrayList<>();
    private final List<Unique> uniques = new ArrayList<>();
    private int minElements;

    /** {@code 0} sınırsız anlamına gelir. */
    private int maxElements;
    private boolean userOrdered;

    public ListNode(String name, SchemaModule module) {
        super(name, module);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST;
    }

    public List<String> getKeys() {
        return keys;
    }

    public List<Unique> getUniques() {
        return uniques;
    }

    public int getMinElements() {
        return minElements;
    }

    public void setMinElements(int minElements) {
        this.minElements = minElements;
    }

    public int getMaxElements() {
        return maxElements;
    }

    public void setMaxElements(int maxElements) {
        this.maxElements = maxElements;
    }

    public boolean isUserOrdered() {
        return userOrdered;
    }

    public void setUserOrdered(boolean userOrdered) {
        this.userOrdered = userOrdered;
    }
}
