package com.gridcore.engine.services;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An open batch: its id and the mutations recorded so far, in call order.
 */
public final class Transaction {

    private final String id;
    private final List<Mutation> mutations = new ArrayList<>();

    public Transaction(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public List<Mutation> getMutations() {
        return Collections.unmodifiableList(mutations);
    }

    void record(Mutation mutation) {
        mutations.add(mutation);
    }

    public boolean hasStructuralMutations() {
        return mutations.stream().anyMatch(Mutation::isStructural);
    }
}
