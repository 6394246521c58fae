package io.github.trackidity.flow_finder.model;

import java.util.Comparator;

public record ContractId(String file, String name) implements Comparable<ContractId> {

    private static final Comparator<ContractId> ORDER = Comparator
            .comparing(ContractId::file)
            .thenComparing(ContractId::name);

    @Override
    public int compareTo(ContractId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return file + ":" + name;
    }
}
