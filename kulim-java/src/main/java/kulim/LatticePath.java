package kulim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A start-to-end path through a lattice with its cost breakdown.
 *
 * Total cost is the sum of the emission costs of the nodes plus every
 * transition, including the ones out of {@code BOS} and into {@code EOS}.
 */
public final class LatticePath {

    private final Lattice lattice;
    private final List<LatticeNode> nodes;
    private final long[] emissions;
    private final long emissionCost;
    private final long transitionCost;

    private LatticePath(Lattice lattice, List<LatticeNode> nodes, long[] emissions,
                        long emissionCost, long transitionCost) {
        this.lattice = lattice;
        this.nodes = nodes;
        this.emissions = emissions;
        this.emissionCost = emissionCost;
        this.transitionCost = transitionCost;
    }

    /**
     * @param emissions emission cost of each node, in path order
     */
    static LatticePath of(Lattice lattice, List<LatticeNode> nodes, long[] emissions, TransitionCostTable transitions) {
        if (emissions.length != nodes.size()) {
            throw new IllegalArgumentException(nodes.size() + " nodes but " + emissions.length + " emissions");
        }
        long emissionTotal = 0;
        long transitionTotal = 0;
        String previous = PosTags.BOS;
        for (int i = 0; i < nodes.size(); i++) {
            LatticeNode node = nodes.get(i);
            emissionTotal += emissions[i];
            transitionTotal += transitions.cost(previous, node.pos());
            previous = node.pos();
        }
        transitionTotal += transitions.cost(previous, PosTags.EOS);
        return new LatticePath(lattice, Collections.unmodifiableList(new ArrayList<>(nodes)),
            emissions.clone(), emissionTotal, transitionTotal);
    }

    public Lattice lattice() {
        return lattice;
    }

    /**
     * Nodes in text order, without the virtual BOS and EOS nodes.
     */
    public List<LatticeNode> nodes() {
        return nodes;
    }

    public long totalCost() {
        return emissionCost + transitionCost;
    }

    public long emissionCost() {
        return emissionCost;
    }

    public long transitionCost() {
        return transitionCost;
    }

    public long emission(int i) {
        return emissions[i];
    }

    /**
     * The path as morphs. A compound entry stays one morph; its components share its span.
     */
    public List<Morph> morphs() {
        List<Morph> morphs = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            LatticeNode node = nodes.get(i);
            DictionaryEntry entry = node.entry();
            List<Morph> components = null;
            if (entry.isCompound()) {
                components = new ArrayList<>(entry.components().size());
                for (Morph component : entry.components()) {
                    components.add(component.withSpan(node.start(), node.end()));
                }
            }
            int cost = (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, emissions[i]));
            morphs.add(new Morph(entry.surface(), entry.pos(), entry.lemma(), cost,
                node.start(), node.end(), components));
        }
        return morphs;
    }

    @Override
    public String toString() {
        return nodes + " cost=" + totalCost();
    }
}
