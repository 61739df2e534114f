package faberromanus.faberc.compiler.backend;

import java.util.EnumSet;

/**
 * The features recorded by a single generator invocation. Features can
 * only ever be added.
 */
public class Features {

    private final EnumSet<Feature> recorded;

    public Features() {
        this.recorded = EnumSet.noneOf(Feature.class);
    }

    public void add(Feature feature) {
        this.recorded.add(feature);
    }

    public boolean contains(Feature feature) {
        return this.recorded.contains(feature);
    }

    @Override
    public String toString() {
        return this.recorded.toString();
    }

}
