package com.pipeline.adg.decl;

import java.util.ArrayList;
import java.util.List;

/**
 * A finalized set of source and step declarations, the input to graph resolution.
 */
public record Declarations(List<SourceDeclaration> sources, List<StepDeclaration> steps) {

    public Declarations {
        sources = List.copyOf(sources);
        steps = List.copyOf(steps);
    }

    public static Declarations of(List<SourceDeclaration> sources, List<StepDeclaration> steps) {
        return new Declarations(sources, steps);
    }

    /** Concatenation of both declaration sets, this one first. */
    public Declarations plus(Declarations other) {
        List<SourceDeclaration> s = new ArrayList<>(sources);
        s.addAll(other.sources);
        List<StepDeclaration> st = new ArrayList<>(steps);
        st.addAll(other.steps);
        return new Declarations(s, st);
    }

    /** Copy whose declaration sites are prefixed with {@code location}. */
    public Declarations relocate(String location) {
        List<SourceDeclaration> s = new ArrayList<>(sources.size());
        for (SourceDeclaration d : sources)
            s.add(d.withSite(location + ":" + d.site()));
        List<StepDeclaration> st = new ArrayList<>(steps.size());
        for (StepDeclaration d : steps)
            st.add(d.withSite(location + ":" + d.site()));
        return new Declarations(s, st);
    }
}
