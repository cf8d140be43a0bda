package com.luacomposer.core.compose;

import com.luacomposer.core.model.ScopeMode;

import java.util.List;
import java.util.Objects;

/**
 * Ordered sections of a composed script plus the scope mode.
 *
 * @param sections sections in emission order
 * @param scope scope mode the sections were planned for
 */
public record CompositionPlan(List<Section> sections, ScopeMode scope) {

    public CompositionPlan {
        Objects.requireNonNull(scope, "scope must not be null");
        sections = List.copyOf(Objects.requireNonNull(sections, "sections must not be null"));
    }

    public List<Section> sectionsOf(SectionKind kind) {
        return sections.stream().filter(section -> section.kind() == kind).toList();
    }
}
