package com.luacomposer.core.compose;

import com.luacomposer.core.dependency.DependencySequencer;
import com.luacomposer.core.model.ScopeMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lays out the sections of the composed script.
 *
 * <p>Order: header, banner, scope open, external dependencies, namespace,
 * core modules, entrypoint, scope close, footer. Scope markers are only
 * planned in {@link ScopeMode#LOCAL}; header and footer always stay outside
 * the {@code do ... end} block.
 */
public class CompositionPlanner {

    private static final Logger log = LoggerFactory.getLogger(CompositionPlanner.class);

    static final String BANNER_TITLE = "-- Combined and Sanitized Lua script generated on ";
    static final String RELEASE_NOTICE =
        "-- THIS IS A RELEASE FILE. DO NOT EDIT THIS FILE DIRECTLY. EDIT SOURCE FILES AND REBUILD.";

    public CompositionPlan plan(CompositionInput input) {
        List<Section> sections = new ArrayList<>();

        if (input.header() != null) {
            sections.add(new Section(SectionKind.HEADER, input.header().module().relativePath(),
                input.header().text() + "\n"));
        }
        sections.add(new Section(SectionKind.BANNER, "banner", banner(input)));

        if (input.scope() == ScopeMode.LOCAL) {
            sections.add(new Section(SectionKind.SCOPE_OPEN, "scope", "-- Beginning of local scope\ndo\n\n"));
        }
        if (!input.dependencies().isEmpty()) {
            sections.add(new Section(SectionKind.DEPENDENCIES, "dependencies",
                DependencySequencer.format(input.dependencies())));
        }

        ComposedModule namespace = input.namespace();
        sections.add(new Section(SectionKind.NAMESPACE, namespace.module().identity(),
            "-- Namespace Content from: " + namespace.module().relativePath() + "\n" + namespace.text() + "\n"));

        for (ComposedModule core : input.coreModules()) {
            sections.add(new Section(SectionKind.CORE_MODULE, core.module().identity(),
                "\n-- Core Module Content from: " + core.module().relativePath() + "\n"
                    + "-- Module Name: " + core.module().identity() + "\n"
                    + core.text() + "\n"));
        }

        ComposedModule entrypoint = input.entrypoint();
        sections.add(new Section(SectionKind.ENTRYPOINT, entrypoint.module().identity(),
            "\n-- Entrypoint Content from: " + entrypoint.module().relativePath() + "\n" + entrypoint.text() + "\n"));

        if (input.scope() == ScopeMode.LOCAL) {
            sections.add(new Section(SectionKind.SCOPE_CLOSE, "scope", "\n-- End of local scope\nend\n"));
        }
        if (input.footer() != null) {
            sections.add(new Section(SectionKind.FOOTER, input.footer().module().relativePath(),
                "\n-- Footer Content from: " + input.footer().module().relativePath() + "\n"
                    + input.footer().text() + "\n"));
        }

        log.debug("Planned {} sections in {} scope", sections.size(), input.scope().id());
        return new CompositionPlan(sections, input.scope());
    }

    static String banner(CompositionInput input) {
        List<String> lines = new ArrayList<>();
        lines.add(BANNER_TITLE
            + DateTimeFormatter.ISO_INSTANT.format(input.generatedAt().truncatedTo(ChronoUnit.SECONDS)));
        lines.add(RELEASE_NOTICE);
        if (input.header() != null) {
            lines.add("-- Header File: " + input.header().module().relativePath());
        }
        if (!input.dependencies().isEmpty()) {
            lines.add("-- External Dependencies: " + input.dependencies().size() + " loaded");
        }
        lines.add("-- Namespace File: " + input.namespace().module().relativePath());
        lines.add("-- Entrypoint File: " + input.entrypoint().module().relativePath());
        if (input.footer() != null) {
            lines.add("-- Footer File: " + input.footer().module().relativePath());
        }
        lines.add("-- Core Modules: " + input.coreModules().size());
        String order = input.coreModules().isEmpty()
            ? "None"
            : input.coreModules().stream().map(core -> core.module().identity()).collect(Collectors.joining(", "));
        lines.add("-- Core Modules Order: " + order);
        lines.add("-- Scope: " + input.scope().id());

        StringBuilder banner = new StringBuilder();
        lines.forEach(line -> banner.append(line).append('\n'));
        return banner.append('\n').toString();
    }
}
