package com.luacomposer.core.dependency;

import com.luacomposer.core.model.ExternalDependency;
import com.luacomposer.core.model.SourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DependencySequencer}.
 */
class DependencySequencerTest {

    @Test
    void format_releaseWithLicense_writesFullHeader() {
        ExternalDependency mist = new ExternalDependency("mist", SourceKind.GITHUB_RELEASE,
            "mrSkortch/MissionScriptingTools@4.5", "mist.lua", "mist = {}", "GPL v3\n\nSee COPYING\n",
            "Mission Scripting Tools");

        assertThat(DependencySequencer.format(List.of(mist))).isEqualTo("""

            -- External Dependency: mist
            -- Description: Mission Scripting Tools
            -- Source: mrSkortch/MissionScriptingTools@4.5
            -- File: mist.lua
            -- License:
            -- GPL v3
            --
            -- See COPYING

            mist = {}
            """);
    }

    @Test
    void format_minimalDependencies_keepsDeclarationOrderAndSkipsAbsentFields() {
        ExternalDependency first = new ExternalDependency("b", SourceKind.URL, "https://x/b.lua", "ignored.lua",
            "B = 1", null, null);
        ExternalDependency second = new ExternalDependency("a", SourceKind.LOCAL, "deps/a.lua", null,
            "A = 1", "  ", "");

        assertThat(DependencySequencer.format(List.of(first, second))).isEqualTo("""

            -- External Dependency: b
            -- Source: https://x/b.lua

            B = 1

            -- External Dependency: a
            -- Source: deps/a.lua

            A = 1
            """);
    }

    @Test
    void format_contentIsNotSanitized() {
        ExternalDependency dependency = new ExternalDependency("d", SourceKind.LOCAL, "d.lua", null,
            "print('x')\nrequire('y')", null, null);

        assertThat(DependencySequencer.format(List.of(dependency))).contains("print('x')\nrequire('y')");
    }

    @Test
    void format_noDependencies_isEmpty() {
        assertThat(DependencySequencer.format(List.of())).isEmpty();
    }
}
