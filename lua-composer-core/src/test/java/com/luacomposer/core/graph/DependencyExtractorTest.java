package com.luacomposer.core.graph;

import com.luacomposer.core.ast.LuaAstParser;
import com.luacomposer.core.model.RequireReference;
import com.luacomposer.core.model.WarningCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DependencyExtractor}.
 */
class DependencyExtractorTest {

    private final LuaAstParser parser = new LuaAstParser();
    private final DependencyExtractor extractor = new DependencyExtractor();

    private DependencyExtractor.Extraction extract(String source) {
        return extractor.extract(parser.parse(source, "m.lua"), "m.lua");
    }

    @Test
    void extract_literalRequires_normalizesIdentities() {
        DependencyExtractor.Extraction extraction = extract("""
            local a = require("util.strings")
            require 'net/http'
            require [[core\\log]]
            """);

        assertThat(extraction.requires()).extracting(RequireReference::identity)
            .containsExactly("util.strings", "net.http", "core.log");
        assertThat(extraction.warnings()).isEmpty();
    }

    @Test
    void extract_luaSuffixInTarget_isPartOfIdentity() {
        DependencyExtractor.Extraction extraction = extract("require('lib.lua')\n");

        assertThat(extraction.requires()).extracting(RequireReference::identity).containsExactly("lib.lua");
    }

    @Test
    void extract_requireInsideFunctionBody_isCounted() {
        DependencyExtractor.Extraction extraction = extract("""
            local function load()
              return require("lazy.module")
            end
            """);

        assertThat(extraction.requires()).singleElement()
            .satisfies(require -> {
                assertThat(require.identity()).isEqualTo("lazy.module");
                assertThat(require.line()).isEqualTo(2);
            });
    }

    @Test
    void extract_duplicateRequires_keepsFirstOccurrence() {
        DependencyExtractor.Extraction extraction = extract("require('a')\nrequire('b')\nrequire('a')\n");

        assertThat(extraction.requires()).extracting(RequireReference::identity).containsExactly("a", "b");
        assertThat(extraction.requires().get(0).line()).isEqualTo(1);
    }

    @Test
    void extract_dynamicRequire_warnsAndAddsNoEdge() {
        DependencyExtractor.Extraction extraction = extract("""
            local name = "x"
            require(name)
            require("a", "b")
            require("pre" .. name)
            """);

        assertThat(extraction.requires()).isEmpty();
        assertThat(extraction.warnings()).hasSize(3)
            .allSatisfy(warning -> assertThat(warning.code()).isEqualTo(WarningCode.DYNAMIC_REQUIRE));
        assertThat(extraction.warnings()).extracting(warning -> warning.line()).containsExactly(2, 3, 4);
    }

    @Test
    void extract_requireAsMemberOrString_isIgnored() {
        DependencyExtractor.Extraction extraction = extract("""
            local s = "require('x')"
            -- require('y')
            mod.require("z")
            """);

        assertThat(extraction.requires()).isEmpty();
        assertThat(extraction.warnings()).isEmpty();
    }
}
