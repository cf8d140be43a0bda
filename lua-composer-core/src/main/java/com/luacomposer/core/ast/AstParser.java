package com.luacomposer.core.ast;

import com.luacomposer.core.error.ComposerException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses Lua source text into a {@link LuaAst.Chunk}.
 *
 * <p>Parsing is all-or-nothing: any lexical or syntax error fails the whole
 * source with a positioned {@link AstParseException}. There is no partial tree
 * and no fallback.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * AstParser parser = new LuaAstParser();
 * LuaAst.Chunk chunk = parser.parse("local x = require('util')", "main.lua");
 * }</pre>
 *
 * @see LuaAstParser
 */
public interface AstParser {

    /**
     * Parses a string of Lua source.
     *
     * @param source source text
     * @param sourceName name reported in errors, usually the file path
     * @return the parsed chunk
     * @throws AstParseException if the source is not valid Lua
     */
    LuaAst.Chunk parse(String source, String sourceName);

    /**
     * Reads a UTF-8 file and parses it.
     *
     * @param filePath path to the source file
     * @return the parsed chunk
     * @throws IOException if the file cannot be read
     * @throws AstParseException if the source is not valid Lua
     */
    default LuaAst.Chunk parseFile(Path filePath) throws IOException {
        return parse(Files.readString(filePath, StandardCharsets.UTF_8), filePath.toString());
    }

    /**
     * Exception thrown when Lua source cannot be parsed.
     */
    class AstParseException extends ComposerException {

        public AstParseException(String message, String sourceName, int line, int column) {
            super(message, sourceName, line, column);
        }

        public AstParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
