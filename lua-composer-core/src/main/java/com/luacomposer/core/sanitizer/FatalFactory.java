package com.luacomposer.core.sanitizer;

import com.luacomposer.core.ast.LuaAst;
import com.luacomposer.core.error.ComposerException;

/**
 * Creates the exception reported when a {@link RuleAction#FAIL} rule matches.
 */
@FunctionalInterface
public interface FatalFactory {

    /**
     * @param node matched node
     * @param modulePath path of the module being sanitized
     * @param lineText trimmed text of the line the node starts on
     * @return the fatal condition to report
     */
    ComposerException create(LuaAst.Node node, String modulePath, String lineText);
}
