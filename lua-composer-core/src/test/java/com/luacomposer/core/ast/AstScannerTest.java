package com.luacomposer.core.ast;

import com.luacomposer.core.ast.LuaAst.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AstScanner}.
 */
class AstScannerTest {

    @Test
    void scan_visitsNamesInNestedFunctionsAndTables() {
        Chunk chunk = new LuaAstParser().parse("""
            local t = { f = function() return helper(x) end }
            while check() do t[key] = -value end
            """, "a.lua");

        List<String> names = new ArrayList<>();
        new AstScanner() {
            @Override
            public Void visitNameExpression(NameExpression node) {
                names.add(node.name());
                return null;
            }
        }.scan(chunk);

        assertThat(names).containsExactly("helper", "x", "check", "t", "key", "value");
    }

    @Test
    void scanStatement_isCalledForEveryStatementInEveryBlock() {
        Chunk chunk = new LuaAstParser().parse("do a() end\nif b then c() end\n", "a.lua");

        List<String> statements = new ArrayList<>();
        new AstScanner() {
            @Override
            protected void scanStatement(Statement statement) {
                statements.add(statement.getClass().getSimpleName());
                super.scanStatement(statement);
            }
        }.scan(chunk);

        assertThat(statements).containsExactly("DoStatement", "CallStatement", "IfStatement", "CallStatement");
    }
}
