package com.luacomposer.core.ast;

import com.luacomposer.core.ast.LuaAst.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LuaAstParser}.
 */
class LuaAstParserTest {

    private final LuaAstParser parser = new LuaAstParser();

    @Test
    void parse_localAssignment_buildsLocalStatement() {
        Chunk chunk = parser.parse("local x, y <const> = 1, 'two'\n", "a.lua");

        assertThat(chunk.sourceName()).isEqualTo("a.lua");
        assertThat(chunk.block().statements()).hasSize(1);
        LocalStatement local = (LocalStatement) chunk.block().statements().get(0);
        assertThat(local.names()).extracting(AttributedName::name).containsExactly("x", "y");
        assertThat(local.names().get(1).attribute()).isEqualTo("const");
        assertThat(local.values()).hasSize(2);
        assertThat(local.values().get(0)).isInstanceOf(NumberLiteral.class);
        assertThat(((StringLiteral) local.values().get(1)).value()).isEqualTo("two");
    }

    @Test
    void parse_callStatement_recordsSpanOfCall() {
        String source = "x = 1\n  print(\"hi\")\n";
        Chunk chunk = parser.parse(source, "a.lua");

        CallStatement statement = (CallStatement) chunk.block().statements().get(1);
        FunctionCall call = (FunctionCall) statement.call();
        assertThat(((NameExpression) call.callee()).name()).isEqualTo("print");
        assertThat(call.span().line()).isEqualTo(2);
        assertThat(call.span().column()).isEqualTo(2);
        assertThat(source.substring(call.span().start(), call.span().end())).isEqualTo("print(\"hi\")");
    }

    @Test
    void parse_memberAndMethodCalls_distinguishesCallForms() {
        Chunk chunk = parser.parse("log.info('a')\nobj:run(1)\nrequire 'x'\n", "a.lua");

        FunctionCall member = (FunctionCall) ((CallStatement) chunk.block().statements().get(0)).call();
        assertThat(member.callee()).isInstanceOf(MemberExpression.class);
        assertThat(((MemberExpression) member.callee()).name()).isEqualTo("info");

        MethodCall method = (MethodCall) ((CallStatement) chunk.block().statements().get(1)).call();
        assertThat(method.method()).isEqualTo("run");
        assertThat(method.arguments()).hasSize(1);

        FunctionCall require = (FunctionCall) ((CallStatement) chunk.block().statements().get(2)).call();
        assertThat(require.arguments()).singleElement().isInstanceOf(StringLiteral.class);
    }

    @Test
    void parse_controlFlow_buildsNestedBlocks() {
        Chunk chunk = parser.parse("""
            local function f(a, ...)
              for i = 1, 10, 2 do
                if a then return i elseif b then break else goto done end
              end
              ::done::
            end
            """, "a.lua");

        LocalFunctionStatement function = (LocalFunctionStatement) chunk.block().statements().get(0);
        assertThat(function.name()).isEqualTo("f");
        assertThat(function.function().parameters()).containsExactly("a");
        assertThat(function.function().vararg()).isTrue();

        NumericForStatement loop = (NumericForStatement) function.function().body().statements().get(0);
        assertThat(loop.variable()).isEqualTo("i");
        assertThat(loop.step()).isNotNull();

        IfStatement branch = (IfStatement) loop.body().statements().get(0);
        assertThat(branch.conditions()).hasSize(2);
        assertThat(branch.elseBlock().statements()).singleElement().isInstanceOf(GotoStatement.class);
        assertThat(function.function().body().statements().get(1)).isInstanceOf(LabelStatement.class);
    }

    @Test
    void parse_methodFunctionDefinition_recordsNamePathAndMethod() {
        Chunk chunk = parser.parse("function a.b:c(x) return x end", "a.lua");

        FunctionStatement function = (FunctionStatement) chunk.block().statements().get(0);
        assertThat(function.namePath()).containsExactly("a", "b");
        assertThat(function.methodName()).isEqualTo("c");
    }

    @Test
    void parse_operators_respectsPrecedence() {
        Chunk chunk = parser.parse("x = 1 + 2 * 3 .. 'a' .. 'b'", "a.lua");

        AssignStatement assign = (AssignStatement) chunk.block().statements().get(0);
        BinaryExpression concat = (BinaryExpression) assign.values().get(0);
        assertThat(concat.operator()).isEqualTo("..");
        assertThat(((BinaryExpression) concat.left()).operator()).isEqualTo("+");
        assertThat(((BinaryExpression) concat.right()).operator()).isEqualTo("..");
    }

    @Test
    void parse_tableConstructor_buildsAllFieldKinds() {
        Chunk chunk = parser.parse("t = { 1, name = 2, [3] = 4; }", "a.lua");

        TableConstructor table = (TableConstructor) ((AssignStatement) chunk.block().statements().get(0)).values().get(0);
        assertThat(table.fields()).hasSize(3);
        assertThat(table.fields().get(0)).isInstanceOf(PositionalField.class);
        assertThat(((NamedField) table.fields().get(1)).name()).isEqualTo("name");
        assertThat(table.fields().get(2)).isInstanceOf(KeyedField.class);
    }

    @Test
    void parse_stringsAndComments_decodesLiterals() {
        Chunk chunk = parser.parse("""
            --[[ long
            comment ]]
            a = "tab\\there"
            b = [==[
            raw]==]
            """, "a.lua");

        StringLiteral a = (StringLiteral) ((AssignStatement) chunk.block().statements().get(0)).values().get(0);
        StringLiteral b = (StringLiteral) ((AssignStatement) chunk.block().statements().get(1)).values().get(0);
        assertThat(a.value()).isEqualTo("tab\there");
        assertThat(b.value()).isEqualTo("raw");
    }

    @Test
    void parse_supplementaryCharacters_keepsCharOffsets() {
        String source = "s = '😀'\nprint(s)\n";
        Chunk chunk = parser.parse(source, "a.lua");

        CallStatement call = (CallStatement) chunk.block().statements().get(1);
        assertThat(source.substring(call.span().start(), call.span().end())).isEqualTo("print(s)");
    }

    @Test
    void parse_syntaxError_throwsPositionedException() {
        assertThatThrownBy(() -> parser.parse("x = = 1\n", "broken.lua"))
            .isInstanceOf(AstParser.AstParseException.class)
            .hasMessageContaining("broken.lua")
            .hasMessageContaining("line 1");
    }

    @Test
    void parse_expressionStatementThatIsNotACall_isRejected() {
        assertThatThrownBy(() -> parser.parse("x.y\n", "a.lua"))
            .isInstanceOf(AstParser.AstParseException.class);
    }
}
