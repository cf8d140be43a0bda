package com.luacomposer.core.graph;

import com.luacomposer.core.ast.AstScanner;
import com.luacomposer.core.ast.LuaAst;
import com.luacomposer.core.ast.LuaAst.FunctionCall;
import com.luacomposer.core.ast.LuaAst.NameExpression;
import com.luacomposer.core.ast.LuaAst.StringLiteral;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.RequireReference;
import com.luacomposer.core.model.WarningCode;
import com.luacomposer.core.util.ModuleIdentity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the modules a Lua chunk requires.
 *
 * <p>A require is a call whose callee is the bare name {@code require} and whose
 * only argument is a string literal, in either {@code require("a.b")} or
 * {@code require "a.b"} form. Calls anywhere in the tree count, including
 * inside function bodies. Any other use of {@code require} as a callee is
 * reported as {@link WarningCode#DYNAMIC_REQUIRE} and contributes no edge.
 *
 * <p>Extraction is pure and does not touch the file system.
 */
public class DependencyExtractor {

    static final String REQUIRE = "require";

    /**
     * Result of scanning one module.
     *
     * @param requires literal requires in first-seen order, one per identity
     * @param warnings dynamic-require warnings
     */
    public record Extraction(List<RequireReference> requires, List<BuildWarning> warnings) {
        public Extraction {
            requires = List.copyOf(requires);
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * Scans a parsed module for requires.
     *
     * @param chunk parsed module
     * @param modulePath path used in warnings
     * @return requires and warnings
     */
    public Extraction extract(LuaAst.Chunk chunk, String modulePath) {
        Map<String, RequireReference> requires = new LinkedHashMap<>();
        List<BuildWarning> warnings = new ArrayList<>();

        new AstScanner() {
            @Override
            public Void visitFunctionCall(FunctionCall node) {
                if (isRequireCallee(node)) {
                    Optional<String> target = literalTarget(node);
                    if (target.isPresent()) {
                        String identity = ModuleIdentity.normalize(target.get());
                        requires.putIfAbsent(identity,
                            new RequireReference(identity, node.span().line(), node.span().column()));
                    } else {
                        warnings.add(new BuildWarning(WarningCode.DYNAMIC_REQUIRE, modulePath, node.span().line(),
                            "require with a non-literal argument is not ordered"));
                    }
                }
                return super.visitFunctionCall(node);
            }
        }.scan(chunk);

        return new Extraction(new ArrayList<>(requires.values()), warnings);
    }

    /**
     * Checks whether a call's callee is the bare name {@code require}.
     *
     * @param call call to test
     * @return true for {@code require(...)} in any form
     */
    public static boolean isRequireCallee(FunctionCall call) {
        return call.callee() instanceof NameExpression name && REQUIRE.equals(name.name());
    }

    /**
     * Returns the string argument of a literal require.
     *
     * @param call call to inspect
     * @return the literal's value, or empty if the call is not a literal require
     */
    public static Optional<String> literalTarget(FunctionCall call) {
        if (isRequireCallee(call)
            && call.arguments().size() == 1
            && call.arguments().get(0) instanceof StringLiteral literal) {
            return Optional.of(literal.value());
        }
        return Optional.empty();
    }
}
