package com.luacomposer.core.sanitizer;

import com.luacomposer.core.ast.LuaAst.*;
import com.luacomposer.core.error.GotoException;
import com.luacomposer.core.error.StrictModeViolationException;
import com.luacomposer.core.graph.DependencyExtractor;
import com.luacomposer.core.model.WarningCode;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The default rule table for the DCS mission scripting environment, in priority order.
 *
 * <ol>
 *   <li>{@code goto} statements abort the module</li>
 *   <li>(strict) access to {@code os}, {@code io} or {@code lfs} aborts the module</li>
 *   <li>{@code log.info} becomes {@code env.info}</li>
 *   <li>{@code log.warning} becomes {@code env.warning}</li>
 *   <li>{@code log.error} becomes {@code env.error}</li>
 *   <li>any other {@code log.*} call is removed</li>
 *   <li>{@code print} becomes {@code env.info}</li>
 *   <li>{@code loadlib} calls are removed with a warning</li>
 *   <li>literal {@code require} calls are removed</li>
 *   <li>statements mentioning the {@code package} identifier lose their lines</li>
 * </ol>
 */
public final class SanitizationRules {

    static final Set<String> HOST_LIBRARIES = Set.of("os", "io", "lfs");
    private static final Set<String> REWRITTEN_LOG_LEVELS = Set.of("info", "warning", "error");
    private static final String PACKAGE = "package";

    private SanitizationRules() {
        // Utility class
    }

    public static List<SanitizationRule> defaults() {
        return List.of(
            SanitizationRule.fail("goto", node -> node instanceof GotoStatement, false,
                (node, path, lineText) -> new GotoException(path, node.span().line(), node.span().column(), lineText)),
            SanitizationRule.fail("strict-host-api", SanitizationRules::isHostApiUsage, true,
                (node, path, lineText) -> new StrictModeViolationException(path, node.span().line(),
                    node.span().column(), describeHostApiUsage(node), lineText)),
            SanitizationRule.rewriteCallee("log-info", logCall("info"), "env.info"),
            SanitizationRule.rewriteCallee("log-warning", logCall("warning"), "env.warning"),
            SanitizationRule.rewriteCallee("log-error", logCall("error"), "env.error"),
            SanitizationRule.removeStatement("log-other", SanitizationRules::isOtherLogCall, null),
            SanitizationRule.rewriteCallee("print", bareCall("print"), "env.info"),
            SanitizationRule.removeStatement("loadlib", bareCall("loadlib"), WarningCode.LOADLIB_REMOVED),
            SanitizationRule.removeStatement("require",
                node -> node instanceof FunctionCall call && DependencyExtractor.literalTarget(call).isPresent(),
                null),
            SanitizationRule.removeLines("package", SanitizationRules::referencesPackage)
        );
    }

    // ------------------------------------------------------------------ matchers

    static Predicate<Node> bareCall(String name) {
        return node -> node instanceof FunctionCall call
            && call.callee() instanceof NameExpression callee
            && callee.name().equals(name);
    }

    static Predicate<Node> logCall(String level) {
        return node -> node instanceof FunctionCall call && level.equals(logLevel(call));
    }

    static boolean isOtherLogCall(Node node) {
        if (node instanceof FunctionCall call) {
            String level = logLevel(call);
            return level != null && !REWRITTEN_LOG_LEVELS.contains(level);
        }
        return false;
    }

    private static String logLevel(FunctionCall call) {
        if (call.callee() instanceof MemberExpression member
            && member.target() instanceof NameExpression target
            && target.name().equals("log")) {
            return member.name();
        }
        return null;
    }

    static boolean isHostApiUsage(Node node) {
        if (node instanceof MemberExpression member) {
            return isHostLibrary(member.target());
        }
        if (node instanceof IndexExpression index) {
            return isHostLibrary(index.target());
        }
        if (node instanceof MethodCall call) {
            return isHostLibrary(call.receiver());
        }
        if (node instanceof FunctionCall call) {
            return isHostLibrary(call.callee());
        }
        return false;
    }

    private static boolean isHostLibrary(Expression expression) {
        return expression instanceof NameExpression name && HOST_LIBRARIES.contains(name.name());
    }

    /**
     * Renders a host API access for diagnostics, e.g. {@code os.time}.
     */
    static String describeHostApiUsage(Node node) {
        if (node instanceof MemberExpression member) {
            return libraryName(member.target()) + "." + member.name();
        }
        if (node instanceof IndexExpression index) {
            String key = index.key() instanceof StringLiteral literal ? literal.value() : "[...]";
            return libraryName(index.target()) + "." + key;
        }
        if (node instanceof MethodCall call) {
            return libraryName(call.receiver()) + ":" + call.method();
        }
        if (node instanceof FunctionCall call) {
            return libraryName(call.callee()) + "()";
        }
        return node.getClass().getSimpleName();
    }

    private static String libraryName(Expression expression) {
        return ((NameExpression) expression).name();
    }

    /**
     * Checks whether a node mentions the {@code package} identifier token as a
     * name, member name, table key or declared name. String contents do not count.
     */
    static boolean referencesPackage(Node node) {
        if (node instanceof NameExpression name) {
            return PACKAGE.equals(name.name());
        }
        if (node instanceof MemberExpression member) {
            return PACKAGE.equals(member.name());
        }
        if (node instanceof MethodCall call) {
            return PACKAGE.equals(call.method());
        }
        if (node instanceof NamedField field) {
            return PACKAGE.equals(field.name());
        }
        if (node instanceof LocalStatement local) {
            return local.names().stream().anyMatch(name -> PACKAGE.equals(name.name()));
        }
        if (node instanceof LocalFunctionStatement function) {
            return PACKAGE.equals(function.name());
        }
        if (node instanceof FunctionStatement function) {
            return function.namePath().contains(PACKAGE) || PACKAGE.equals(function.methodName());
        }
        if (node instanceof NumericForStatement loop) {
            return PACKAGE.equals(loop.variable());
        }
        if (node instanceof GenericForStatement loop) {
            return loop.variables().contains(PACKAGE);
        }
        if (node instanceof FunctionExpression function) {
            return function.parameters().contains(PACKAGE);
        }
        return false;
    }
}
