package com.luacomposer.core.sanitizer;

import com.luacomposer.core.ast.LuaAst;
import com.luacomposer.core.model.WarningCode;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One entry of the sanitizer's rule table.
 *
 * <p>Rules are plain data: a matcher over syntax nodes and the action taken on
 * a match. Use the static factories rather than the canonical constructor.
 *
 * @param id stable rule identifier, used in logs
 * @param matcher predicate over syntax nodes
 * @param action what to do on a match
 * @param replacement new callee text for {@link RuleAction#REWRITE_CALLEE}, otherwise {@code null}
 * @param warning warning recorded on a match, or {@code null}
 * @param fatal exception factory for {@link RuleAction#FAIL}, otherwise {@code null}
 * @param strictOnly whether the rule only applies in strict mode
 */
public record SanitizationRule(
    String id,
    Predicate<LuaAst.Node> matcher,
    RuleAction action,
    String replacement,
    WarningCode warning,
    FatalFactory fatal,
    boolean strictOnly
) {
    public SanitizationRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(action, "action must not be null");
        if (action == RuleAction.FAIL && fatal == null) {
            throw new IllegalArgumentException("FAIL rule " + id + " needs a fatal factory");
        }
        if (action == RuleAction.REWRITE_CALLEE && replacement == null) {
            throw new IllegalArgumentException("REWRITE_CALLEE rule " + id + " needs a replacement");
        }
    }

    public static SanitizationRule fail(String id, Predicate<LuaAst.Node> matcher, boolean strictOnly,
                                        FatalFactory fatal) {
        return new SanitizationRule(id, matcher, RuleAction.FAIL, null, null, fatal, strictOnly);
    }

    public static SanitizationRule rewriteCallee(String id, Predicate<LuaAst.Node> matcher, String replacement) {
        return new SanitizationRule(id, matcher, RuleAction.REWRITE_CALLEE, replacement, null, null, false);
    }

    public static SanitizationRule removeStatement(String id, Predicate<LuaAst.Node> matcher, WarningCode warning) {
        return new SanitizationRule(id, matcher, RuleAction.REMOVE_STATEMENT, null, warning, null, false);
    }

    public static SanitizationRule removeLines(String id, Predicate<LuaAst.Node> matcher) {
        return new SanitizationRule(id, matcher, RuleAction.REMOVE_LINES, null, null, null, false);
    }

    public boolean appliesTo(boolean strict) {
        return strict || !strictOnly;
    }

    public boolean matches(LuaAst.Node node) {
        return matcher.test(node);
    }
}
