package com.luacomposer.core.sanitizer;

import com.luacomposer.core.ast.AstScanner;
import com.luacomposer.core.ast.LuaAst;
import com.luacomposer.core.ast.LuaAst.*;
import com.luacomposer.core.ast.SourceSpan;
import com.luacomposer.core.error.ComposerException;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.Module;
import com.luacomposer.core.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Applies a rule table to a parsed module and returns the transformed text.
 *
 * <p>Sanitization runs in two passes over the syntax tree:
 * <ol>
 *   <li>every {@link RuleAction#FAIL} rule is checked over the whole tree; the
 *       first match in source order aborts the module and no edit is made;</li>
 *   <li>the remaining rules are evaluated per node in table order, the first
 *       match consuming the node, and produce text edits keyed to node spans.</li>
 * </ol>
 * Edits are then merged (edits inside a removed range are dropped) and applied
 * back to front. An edit that partly overlaps an earlier one is not applied and
 * is reported as {@link WarningCode#EDIT_SKIPPED}. Because matching works on the tree, string contents and
 * comments are never touched, and sanitizing sanitized output changes nothing.
 *
 * <p><b>Statement removal:</b> a matched call whose innermost enclosing statement
 * is a call statement, {@code local} or assignment removes that statement with
 * a trailing {@code ;}, plus the whole line when nothing else is left on it.
 * Inside any other statement (an {@code if} or loop condition, a {@code return})
 * the call alone is replaced by {@code nil} and
 * {@link WarningCode#CALL_REPLACED_WITH_NIL} is recorded.
 *
 * <p><b>Line removal:</b> a {@link RuleAction#REMOVE_LINES} match deletes only the
 * physical lines the matched node spans. When that leaves an incomplete
 * statement behind, re-parsing the result reports it.
 *
 * <p>Instances hold no per-module state and may be shared.
 */
public class Sanitizer {

    private static final Logger log = LoggerFactory.getLogger(Sanitizer.class);

    private final List<SanitizationRule> rules;

    public Sanitizer() {
        this(SanitizationRules.defaults());
    }

    public Sanitizer(List<SanitizationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /**
     * Sanitizes a parsed Lua module.
     *
     * @param module module with a syntax tree
     * @param strict whether strict-only rules apply
     * @return transformed text and report
     */
    public SanitizationResult sanitize(Module module, boolean strict) {
        if (!module.isLua()) {
            throw new IllegalArgumentException("Module " + module.relativePath() + " has no syntax tree");
        }
        return sanitize(module.source(), module.chunk(), module.relativePath(), strict);
    }

    /**
     * Sanitizes source text using its syntax tree.
     *
     * @param source text the tree was parsed from
     * @param chunk parsed tree
     * @param modulePath path used in diagnostics
     * @param strict whether strict-only rules apply
     * @return transformed text and report
     */
    public SanitizationResult sanitize(String source, LuaAst.Chunk chunk, String modulePath, boolean strict) {
        List<SanitizationRule> active = rules.stream().filter(rule -> rule.appliesTo(strict)).toList();

        ComposerException fatal = findFatal(source, chunk, modulePath, active);
        if (fatal != null) {
            log.debug("Sanitization of {} aborted: {}", modulePath, fatal.getMessage());
            return new SanitizationResult(source, new SanitizationReport(List.of(), fatal));
        }

        EditCollector collector = new EditCollector(source, modulePath,
            active.stream().filter(rule -> rule.action() != RuleAction.FAIL).toList());
        collector.scan(chunk);

        List<TextEdit> skipped = new ArrayList<>();
        String text = applyEdits(source, merge(collector.edits, skipped));
        for (TextEdit edit : skipped) {
            collector.warnings.add(new BuildWarning(WarningCode.EDIT_SKIPPED, modulePath, lineOf(source, edit.start()),
                "Overlapping edit not applied: " + lineText(source, edit.start())));
        }
        log.debug("Sanitized {}: {} edits, {} warnings", modulePath, collector.edits.size(), collector.warnings.size());
        return new SanitizationResult(text, new SanitizationReport(collector.warnings, null));
    }

    private static ComposerException findFatal(String source, LuaAst.Chunk chunk, String modulePath,
                                               List<SanitizationRule> active) {
        List<SanitizationRule> failRules = active.stream()
            .filter(rule -> rule.action() == RuleAction.FAIL)
            .toList();
        if (failRules.isEmpty()) {
            return null;
        }

        ComposerException[] found = new ComposerException[1];
        new AstScanner() {
            @Override
            public void scan(Node node) {
                if (node == null || found[0] != null) {
                    return;
                }
                for (SanitizationRule rule : failRules) {
                    if (rule.matches(node)) {
                        found[0] = rule.fatal().create(node, modulePath, lineText(source, node.span()));
                        return;
                    }
                }
                super.scan(node);
            }

            @Override
            protected void scanStatement(Statement statement) {
                scan(statement);
            }
        }.scan(chunk);
        return found[0];
    }

    /**
     * Walks the tree tracking enclosing statements and records edits.
     */
    private static final class EditCollector extends AstScanner {

        private final String source;
        private final String modulePath;
        private final List<SanitizationRule> rules;
        private final Deque<Statement> statements = new ArrayDeque<>();
        private final List<TextEdit> edits = new ArrayList<>();
        private final List<BuildWarning> warnings = new ArrayList<>();

        EditCollector(String source, String modulePath, List<SanitizationRule> rules) {
            this.source = source;
            this.modulePath = modulePath;
            this.rules = rules;
        }

        @Override
        protected void scanStatement(Statement statement) {
            statements.push(statement);
            try {
                scan(statement);
            } finally {
                statements.pop();
            }
        }

        @Override
        public void scan(Node node) {
            if (node == null) {
                return;
            }
            for (SanitizationRule rule : rules) {
                if (rule.matches(node)) {
                    apply(rule, node);
                    return;
                }
            }
            super.scan(node);
        }

        private void apply(SanitizationRule rule, Node node) {
            log.trace("Rule {} matched at {}:{}", rule.id(), modulePath, node.span().line());
            if (rule.warning() != null) {
                warnings.add(new BuildWarning(rule.warning(), modulePath, node.span().line(),
                    "Disallowed call removed: " + lineText(source, node.span())));
            }
            switch (rule.action()) {
                case REWRITE_CALLEE -> {
                    FunctionCall call = (FunctionCall) node;
                    SourceSpan callee = call.callee().span();
                    edits.add(new TextEdit(callee.start(), callee.end(), rule.replacement()));
                    scanAll(call.arguments());
                }
                case REMOVE_STATEMENT -> removeStatement(node);
                case REMOVE_LINES -> {
                    SourceSpan span = node.span();
                    edits.add(new TextEdit(lineStart(source, span.start()), lineEndInclusive(source, span.end()), ""));
                }
                case FAIL -> throw new IllegalStateException("FAIL rules are evaluated before editing");
            }
        }

        private void removeStatement(Node node) {
            Statement statement = enclosingStatement(node);
            if (statement instanceof CallStatement
                || statement instanceof LocalStatement
                || statement instanceof AssignStatement) {
                edits.add(statementRemoval(source, statement.span()));
            } else {
                edits.add(new TextEdit(node.span().start(), node.span().end(), "nil"));
                warnings.add(new BuildWarning(WarningCode.CALL_REPLACED_WITH_NIL, modulePath, node.span().line(),
                    "Call inside " + describe(statement) + " replaced with nil: " + lineText(source, node.span())));
            }
        }

        private Statement enclosingStatement(Node node) {
            if (node instanceof Statement statement) {
                return statement;
            }
            Statement statement = statements.peek();
            if (statement == null) {
                throw new IllegalStateException("No enclosing statement for node at line " + node.span().line());
            }
            return statement;
        }

        private static String describe(Statement statement) {
            if (statement instanceof IfStatement) {
                return "an if statement";
            }
            if (statement instanceof WhileStatement || statement instanceof RepeatStatement) {
                return "a loop condition";
            }
            if (statement instanceof ReturnStatement) {
                return "a return statement";
            }
            if (statement instanceof NumericForStatement || statement instanceof GenericForStatement) {
                return "a for header";
            }
            return "a " + statement.getClass().getSimpleName();
        }
    }

    // -------------------------------------------------------------- text edits

    /**
     * Removal of a statement with its trailing {@code ;}, widened to the whole
     * line(s) when only whitespace would remain.
     */
    static TextEdit statementRemoval(String source, SourceSpan span) {
        int start = span.start();
        int end = span.end();

        int cursor = end;
        while (cursor < source.length() && isBlank(source.charAt(cursor))) {
            cursor++;
        }
        if (cursor < source.length() && source.charAt(cursor) == ';') {
            end = cursor + 1;
        }

        int lineStart = lineStart(source, start);
        int lineEnd = lineEndInclusive(source, end);
        if (isBlank(source, lineStart, start) && isBlank(source, end, lineEnd)) {
            return new TextEdit(lineStart, lineEnd, "");
        }
        // Another statement follows on the same line.
        while (end < lineEnd && isBlank(source.charAt(end))) {
            end++;
        }
        return new TextEdit(start, end, "");
    }

    /**
     * Sorts edits and drops those contained in an earlier, wider edit.
     * Overlapping deletions are merged into one; any other partly overlapping
     * edit is left out and added to {@code skipped}.
     */
    static List<TextEdit> merge(List<TextEdit> edits, List<TextEdit> skipped) {
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(TextEdit.BY_POSITION);

        List<TextEdit> merged = new ArrayList<>();
        for (TextEdit edit : sorted) {
            if (merged.isEmpty()) {
                merged.add(edit);
                continue;
            }
            TextEdit last = merged.get(merged.size() - 1);
            if (last.contains(edit)) {
                continue;
            }
            if (edit.start() < last.end()) {
                if (last.isDeletion() && edit.isDeletion()) {
                    merged.set(merged.size() - 1, new TextEdit(last.start(), Math.max(last.end(), edit.end()), ""));
                } else {
                    log.debug("Skipping edit [{}, {}) overlapping [{}, {})",
                        edit.start(), edit.end(), last.start(), last.end());
                    skipped.add(edit);
                }
                continue;
            }
            merged.add(edit);
        }
        return merged;
    }

    static String applyEdits(String source, List<TextEdit> edits) {
        StringBuilder text = new StringBuilder(source);
        for (int i = edits.size() - 1; i >= 0; i--) {
            TextEdit edit = edits.get(i);
            text.replace(edit.start(), edit.end(), edit.replacement());
        }
        return text.toString();
    }

    static String lineText(String source, SourceSpan span) {
        return lineText(source, span.start());
    }

    static String lineText(String source, int offset) {
        int start = lineStart(source, offset);
        int end = source.indexOf('\n', offset);
        return source.substring(start, end < 0 ? source.length() : end).trim();
    }

    static int lineOf(String source, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int lineStart(String source, int offset) {
        return source.lastIndexOf('\n', offset - 1) + 1;
    }

    /**
     * Offset just past the line break ending the line that contains {@code offset - 1},
     * or the end of the text on the last line.
     */
    private static int lineEndInclusive(String source, int offset) {
        int newline = source.indexOf('\n', Math.max(offset - 1, 0));
        return newline < 0 ? source.length() : newline + 1;
    }

    private static boolean isBlank(String source, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!isBlank(source.charAt(i)) && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
