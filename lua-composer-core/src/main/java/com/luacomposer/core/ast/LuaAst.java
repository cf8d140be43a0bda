package com.luacomposer.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Syntax node types for Lua source code.
 *
 * <p>The model is closed: {@link Statement}, {@link Expression} and {@link TableField}
 * are sealed and every variant is a record declared here. Each node carries the
 * {@link SourceSpan} it was parsed from, which is what source rewriting keys on.
 * Traversals implement {@link Visitor}, which has one method per node kind, or
 * extend {@link AstScanner} to walk the whole tree.
 *
 * <p>The tree is read-only. Empty statements ({@code ;}) are not represented.
 *
 * @see LuaAstParser
 */
public final class LuaAst {

    private LuaAst() {
        // Utility class - no instantiation
    }

    /**
     * Common contract of every syntax node.
     */
    public interface Node {

        SourceSpan span();

        <R> R accept(Visitor<R> visitor);
    }

    /**
     * A statement inside a {@link Block}.
     */
    public sealed interface Statement extends Node {
    }

    /**
     * An expression.
     */
    public sealed interface Expression extends Node {
    }

    /**
     * A call expression, either {@code f(args)} or {@code obj:m(args)}.
     */
    public sealed interface Invocation extends Expression {

        List<Expression> arguments();
    }

    /**
     * An entry of a table constructor.
     */
    public sealed interface TableField extends Node {

        Expression value();
    }

    /**
     * Root of a parsed source file.
     *
     * @param sourceName name used in diagnostics, usually the file path
     * @param block top-level block
     * @param span span of the whole text
     */
    public record Chunk(String sourceName, Block block, SourceSpan span) implements Node {
        public Chunk {
            Objects.requireNonNull(sourceName, "sourceName must not be null");
            Objects.requireNonNull(block, "block must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChunk(this);
        }
    }

    /**
     * A sequence of statements. A trailing {@code return} is the last statement.
     *
     * @param statements statements in source order
     * @param span span of the block, empty for an empty block
     */
    public record Block(List<Statement> statements, SourceSpan span) implements Node {
        public Block {
            statements = statements != null ? List.copyOf(statements) : List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /**
     * A name declared by {@code local}, with its optional attribute.
     *
     * @param name declared name
     * @param attribute {@code const} or {@code close}, or {@code null}
     */
    public record AttributedName(String name, String attribute) {
        public AttributedName {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    // ---------------------------------------------------------------- statements

    /**
     * {@code local a <const>, b = 1, 2}
     */
    public record LocalStatement(List<AttributedName> names, List<Expression> values, SourceSpan span)
        implements Statement {
        public LocalStatement {
            names = List.copyOf(names);
            values = values != null ? List.copyOf(values) : List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLocalStatement(this);
        }
    }

    /**
     * {@code a.b, c[1] = x, y}
     */
    public record AssignStatement(List<Expression> targets, List<Expression> values, SourceSpan span)
        implements Statement {
        public AssignStatement {
            targets = List.copyOf(targets);
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignStatement(this);
        }
    }

    /**
     * A call used as a statement, e.g. {@code print("hi")}.
     */
    public record CallStatement(Invocation call, SourceSpan span) implements Statement {
        public CallStatement {
            Objects.requireNonNull(call, "call must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallStatement(this);
        }
    }

    public record DoStatement(Block body, SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDoStatement(this);
        }
    }

    public record WhileStatement(Expression condition, Block body, SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhileStatement(this);
        }
    }

    public record RepeatStatement(Block body, Expression condition, SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRepeatStatement(this);
        }
    }

    /**
     * {@code if c1 then b1 elseif c2 then b2 else b3 end}
     *
     * @param conditions the {@code if} and {@code elseif} conditions
     * @param blocks the block guarded by each condition, same size as {@code conditions}
     * @param elseBlock the {@code else} block, or {@code null}
     * @param span statement span
     */
    public record IfStatement(List<Expression> conditions, List<Block> blocks, Block elseBlock, SourceSpan span)
        implements Statement {
        public IfStatement {
            conditions = List.copyOf(conditions);
            blocks = List.copyOf(blocks);
            if (conditions.size() != blocks.size()) {
                throw new IllegalArgumentException("Each condition needs exactly one block");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfStatement(this);
        }
    }

    /**
     * {@code for i = start, limit, step do ... end}; {@code step} may be {@code null}.
     */
    public record NumericForStatement(
        String variable,
        Expression start,
        Expression limit,
        Expression step,
        Block body,
        SourceSpan span
    ) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumericForStatement(this);
        }
    }

    /**
     * {@code for k, v in pairs(t) do ... end}
     */
    public record GenericForStatement(List<String> variables, List<Expression> iterators, Block body, SourceSpan span)
        implements Statement {
        public GenericForStatement {
            variables = List.copyOf(variables);
            iterators = List.copyOf(iterators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGenericForStatement(this);
        }
    }

    /**
     * {@code function a.b.c:m(...) ... end}
     *
     * @param namePath dotted name segments, e.g. {@code [a, b, c]}
     * @param methodName name after {@code :}, or {@code null}
     * @param function parameters and body
     * @param span statement span
     */
    public record FunctionStatement(List<String> namePath, String methodName, FunctionExpression function,
                                    SourceSpan span) implements Statement {
        public FunctionStatement {
            namePath = List.copyOf(namePath);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionStatement(this);
        }
    }

    public record LocalFunctionStatement(String name, FunctionExpression function, SourceSpan span)
        implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLocalFunctionStatement(this);
        }
    }

    public record ReturnStatement(List<Expression> values, SourceSpan span) implements Statement {
        public ReturnStatement {
            values = values != null ? List.copyOf(values) : List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturnStatement(this);
        }
    }

    public record BreakStatement(SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreakStatement(this);
        }
    }

    public record GotoStatement(String label, SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGotoStatement(this);
        }
    }

    public record LabelStatement(String label, SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLabelStatement(this);
        }
    }

    // --------------------------------------------------------------- expressions

    public record NilLiteral(SourceSpan span) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNilLiteral(this);
        }
    }

    public record BooleanLiteral(boolean value, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBooleanLiteral(this);
        }
    }

    /**
     * A numeral, kept as written ({@code 0x1F}, {@code 1e3}).
     */
    public record NumberLiteral(String text, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumberLiteral(this);
        }
    }

    /**
     * A string literal.
     *
     * @param value decoded value with escapes resolved
     * @param raw literal as written, including quotes or long brackets
     * @param span literal span
     */
    public record StringLiteral(String value, String raw, SourceSpan span) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(raw, "raw must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    public record VarargExpression(SourceSpan span) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarargExpression(this);
        }
    }

    /**
     * A bare identifier reference.
     */
    public record NameExpression(String name, SourceSpan span) implements Expression {
        public NameExpression {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNameExpression(this);
        }
    }

    /**
     * {@code target.name}
     */
    public record MemberExpression(Expression target, String name, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMemberExpression(this);
        }
    }

    /**
     * {@code target[key]}
     */
    public record IndexExpression(Expression target, Expression key, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIndexExpression(this);
        }
    }

    /**
     * {@code callee(args)}, {@code callee "str"} or {@code callee {table}}.
     */
    public record FunctionCall(Expression callee, List<Expression> arguments, SourceSpan span)
        implements Invocation {
        public FunctionCall {
            Objects.requireNonNull(callee, "callee must not be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    /**
     * {@code receiver:method(args)}
     */
    public record MethodCall(Expression receiver, String method, List<Expression> arguments, SourceSpan span)
        implements Invocation {
        public MethodCall {
            Objects.requireNonNull(receiver, "receiver must not be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMethodCall(this);
        }
    }

    /**
     * {@code function(a, b, ...) ... end}
     */
    public record FunctionExpression(List<String> parameters, boolean vararg, Block body, SourceSpan span)
        implements Expression {
        public FunctionExpression {
            parameters = List.copyOf(parameters);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionExpression(this);
        }
    }

    public record TableConstructor(List<TableField> fields, SourceSpan span) implements Expression {
        public TableConstructor {
            fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTableConstructor(this);
        }
    }

    /**
     * A binary operation; {@code operator} is the operator token, e.g. {@code ..} or {@code and}.
     */
    public record BinaryExpression(String operator, Expression left, Expression right, SourceSpan span)
        implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryExpression(this);
        }
    }

    public record UnaryExpression(String operator, Expression operand, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryExpression(this);
        }
    }

    public record ParenthesizedExpression(Expression expression, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParenthesizedExpression(this);
        }
    }

    // -------------------------------------------------------------- table fields

    /** {@code { value }} */
    public record PositionalField(Expression value, SourceSpan span) implements TableField {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPositionalField(this);
        }
    }

    /** {@code { name = value }} */
    public record NamedField(String name, Expression value, SourceSpan span) implements TableField {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamedField(this);
        }
    }

    /** {@code { [key] = value }} */
    public record KeyedField(Expression key, Expression value, SourceSpan span) implements TableField {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitKeyedField(this);
        }
    }

    /**
     * Visitor over every node kind.
     *
     * @param <R> result type
     */
    public interface Visitor<R> {

        R visitChunk(Chunk node);

        R visitBlock(Block node);

        R visitLocalStatement(LocalStatement node);

        R visitAssignStatement(AssignStatement node);

        R visitCallStatement(CallStatement node);

        R visitDoStatement(DoStatement node);

        R visitWhileStatement(WhileStatement node);

        R visitRepeatStatement(RepeatStatement node);

        R visitIfStatement(IfStatement node);

        R visitNumericForStatement(NumericForStatement node);

        R visitGenericForStatement(GenericForStatement node);

        R visitFunctionStatement(FunctionStatement node);

        R visitLocalFunctionStatement(LocalFunctionStatement node);

        R visitReturnStatement(ReturnStatement node);

        R visitBreakStatement(BreakStatement node);

        R visitGotoStatement(GotoStatement node);

        R visitLabelStatement(LabelStatement node);

        R visitNilLiteral(NilLiteral node);

        R visitBooleanLiteral(BooleanLiteral node);

        R visitNumberLiteral(NumberLiteral node);

        R visitStringLiteral(StringLiteral node);

        R visitVarargExpression(VarargExpression node);

        R visitNameExpression(NameExpression node);

        R visitMemberExpression(MemberExpression node);

        R visitIndexExpression(IndexExpression node);

        R visitFunctionCall(FunctionCall node);

        R visitMethodCall(MethodCall node);

        R visitFunctionExpression(FunctionExpression node);

        R visitTableConstructor(TableConstructor node);

        R visitBinaryExpression(BinaryExpression node);

        R visitUnaryExpression(UnaryExpression node);

        R visitParenthesizedExpression(ParenthesizedExpression node);

        R visitPositionalField(PositionalField node);

        R visitNamedField(NamedField node);

        R visitKeyedField(KeyedField node);
    }
}
