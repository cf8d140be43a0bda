package com.luacomposer.core.ast;

import com.luacomposer.core.ast.LuaAst.*;

import java.util.List;

/**
 * Visitor that walks a whole syntax tree in source order.
 *
 * <p>Every method visits the node's children and nothing else. Subclasses
 * override the methods for the node kinds they care about and call
 * {@code super} to keep descending. Statements are always reached through
 * {@link #scanStatement(Statement)}, which is the hook for tracking the
 * enclosing statement.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * new AstScanner() {
 *     @Override
 *     public Void visitGotoStatement(GotoStatement node) {
 *         gotos.add(node);
 *         return null;
 *     }
 * }.scan(chunk);
 * }</pre>
 */
public class AstScanner implements Visitor<Void> {

    /**
     * Scans a node if it is present.
     *
     * @param node node to scan, may be {@code null}
     */
    public void scan(Node node) {
        if (node != null) {
            node.accept(this);
        }
    }

    protected void scanAll(List<? extends Node> nodes) {
        for (Node node : nodes) {
            scan(node);
        }
    }

    /**
     * Called for every statement of every block.
     *
     * @param statement the statement about to be visited
     */
    protected void scanStatement(Statement statement) {
        statement.accept(this);
    }

    @Override
    public Void visitChunk(Chunk node) {
        scan(node.block());
        return null;
    }

    @Override
    public Void visitBlock(Block node) {
        for (Statement statement : node.statements()) {
            scanStatement(statement);
        }
        return null;
    }

    @Override
    public Void visitLocalStatement(LocalStatement node) {
        scanAll(node.values());
        return null;
    }

    @Override
    public Void visitAssignStatement(AssignStatement node) {
        scanAll(node.targets());
        scanAll(node.values());
        return null;
    }

    @Override
    public Void visitCallStatement(CallStatement node) {
        scan(node.call());
        return null;
    }

    @Override
    public Void visitDoStatement(DoStatement node) {
        scan(node.body());
        return null;
    }

    @Override
    public Void visitWhileStatement(WhileStatement node) {
        scan(node.condition());
        scan(node.body());
        return null;
    }

    @Override
    public Void visitRepeatStatement(RepeatStatement node) {
        scan(node.body());
        scan(node.condition());
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatement node) {
        for (int i = 0; i < node.conditions().size(); i++) {
            scan(node.conditions().get(i));
            scan(node.blocks().get(i));
        }
        scan(node.elseBlock());
        return null;
    }

    @Override
    public Void visitNumericForStatement(NumericForStatement node) {
        scan(node.start());
        scan(node.limit());
        scan(node.step());
        scan(node.body());
        return null;
    }

    @Override
    public Void visitGenericForStatement(GenericForStatement node) {
        scanAll(node.iterators());
        scan(node.body());
        return null;
    }

    @Override
    public Void visitFunctionStatement(FunctionStatement node) {
        scan(node.function());
        return null;
    }

    @Override
    public Void visitLocalFunctionStatement(LocalFunctionStatement node) {
        scan(node.function());
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement node) {
        scanAll(node.values());
        return null;
    }

    @Override
    public Void visitBreakStatement(BreakStatement node) {
        return null;
    }

    @Override
    public Void visitGotoStatement(GotoStatement node) {
        return null;
    }

    @Override
    public Void visitLabelStatement(LabelStatement node) {
        return null;
    }

    @Override
    public Void visitNilLiteral(NilLiteral node) {
        return null;
    }

    @Override
    public Void visitBooleanLiteral(BooleanLiteral node) {
        return null;
    }

    @Override
    public Void visitNumberLiteral(NumberLiteral node) {
        return null;
    }

    @Override
    public Void visitStringLiteral(StringLiteral node) {
        return null;
    }

    @Override
    public Void visitVarargExpression(VarargExpression node) {
        return null;
    }

    @Override
    public Void visitNameExpression(NameExpression node) {
        return null;
    }

    @Override
    public Void visitMemberExpression(MemberExpression node) {
        scan(node.target());
        return null;
    }

    @Override
    public Void visitIndexExpression(IndexExpression node) {
        scan(node.target());
        scan(node.key());
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        scan(node.callee());
        scanAll(node.arguments());
        return null;
    }

    @Override
    public Void visitMethodCall(MethodCall node) {
        scan(node.receiver());
        scanAll(node.arguments());
        return null;
    }

    @Override
    public Void visitFunctionExpression(FunctionExpression node) {
        scan(node.body());
        return null;
    }

    @Override
    public Void visitTableConstructor(TableConstructor node) {
        scanAll(node.fields());
        return null;
    }

    @Override
    public Void visitBinaryExpression(BinaryExpression node) {
        scan(node.left());
        scan(node.right());
        return null;
    }

    @Override
    public Void visitUnaryExpression(UnaryExpression node) {
        scan(node.operand());
        return null;
    }

    @Override
    public Void visitParenthesizedExpression(ParenthesizedExpression node) {
        scan(node.expression());
        return null;
    }

    @Override
    public Void visitPositionalField(PositionalField node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitNamedField(NamedField node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitKeyedField(KeyedField node) {
        scan(node.key());
        scan(node.value());
        return null;
    }
}
