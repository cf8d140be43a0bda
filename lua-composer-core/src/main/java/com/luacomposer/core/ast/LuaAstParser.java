package com.luacomposer.core.ast;

import com.luacomposer.core.ast.LuaAst.*;
import com.luacomposer.parser.LuaBaseVisitor;
import com.luacomposer.parser.LuaLexer;
import com.luacomposer.parser.LuaParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR-based {@link AstParser} for Lua 5.1 to 5.4.
 *
 * <p>Uses the {@code Lua.g4} grammar (generated into {@code com.luacomposer.parser}
 * at build time) and converts the parse tree into the {@link LuaAst} node model
 * with a generated visitor. The default ANTLR error listeners, which print to
 * stderr and recover, are replaced by one that fails on the first error.
 *
 * <p>Spans are expressed in Java {@code char} offsets. ANTLR counts code points,
 * so offsets are translated when the source contains supplementary characters.
 *
 * <p>Instances are stateless and thread-safe.
 */
public class LuaAstParser implements AstParser {

    private static final Logger log = LoggerFactory.getLogger(LuaAstParser.class);

    @Override
    public Chunk parse(String source, String sourceName) {
        ThrowingErrorListener errors = new ThrowingErrorListener(sourceName);

        LuaLexer lexer = new LuaLexer(CharStreams.fromString(source, sourceName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        LuaParser parser = new LuaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        LuaParser.ChunkContext tree = parser.chunk();
        Chunk chunk = new TreeBuilder(source, sourceName).chunk(tree);
        log.debug("Parsed {}: {} top-level statements", sourceName, chunk.block().statements().size());
        return chunk;
    }

    /**
     * Converts ANTLR contexts into syntax nodes.
     */
    private static final class TreeBuilder extends LuaBaseVisitor<Node> {

        private final String source;
        private final String sourceName;
        private final int[] charOffsets;

        TreeBuilder(String source, String sourceName) {
            this.source = source;
            this.sourceName = sourceName;
            this.charOffsets = source.length() == source.codePointCount(0, source.length())
                ? null
                : codePointToCharOffsets(source);
        }

        Chunk chunk(LuaParser.ChunkContext ctx) {
            return new Chunk(sourceName, block(ctx.block()), new SourceSpan(0, source.length(), 1, 0));
        }

        // ------------------------------------------------------------ blocks

        private Block block(LuaParser.BlockContext ctx) {
            List<Statement> statements = new ArrayList<>();
            for (LuaParser.StatContext stat : ctx.stat()) {
                Node node = visit(stat);
                if (node != null) {
                    statements.add((Statement) node);
                }
            }
            if (ctx.retstat() != null) {
                LuaParser.RetstatContext ret = ctx.retstat();
                statements.add(new ReturnStatement(
                    ret.explist() != null ? expressions(ret.explist()) : List.of(), span(ret)));
            }
            return new Block(statements, span(ctx));
        }

        @Override
        public Node visitEmptyStat(LuaParser.EmptyStatContext ctx) {
            return null;
        }

        @Override
        public Node visitAssignStat(LuaParser.AssignStatContext ctx) {
            List<Expression> targets = new ArrayList<>();
            for (LuaParser.SuffixedexpContext target : ctx.suffixedexp()) {
                Expression expression = suffixed(target);
                if (!(expression instanceof NameExpression
                    || expression instanceof MemberExpression
                    || expression instanceof IndexExpression)) {
                    throw syntaxError(target, "cannot assign to this expression");
                }
                targets.add(expression);
            }
            return new AssignStatement(targets, expressions(ctx.explist()), span(ctx));
        }

        @Override
        public Node visitExprStat(LuaParser.ExprStatContext ctx) {
            Expression expression = suffixed(ctx.suffixedexp());
            if (expression instanceof Invocation invocation) {
                return new CallStatement(invocation, span(ctx));
            }
            throw syntaxError(ctx, "expression statement must be a function call");
        }

        @Override
        public Node visitLabelStat(LuaParser.LabelStatContext ctx) {
            return new LabelStatement(ctx.label().NAME().getText(), span(ctx));
        }

        @Override
        public Node visitBreakStat(LuaParser.BreakStatContext ctx) {
            return new BreakStatement(span(ctx));
        }

        @Override
        public Node visitGotoStat(LuaParser.GotoStatContext ctx) {
            return new GotoStatement(ctx.NAME().getText(), span(ctx));
        }

        @Override
        public Node visitDoStat(LuaParser.DoStatContext ctx) {
            return new DoStatement(block(ctx.block()), span(ctx));
        }

        @Override
        public Node visitWhileStat(LuaParser.WhileStatContext ctx) {
            return new WhileStatement(expression(ctx.exp()), block(ctx.block()), span(ctx));
        }

        @Override
        public Node visitRepeatStat(LuaParser.RepeatStatContext ctx) {
            return new RepeatStatement(block(ctx.block()), expression(ctx.exp()), span(ctx));
        }

        @Override
        public Node visitIfStat(LuaParser.IfStatContext ctx) {
            List<Expression> conditions = ctx.exp().stream().map(this::expression).toList();
            List<Block> blocks = new ArrayList<>();
            for (int i = 0; i < conditions.size(); i++) {
                blocks.add(block(ctx.block(i)));
            }
            Block elseBlock = ctx.block().size() > conditions.size()
                ? block(ctx.block(conditions.size()))
                : null;
            return new IfStatement(conditions, blocks, elseBlock, span(ctx));
        }

        @Override
        public Node visitNumericForStat(LuaParser.NumericForStatContext ctx) {
            List<LuaParser.ExpContext> bounds = ctx.exp();
            return new NumericForStatement(
                ctx.NAME().getText(),
                expression(bounds.get(0)),
                expression(bounds.get(1)),
                bounds.size() > 2 ? expression(bounds.get(2)) : null,
                block(ctx.block()),
                span(ctx)
            );
        }

        @Override
        public Node visitGenericForStat(LuaParser.GenericForStatContext ctx) {
            return new GenericForStatement(
                names(ctx.namelist().NAME()),
                expressions(ctx.explist()),
                block(ctx.block()),
                span(ctx)
            );
        }

        @Override
        public Node visitFunctionStat(LuaParser.FunctionStatContext ctx) {
            LuaParser.FuncnameContext name = ctx.funcname();
            List<String> parts = names(name.NAME());
            boolean isMethod = name.getChildCount() >= 3
                && ":".equals(name.getChild(name.getChildCount() - 2).getText());
            List<String> namePath = isMethod ? parts.subList(0, parts.size() - 1) : parts;
            String methodName = isMethod ? parts.get(parts.size() - 1) : null;
            return new FunctionStatement(namePath, methodName, function(ctx.funcbody(), span(ctx.funcbody())),
                span(ctx));
        }

        @Override
        public Node visitLocalFunctionStat(LuaParser.LocalFunctionStatContext ctx) {
            return new LocalFunctionStatement(ctx.NAME().getText(),
                function(ctx.funcbody(), span(ctx.funcbody())), span(ctx));
        }

        @Override
        public Node visitLocalStat(LuaParser.LocalStatContext ctx) {
            List<AttributedName> names = new ArrayList<>();
            for (LuaParser.AttnameContext attname : ctx.attnamelist().attname()) {
                List<TerminalNode> parts = attname.NAME();
                names.add(new AttributedName(parts.get(0).getText(),
                    parts.size() > 1 ? parts.get(1).getText() : null));
            }
            List<Expression> values = ctx.explist() != null ? expressions(ctx.explist()) : List.of();
            return new LocalStatement(names, values, span(ctx));
        }

        // ------------------------------------------------------- expressions

        private Expression expression(LuaParser.ExpContext ctx) {
            return (Expression) visit(ctx);
        }

        private List<Expression> expressions(LuaParser.ExplistContext ctx) {
            return ctx.exp().stream().map(this::expression).toList();
        }

        @Override
        public Node visitNilExp(LuaParser.NilExpContext ctx) {
            return new NilLiteral(span(ctx));
        }

        @Override
        public Node visitFalseExp(LuaParser.FalseExpContext ctx) {
            return new BooleanLiteral(false, span(ctx));
        }

        @Override
        public Node visitTrueExp(LuaParser.TrueExpContext ctx) {
            return new BooleanLiteral(true, span(ctx));
        }

        @Override
        public Node visitNumberExp(LuaParser.NumberExpContext ctx) {
            return new NumberLiteral(ctx.numeral().getText(), span(ctx));
        }

        @Override
        public Node visitStringExp(LuaParser.StringExpContext ctx) {
            return string(ctx.stringLiteral());
        }

        @Override
        public Node visitVarargExp(LuaParser.VarargExpContext ctx) {
            return new VarargExpression(span(ctx));
        }

        @Override
        public Node visitFunctionExp(LuaParser.FunctionExpContext ctx) {
            return function(ctx.functiondef().funcbody(), span(ctx));
        }

        @Override
        public Node visitPrefixExp(LuaParser.PrefixExpContext ctx) {
            return suffixed(ctx.suffixedexp());
        }

        @Override
        public Node visitTableExp(LuaParser.TableExpContext ctx) {
            return table(ctx.tableconstructor());
        }

        @Override
        public Node visitUnaryExp(LuaParser.UnaryExpContext ctx) {
            return new UnaryExpression(ctx.op.getText(), expression(ctx.exp()), span(ctx));
        }

        @Override
        public Node visitPowerExp(LuaParser.PowerExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitMulExp(LuaParser.MulExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitAddExp(LuaParser.AddExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitConcatExp(LuaParser.ConcatExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitShiftExp(LuaParser.ShiftExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitBandExp(LuaParser.BandExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitBxorExp(LuaParser.BxorExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitBorExp(LuaParser.BorExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitCompareExp(LuaParser.CompareExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitAndExp(LuaParser.AndExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        @Override
        public Node visitOrExp(LuaParser.OrExpContext ctx) {
            return binary(ctx, ctx.op, ctx.exp(0), ctx.exp(1));
        }

        private BinaryExpression binary(ParserRuleContext ctx, Token op,
                                        LuaParser.ExpContext left, LuaParser.ExpContext right) {
            return new BinaryExpression(op.getText(), expression(left), expression(right), span(ctx));
        }

        /**
         * Folds a primary expression and its suffixes left to right, so
         * {@code a.b(c)} becomes a call whose callee is the member access.
         */
        private Expression suffixed(LuaParser.SuffixedexpContext ctx) {
            Token first = ctx.getStart();
            Expression current = (Expression) visit(ctx.primaryexp());
            for (LuaParser.SuffixContext suffix : ctx.suffix()) {
                SourceSpan span = span(first, suffix.getStop());
                if (suffix instanceof LuaParser.MemberSuffixContext member) {
                    current = new MemberExpression(current, member.NAME().getText(), span);
                } else if (suffix instanceof LuaParser.IndexSuffixContext index) {
                    current = new IndexExpression(current, expression(index.exp()), span);
                } else if (suffix instanceof LuaParser.MethodCallSuffixContext method) {
                    current = new MethodCall(current, method.NAME().getText(), arguments(method.args()), span);
                } else if (suffix instanceof LuaParser.CallSuffixContext call) {
                    current = new FunctionCall(current, arguments(call.args()), span);
                } else {
                    throw syntaxError(suffix, "unsupported suffix");
                }
            }
            return current;
        }

        @Override
        public Node visitNamePrimary(LuaParser.NamePrimaryContext ctx) {
            return new NameExpression(ctx.NAME().getText(), span(ctx));
        }

        @Override
        public Node visitParenPrimary(LuaParser.ParenPrimaryContext ctx) {
            return new ParenthesizedExpression(expression(ctx.exp()), span(ctx));
        }

        private List<Expression> arguments(LuaParser.ArgsContext ctx) {
            if (ctx.tableconstructor() != null) {
                return List.of(table(ctx.tableconstructor()));
            }
            if (ctx.stringLiteral() != null) {
                return List.of(string(ctx.stringLiteral()));
            }
            return ctx.explist() != null ? expressions(ctx.explist()) : List.of();
        }

        private StringLiteral string(LuaParser.StringLiteralContext ctx) {
            String raw = ctx.getText();
            return new StringLiteral(LuaStrings.decode(raw), raw, span(ctx));
        }

        private FunctionExpression function(LuaParser.FuncbodyContext ctx, SourceSpan span) {
            LuaParser.ParlistContext parlist = ctx.parlist();
            List<String> parameters = List.of();
            boolean vararg = false;
            if (parlist != null) {
                if (parlist.namelist() != null) {
                    parameters = names(parlist.namelist().NAME());
                }
                vararg = "...".equals(parlist.getStop().getText());
            }
            return new FunctionExpression(parameters, vararg, block(ctx.block()), span);
        }

        private TableConstructor table(LuaParser.TableconstructorContext ctx) {
            List<TableField> fields = new ArrayList<>();
            if (ctx.fieldlist() != null) {
                for (LuaParser.FieldContext field : ctx.fieldlist().field()) {
                    fields.add((TableField) visit(field));
                }
            }
            return new TableConstructor(fields, span(ctx));
        }

        @Override
        public Node visitKeyedField(LuaParser.KeyedFieldContext ctx) {
            return new KeyedField(expression(ctx.exp(0)), expression(ctx.exp(1)), span(ctx));
        }

        @Override
        public Node visitNamedField(LuaParser.NamedFieldContext ctx) {
            return new NamedField(ctx.NAME().getText(), expression(ctx.exp()), span(ctx));
        }

        @Override
        public Node visitPositionalField(LuaParser.PositionalFieldContext ctx) {
            return new PositionalField(expression(ctx.exp()), span(ctx));
        }

        // ----------------------------------------------------------- helpers

        private static List<String> names(List<TerminalNode> nodes) {
            return nodes.stream().map(TerminalNode::getText).toList();
        }

        private SourceSpan span(ParserRuleContext ctx) {
            return span(ctx.getStart(), ctx.getStop());
        }

        private SourceSpan span(Token start, Token stop) {
            int from = offset(Math.max(start.getStartIndex(), 0));
            int to = stop != null && stop.getStopIndex() >= start.getStartIndex()
                ? offset(stop.getStopIndex() + 1)
                : from;
            return new SourceSpan(from, to, start.getLine(), start.getCharPositionInLine());
        }

        private int offset(int codePointIndex) {
            if (charOffsets == null) {
                return Math.min(codePointIndex, source.length());
            }
            return charOffsets[Math.min(codePointIndex, charOffsets.length - 1)];
        }

        private AstParseException syntaxError(ParserRuleContext ctx, String message) {
            Token start = ctx.getStart();
            return new AstParseException(
                "Syntax error in " + sourceName + " at line " + start.getLine() + ":"
                    + start.getCharPositionInLine() + ": " + message,
                sourceName, start.getLine(), start.getCharPositionInLine());
        }

        private static int[] codePointToCharOffsets(String source) {
            int[] offsets = new int[source.codePointCount(0, source.length()) + 1];
            int charIndex = 0;
            for (int i = 0; i < offsets.length - 1; i++) {
                offsets[i] = charIndex;
                charIndex += Character.charCount(source.codePointAt(charIndex));
            }
            offsets[offsets.length - 1] = source.length();
            return offsets;
        }
    }

    /**
     * Fails the parse on the first lexer or parser error.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String sourceName;

        ThrowingErrorListener(String sourceName) {
            this.sourceName = sourceName;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new AstParseException(
                "Syntax error in " + sourceName + " at line " + line + ":" + charPositionInLine + ": " + msg,
                sourceName, line, charPositionInLine);
        }
    }
}
