package com.cgen.codegen;

import com.cgen.ast.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * C 风格源码生成器
 *
 * <p>深度优先遍历 AST，把每个节点按固定的词法与空白规则拼接成文本。
 * 生成器本身没有字段，所有状态都在每次调用新建的 {@link CodeGenContext} 中，
 * 因此同一实例可以重复、并发地渲染互不相关的树。</p>
 */
public class CodeGenerator implements AstVisitor<Void, CodeGenContext> {

    /**
     * 渲染以 root 为根的整棵树
     */
    public String render(Node root) {
        Objects.requireNonNull(root, "root");
        CodeGenContext ctx = new CodeGenContext();
        root.accept(this, ctx);
        return ctx.getOutput();
    }

    // ============ 类型 ============

    @Override
    public Void visitPrimitive(Primitive node, CodeGenContext ctx) {
        ctx.append(primitiveName(node.getKind()));
        return null;
    }

    /**
     * 标量种类到 C 类型名的映射
     */
    public static String primitiveName(Primitive.Kind kind) {
        switch (kind) {
            case I8:  return "char";
            case I16: return "short";
            case I32: return "int";
            case I64: return "long";
            case U8:  return "unsigned char";
            case U16: return "unsigned short";
            case U32: return "unsigned int";
            case U64: return "unsigned long";
            case F32: return "float";
            case F64: return "double";
            default:
                throw new IllegalStateException("unknown primitive kind: " + kind);
        }
    }

    @Override
    public Void visitType(Type node, CodeGenContext ctx) {
        ctx.append("struct ").append(node.getName());
        return null;
    }

    @Override
    public Void visitPointerOf(PointerOf node, CodeGenContext ctx) {
        node.getInner().accept(this, ctx);
        ctx.append('*');
        return null;
    }

    @Override
    public Void visitArrayOf(ArrayOf node, CodeGenContext ctx) {
        node.getInner().accept(this, ctx);
        ctx.append('[');
        if (node.isSized()) {
            ctx.append(node.getSize());
        }
        ctx.append(']');
        return null;
    }

    @Override
    public Void visitStatic(Static node, CodeGenContext ctx) {
        ctx.append("static ");
        node.getInner().accept(this, ctx);
        return null;
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, CodeGenContext ctx) {
        formatTerminatedList(node.getDeclarations(), ctx);
        return null;
    }

    @Override
    public Void visitDeclLocal(DeclLocal node, CodeGenContext ctx) {
        node.getType().accept(this, ctx);
        ctx.append(' ').append(node.getName());
        return null;
    }

    @Override
    public Void visitDeclType(DeclType node, CodeGenContext ctx) {
        ctx.append("struct ").append(node.getName()).append('{');
        formatTerminatedList(node.getFields(), ctx);
        ctx.append("};");
        return null;
    }

    @Override
    public Void visitFunction(Function node, CodeGenContext ctx) {
        node.getReturnType().accept(this, ctx);
        ctx.append(' ').append(node.getName()).append('(');
        formatSeparatedList(node.getParameters(), ", ", ctx);
        ctx.append(')');
        // 函数体自带右花括号，后面不再补分号
        node.getBody().accept(this, ctx);
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, CodeGenContext ctx) {
        ctx.append('{');
        formatTerminatedList(node.getStatements(), ctx);
        ctx.append('}');
        return null;
    }

    @Override
    public Void visitReturn(Return node, CodeGenContext ctx) {
        ctx.append("return ");
        node.getValue().accept(this, ctx);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, CodeGenContext ctx) {
        Object value = node.getValue();
        switch (node.getKind()) {
            case INT:
            case LONG:
                ctx.append(((Number) value).longValue());
                break;
            case ULONG:
                ctx.append(Long.toUnsignedString((Long) value));
                break;
            case FLOAT:
            case DOUBLE:
                ctx.append(fixedDecimal(((Number) value).doubleValue()));
                break;
            case CHAR:
                ctx.append('\'').append((Character) value).append('\'');
                break;
            case STRING:
                ctx.append('"').append((String) value).append('"');
                break;
            default:
                throw new IllegalStateException("unknown literal kind: " + node.getKind());
        }
        return null;
    }

    @Override
    public Void visitAssign(Assign node, CodeGenContext ctx) {
        node.getLhs().accept(this, ctx);
        ctx.append(" = ");
        node.getRhs().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitField(Field node, CodeGenContext ctx) {
        node.getOwner().accept(this, ctx);
        ctx.append('.').append(node.getName());
        return null;
    }

    @Override
    public Void visitDeref(Deref node, CodeGenContext ctx) {
        ctx.append("(*");
        node.getInner().accept(this, ctx);
        ctx.append(')');
        return null;
    }

    @Override
    public Void visitGetRef(GetRef node, CodeGenContext ctx) {
        ctx.append("(&");
        node.getInner().accept(this, ctx);
        ctx.append(')');
        return null;
    }

    @Override
    public Void visitLocal(Local node, CodeGenContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitCall(Call node, CodeGenContext ctx) {
        node.getCallee().accept(this, ctx);
        ctx.append('(');
        formatSeparatedList(node.getArguments(), ",", ctx);
        ctx.append(')');
        return null;
    }

    // ============ 辅助方法 ============

    /**
     * 按 C 的 {@code %f} 输出：二进制值的精确十进制展开，舍入到六位小数
     */
    static String fixedDecimal(double v) {
        if (Double.isNaN(v)) {
            return "nan";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "inf" : "-inf";
        }
        String text = new BigDecimal(v).setScale(6, RoundingMode.HALF_EVEN).toPlainString();
        // 负零与舍入为零的负数保留符号
        if (Math.copySign(1.0, v) < 0 && text.charAt(0) != '-') {
            text = "-" + text;
        }
        return text;
    }

    /**
     * 每项后跟分号（代码块、程序、结构体字段），嵌套代码块因此输出 "};"
     */
    private void formatTerminatedList(List<Node> nodes, CodeGenContext ctx) {
        for (Node n : nodes) {
            n.accept(this, ctx);
            ctx.append(';');
        }
    }

    private void formatSeparatedList(List<Node> nodes, String separator, CodeGenContext ctx) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                ctx.append(separator);
            }
            nodes.get(i).accept(this, ctx);
        }
    }
}
