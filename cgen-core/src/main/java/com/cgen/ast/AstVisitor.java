package com.cgen.ast;

/**
 * AST 访问者接口
 *
 * <p>每个节点变体对应一个方法，且没有默认实现：新增变体后，
 * 所有访问者在补齐对应方法之前都无法通过编译。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 类型 ============

    R visitPrimitive(Primitive node, C ctx);

    R visitType(Type node, C ctx);

    R visitPointerOf(PointerOf node, C ctx);

    R visitArrayOf(ArrayOf node, C ctx);

    R visitStatic(Static node, C ctx);

    // ============ 声明 ============

    R visitProgram(Program node, C ctx);

    R visitDeclLocal(DeclLocal node, C ctx);

    R visitDeclType(DeclType node, C ctx);

    R visitFunction(Function node, C ctx);

    // ============ 语句 ============

    R visitBlock(Block node, C ctx);

    R visitReturn(Return node, C ctx);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C ctx);

    R visitAssign(Assign node, C ctx);

    R visitField(Field node, C ctx);

    R visitDeref(Deref node, C ctx);

    R visitGetRef(GetRef node, C ctx);

    R visitLocal(Local node, C ctx);

    R visitCall(Call node, C ctx);
}
