package com.cgen.ast;

import java.util.Arrays;
import java.util.List;

/**
 * 节点构造辅助方法
 *
 * <p>每个方法返回新建节点，并接管传入子节点的所有权。</p>
 */
public final class Nodes {
    private Nodes() {
    }

    // ============ 标量类型 ============

    public static Primitive i8() {
        return new Primitive(Primitive.Kind.I8);
    }

    public static Primitive i16() {
        return new Primitive(Primitive.Kind.I16);
    }

    public static Primitive i32() {
        return new Primitive(Primitive.Kind.I32);
    }

    public static Primitive i64() {
        return new Primitive(Primitive.Kind.I64);
    }

    public static Primitive u8() {
        return new Primitive(Primitive.Kind.U8);
    }

    public static Primitive u16() {
        return new Primitive(Primitive.Kind.U16);
    }

    public static Primitive u32() {
        return new Primitive(Primitive.Kind.U32);
    }

    public static Primitive u64() {
        return new Primitive(Primitive.Kind.U64);
    }

    public static Primitive f32() {
        return new Primitive(Primitive.Kind.F32);
    }

    public static Primitive f64() {
        return new Primitive(Primitive.Kind.F64);
    }

    // ============ 复合类型 ============

    public static Type type(String name) {
        return new Type(name);
    }

    public static PointerOf pointerOf(Node node) {
        return new PointerOf(node);
    }

    public static ArrayOf arrayOf(Node node) {
        return new ArrayOf(node, 0);
    }

    public static ArrayOf arrayOf(Node node, long size) {
        return new ArrayOf(node, size);
    }

    public static Static staticOf(Node node) {
        return new Static(node);
    }

    // ============ 声明 ============

    public static DeclLocal declLocal(String name, Node type) {
        return new DeclLocal(name, type);
    }

    public static DeclType declType(String name, Node... fields) {
        return new DeclType(name, Arrays.asList(fields));
    }

    public static DeclType declType(String name, List<? extends Node> fields) {
        return new DeclType(name, fields);
    }

    public static Function function(String name, Node returnType, List<? extends Node> parameters, Block body) {
        return new Function(name, returnType, parameters, body);
    }

    public static Program program(Node... declarations) {
        return new Program(Arrays.asList(declarations));
    }

    // ============ 语句 ============

    public static Block block(Node... statements) {
        return new Block(Arrays.asList(statements));
    }

    public static Return ret(Node value) {
        return new Return(value);
    }

    // ============ 表达式 ============

    public static Literal literal(int value) {
        return new Literal(value, Literal.Kind.INT);
    }

    public static Literal literal(long value) {
        return new Literal(value, Literal.Kind.LONG);
    }

    /**
     * 无符号 64 位整数字面量，{@code -1L} 输出为 18446744073709551615
     */
    public static Literal unsignedLiteral(long value) {
        return new Literal(value, Literal.Kind.ULONG);
    }

    public static Literal literal(float value) {
        return new Literal(value, Literal.Kind.FLOAT);
    }

    public static Literal literal(double value) {
        return new Literal(value, Literal.Kind.DOUBLE);
    }

    public static Literal literal(char value) {
        return new Literal(value, Literal.Kind.CHAR);
    }

    public static Literal literal(String value) {
        return new Literal(value, Literal.Kind.STRING);
    }

    public static Local local(String name) {
        return new Local(name);
    }

    public static Field field(Node owner, String name) {
        return new Field(owner, name);
    }

    public static Assign assign(Node lhs, Node rhs) {
        return new Assign(lhs, rhs);
    }

    public static Deref deref(Node node) {
        return new Deref(node);
    }

    public static GetRef getRef(Node node) {
        return new GetRef(node);
    }

    public static Call call(Node callee, Node... arguments) {
        return new Call(callee, Arrays.asList(arguments));
    }

    public static Call call(Node callee, List<? extends Node> arguments) {
        return new Call(callee, arguments);
    }
}
