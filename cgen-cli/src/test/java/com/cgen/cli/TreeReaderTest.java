package com.cgen.cli;

import com.cgen.ast.*;
import com.cgen.codegen.CodeGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Locale;

import static com.cgen.ast.Nodes.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("TreeReader 测试")
class TreeReaderTest {

    private static final String MAIN_FUNCTION = "{"
            + "\"kind\":\"function\",\"name\":\"main\",\"returnType\":{\"kind\":\"i32\"},"
            + "\"parameters\":["
            + "  {\"kind\":\"decl\",\"name\":\"a0\",\"type\":{\"kind\":\"i32\"}},"
            + "  {\"kind\":\"array\",\"inner\":{\"kind\":\"decl\",\"name\":\"a1\","
            + "     \"type\":{\"kind\":\"pointer\",\"inner\":{\"kind\":\"i8\"}}}}"
            + "],"
            + "\"body\":{\"kind\":\"block\",\"statements\":["
            + "  {\"kind\":\"decl\",\"name\":\"l0\",\"type\":{\"kind\":\"u8\"}},"
            + "  {\"kind\":\"return\",\"value\":{\"kind\":\"literal\",\"int\":0}}"
            + "]}}";

    private final CodeGenerator generator = new CodeGenerator();

    private String renderJson(String json) {
        return generator.render(new TreeReader().read(json));
    }

    // ============ 正常读取 ============

    @Nested
    @DisplayName("读取")
    class Read {

        @Test
        @DisplayName("JSON 与构造器得到相同输出")
        void testSameOutputAsBuilders() {
            Function built = function("main", i32(),
                    Arrays.asList(declLocal("a0", i32()), arrayOf(declLocal("a1", pointerOf(i8())))),
                    block(declLocal("l0", u8()), ret(literal(0))));

            assertThat(renderJson(MAIN_FUNCTION))
                    .isEqualTo(generator.render(built))
                    .isEqualTo("int main(int a0, char* a1[]){unsigned char l0;return 0;}");
        }

        @Test
        @DisplayName("读取结果的根节点变体")
        void testRootVariant() {
            Node root = new TreeReader().read(MAIN_FUNCTION);
            assertThat(root.as(Function.class)).isPresent();
            assertThat(root.as(Function.class).get().getParameters()).hasSize(2);
        }

        @Test
        @DisplayName("结构体、字段访问与调用")
        void testStructAndCall() {
            String json = "{\"kind\":\"program\",\"declarations\":["
                    + "{\"kind\":\"struct\",\"name\":\"Point\",\"fields\":["
                    + "  {\"kind\":\"decl\",\"name\":\"p0\",\"type\":{\"kind\":\"i32\"}},"
                    + "  {\"kind\":\"decl\",\"name\":\"p1\",\"type\":{\"kind\":\"i8\"}}]},"
                    + "{\"kind\":\"function\",\"name\":\"f\",\"returnType\":{\"kind\":\"f64\"},"
                    + " \"body\":{\"kind\":\"block\",\"statements\":["
                    + "  {\"kind\":\"assign\",\"lhs\":{\"kind\":\"field\",\"owner\":{\"kind\":\"local\",\"name\":\"a\"},\"name\":\"p0\"},"
                    + "   \"rhs\":{\"kind\":\"call\",\"callee\":{\"kind\":\"local\",\"name\":\"foo\"},"
                    + "   \"arguments\":[{\"kind\":\"literal\",\"int\":1},{\"kind\":\"literal\",\"int\":2}]}}]}}]}";

            assertThat(renderJson(json))
                    .isEqualTo("struct Point{int p0;char p1;};;double f(){a.p0 = foo(1,2);};");
        }

        @Test
        @DisplayName("各类字面量")
        void testLiterals() {
            assertThat(renderJson("{\"kind\":\"literal\",\"long\":9000000000}")).isEqualTo("9000000000");
            assertThat(renderJson("{\"kind\":\"literal\",\"double\":2.5}")).isEqualTo("2.500000");
            assertThat(renderJson("{\"kind\":\"literal\",\"float\":0.5}")).isEqualTo("0.500000");
            assertThat(renderJson("{\"kind\":\"literal\",\"char\":\"z\"}")).isEqualTo("'z'");
            assertThat(renderJson("{\"kind\":\"literal\",\"string\":\"hi\"}")).isEqualTo("\"hi\"");
        }

        @Test
        @DisplayName("超出 long 范围的无符号字面量")
        void testUnsignedLongLiteral() {
            assertThat(renderJson("{\"kind\":\"literal\",\"ulong\":18446744073709551615}"))
                    .isEqualTo("18446744073709551615");
            assertThat(renderJson("{\"kind\":\"literal\",\"ulong\":7}")).isEqualTo("7");
        }

        @Test
        @DisplayName("类型修饰与指针操作")
        void testTypeWrappersAndPointerOps() {
            assertThat(renderJson("{\"kind\":\"static\",\"inner\":{\"kind\":\"decl\",\"name\":\"n\","
                    + "\"type\":{\"kind\":\"array\",\"size\":8,\"inner\":{\"kind\":\"u16\"}}}}"))
                    .isEqualTo("static unsigned short[8] n");
            assertThat(renderJson("{\"kind\":\"pointer\",\"inner\":{\"kind\":\"type\",\"name\":\"Node\"}}"))
                    .isEqualTo("struct Node*");
            assertThat(renderJson("{\"kind\":\"deref\",\"inner\":{\"kind\":\"ref\",\"inner\":{\"kind\":\"local\",\"name\":\"x\"}}}"))
                    .isEqualTo("(*(&x))");
        }

        @Test
        @DisplayName("每种标量名都能读取")
        void testAllPrimitiveKinds() {
            for (Primitive.Kind kind : Primitive.Kind.values()) {
                String json = "{\"kind\":\"" + kind.name().toLowerCase(Locale.ROOT) + "\"}";
                assertThat(renderJson(json)).isEqualTo(CodeGenerator.primitiveName(kind));
            }
        }

        @Test
        @DisplayName("省略的可选列表按空列表处理")
        void testOptionalLists() {
            assertThat(renderJson("{\"kind\":\"block\"}")).isEqualTo("{}");
            assertThat(renderJson("{\"kind\":\"call\",\"callee\":{\"kind\":\"local\",\"name\":\"f\"}}"))
                    .isEqualTo("f()");
        }
    }

    // ============ 错误报告 ============

    @Nested
    @DisplayName("错误")
    class Errors {

        @Test
        @DisplayName("非法 JSON")
        void testMalformedJson() {
            assertThatThrownBy(() -> new TreeReader().read("{\"kind\":"))
                    .isInstanceOf(TreeFormatException.class)
                    .hasMessageContaining("malformed JSON");
        }

        @Test
        @DisplayName("未知节点种类")
        void testUnknownKind() {
            TreeFormatException e = catchThrowableOfType(
                    () -> new TreeReader().read("{\"kind\":\"while\"}"), TreeFormatException.class);
            assertThat(e.getPath()).isEqualTo("$.kind");
            assertThat(e.getMessage()).contains("unknown node kind 'while'");
        }

        @Test
        @DisplayName("缺少成员时报告路径")
        void testMissingMember() {
            String json = "{\"kind\":\"block\",\"statements\":["
                    + "{\"kind\":\"local\",\"name\":\"a\"},"
                    + "{\"kind\":\"return\"}]}";
            TreeFormatException e = catchThrowableOfType(
                    () -> new TreeReader().read(json), TreeFormatException.class);
            assertThat(e.getPath()).isEqualTo("$.statements[1]");
            assertThat(e.getMessage()).isEqualTo("missing member 'value' at $.statements[1]");
        }

        @Test
        @DisplayName("函数体不是代码块")
        void testFunctionBodyNotBlock() {
            String json = "{\"kind\":\"function\",\"name\":\"f\",\"returnType\":{\"kind\":\"i32\"},"
                    + "\"body\":{\"kind\":\"local\",\"name\":\"x\"}}";
            TreeFormatException e = catchThrowableOfType(
                    () -> new TreeReader().read(json), TreeFormatException.class);
            assertThat(e.getPath()).isEqualTo("$.body");
        }

        @Test
        @DisplayName("负数数组长度")
        void testNegativeSize() {
            String json = "{\"kind\":\"array\",\"size\":-2,\"inner\":{\"kind\":\"i32\"}}";
            assertThatThrownBy(() -> new TreeReader().read(json))
                    .isInstanceOf(TreeFormatException.class)
                    .hasMessageContaining("negative")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("字面量成员数量不正确")
        void testLiteralMembers() {
            assertThatThrownBy(() -> new TreeReader().read("{\"kind\":\"literal\"}"))
                    .isInstanceOf(TreeFormatException.class);
            assertThatThrownBy(() -> new TreeReader().read("{\"kind\":\"literal\",\"int\":1,\"string\":\"1\"}"))
                    .isInstanceOf(TreeFormatException.class)
                    .hasMessageContaining("both");
            assertThatThrownBy(() -> new TreeReader().read("{\"kind\":\"literal\",\"char\":\"ab\"}"))
                    .isInstanceOf(TreeFormatException.class)
                    .hasMessageContaining("$.char");
            assertThatThrownBy(() -> new TreeReader().read("{\"kind\":\"literal\",\"int\":1.5}"))
                    .isInstanceOf(TreeFormatException.class)
                    .hasMessageContaining("expected an integer");
            assertThatThrownBy(() -> new TreeReader().read("{\"kind\":\"literal\",\"int\":3000000000}"))
                    .isInstanceOf(TreeFormatException.class)
                    .hasMessageContaining("out of range");
            assertThatThrownBy(() -> new TreeReader().read("{\"kind\":\"literal\",\"ulong\":18446744073709551616}"))
                    .isInstanceOf(TreeFormatException.class)
                    .hasMessageContaining("$.ulong")
                    .hasMessageContaining("out of range");
            assertThatThrownBy(() -> new TreeReader().read("{\"kind\":\"literal\",\"ulong\":-1}"))
                    .isInstanceOf(TreeFormatException.class)
                    .hasMessageContaining("out of range");
        }

        @Test
        @DisplayName("节点不是对象")
        void testNotAnObject() {
            TreeFormatException e = catchThrowableOfType(
                    () -> new TreeReader().read("{\"kind\":\"call\",\"callee\":{\"kind\":\"local\",\"name\":\"f\"},\"arguments\":[1]}"),
                    TreeFormatException.class);
            assertThat(e.getPath()).isEqualTo("$.arguments[0]");
            assertThat(e.getMessage()).contains("expected a node object");
        }
    }
}
