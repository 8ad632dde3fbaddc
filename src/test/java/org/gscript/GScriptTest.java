package org.gscript;

import org.gscript.error.ScriptError;
import org.gscript.grammar.TokenType;
import org.gscript.runtime.InterpreterConfig;
import org.gscript.runtime.Truthiness;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class GScriptTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private GScript session() {
        return GScript.builder().out(out).build();
    }

    @Test
    void run_functionCall_printsSum() {
        var result = session().eval("let x = 5; let y = 10; fn add(a, b) { return a + b; } print(add(x, y));");

        assertTrue(result.isSuccess());
        assertThat(result.output()).containsExactly("15");
        assertThat(buffer.toString(StandardCharsets.UTF_8).lines()).containsExactly("15");
    }

    @Test
    void run_whileLoop_printsCounter() {
        var result = session().eval("let i = 0; while (i < 3) { print(i); i = i + 1; }");

        assertThat(result.output()).containsExactly("0", "1", "2");
    }

    @Test
    void run_forLoop_printsCounter() {
        var result = session().eval("for (let j = 0; j < 3; j = j + 1) { print(j); }");

        assertThat(result.output()).containsExactly("0", "1", "2");
    }

    @Test
    void run_numberPlusString_concatenates() {
        var result = session().eval("print(1 + \"x\");");

        assertThat(result.output()).containsExactly("1x");
    }

    @Test
    void run_numberMinusString_reportsRuntimeError() {
        var result = session().eval("print(1 - \"x\");");

        assertTrue(result.hasError());
        assertEquals(ScriptError.Kind.RUNTIME, result.errorKind().orElseThrow());
        assertThat(result.error().orElseThrow().reason()).startsWith("operands must be numbers");
        assertThat(result.output()).isEmpty();
    }

    @Test
    void run_undeclaredVariable_reportsErrorWithoutOutput() {
        var result = session().eval("print(undeclared);");

        assertThat(result.error().orElseThrow().reason()).contains("undefined variable");
        assertThat(result.output()).isEmpty();
        assertEquals("", buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void run_lexError_executesNothing() {
        var result = session().eval("print 1;\nprint @;");

        assertEquals(ScriptError.Kind.LEX, result.errorKind().orElseThrow());
        assertEquals(2, result.error().orElseThrow().line());
        assertThat(result.output()).isEmpty();
    }

    @Test
    void run_parseError_executesNothing() {
        var result = session().eval("print 1;\nprint 2");

        assertEquals(ScriptError.Kind.PARSE, result.errorKind().orElseThrow());
        assertThat(result.output()).isEmpty();
    }

    @Test
    void run_unsupportedConstruct_reportsParseError() {
        var result = session().eval("class Point {}");

        assertEquals(ScriptError.Kind.PARSE, result.errorKind().orElseThrow());
        assertThat(result.error().orElseThrow().reason()).isEqualTo("unsupported construct, found 'class'");
    }

    @Test
    void run_runtimeError_keepsEarlierOutput() {
        var result = session().eval("print \"a\"; print missing; print \"b\";");

        assertThat(result.output()).containsExactly("a");
        assertEquals(ScriptError.Kind.RUNTIME, result.errorKind().orElseThrow());
    }

    @Test
    void eval_sessionKeepsGlobalsBetweenCalls() {
        var session = session();

        var first = session.eval("let total = 1; fn bump() { total = total + 1; }");
        var second = session.eval("bump(); print total;");
        var third = session.eval("print total * 10;");

        assertThat(first.output()).isEmpty();
        assertThat(second.output()).containsExactly("2");
        assertThat(third.output()).containsExactly("20");
        assertThat(session.interpreter().output()).containsExactly("20");
    }

    @Test
    void eval_manyRuns_sessionRetainsOnlyLatestOutput() {
        var session = session();

        for (int i = 0; i < 50; i++) {
            var result = session.eval("for (let k = 0; k < 100; k = k + 1) print k;");
            assertThat(result.output()).hasSize(100);
        }

        assertThat(session.interpreter().output()).hasSize(100);
        assertThat(session.eval("print \"done\";").output()).containsExactly("done");
        assertThat(session.interpreter().output()).containsExactly("done");
    }

    @Test
    void run_deeplyNestedGrouping_reportsParseError() {
        var result = GScript.run("print " + "(".repeat(20000) + "1" + ")".repeat(20000) + ";",
                                 InterpreterConfig.DEFAULT.withOut(out));

        assertEquals(ScriptError.Kind.PARSE, result.errorKind().orElseThrow());
        assertThat(result.error().orElseThrow().reason()).startsWith("expression nested too deeply");
        assertThat(result.output()).isEmpty();
    }

    @Test
    void run_deeplyNestedNegation_reportsParseError() {
        var result = session().eval("print " + "-".repeat(20000) + "1;");

        assertEquals(ScriptError.Kind.PARSE, result.errorKind().orElseThrow());
    }

    @Test
    void eval_failedParse_leavesSessionUsable() {
        var session = session();
        session.eval("let x = 3;");

        assertTrue(session.eval("print x").hasError());
        assertThat(session.eval("print x;").output()).containsExactly("3");
    }

    @Test
    void formatDiagnostics_rendersSourceLine() {
        var result = session().eval("let a = 1;\nprint(total + 1);");

        assertEquals("""
            error[runtime]: undefined variable 'total'
              --> main.gs:2:7
              |
            2 | print(total + 1);
              |       ^^^^^ runtime error
              |
            """, result.formatDiagnostics("main.gs"));
    }

    @Test
    void formatSimple_rendersOneLine() {
        var result = session().eval("let a = 1;\nprint(total + 1);");

        assertEquals("main.gs:2:7: error[runtime]: undefined variable 'total'", result.formatSimple("main.gs"));
        assertEquals("", session().eval("print 1;").formatSimple("main.gs"));
    }

    @Test
    void formatDiagnostics_onSuccess_isEmpty() {
        var result = session().eval("print 1;");

        assertEquals("", result.formatDiagnostics());
    }

    @Test
    void formatDiagnostics_parseError_pointsAtToken() {
        var result = session().eval("print ;");

        assertThat(result.formatDiagnostics()).startsWith("error[parse]: expected expression, found ';'\n  --> input:1:7\n");
    }

    @Test
    void builder_truthiness_appliesToRun() {
        var session = GScript.builder().out(out).truthiness(Truthiness.COERCING).build();

        assertThat(session.eval("if (0) print \"truthy\"; else print \"falsy\";").output()).containsExactly("falsy");
    }

    @Test
    void builder_maxCallDepth_limitsRecursion() {
        var session = GScript.builder().out(out).maxCallDepth(10).build();

        var result = session.eval("fn f(n) { return f(n + 1); } f(0);");

        assertThat(result.error().orElseThrow().reason()).isEqualTo("stack overflow");
    }

    @Test
    void builder_config_reflectsSettings() {
        var config = GScript.builder().out(out).maxCallDepth(7).nativeFunctions(false).config();

        assertEquals(7, config.maxCallDepth());
        assertFalse(config.nativeFunctions());
        assertEquals(Truthiness.NULL_AND_FALSE, config.truthiness());
        assertSame(out, config.out());
    }

    @Test
    void config_invalidDepth_rejected() {
        assertThatThrownBy(() -> new InterpreterConfig(out, Truthiness.NULL_AND_FALSE, 0, true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void run_withConfig_usesConfiguredStream() {
        var result = GScript.run("print \"hi\";", InterpreterConfig.DEFAULT.withOut(out));

        assertThat(result.output()).containsExactly("hi");
        assertThat(buffer.toString(StandardCharsets.UTF_8).lines()).containsExactly("hi");
    }

    @Test
    void scanAndParse_exposePipelineStages() {
        var tokens = GScript.scan("let x = 1;");
        var statements = GScript.parse("let x = 1; print x;");

        assertEquals(TokenType.VAR, tokens.get(0).type());
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
        assertEquals(2, statements.size());
    }
}
