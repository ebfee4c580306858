import org.junit.jupiter.api.Test;

import com.brisk.script.BriskScript;
import com.brisk.script.parser.Environment;
import com.brisk.script.parser.Expr;
import com.brisk.script.parser.Interpreter;
import com.brisk.script.parser.ScriptError;
import com.brisk.script.parser.Token;
import com.brisk.script.parser.TokenType;
import com.brisk.script.parser.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BriskInterpreterTest {

    private final BriskScript es = new BriskScript();

    private double num(String src) {
        return es.eval(src).asNumber();
    }

    private ScriptError evalError(String src) {
        ScriptError e = assertThrows(ScriptError.class, () -> es.eval(src));
        assertEquals(ScriptError.Stage.EVAL, e.stage());
        return e;
    }

    // -------------------------
    // Arithmetic and comparison
    // -------------------------

    @Test
    void arithmetic() {
        assertEquals(14.0, num("2 + 3 * 4"), 1e-9);
        assertEquals(2.5, num("10 / 4"), 1e-9);
        assertEquals(1.0, num("7 % 3"), 1e-9);
        assertEquals(-3.0, num("0 - 3"), 1e-9);
        assertEquals(-1.5, num("0 - 7.5 % 3"), 1e-9);
        assertTrue(Double.isInfinite(num("1 / 0")));
    }

    @Test
    void comparisons_produceOneOrZero() {
        assertEquals(1.0, num("2 <= 2"));
        assertEquals(0.0, num("3 < 2"));
        assertEquals(0.0, num("2 >= 3"));
        assertEquals(1.0, num("3 > 2"));
        assertEquals(1.0, num("(1 + 1) == 2"));
        assertEquals(0.0, num("0 / 0 == 0 / 0"));
    }

    @Test
    void operatorOutsideTheArithmeticSet_yieldsZero() {
        Expr.Binary odd = new Expr.Binary(new Expr.NumberLiteral(4), Token.of(TokenType.COMMA, ","), new Expr.NumberLiteral(2));
        assertEquals(Value.number(0.0), new Interpreter(new Environment()).eval(odd));
    }

    @Test
    void nonNumericOperands() {
        assertEquals("Left operand is not a number.", evalError("(fn -> 1) + 1").getMessage());
        assertEquals("Right operand is not a number.", evalError("1 * (fn -> 1)").getMessage());
    }

    @Test
    void leftOperandCheckedBeforeRightIsEvaluated() {
        Environment env = new Environment();
        assertThrows(ScriptError.class, () -> es.eval("(fn -> 1) + (z = 3)", env));
        assertFalse(env.exists("z"));
    }

    // -------------------------
    // Variables and blocks
    // -------------------------

    @Test
    void blockAssignment_visibleInSurroundingEnvironment() {
        Environment env = new Environment();
        assertEquals(7.0, es.eval("[a = 5; a + 2]", env).asNumber(), 1e-9);
        assertEquals(Value.number(5.0), env.get("a"));
    }

    @Test
    void assignment_returnsValueAndChains() {
        Environment env = new Environment();
        assertEquals(3.0, es.eval("a = b = 3", env).asNumber());
        assertEquals(Value.number(3.0), env.get("a"));
        assertEquals(Value.number(3.0), env.get("b"));
    }

    @Test
    void undefinedVariable_isAnError() {
        assertEquals("Undefined variable: y", evalError("y").getMessage());
        assertEquals("Undefined variable: y", evalError("[x = 1; x + y]").getMessage());
    }

    @Test
    void emptyBlock_isNull() {
        Value v = new Interpreter(new Environment()).eval(new Expr.CodeBlock(List.of()));
        assertEquals(Value.Type.NULL, v.getType());
    }

    // -------------------------
    // Switch
    // -------------------------

    @Test
    void switch_firstMatchWins() {
        assertEquals(20.0, num("{1 == 2 -> 10, 1 == 1 -> 20}"));
        assertEquals(10.0, num("{1 -> 10, 1 -> 20}"));
    }

    @Test
    void switch_shortCircuitsRemainingConditions() {
        Environment env = new Environment();
        es.eval("[n = 0; {1 -> 10, n = 5 -> 20}]", env);
        assertEquals(Value.number(0.0), env.get("n"));
    }

    @Test
    void switch_noMatchIsNull() {
        assertEquals(Value.nil(), es.eval("{0 -> 1, 1 == 2 -> 2}"));
    }

    @Test
    void switch_functionMatches_nullAndVectorDoNot() {
        assertEquals(7.0, num("{(fn -> 0) -> 7}"));
        assertEquals(2.0, num("{[x = 1; while 0 1] -> 1, 1 -> 2}"));

        Environment env = new Environment();
        env.assign("v", Value.vector(List.of(Value.number(1))));
        assertEquals(2.0, es.eval("{v -> 1, 1 -> 2}", env).asNumber());
    }

    @Test
    void switch_lengthMismatchAlwaysFails() {
        Interpreter interpreter = new Interpreter(new Environment());
        Expr.Switch noBranches = new Expr.Switch(List.of(new Expr.NumberLiteral(1)), List.of());
        Expr.Switch extraBranch = new Expr.Switch(
                List.of(new Expr.NumberLiteral(0)),
                List.of(new Expr.NumberLiteral(1), new Expr.NumberLiteral(2)));

        ScriptError e = assertThrows(ScriptError.class, () -> interpreter.eval(noBranches));
        assertEquals("Switch has 1 conditions but 0 branches.", e.getMessage());
        assertThrows(ScriptError.class, () -> interpreter.eval(extraBranch));
    }

    // -------------------------
    // While
    // -------------------------

    @Test
    void whileLoop_countsUp() {
        assertEquals(3.0, num("[i = 0; while i < 3 [i = i + 1]; i]"));
    }

    @Test
    void whileLoop_returnsNull() {
        assertEquals(Value.nil(), es.eval("while 0 1"));
        assertEquals(Value.nil(), es.eval("[i = 0; while i < 2 i = i + 1]"));
    }

    @Test
    void whileLoop_sumsWithTwoVariables() {
        assertEquals(55.0, num("[i = 0; s = 0; while i < 10 [i = i + 1; s = s + i]; s]"));
    }

    @Test
    void truthiness() {
        assertFalse(Interpreter.isTruthy(Value.nil()));
        assertFalse(Interpreter.isTruthy(Value.number(0.0)));
        assertTrue(Interpreter.isTruthy(Value.number(-0.5)));
        assertTrue(Interpreter.isTruthy(Value.vector(List.of())));
        assertTrue(Interpreter.isTruthy(es.eval("fn -> 0")));

        assertFalse(Interpreter.matchesCase(Value.vector(List.of(Value.number(1)))));
        assertFalse(Interpreter.matchesCase(Value.nil()));
    }

    // -------------------------
    // Functions and calls
    // -------------------------

    @Test
    void immediatelyAppliedFunction() {
        assertEquals(16.0, num("(fn x -> x * x)(4)"));
        assertEquals(7.0, num("(fn a, b -> a + b)(3, 4)"));
        assertEquals(1.0, num("(fn -> 1)()"));
    }

    @Test
    void functionValue_doesNotRunItsBody() {
        Value f = es.eval("fn -> undefinedName");
        assertEquals(Value.Type.FUNCTION, f.getType());
        assertEquals(List.of(), f.asFunction().params);
    }

    @Test
    void callingANonFunction() {
        assertEquals("Can only call functions, got NUMBER", evalError("1(2)").getMessage());
        assertEquals("Can only call functions, got NULL", evalError("(while 0 1)()").getMessage());
    }

    @Test
    void capturedValue_winsOverCallerValue() {
        assertEquals(1.0, num("[x = 1; f = fn -> x; x = 2; f()]"));
    }

    @Test
    void callerEnvironment_fillsNamesTheSnapshotLacks() {
        assertEquals(5.0, num("[f = fn -> y; y = 5; f()]"));
    }

    @Test
    void reassignmentBeforeAndAfter_followsMergeOrder() {
        // y unknown at definition: each call sees the caller's current y
        assertEquals(12.0, num("[f = fn -> y; y = 1; a = f(); y = 2; b = f(); a * 10 + b]"));
        // y captured at definition: the snapshot wins on every call
        assertEquals(11.0, num("[y = 1; f = fn -> y; a = f(); y = 2; b = f(); a * 10 + b]"));
    }

    @Test
    void parameters_winOverCapturedAndCaller() {
        assertEquals(3.0, num("[x = 1; f = fn x -> x; x = 2; f(3)]"));
    }

    @Test
    void mutationInsideCall_notVisibleToCaller() {
        assertEquals(10.0, num("[x = 1; f = fn -> x = 10; f()]"));
        assertEquals(1.0, num("[x = 1; f = fn -> x = 10; f(); x]"));
    }

    @Test
    void undefinedAfterCall_localNamesDoNotLeak() {
        assertEquals("Undefined variable: q", evalError("[f = fn -> q = 4; f(); q]").getMessage());
    }

    @Test
    void arguments_evaluateInCallerEnvironment() {
        Environment env = new Environment();
        assertEquals(7.0, es.eval("[x = 1; f = fn a -> a; f(x = 7)]", env).asNumber());
        assertEquals(Value.number(7.0), env.get("x"));
    }

    @Test
    void callerSnapshot_takenBeforeArgumentsRun() {
        Environment env = new Environment();
        assertEquals(1.0, es.eval("[f = fn a -> b; b = 1; f(b = 2)]", env).asNumber());
        assertEquals(Value.number(2.0), env.get("b"));
    }

    @Test
    void fewerArguments_bindOnlyThePrefix() {
        assertEquals(1.0, num("(fn a, b -> a)(1)"));
        assertEquals("Undefined variable: b", evalError("(fn a, b -> b)(1)").getMessage());
    }

    @Test
    void tooManyArguments_isAnError() {
        assertEquals("Function expects 1 arguments, got 2", evalError("(fn a -> a)(1, 2)").getMessage());
    }

    @Test
    void recursion_throughCallerEnvironment() {
        assertEquals(120.0, num("[fact = fn n -> {n < 2 -> 1, 1 -> n * fact(n - 1)}; fact(5)]"));
        assertEquals(100.0, num("[count = fn n -> {n < 100 -> count(n + 1), 1 -> n}; count(0)]"));
    }

    @Test
    void curriedFunctions_andChainedCalls() {
        assertEquals(5.0, num("[add = fn a -> fn b -> a + b; add(2)(3)]"));
        assertEquals(9.0, num("[add2 = (fn a -> fn b -> a + b)(2); add2(7)]"));
    }

    @Test
    void capturedSnapshot_isIndependentAndImmutable() {
        Value f = es.eval("[x = 1; f = fn -> x; x = 2; f]");
        Map<String, Value> captured = f.asFunction().captured;
        assertEquals(Value.number(1.0), captured.get("x"));
        assertFalse(captured.containsKey("f"));
        assertThrows(UnsupportedOperationException.class, () -> captured.put("x", Value.number(3)));
    }

    @Test
    void callDepthLimit() {
        BriskScript shallow = new BriskScript();
        shallow.setMaxCallDepth(10);
        ScriptError e = assertThrows(ScriptError.class, () -> shallow.eval("[f = fn n -> f(n + 1); f(0)]"));
        assertEquals("Max call depth exceeded (10) calling f(10.0)", e.getMessage());

        assertEquals(9.0, shallow.eval("[c = fn n -> {n < 9 -> c(n + 1), 1 -> n}; c(0)]").asNumber());
    }

    // -------------------------
    // Error reporting hook
    // -------------------------

    @Test
    void errorReporter_receivesKindNameAndCurrentFunction() {
        List<String> seen = new ArrayList<>();
        es.setErrorReporter((interpreter, kind, name, message) ->
                seen.add(kind + "|" + name + "|" + interpreter.currentFunctionName() + "|" + message));

        assertThrows(ScriptError.class, () -> es.eval("[g = fn -> q; g()]"));
        assertEquals(List.of("var_not_found|q|g|Undefined variable: q"), seen);

        seen.clear();
        assertThrows(ScriptError.class, () -> es.eval("{1 -> 2}(3)"));
        assertEquals(1, seen.size());
        assertTrue(seen.get(0).startsWith("call_error|<anonymous>|null|"), seen.get(0));
    }

    @Test
    void errorReporter_seesArgumentsOfCurrentCall() {
        List<String> seen = new ArrayList<>();
        es.setErrorReporter((interpreter, kind, name, message) ->
                seen.add(kind + "|" + name + "|" + interpreter.currentArguments() + "|" + message));

        ScriptError e = assertThrows(ScriptError.class, () -> es.eval("[g = fn a -> a; h = fn x -> g(1, 2); h(7)]"));
        assertEquals("Function expects 1 arguments, got 2", e.getMessage());
        assertEquals(List.of("arity_error|g|[1.0, 2.0]|Function expects 1 arguments, got 2"), seen);
    }
}
