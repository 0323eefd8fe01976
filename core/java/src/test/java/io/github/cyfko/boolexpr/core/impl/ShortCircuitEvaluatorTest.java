package io.github.cyfko.boolexpr.core.impl;

import io.github.cyfko.boolexpr.core.api.Expr;
import io.github.cyfko.boolexpr.core.exception.UnreducibleExpressionException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static io.github.cyfko.boolexpr.core.api.Expr.FALSE;
import static io.github.cyfko.boolexpr.core.api.Expr.TRUE;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link ShortCircuitEvaluator}.
 * <p>
 * Verifies the rewrite rules on literal operands, the reduction of compound operands,
 * and that operands discarded by a short-circuit rule are never reduced.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("ShortCircuitEvaluator Tests")
class ShortCircuitEvaluatorTest {

    private ShortCircuitEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new ShortCircuitEvaluator();
    }

    private static Expr not(Expr e) {
        return new Expr.Not(e);
    }

    private static Expr and(Expr e1, Expr e2) {
        return new Expr.And(e1, e2);
    }

    private static Expr or(Expr e1, Expr e2) {
        return new Expr.Or(e1, e2);
    }

    private static Expr ifThenElse(Expr c, Expr e1, Expr e2) {
        return new Expr.If(c, e1, e2);
    }

    // ========== Literal Rules ==========

    @Test
    @DisplayName("Literals reduce to themselves")
    void testLiterals() {
        assertEquals(TRUE, evaluator.eval(TRUE));
        assertEquals(FALSE, evaluator.eval(FALSE));
    }

    @Test
    @DisplayName("Not on literals")
    void testNotLiterals() {
        assertEquals(FALSE, evaluator.eval(not(TRUE)));
        assertEquals(TRUE, evaluator.eval(not(FALSE)));
    }

    @ParameterizedTest(name = "{0} => {1}")
    @MethodSource("literalTruthTable")
    @DisplayName("Binary and conditional operators on literal operands")
    void testTruthTable(Expr expr, Expr expected) {
        assertEquals(expected, evaluator.eval(expr));
    }

    static Stream<Arguments> literalTruthTable() {
        return Stream.of(
                Arguments.of(and(TRUE, TRUE), TRUE),
                Arguments.of(and(TRUE, FALSE), FALSE),
                Arguments.of(and(FALSE, TRUE), FALSE),
                Arguments.of(and(FALSE, FALSE), FALSE),
                Arguments.of(or(TRUE, TRUE), TRUE),
                Arguments.of(or(TRUE, FALSE), TRUE),
                Arguments.of(or(FALSE, TRUE), TRUE),
                Arguments.of(or(FALSE, FALSE), FALSE),
                Arguments.of(ifThenElse(TRUE, TRUE, FALSE), TRUE),
                Arguments.of(ifThenElse(TRUE, FALSE, TRUE), FALSE),
                Arguments.of(ifThenElse(FALSE, TRUE, FALSE), FALSE),
                Arguments.of(ifThenElse(FALSE, FALSE, TRUE), TRUE)
        );
    }

    // ========== Compound Operands ==========

    @Test
    @DisplayName("And(Or(False,True), Not(False)) reduces to True")
    void testNestedExample() {
        assertEquals(TRUE, evaluator.eval(and(or(FALSE, TRUE), not(FALSE))));
    }

    @Test
    @DisplayName("Not(Not(Not(True))) reduces to False")
    void testTripleNegation() {
        assertEquals(FALSE, evaluator.eval(not(not(not(TRUE)))));
    }

    @Test
    @DisplayName("Compound right operands are reduced when the rule needs them")
    void testCompoundRightOperand() {
        assertEquals(FALSE, evaluator.eval(and(TRUE, not(TRUE))));
        assertEquals(TRUE, evaluator.eval(or(FALSE, and(TRUE, TRUE))));
    }

    @Test
    @DisplayName("Compound condition selects the branch")
    void testCompoundCondition() {
        Expr expr = ifThenElse(and(TRUE, not(TRUE)), TRUE, or(FALSE, not(FALSE)));
        assertEquals(TRUE, evaluator.eval(expr));
        assertEquals(FALSE, evaluator.eval(ifThenElse(or(FALSE, TRUE), not(TRUE), TRUE)));
    }

    @Test
    @DisplayName("If(True, A, B) reduces like A and If(False, A, B) like B")
    void testIfSelectsBranch() {
        Expr a = and(or(FALSE, TRUE), not(FALSE));
        Expr b = or(FALSE, not(TRUE));

        assertEquals(evaluator.eval(a), evaluator.eval(ifThenElse(TRUE, a, b)));
        assertEquals(evaluator.eval(b), evaluator.eval(ifThenElse(FALSE, a, b)));
    }

    @Test
    @DisplayName("Same subtree used as both branches evaluates correctly")
    void testSharedBranches() {
        Expr branch = not(and(TRUE, FALSE));
        assertEquals(TRUE, evaluator.eval(ifThenElse(FALSE, branch, branch)));
        assertEquals(TRUE, evaluator.eval(ifThenElse(not(FALSE), branch, branch)));
    }

    @Test
    @DisplayName("Deep left-nested conjunction terminates")
    void testDeepTree() {
        Expr expr = TRUE;
        for (int i = 0; i < 200; i++) {
            expr = and(expr, not(FALSE));
        }
        assertEquals(TRUE, evaluator.eval(expr));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("compoundExpressions")
    @DisplayName("Reduction result is a literal and reducing it again changes nothing")
    void testLiteralAndIdempotent(Expr expr) {
        Expr result = evaluator.eval(expr);

        assertTrue(result.isLiteral());
        assertEquals(result, evaluator.eval(result));
    }

    static Stream<Expr> compoundExpressions() {
        return Stream.of(
                not(or(FALSE, FALSE)),
                and(or(TRUE, FALSE), ifThenElse(FALSE, FALSE, TRUE)),
                or(and(TRUE, FALSE), not(not(FALSE))),
                ifThenElse(not(TRUE), and(TRUE, TRUE), or(FALSE, FALSE)),
                not(ifThenElse(and(TRUE, TRUE), not(TRUE), TRUE))
        );
    }

    // ========== Short-circuit ==========

    @Nested
    @DisplayName("Short-circuit")
    class ShortCircuit {

        private final Logger evaluatorLogger = Logger.getLogger(ShortCircuitEvaluator.class.getName());
        private final List<String> messages = new ArrayList<>();
        private Level previousLevel;

        private final Handler recorder = new Handler() {
            @Override
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        @BeforeEach
        void attachRecorder() {
            previousLevel = evaluatorLogger.getLevel();
            evaluatorLogger.setLevel(Level.FINEST);
            recorder.setLevel(Level.ALL);
            evaluatorLogger.addHandler(recorder);
        }

        @AfterEach
        void detachRecorder() {
            evaluatorLogger.removeHandler(recorder);
            evaluatorLogger.setLevel(previousLevel);
        }

        private void assertNeverReduced(Expr discarded) {
            assertFalse(messages.contains("Reducing " + discarded),
                    () -> "Discarded operand was reduced: " + discarded);
        }

        @Test
        @DisplayName("And(False, X) is False without reducing X")
        void testAndFalse() {
            Expr discarded = not(or(TRUE, FALSE));

            assertEquals(FALSE, evaluator.eval(and(FALSE, discarded)));
            assertNeverReduced(discarded);
        }

        @Test
        @DisplayName("Or(True, X) is True without reducing X")
        void testOrTrue() {
            Expr discarded = and(TRUE, not(TRUE));

            assertEquals(TRUE, evaluator.eval(or(TRUE, discarded)));
            assertNeverReduced(discarded);
        }

        @Test
        @DisplayName("A compound left operand reducing to False skips the right operand")
        void testCompoundLeftOperand() {
            Expr discarded = ifThenElse(TRUE, not(FALSE), FALSE);

            assertEquals(FALSE, evaluator.eval(and(not(TRUE), discarded)));
            assertNeverReduced(discarded);
        }

        @Test
        @DisplayName("If reduces only the selected branch")
        void testIfBranch() {
            Expr selected = or(FALSE, TRUE);
            Expr discarded = and(TRUE, FALSE);

            assertEquals(TRUE, evaluator.eval(ifThenElse(not(FALSE), selected, discarded)));
            assertTrue(messages.contains("Reducing " + selected));
            assertNeverReduced(discarded);
        }
    }

    // ========== Malformed Input ==========

    @Test
    @DisplayName("Null expression is unreducible")
    void testNullExpression() {
        UnreducibleExpressionException exception =
                assertThrows(UnreducibleExpressionException.class, () -> evaluator.eval(null));
        assertEquals("Unreducible expression: null", exception.getMessage());
    }
}
