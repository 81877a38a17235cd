package com.lexgate.core.detect;

import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SuggestOnlyStrategiesTest {

    // ── LONG_METHOD ──────────────────────────────────────────────────

    @Nested
    @DisplayName("long methods")
    class LongMethod {

        private final LongMethodStrategy strategy = new LongMethodStrategy();

        @Test
        void reportsMethodsOverTheLimit() {
            var spec = new DetectorSpec(DetectorKind.LONG_METHOD, Map.of("max_lines", 3));
            SourceUnit unit = SourceUnit.parse("A.java", """
                    class A {
                        void short1() { }
                        void long1() {
                            int a = 1;
                            int b = 2;
                            int c = a + b;
                        }
                    }
                    """);

            List<Detection> detections = strategy.detect(unit, spec);

            assertEquals(1, detections.size());
            assertEquals("long1 spans 5 lines (limit 3)", detections.get(0).message());
            assertFalse(detections.get(0).hasFix());
        }

        @Test
        void limitAcceptsStringValue() {
            var spec = new DetectorSpec(DetectorKind.LONG_METHOD, Map.of("max_lines", "1"));
            SourceUnit unit = SourceUnit.parse("A.java", "class A {\n  A() {\n  }\n}\n");

            assertEquals(1, strategy.detect(unit, spec).size());
        }
    }

    // ── SQL_CONCAT ───────────────────────────────────────────────────

    @Nested
    @DisplayName("SQL concatenation")
    class SqlConcat {

        private final SqlConcatStrategy strategy = new SqlConcatStrategy();
        private final DetectorSpec spec = DetectorSpec.of(DetectorKind.SQL_CONCAT);

        @Test
        void inlineConcatenation() {
            SourceUnit unit = SourceUnit.parse("Dao.java", """
                    class Dao {
                        void find(java.sql.Statement stmt, String id) throws Exception {
                            stmt.executeQuery("select * from t where id = " + id);
                        }
                    }
                    """);

            List<Detection> detections = strategy.detect(unit, spec);

            assertEquals(1, detections.size());
            assertEquals(3, detections.get(0).span().startLine());
            assertFalse(detections.get(0).hasFix());
        }

        @Test
        void concatenationThroughLocalVariable() {
            SourceUnit unit = SourceUnit.parse("Dao.java", """
                    class Dao {
                        void find(java.sql.Statement stmt, String col) throws Exception {
                            String q = "select " + col + " from t";
                            stmt.execute(q);
                        }
                    }
                    """);

            List<Detection> detections = strategy.detect(unit, spec);

            assertEquals(1, detections.size());
            assertEquals(List.of("q"), detections.get(0).hints());
        }

        @Test
        void literalOnlyConcatenationIsIgnored() {
            SourceUnit unit = SourceUnit.parse("Dao.java", """
                    class Dao {
                        void find(java.sql.Statement stmt) throws Exception {
                            stmt.executeQuery("select * " + "from t");
                        }
                    }
                    """);

            assertTrue(strategy.detect(unit, spec).isEmpty());
        }
    }

    // ── SYNTAX_ERROR ─────────────────────────────────────────────────

    @Nested
    @DisplayName("syntax errors")
    class SyntaxError {

        private final SyntaxErrorStrategy strategy = new SyntaxErrorStrategy();
        private final DetectorSpec spec = DetectorSpec.of(DetectorKind.SYNTAX_ERROR);

        @Test
        void reportsUnparseableFile() {
            SourceUnit unit = SourceUnit.parse("Broken.java", "class Broken { void f( }\n");

            List<Detection> detections = strategy.detect(unit, spec);

            assertFalse(strategy.requiresParse());
            assertEquals(1, detections.size());
            assertTrue(detections.get(0).message().startsWith("file does not parse: "));
            assertEquals("<file>", detections.get(0).frame());
        }

        @Test
        void parsedFileHasNoFinding() {
            assertTrue(strategy.detect(SourceUnit.parse("A.java", "class A {}\n"), spec).isEmpty());
        }
    }
}
