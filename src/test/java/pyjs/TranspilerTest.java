package pyjs;

import org.junit.jupiter.api.Test;
import pyjs.parse.PyLexer;
import pyjs.parse.PyTokenKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class TranspilerTest {
	private static final String GREETING = "def greet(name):\n" +
			"    return \"Hello, \" + name\n" +
			"message = greet(\"World\")\n" +
			"print(message)\n";

	private static final String LOOP = "for i in range(3):\n" +
			"    if i > 1:\n" +
			"        print(\"big\")\n" +
			"    else:\n" +
			"        print(\"small\")\n";

	@Test
	void compilesFunctionAndCall() {
		CompileResult result = new Transpiler().compile(GREETING);

		assertTrue(result.isSuccess());
		assertEquals(List.of(), result.diagnostics());
		String js = result.generatedText().orElseThrow();
		assertTrue(js.contains("function greet(name) {"), js);
		assertTrue(js.contains("(\"Hello, \" + name)"), js);
		assertEquals(1, occurrences(js, "let "));
		assertEquals(1, occurrences(js, "console.log("));
	}

	@Test
	void compilesLoopWithCondition() {
		String js = new Transpiler().compile(LOOP).generatedText().orElseThrow();

		assertTrue(js.contains("if (i > 1) {"), js);
		assertTrue(js.startsWith("let i;\n"), js);
		assertTrue(js.contains("for (i of Array.from({ length: 3 }"), js);
	}

	@Test
	void loopPrintsThreeLinesUnderNode() throws Exception {
		assumeTrue(NodeRunner.isAvailable(), "node is not installed");

		String js = new Transpiler().compile(LOOP).generatedText().orElseThrow();

		assertEquals("small\nsmall\nbig\n", NodeRunner.run(js));
	}

	@Test
	void sequenceOperatorsBehaveLikePythonUnderNode() throws Exception {
		assumeTrue(NodeRunner.isAvailable(), "node is not installed");

		assertEquals("10 2\n", runUnderNode("xs = [10] + [20]\nprint(xs[0], len(xs))\n"));
		assertEquals("abab --\n", runUnderNode("print(\"ab\" * 2, 2 * \"-\")\n"));
		assertEquals("4 1 0\n", runUnderNode("ys = [0, 1] * 2\nzs = [1] * -1\nprint(len(ys), ys[3], len(zs))\n"));
	}

	@Test
	void loopVariableKeepsLastValueUnderNode() throws Exception {
		assumeTrue(NodeRunner.isAvailable(), "node is not installed");

		assertEquals("2\n", runUnderNode("for i in range(3):\n    pass\nprint(i)\n"));
	}

	@Test
	void rangeEvaluatesItsArgumentsOnceUnderNode() throws Exception {
		assumeTrue(NodeRunner.isAvailable(), "node is not installed");

		String source = "def s():\n" +
				"    print(\"s\")\n" +
				"    return 0\n" +
				"for i in range(s(), 2):\n" +
				"    print(i)\n";

		assertEquals("s\n0\n1\n", runUnderNode(source));
	}

	@Test
	void userDefinedNamesKeepPythonMeaningUnderNode() throws Exception {
		assumeTrue(NodeRunner.isAvailable(), "node is not installed");

		String bag = "class Bag:\n" +
				"    def append(self, x):\n" +
				"        print(x)\n" +
				"b = Bag()\n" +
				"b.append(4)\n";
		assertEquals("4\n", runUnderNode(bag));
		assertEquals("neg\n", runUnderNode("d = {-1: \"neg\"}\nprint(d[-1])\n"));

		String redefined = "def f():\n" +
				"    return 1\n" +
				"print(f())\n" +
				"def f():\n" +
				"    return 2\n" +
				"print(f())\n";
		assertEquals("1\n2\n", runUnderNode(redefined));
		assertEquals("[ 1 ]\n", runUnderNode("console = [1]\nprint(console)\n"));
	}

	@Test
	void undefinedNameProducesOneSemanticErrorAndNoOutput() {
		CompileResult result = new Transpiler().compile("x = 1\nprint(y)\n");

		assertFalse(result.isSuccess());
		assertEquals(1, result.diagnostics().size());
		Diagnostic d = result.diagnostics().get(0);
		assertEquals(Diagnostic.Stage.SEMANTIC, d.stage());
		assertEquals(Diagnostic.Severity.ERROR, d.severity());
		assertEquals(2, d.line());
		assertEquals("2:7: error: undefined name 'y'", d.toString());
	}

	@Test
	void inconsistentDedentProducesOneLexError() {
		CompileResult result = new Transpiler().compile("if x:\n    y = 1\n  z = 2\n");

		assertFalse(result.isSuccess());
		assertEquals(1, result.diagnostics().size());
		assertEquals(Diagnostic.Stage.LEX, result.diagnostics().get(0).stage());
		assertEquals(3, result.diagnostics().get(0).line());
	}

	@Test
	void parseErrorBecomesDiagnostic() {
		List<Diagnostic> diagnostics = new Transpiler().validate("x = (1 +\n");

		assertEquals(1, diagnostics.size());
		assertEquals(Diagnostic.Stage.LEX, diagnostics.get(0).stage());

		diagnostics = new Transpiler().validate("x = 1 +\n");
		assertEquals(1, diagnostics.size());
		assertEquals(Diagnostic.Stage.PARSE, diagnostics.get(0).stage());
		assertEquals("expected expression but found end of line", diagnostics.get(0).message());
	}

	@Test
	void warningsAccompanySuccessfulOutput() {
		CompileResult result = new Transpiler().compile("xs = [1]\nys = xs + 1\n");

		assertTrue(result.isSuccess());
		assertEquals(1, result.diagnostics().size());
		assertEquals(Diagnostic.Severity.WARNING, result.diagnostics().get(0).severity());
		assertEquals(List.of(), result.errors());
	}

	@Test
	void validateMatchesCompileDiagnostics() {
		Transpiler transpiler = new Transpiler();
		String source = "xs = [1]\nys = xs + 1\nprint(zs)\n";

		assertEquals(transpiler.compile(source).diagnostics(), transpiler.validate(source));
		assertEquals(List.of(), transpiler.validate(GREETING));
	}

	@Test
	void closingBracesMatchDedents() {
		String source = "def fact(n):\n" +
				"    if n <= 1:\n" +
				"        return 1\n" +
				"    else:\n" +
				"        return n * fact(n - 1)\n" +
				"class Walker:\n" +
				"    def __init__(self, a):\n" +
				"        self.a = a\n" +
				"    def walk(self):\n" +
				"        while self.a > 10:\n" +
				"            self.a = self.a - 1\n" +
				"        return self.a\n" +
				"print(fact(5), Walker(12).walk())\n";

		long dedents = new PyLexer().lex(source).stream().filter(t -> t.kind() == PyTokenKind.DEDENT).count();
		String js = new Transpiler().compile(source).generatedText().orElseThrow();

		assertEquals(7, dedents);
		assertEquals(dedents, occurrences(js, "}"));
	}

	@Test
	void honorsOptions() {
		Transpiler transpiler = new Transpiler(new CompilerOptions("    ", 8));

		String js = transpiler.compile("if True:\n\tx = 1\n").generatedText().orElseThrow();

		assertEquals("let x;\nif (true) {\n    x = 1;\n}\n", js);
	}

	@Test
	void rejectsInvalidOptions() {
		assertThrows(IllegalArgumentException.class, () -> new CompilerOptions("", 4));
		assertThrows(IllegalArgumentException.class, () -> new CompilerOptions("ab", 4));
		assertThrows(IllegalArgumentException.class, () -> new CompilerOptions("  ", 0));
		assertThrows(NullPointerException.class, () -> new Transpiler().compile(null));
	}

	@Test
	void emptySourceCompilesToEmptyOutput() {
		CompileResult result = new Transpiler().compile("# nothing here\n\n");

		assertEquals("", result.generatedText().orElseThrow());
		assertEquals(List.of(), result.diagnostics());
	}

	private static String runUnderNode(String source) throws Exception {
		CompileResult result = new Transpiler().compile(source);
		assertEquals(List.of(), result.errors());
		return NodeRunner.run(result.generatedText().orElseThrow());
	}

	private static int occurrences(String haystack, String needle) {
		int count = 0;
		for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + needle.length())) {
			count++;
		}
		return count;
	}
}
