package pyjs;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class GoldenTranspileTest {
	private static final Path GOLDEN = Path.of("src", "test", "resources", "golden");

	@ParameterizedTest
	@ValueSource(strings = { "functions", "classes" })
	void transpilesSamplePythonToExpectedJavaScript(String name) throws Exception {
		String pythonSource = Files.readString(GOLDEN.resolve(name + ".py"));
		String expected = Files.readString(GOLDEN.resolve(name + ".js"));

		CompileResult result = new Transpiler().compile(pythonSource);

		assertTrue(result.isSuccess(), result.diagnostics().toString());
		assertEquals(normalize(expected), normalize(result.generatedText().orElseThrow()));
	}

	@ParameterizedTest
	@ValueSource(strings = { "functions", "classes" })
	void generatedJavaScriptPrintsWhatPythonPrints(String name) throws Exception {
		assumeTrue(NodeRunner.isAvailable(), "node is not installed");
		String pythonSource = Files.readString(GOLDEN.resolve(name + ".py"));
		String expectedOutput = Files.readString(GOLDEN.resolve(name + ".out"));

		String js = new Transpiler().compile(pythonSource).generatedText().orElseThrow();

		assertEquals(normalize(expectedOutput), normalize(NodeRunner.run(js)));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
