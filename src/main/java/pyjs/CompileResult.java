package pyjs;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link Transpiler#compile(String)}. The generated text is present exactly when no diagnostic is
 * an error; warnings may accompany it.
 */
public record CompileResult(Optional<String> generatedText, List<Diagnostic> diagnostics) {
	public CompileResult {
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean isSuccess() {
		return generatedText.isPresent();
	}

	public List<Diagnostic> errors() {
		return diagnostics.stream().filter(Diagnostic::isError).toList();
	}
}
