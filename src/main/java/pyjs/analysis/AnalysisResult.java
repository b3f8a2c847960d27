package pyjs.analysis;

import pyjs.Diagnostic;

import java.util.List;

public record AnalysisResult(List<Diagnostic> diagnostics, SemanticModel model) {
	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}
}
