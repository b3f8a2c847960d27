package pyjs.analysis;

public record SymbolInfo(String name, SymbolKind kind, int declaredAtLine, InferredType inferredType) {
	public SymbolInfo withType(InferredType type) {
		return new SymbolInfo(name, kind, declaredAtLine, type);
	}
}
