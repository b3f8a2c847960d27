package pyjs.analysis;

import pyjs.ast.PyExpr;
import pyjs.ast.PyNameExpr;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Analysis results keyed by node identity: the symbol each name resolved to and the inferred type of each
 * expression. The tree itself carries none of this.
 */
public final class SemanticModel {
	private final Map<PyNameExpr, SymbolInfo> resolutions = new IdentityHashMap<>();
	private final Map<PyExpr, InferredType> types = new IdentityHashMap<>();

	void resolve(PyNameExpr name, SymbolInfo symbol) {
		resolutions.put(name, symbol);
	}

	void recordType(PyExpr expr, InferredType type) {
		types.put(expr, type);
	}

	/**
	 * Returns the symbol {@code name} resolved to, or null if it was never resolved.
	 */
	public SymbolInfo symbolOf(PyNameExpr name) {
		return resolutions.get(name);
	}

	public InferredType typeOf(PyExpr expr) {
		return types.getOrDefault(expr, InferredType.UNKNOWN);
	}

	public boolean isBuiltinCall(PyExpr callee, BuiltinFunction builtin) {
		if (callee instanceof PyNameExpr name) {
			SymbolInfo symbol = symbolOf(name);
			return symbol != null && symbol.kind() == SymbolKind.BUILTIN && name.name().equals(builtin.pythonName());
		}
		return false;
	}

	public Map<PyNameExpr, SymbolInfo> resolutions() {
		return Collections.unmodifiableMap(resolutions);
	}
}
