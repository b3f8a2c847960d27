package pyjs.analysis;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One lexical scope of the analyzer. Lookup walks outward through the parents.
 */
final class Scope {
	enum Kind {
		BUILTINS,
		MODULE,
		FUNCTION,
		CLASS
	}

	private final Scope parent;
	private final Kind kind;
	private final Map<String, SymbolInfo> symbols = new LinkedHashMap<>();
	private final Set<String> assigned = new HashSet<>();

	Scope(Scope parent, Kind kind) {
		this.parent = parent;
		this.kind = kind;
	}

	void define(SymbolInfo symbol) {
		symbols.put(symbol.name(), symbol);
	}

	SymbolInfo lookupLocal(String name) {
		return symbols.get(name);
	}

	SymbolInfo lookup(String name) {
		for (Scope s = this; s != null; s = s.parent) {
			// a class body is not an enclosing scope for its methods
			if (s != this && s.kind == Kind.CLASS) {
				continue;
			}
			SymbolInfo found = s.symbols.get(name);
			if (found != null) {
				return found;
			}
		}
		return null;
	}

	/**
	 * Records a value flowing into a local binding. The first assignment fixes the type; a later assignment of
	 * a different type demotes it to {@link InferredType#UNKNOWN}.
	 */
	void recordAssignment(String name, InferredType type) {
		SymbolInfo symbol = symbols.get(name);
		if (symbol == null) {
			return;
		}
		if (assigned.add(name)) {
			symbols.put(name, symbol.withType(type));
		} else if (symbol.inferredType() != type) {
			symbols.put(name, symbol.withType(InferredType.UNKNOWN));
		}
	}
}
