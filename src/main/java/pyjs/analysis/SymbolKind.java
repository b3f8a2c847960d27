package pyjs.analysis;

public enum SymbolKind {
	VARIABLE,
	FUNCTION,
	PARAMETER,
	CLASS,
	BUILTIN;

	/**
	 * Variables and parameters may rebind each other: assigning to a parameter is ordinary rebinding.
	 */
	public boolean canRebindAs(SymbolKind other) {
		if (isValue() && other.isValue()) {
			return true;
		}
		return this == FUNCTION && other == FUNCTION;
	}

	public boolean isValue() {
		return this == VARIABLE || this == PARAMETER;
	}

	public String displayName() {
		return name().toLowerCase();
	}
}
