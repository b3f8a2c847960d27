package pyjs.ast;

public enum UnaryOperator {
	NOT("not"),
	NEG("-");

	private final String symbol;

	UnaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
