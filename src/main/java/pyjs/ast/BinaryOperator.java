package pyjs.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Binary operators with their binding strength. Higher binds tighter. The prefix operators {@code not} and unary
 * minus share {@link #UNARY_PRECEDENCE}, between the multiplicative operators and {@code **}.
 */
public enum BinaryOperator {
	OR("or", 1),
	AND("and", 2),
	EQ("==", 3),
	NE("!=", 3),
	LT("<", 3),
	GT(">", 3),
	LE("<=", 3),
	GE(">=", 3),
	ADD("+", 4),
	SUB("-", 4),
	MUL("*", 5),
	DIV("/", 5),
	FLOOR_DIV("//", 5),
	MOD("%", 5),
	POW("**", 7);

	public static final int UNARY_PRECEDENCE = 6;

	private static final Map<String, BinaryOperator> BY_SYMBOL = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(BinaryOperator::symbol, Function.identity()));

	private final String symbol;
	private final int precedence;

	BinaryOperator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String symbol() {
		return symbol;
	}

	public int precedence() {
		return precedence;
	}

	public boolean isRightAssociative() {
		return this == POW;
	}

	public boolean isComparison() {
		return precedence == 3;
	}

	/**
	 * Returns the operator spelled by {@code symbol} (an operator lexeme or the keywords {@code and}/{@code or}),
	 * or null.
	 */
	public static BinaryOperator fromSymbol(String symbol) {
		return BY_SYMBOL.get(symbol);
	}
}
