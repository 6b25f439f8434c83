/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [http://neo4j.com]
 *
 * This file is part of Neo4j Spatial.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package org.neo4j.spatial.filter.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the filter expression grammar shared by the supported backends:
 *
 * <pre>
 * or         := and (OR and)*
 * and        := not (AND not)*
 * not        := NOT not | predicate
 * predicate  := operand [ compareOp operand | [NOT] IN ( select | list ) | [NOT] BETWEEN operand AND operand
 *                       | [NOT] (LIKE|ILIKE) operand | IS [NOT] NULL ]
 * operand    := literal | - number | EXISTS ( select ) | ( or ) | name [ . name ]* [ ( args ) ]
 * select     := SELECT item [AS name] (, item [AS name])* FROM (name [. name]* | ( select )) [[AS] name]
 *               [WHERE or]
 * </pre>
 */
public class ExpressionParser {

	private static final Set<String> RESERVED = Set.of("AND", "OR", "NOT", "IN", "IS", "NULL", "LIKE", "ILIKE",
			"BETWEEN", "EXISTS", "SELECT", "FROM", "WHERE", "AS", "TRUE", "FALSE");
	private static final Set<String> COMPARISON_OPERATORS = Set.of("=", "<>", "!=", "<", "<=", ">", ">=", "&&");

	private final String source;
	private final List<Token> tokens;
	private int index = 0;

	private ExpressionParser(String source, List<Token> tokens) {
		this.source = source;
		this.tokens = tokens;
	}

	public static Expression parse(String text) throws ExpressionSyntaxException {
		if (text == null || text.isBlank()) {
			throw new ExpressionSyntaxException("Empty expression", 0);
		}
		ExpressionParser parser = new ExpressionParser(text, ExpressionLexer.tokenize(text));
		Expression expression = parser.parseOr();
		if (parser.peek().type() != TokenType.EOF) {
			throw parser.error("Unexpected '" + parser.peek().text() + "'");
		}
		return expression;
	}

	private Token peek() {
		return tokens.get(index);
	}

	private Token peek(int ahead) {
		return tokens.get(Math.min(index + ahead, tokens.size() - 1));
	}

	private Token advance() {
		Token token = tokens.get(index);
		if (token.type() != TokenType.EOF) {
			index++;
		}
		return token;
	}

	private int lastEnd() {
		return index == 0 ? 0 : tokens.get(index - 1).end();
	}

	private boolean acceptKeyword(String keyword) {
		if (peek().isKeyword(keyword)) {
			index++;
			return true;
		}
		return false;
	}

	private void expectKeyword(String keyword) throws ExpressionSyntaxException {
		if (!acceptKeyword(keyword)) {
			throw error("Expected " + keyword + " but found '" + peek().text() + "'");
		}
	}

	private Token expect(TokenType type) throws ExpressionSyntaxException {
		if (peek().type() != type) {
			throw error("Expected " + type + " but found '" + peek().text() + "'");
		}
		return advance();
	}

	private ExpressionSyntaxException error(String message) {
		return new ExpressionSyntaxException(message, peek().start());
	}

	private Expression parseOr() throws ExpressionSyntaxException {
		int start = peek().start();
		List<Expression> operands = new ArrayList<>();
		operands.add(parseAnd());
		while (acceptKeyword("OR") || acceptOperator("||")) {
			operands.add(parseAnd());
		}
		if (operands.size() == 1) {
			return operands.get(0);
		}
		return new LogicalExpression(source, start, lastEnd(), LogicalExpression.Operator.OR, operands);
	}

	private boolean acceptOperator(String operator) {
		if (peek().isOperator(operator)) {
			index++;
			return true;
		}
		return false;
	}

	private Expression parseAnd() throws ExpressionSyntaxException {
		int start = peek().start();
		List<Expression> operands = new ArrayList<>();
		operands.add(parseNot());
		while (acceptKeyword("AND")) {
			operands.add(parseNot());
		}
		if (operands.size() == 1) {
			return operands.get(0);
		}
		return new LogicalExpression(source, start, lastEnd(), LogicalExpression.Operator.AND, operands);
	}

	private Expression parseNot() throws ExpressionSyntaxException {
		int start = peek().start();
		if (acceptKeyword("NOT")) {
			Expression operand = parseNot();
			return new NotExpression(source, start, lastEnd(), operand);
		}
		return parsePredicate();
	}

	private Expression parsePredicate() throws ExpressionSyntaxException {
		int start = peek().start();
		Expression left = parseOperand();
		Token next = peek();
		if (next.type() == TokenType.OPERATOR && COMPARISON_OPERATORS.contains(next.text())) {
			advance();
			Expression right = parseOperand();
			return new Comparison(source, start, lastEnd(), next.text(), left, right);
		}
		if (next.isKeyword("IS")) {
			advance();
			boolean negated = acceptKeyword("NOT");
			expectKeyword("NULL");
			return new IsNullExpression(source, start, lastEnd(), left, negated);
		}
		boolean negated = false;
		if (next.isKeyword("NOT") && (peek(1).isKeyword("IN") || peek(1).isKeyword("BETWEEN")
				|| peek(1).isKeyword("LIKE") || peek(1).isKeyword("ILIKE"))) {
			advance();
			negated = true;
		}
		if (acceptKeyword("IN")) {
			return parseIn(start, left, negated);
		}
		if (acceptKeyword("BETWEEN")) {
			Expression lower = parseOperand();
			expectKeyword("AND");
			Expression upper = parseOperand();
			return new BetweenExpression(source, start, lastEnd(), left, lower, upper, negated);
		}
		if (peek().isKeyword("LIKE") || peek().isKeyword("ILIKE")) {
			boolean caseInsensitive = advance().isKeyword("ILIKE");
			Expression pattern = parseOperand();
			return new LikeExpression(source, start, lastEnd(), left, pattern, caseInsensitive, negated);
		}
		if (negated) {
			throw error("Expected IN, BETWEEN or LIKE after NOT");
		}
		return left;
	}

	private Expression parseIn(int start, Expression left, boolean negated) throws ExpressionSyntaxException {
		expect(TokenType.LPAREN);
		if (peek().isKeyword("SELECT")) {
			SelectQuery query = parseSelect();
			expect(TokenType.RPAREN);
			return new InSubquery(source, start, lastEnd(), left, query, negated);
		}
		List<Expression> values = new ArrayList<>();
		if (peek().type() == TokenType.RPAREN) {
			throw error("Empty IN list");
		}
		values.add(parseOperand());
		while (peek().type() == TokenType.COMMA) {
			advance();
			values.add(parseOperand());
		}
		expect(TokenType.RPAREN);
		return new InList(source, start, lastEnd(), left, values, negated);
	}

	private Expression parseOperand() throws ExpressionSyntaxException {
		Token token = peek();
		int start = token.start();
		switch (token.type()) {
			case NUMBER -> {
				advance();
				return new Literal(source, start, lastEnd(), parseNumber(token.text(), false));
			}
			case STRING -> {
				advance();
				return new Literal(source, start, lastEnd(), token.value());
			}
			case OPERATOR -> {
				if (token.isOperator("-") || token.isOperator("+")) {
					advance();
					Token number = expect(TokenType.NUMBER);
					return new Literal(source, start, lastEnd(), parseNumber(number.text(), token.isOperator("-")));
				}
				throw error("Unexpected operator '" + token.text() + "'");
			}
			case LPAREN -> {
				advance();
				Expression inner = parseOr();
				expect(TokenType.RPAREN);
				return new Parenthesized(source, start, lastEnd(), inner);
			}
			case IDENTIFIER, QUOTED_IDENTIFIER -> {
				return parseNameOrCall();
			}
			default -> throw error(token.type() == TokenType.EOF ? "Unexpected end of expression"
					: "Unexpected '" + token.text() + "'");
		}
	}

	private Expression parseNameOrCall() throws ExpressionSyntaxException {
		Token first = peek();
		int start = first.start();
		if (first.type() == TokenType.IDENTIFIER) {
			switch (first.upper()) {
				case "NULL" -> {
					advance();
					return new Literal(source, start, lastEnd(), null);
				}
				case "TRUE", "FALSE" -> {
					advance();
					return new Literal(source, start, lastEnd(), first.isKeyword("TRUE"));
				}
				case "EXISTS" -> {
					advance();
					expect(TokenType.LPAREN);
					SelectQuery query = parseSelect();
					expect(TokenType.RPAREN);
					return new ExistsExpression(source, start, lastEnd(), query);
				}
				default -> {
					if (RESERVED.contains(first.upper())) {
						throw error("Unexpected keyword " + first.text());
					}
				}
			}
		}
		List<String> parts = parseQualifiedName();
		if (parts.size() == 1 && first.type() == TokenType.IDENTIFIER && peek().type() == TokenType.LPAREN) {
			advance();
			List<Expression> arguments = new ArrayList<>();
			if (peek().type() != TokenType.RPAREN) {
				arguments.add(parseOr());
				while (peek().type() == TokenType.COMMA) {
					advance();
					arguments.add(parseOr());
				}
			}
			expect(TokenType.RPAREN);
			return new FunctionCall(source, start, lastEnd(), parts.get(0), arguments);
		}
		String name = parts.get(parts.size() - 1);
		String qualifier = parts.size() == 1 ? null : String.join(".", parts.subList(0, parts.size() - 1));
		return new ColumnRef(source, start, lastEnd(), qualifier, name);
	}

	private List<String> parseQualifiedName() throws ExpressionSyntaxException {
		List<String> parts = new ArrayList<>();
		parts.add(name());
		while (peek().type() == TokenType.DOT) {
			advance();
			parts.add(name());
		}
		return parts;
	}

	private String name() throws ExpressionSyntaxException {
		Token token = peek();
		if (!token.isName() || (token.type() == TokenType.IDENTIFIER && RESERVED.contains(token.upper()))) {
			throw error("Expected a name but found '" + token.text() + "'");
		}
		advance();
		return token.value();
	}

	private SelectQuery parseSelect() throws ExpressionSyntaxException {
		int start = peek().start();
		expectKeyword("SELECT");
		List<SelectQuery.SelectItem> items = new ArrayList<>();
		items.add(parseSelectItem());
		while (peek().type() == TokenType.COMMA) {
			advance();
			items.add(parseSelectItem());
		}
		expectKeyword("FROM");
		List<String> tableParts = null;
		String tableText = null;
		Expression derived = null;
		if (peek().type() == TokenType.LPAREN) {
			int derivedStart = advance().start();
			SelectQuery inner = parseSelect();
			expect(TokenType.RPAREN);
			derived = new Parenthesized(source, derivedStart, lastEnd(), inner);
		} else {
			int tableStart = peek().start();
			tableParts = parseQualifiedName();
			tableText = source.substring(tableStart, lastEnd());
		}
		String alias = null;
		if (acceptKeyword("AS")) {
			alias = name();
		} else if (peek().isName() && !RESERVED.contains(peek().upper())) {
			alias = name();
		}
		Expression where = null;
		if (acceptKeyword("WHERE")) {
			where = parseOr();
		}
		return new SelectQuery(source, start, lastEnd(), items, tableParts, tableText, derived, alias, where);
	}

	private SelectQuery.SelectItem parseSelectItem() throws ExpressionSyntaxException {
		Expression expression = parseOr();
		String alias = null;
		if (acceptKeyword("AS")) {
			alias = name();
		}
		return new SelectQuery.SelectItem(expression, alias);
	}

	private Object parseNumber(String text, boolean negative) throws ExpressionSyntaxException {
		String signed = negative ? "-" + text : text;
		try {
			if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
				return Long.parseLong(signed);
			}
			return Double.parseDouble(signed);
		} catch (NumberFormatException e) {
			throw error("Invalid number " + signed);
		}
	}
}
