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

/**
 * Splits filter expression text into tokens. Keywords are left as identifiers and recognised by the parser.
 */
public class ExpressionLexer {

	private final String text;
	private int pos = 0;

	public ExpressionLexer(String text) {
		this.text = text;
	}

	public static List<Token> tokenize(String text) throws ExpressionSyntaxException {
		return new ExpressionLexer(text).tokenize();
	}

	public List<Token> tokenize() throws ExpressionSyntaxException {
		List<Token> tokens = new ArrayList<>();
		while (true) {
			skipWhitespace();
			if (pos >= text.length()) {
				tokens.add(new Token(TokenType.EOF, "", "", pos, pos));
				return tokens;
			}
			tokens.add(next());
		}
	}

	private void skipWhitespace() {
		while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
			pos++;
		}
	}

	private Token next() throws ExpressionSyntaxException {
		int start = pos;
		char c = text.charAt(pos);
		switch (c) {
			case '(':
				pos++;
				return simple(TokenType.LPAREN, start);
			case ')':
				pos++;
				return simple(TokenType.RPAREN, start);
			case ',':
				pos++;
				return simple(TokenType.COMMA, start);
			case '\'':
				return quoted('\'', TokenType.STRING, start);
			case '"':
				return quoted('"', TokenType.QUOTED_IDENTIFIER, start);
			default:
				break;
		}
		if (c == '.' && !(pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
			pos++;
			return simple(TokenType.DOT, start);
		}
		if (Character.isDigit(c) || c == '.') {
			return number(start);
		}
		if (Character.isLetter(c) || c == '_' || c == '$') {
			while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
				pos++;
			}
			return simple(TokenType.IDENTIFIER, start);
		}
		String two = pos + 1 < text.length() ? text.substring(pos, pos + 2) : "";
		switch (two) {
			case "<=", ">=", "<>", "!=", "&&", "||" -> {
				pos += 2;
				return simple(TokenType.OPERATOR, start);
			}
			default -> {
			}
		}
		if ("=<>+-".indexOf(c) >= 0) {
			pos++;
			return simple(TokenType.OPERATOR, start);
		}
		throw new ExpressionSyntaxException("Unexpected character '" + c + "'", start);
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	private Token simple(TokenType type, int start) {
		String t = text.substring(start, pos);
		return new Token(type, t, t, start, pos);
	}

	private Token quoted(char quote, TokenType type, int start) throws ExpressionSyntaxException {
		StringBuilder value = new StringBuilder();
		pos++;
		while (pos < text.length()) {
			char c = text.charAt(pos++);
			if (c == quote) {
				if (pos < text.length() && text.charAt(pos) == quote) {
					value.append(quote);
					pos++;
				} else {
					return new Token(type, text.substring(start, pos), value.toString(), start, pos);
				}
			} else {
				value.append(c);
			}
		}
		throw new ExpressionSyntaxException("Unterminated " + (quote == '"' ? "identifier" : "string"), start);
	}

	private Token number(int start) throws ExpressionSyntaxException {
		while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
			pos++;
		}
		if (pos < text.length() && text.charAt(pos) == '.') {
			pos++;
			while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
				pos++;
			}
		}
		if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
			int mark = pos++;
			if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
				pos++;
			}
			if (pos >= text.length() || !Character.isDigit(text.charAt(pos))) {
				pos = mark;
				throw new ExpressionSyntaxException("Malformed number exponent", mark);
			}
			while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
				pos++;
			}
		}
		if (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
			throw new ExpressionSyntaxException("Malformed number", start);
		}
		return simple(TokenType.NUMBER, start);
	}
}
