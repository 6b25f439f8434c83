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
package org.neo4j.spatial.filter.rewrite;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.neo4j.spatial.filter.api.BackendKind;
import org.neo4j.spatial.filter.expression.ExpressionLexer;
import org.neo4j.spatial.filter.expression.ExpressionSyntaxException;
import org.neo4j.spatial.filter.expression.Token;
import org.neo4j.spatial.filter.expression.TokenType;

/**
 * Guesses which backend an expression of unknown origin was written for, from the functions and operators it
 * uses. Requests normally carry their backend explicitly; this is only for classifying an existing filter
 * found on a dataset. {@link BackendKind#UNKNOWN} is a normal answer.
 */
public final class BackendDialectDetector {

	private static final Set<String> EMBEDDED_FUNCTIONS = Set.of("GEOMFROMTEXT", "MBRINTERSECTS", "BUILDMBR",
			"MAKEPOINT", "GEOMFROMWKB", "SIMPLIFYPRESERVETOPOLOGY", "PTDISTWITHIN");
	private static final Set<String> EMBEDDED_NAMES = Set.of("ROWID", "PKID", "XMIN", "XMAX", "YMIN", "YMAX");
	private static final Set<String> IN_MEMORY_NAMES = Set.of("$ID", "$GEOMETRY", "$AREA", "$LENGTH");

	private BackendDialectDetector() {
	}

	public static BackendKind detect(String expression) {
		if (expression == null || expression.isBlank()) {
			return BackendKind.UNKNOWN;
		}
		List<Token> tokens;
		try {
			tokens = ExpressionLexer.tokenize(expression);
		} catch (ExpressionSyntaxException e) {
			return BackendKind.UNKNOWN;
		}
		int server = 0;
		int embedded = 0;
		int memory = 0;
		boolean subquery = false;
		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			boolean call = i + 1 < tokens.size() && tokens.get(i + 1).type() == TokenType.LPAREN;
			String upper = token.type() == TokenType.QUOTED_IDENTIFIER ? token.value().toUpperCase(Locale.ROOT)
					: token.upper();
			if (token.isOperator("&&")) {
				server++;
			} else if (token.isKeyword("SELECT")) {
				subquery = true;
			} else if (token.type() == TokenType.IDENTIFIER && call) {
				if (upper.startsWith("ST_")) {
					server++;
				} else if (EMBEDDED_FUNCTIONS.contains(upper)) {
					embedded++;
				}
			} else if (token.type() == TokenType.IDENTIFIER && IN_MEMORY_NAMES.contains(upper)) {
				memory++;
			} else if (token.isName() && (EMBEDDED_NAMES.contains(upper) || upper.startsWith("IDX_"))) {
				embedded++;
			} else if (token.type() == TokenType.STRING && token.value().contains("quad_segs")) {
				server++;
			}
		}
		if (memory > 0 && server == 0 && embedded == 0 && !subquery) {
			return BackendKind.IN_MEMORY;
		}
		if (server > embedded) {
			return BackendKind.SERVER_SQL;
		}
		if (embedded > server) {
			return BackendKind.EMBEDDED_SQL;
		}
		return BackendKind.UNKNOWN;
	}
}
