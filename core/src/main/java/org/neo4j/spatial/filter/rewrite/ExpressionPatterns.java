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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.neo4j.spatial.filter.api.FeatureRecord;
import org.neo4j.spatial.filter.api.IdRange;
import org.neo4j.spatial.filter.api.IdSet;
import org.neo4j.spatial.filter.expression.BetweenExpression;
import org.neo4j.spatial.filter.expression.ColumnRef;
import org.neo4j.spatial.filter.expression.Comparison;
import org.neo4j.spatial.filter.expression.ExistsExpression;
import org.neo4j.spatial.filter.expression.Expression;
import org.neo4j.spatial.filter.expression.ExpressionLexer;
import org.neo4j.spatial.filter.expression.ExpressionParser;
import org.neo4j.spatial.filter.expression.ExpressionSyntaxException;
import org.neo4j.spatial.filter.expression.FunctionCall;
import org.neo4j.spatial.filter.expression.InList;
import org.neo4j.spatial.filter.expression.InSubquery;
import org.neo4j.spatial.filter.expression.Literal;
import org.neo4j.spatial.filter.expression.LogicalExpression;
import org.neo4j.spatial.filter.expression.SelectQuery;
import org.neo4j.spatial.filter.expression.Token;
import org.neo4j.spatial.filter.expression.TokenType;
import org.neo4j.spatial.filter.model.SpatialPredicate;

/**
 * Recognises the expression fragments the rewriters care about in parsed filter expressions.
 */
public class ExpressionPatterns {

	public static final Set<String> DEFAULT_ID_COLUMNS = Set.of("fid", "$id", "rowid", "id", "pk", "ogc_fid", "gid");
	private static final Set<String> BBOX_FUNCTIONS = Set.of("MBRINTERSECTS", "ST_ENVELOPESINTERSECT",
			"ENVELOPESINTERSECT", "ST_DWITHIN", "DWITHIN", "PTDISTWITHIN");

	private final Set<String> idColumns;

	public ExpressionPatterns() {
		this(DEFAULT_ID_COLUMNS);
	}

	public ExpressionPatterns(Set<String> idColumns) {
		Set<String> lower = new LinkedHashSet<>();
		idColumns.forEach(c -> lower.add(c.toLowerCase(Locale.ROOT)));
		this.idColumns = Set.copyOf(lower);
	}

	/**
	 * @return the parsed expression, or null if the text is not in the supported grammar
	 */
	public static Expression parseOrNull(String text) {
		try {
			return ExpressionParser.parse(text);
		} catch (ExpressionSyntaxException e) {
			return null;
		}
	}

	public boolean isIdColumn(Expression node) {
		return node instanceof ColumnRef ref && idColumns.contains(ref.getName().toLowerCase(Locale.ROOT));
	}

	public PatternMatch<IdPredicate> idPredicate(String text) {
		Expression node = parseOrNull(text);
		if (node == null) {
			return startsWithInList(text, false) ? PatternMatch.malformed("Unparseable id list: " + abbreviate(text))
					: PatternMatch.noMatch();
		}
		return idPredicate(node);
	}

	public PatternMatch<IdPredicate> idPredicate(Expression node) {
		Expression e = node.unwrap();
		if (e instanceof InList in && !in.isNegated() && isIdColumn(in.getOperand())) {
			long[] ids = new long[in.getValues().size()];
			for (int i = 0; i < ids.length; i++) {
				Long id = integer(in.getValues().get(i));
				if (id == null) {
					return PatternMatch.malformed("Non integer value in id list: " + in.getValues().get(i)
							.getSourceText());
				}
				ids[i] = id;
			}
			return PatternMatch.match(new IdPredicate(node, (ColumnRef) in.getOperand(), IdSet.of(ids), false));
		}
		if (e instanceof Comparison c && c.getOperator().equals("=")) {
			if (isIdColumn(c.getLeft()) && integer(c.getRight()) != null) {
				return PatternMatch.match(
						new IdPredicate(node, (ColumnRef) c.getLeft(), IdSet.of(integer(c.getRight())), false));
			}
			if (isIdColumn(c.getRight()) && integer(c.getLeft()) != null) {
				return PatternMatch.match(
						new IdPredicate(node, (ColumnRef) c.getRight(), IdSet.of(integer(c.getLeft())), false));
			}
			return PatternMatch.noMatch();
		}
		if (e instanceof BetweenExpression b && !b.isNegated() && isIdColumn(b.getOperand())) {
			Long low = integer(b.getLower());
			Long high = integer(b.getUpper());
			if (low == null || high == null) {
				return PatternMatch.malformed("Non integer id range: " + b.getSourceText());
			}
			IdSet ids = low <= high ? IdSet.ofRanges(List.of(new IdRange(low, high)), List.of()) : IdSet.empty();
			return PatternMatch.match(new IdPredicate(node, (ColumnRef) b.getOperand(), ids, true));
		}
		if (e instanceof LogicalExpression logical) {
			return logical.getOperator() == LogicalExpression.Operator.AND ? boundedRange(node, logical)
					: unionOfRanges(node, logical);
		}
		return PatternMatch.noMatch();
	}

	/**
	 * {@code id >= a AND id <= b [AND id NOT IN (...)] [AND id <> c]}
	 */
	private PatternMatch<IdPredicate> boundedRange(Expression node, LogicalExpression and) {
		ColumnRef column = null;
		Long low = null;
		Long high = null;
		List<Long> exclusions = new ArrayList<>();
		for (Expression operand : and.getOperands()) {
			Expression o = operand.unwrap();
			ColumnRef ref;
			if (o instanceof Comparison c && isIdColumn(c.getLeft()) && integer(c.getRight()) != null) {
				ref = (ColumnRef) c.getLeft();
				long value = integer(c.getRight());
				switch (c.getOperator()) {
					case ">=" -> low = max(low, value);
					case ">" -> low = max(low, value + 1);
					case "<=" -> high = min(high, value);
					case "<" -> high = min(high, value - 1);
					case "<>", "!=" -> exclusions.add(value);
					default -> {
						return PatternMatch.noMatch();
					}
				}
			} else if (o instanceof InList in && in.isNegated() && isIdColumn(in.getOperand())) {
				ref = (ColumnRef) in.getOperand();
				for (Expression value : in.getValues()) {
					Long id = integer(value);
					if (id == null) {
						return PatternMatch.malformed("Non integer id exclusion: " + value.getSourceText());
					}
					exclusions.add(id);
				}
			} else {
				return PatternMatch.noMatch();
			}
			if (column != null && !sameColumn(column, ref)) {
				return PatternMatch.noMatch();
			}
			column = ref;
		}
		if (column == null || low == null || high == null) {
			return PatternMatch.noMatch();
		}
		IdSet ids = low <= high ? IdSet.ofRanges(List.of(new IdRange(low, high)), exclusions) : IdSet.empty();
		return PatternMatch.match(new IdPredicate(node, column, ids, true));
	}

	/**
	 * An OR of id predicates on the same column, as produced for runs of consecutive ids.
	 */
	private PatternMatch<IdPredicate> unionOfRanges(Expression node, LogicalExpression or) {
		ColumnRef column = null;
		List<IdRange> ranges = new ArrayList<>();
		for (Expression operand : or.getOperands()) {
			PatternMatch<IdPredicate> part = idPredicate(operand);
			if (!part.isMatch()) {
				return part;
			}
			IdPredicate predicate = part.getValue();
			if (column != null && !sameColumn(column, predicate.column())) {
				return PatternMatch.noMatch();
			}
			column = predicate.column();
			IdSet ids = predicate.ids();
			if (ids.isCompressed()) {
				if (ids.getExclusions().length > 0) {
					return PatternMatch.noMatch();
				}
				ranges.addAll(ids.getRanges());
			} else {
				for (long id : ids.toIdArray()) {
					ranges.add(new IdRange(id, id));
				}
			}
		}
		IdSet ids = ranges.isEmpty() ? IdSet.empty() : IdSet.ofRanges(ranges, List.of());
		return PatternMatch.match(new IdPredicate(node, column, ids, true));
	}

	public PatternMatch<MaterializedMembership> materializedMembership(String text) {
		Expression node = parseOrNull(text);
		if (node == null) {
			return startsWithInList(text, true)
					? PatternMatch.malformed("Unparseable materialized result reference: " + abbreviate(text))
					: PatternMatch.noMatch();
		}
		return materializedMembership(node);
	}

	public PatternMatch<MaterializedMembership> materializedMembership(Expression node) {
		if (!(node.unwrap() instanceof InSubquery in) || in.isNegated()
				|| !(in.getOperand() instanceof ColumnRef column)) {
			return PatternMatch.noMatch();
		}
		SelectQuery query = in.getQuery();
		if (query.getTableParts() == null || query.getWhere() != null || query.getItems().size() != 1) {
			return PatternMatch.noMatch();
		}
		if (!(query.getItems().get(0).expression() instanceof ColumnRef key)) {
			return PatternMatch.malformed("Materialized result reference selects an expression: "
					+ query.getItems().get(0).expression().getSourceText());
		}
		return PatternMatch.match(new MaterializedMembership(in, column, key));
	}

	public PatternMatch<SpatialExistsClause> spatialExists(String text) {
		Expression node = parseOrNull(text);
		if (node == null) {
			return startsWithKeyword(text, "EXISTS")
					? PatternMatch.malformed("Unparseable EXISTS clause: " + abbreviate(text))
					: PatternMatch.noMatch();
		}
		return spatialExists(node);
	}

	public PatternMatch<SpatialExistsClause> spatialExists(Expression node) {
		if (!(node.unwrap() instanceof ExistsExpression exists)) {
			return PatternMatch.noMatch();
		}
		if (exists.getQuery().getWhere() == null) {
			return PatternMatch.noMatch();
		}
		List<Expression> predicates = new ArrayList<>();
		Set<String> innerNames = new LinkedHashSet<>();
		for (Expression d : exists.descendants()) {
			if (isSpatialPredicate(d)) {
				predicates.add(d);
			}
			if (d instanceof SelectQuery q) {
				if (q.getAlias() != null) {
					innerNames.add(q.getAlias().toLowerCase(Locale.ROOT));
				}
				if (q.getTableParts() != null) {
					List<String> parts = q.getTableParts();
					innerNames.add(parts.get(parts.size() - 1).toLowerCase(Locale.ROOT));
				}
			}
		}
		if (predicates.isEmpty()) {
			return PatternMatch.noMatch();
		}
		List<ColumnRef> outer = new ArrayList<>();
		for (Expression d : exists.descendants()) {
			if (d instanceof ColumnRef ref && ref.getQualifier() != null
					&& !innerNames.contains(ref.getQualifier().toLowerCase(Locale.ROOT))) {
				outer.add(ref);
			}
		}
		return PatternMatch.match(new SpatialExistsClause(exists, predicates, outer, List.copyOf(innerNames)));
	}

	public static boolean containsSpatialPredicate(Expression node) {
		return node.descendants().stream().anyMatch(ExpressionPatterns::isSpatialPredicate);
	}

	public static boolean isSpatialPredicate(Expression node) {
		if (node instanceof FunctionCall call) {
			return SpatialPredicate.fromFunctionName(call.getName()) != null
					|| BBOX_FUNCTIONS.contains(call.getUpperName());
		}
		return node instanceof Comparison c && c.getOperator().equals("&&");
	}

	public static boolean isGeometryColumnName(String name) {
		return FeatureRecord.GEOMETRY_ALIASES.contains(name.toLowerCase(Locale.ROOT));
	}

	/**
	 * @return the operands of a top level AND chain, looking through parentheses, or the expression itself
	 */
	public static List<Expression> conjuncts(Expression node) {
		List<Expression> result = new ArrayList<>();
		Expression e = node.unwrap();
		if (e instanceof LogicalExpression logical && logical.getOperator() == LogicalExpression.Operator.AND) {
			for (Expression operand : logical.getOperands()) {
				result.addAll(conjuncts(operand));
			}
		} else {
			result.add(e);
		}
		return result;
	}

	/**
	 * Token level check for {@code idcolumn IN (} or {@code column IN (SELECT}, used to tell a broken id
	 * predicate from text that never was one.
	 */
	private boolean startsWithInList(String text, boolean subquery) {
		List<Token> tokens = tokensOrNull(text);
		if (tokens == null) {
			return false;
		}
		int i = 0;
		while (i < tokens.size() && tokens.get(i).type() == TokenType.LPAREN) {
			i++;
		}
		if (i >= tokens.size() || !tokens.get(i).isName()) {
			return false;
		}
		String name = tokens.get(i).value();
		i++;
		while (i + 1 < tokens.size() && tokens.get(i).type() == TokenType.DOT && tokens.get(i + 1).isName()) {
			name = tokens.get(i + 1).value();
			i += 2;
		}
		if (i + 1 >= tokens.size() || !tokens.get(i).isKeyword("IN")
				|| tokens.get(i + 1).type() != TokenType.LPAREN) {
			return false;
		}
		if (subquery) {
			return i + 2 < tokens.size() && tokens.get(i + 2).isKeyword("SELECT");
		}
		return idColumns.contains(name.toLowerCase(Locale.ROOT))
				&& !(i + 2 < tokens.size() && tokens.get(i + 2).isKeyword("SELECT"));
	}

	private static boolean startsWithKeyword(String text, String keyword) {
		List<Token> tokens = tokensOrNull(text);
		if (tokens == null) {
			return text.trim().toUpperCase(Locale.ROOT).startsWith(keyword);
		}
		for (Token token : tokens) {
			if (token.type() != TokenType.LPAREN) {
				return token.isKeyword(keyword);
			}
		}
		return false;
	}

	private static List<Token> tokensOrNull(String text) {
		if (text == null) {
			return null;
		}
		try {
			return ExpressionLexer.tokenize(text);
		} catch (ExpressionSyntaxException e) {
			return null;
		}
	}

	private static boolean sameColumn(ColumnRef a, ColumnRef b) {
		return a.getName().equalsIgnoreCase(b.getName())
				&& (a.getQualifier() == null ? b.getQualifier() == null
				: a.getQualifier().equalsIgnoreCase(String.valueOf(b.getQualifier())));
	}

	private static Long integer(Expression node) {
		if (node instanceof Literal literal && literal.getValue() instanceof Long value) {
			return value;
		}
		return null;
	}

	private static Long max(Long current, long value) {
		return current == null ? value : Math.max(current, value);
	}

	private static Long min(Long current, long value) {
		return current == null ? value : Math.min(current, value);
	}

	public static String abbreviate(String text) {
		return text.length() <= 80 ? text : text.substring(0, 77) + "...";
	}
}
