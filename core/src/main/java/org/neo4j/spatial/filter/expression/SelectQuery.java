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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;
import org.neo4j.spatial.filter.api.FeatureRecord;

/**
 * The restricted subquery form used inside {@code IN (...)}, {@code EXISTS (...)} and derived tables:
 * {@code SELECT item [AS alias], ... FROM table|(subquery) [[AS] alias] [WHERE condition]}.
 */
public class SelectQuery extends Expression {

	public record SelectItem(Expression expression, String alias) {

		public String outputName() {
			if (alias != null) {
				return alias;
			}
			if (expression instanceof ColumnRef ref) {
				return ref.getName();
			}
			if (expression instanceof FunctionCall call) {
				return call.getName().toLowerCase(Locale.ROOT);
			}
			return expression.getSourceText();
		}
	}

	private final List<SelectItem> items;
	private final List<String> tableParts;
	private final String tableText;
	private final SelectQuery derived;
	private final Expression derivedNode;
	private final String alias;
	private final Expression where;

	public SelectQuery(String source, int start, int end, List<SelectItem> items, List<String> tableParts,
			String tableText, Expression derivedNode, String alias, Expression where) {
		super(source, start, end);
		this.items = List.copyOf(items);
		this.tableParts = tableParts == null ? null : List.copyOf(tableParts);
		this.tableText = tableText;
		this.derivedNode = derivedNode;
		this.derived = derivedNode == null ? null : (SelectQuery) derivedNode.unwrap();
		this.alias = alias;
		this.where = where;
	}

	public List<SelectItem> getItems() {
		return items;
	}

	/**
	 * @return the unquoted parts of the table name, or null when selecting from a derived table
	 */
	public List<String> getTableParts() {
		return tableParts;
	}

	public String getTableName() {
		return tableParts == null ? null : String.join(".", tableParts);
	}

	/**
	 * @return the table name exactly as written, with its quotes, or null for a derived table
	 */
	public String getTableText() {
		return tableText;
	}

	public SelectQuery getDerived() {
		return derived;
	}

	public String getAlias() {
		return alias;
	}

	public Expression getWhere() {
		return where;
	}

	@Override
	public Object evaluate(EvaluationContext context) {
		throw new ExpressionEvaluationException("A subquery is not a value: " + getSourceText());
	}

	public boolean hasAnyRow(EvaluationContext context) {
		for (FeatureRecord row : sourceRows(context)) {
			if (where == null || where.test(bind(context, row))) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the values of the first select item over all rows passing the WHERE clause
	 */
	public List<Object> selectFirstColumn(EvaluationContext context) {
		List<Object> values = new ArrayList<>();
		Expression first = items.get(0).expression();
		for (FeatureRecord row : sourceRows(context)) {
			EvaluationContext bound = bind(context, row);
			if (where == null || where.test(bound)) {
				values.add(first.evaluate(bound));
			}
		}
		return values;
	}

	/**
	 * Evaluates this query as a derived table. The resulting rows keep the id of their source row and take the
	 * first geometry valued item as their geometry.
	 */
	public List<FeatureRecord> materialize(EvaluationContext context) {
		List<FeatureRecord> rows = new ArrayList<>();
		for (FeatureRecord row : sourceRows(context)) {
			EvaluationContext bound = bind(context, row);
			if (where != null && !where.test(bound)) {
				continue;
			}
			Map<String, Object> values = new LinkedHashMap<>();
			Geometry geometry = null;
			for (SelectItem item : items) {
				Object value = item.expression().evaluate(bound);
				values.put(item.outputName(), value);
				if (geometry == null && value instanceof Geometry g) {
					geometry = g;
				}
			}
			rows.add(new FeatureRecord(row.getId(), geometry, values));
		}
		return rows;
	}

	private Iterable<FeatureRecord> sourceRows(EvaluationContext context) {
		if (derived != null) {
			return derived.materialize(context);
		}
		return context.getResolver().rows(getTableName());
	}

	private EvaluationContext bind(EvaluationContext context, FeatureRecord row) {
		List<String> names = new ArrayList<>(2);
		if (alias != null) {
			names.add(alias);
		}
		if (tableParts != null) {
			names.add(tableParts.get(tableParts.size() - 1));
		}
		return context.push(row, names);
	}

	@Override
	public List<Expression> children() {
		List<Expression> children = new ArrayList<>();
		for (SelectItem item : items) {
			children.add(item.expression());
		}
		if (derivedNode != null) {
			children.add(derivedNode);
		}
		if (where != null) {
			children.add(where);
		}
		return children;
	}
}
