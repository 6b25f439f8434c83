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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.neo4j.spatial.filter.testutils.FeatureFixtures.record;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.neo4j.spatial.filter.api.FeatureRecord;

public class ExpressionEvaluationTest {

	private static final FeatureRecord ROW = record(7, "POINT (5 5)",
			attributes("category", "park", "population", 70L, "name", null));

	private static Map<String, Object> attributes(Object... pairs) {
		Map<String, Object> map = new HashMap<>();
		for (int i = 0; i < pairs.length; i += 2) {
			map.put((String) pairs[i], pairs[i + 1]);
		}
		return map;
	}

	private static Object eval(String text) throws ExpressionSyntaxException {
		return ExpressionParser.parse(text).evaluate(EvaluationContext.forRow(ROW, "features"));
	}

	@Test
	public void shouldCompareAttributes() throws ExpressionSyntaxException {
		assertThat(eval("category = 'park'"), equalTo(true));
		assertThat(eval("population >= 70 AND population < 71"), equalTo(true));
		assertThat(eval("population = '70'"), equalTo(true));
		assertThat(eval("fid IN (1, 7)"), equalTo(true));
		assertThat(eval("fid NOT IN (1, 7)"), equalTo(false));
		assertThat(eval("population BETWEEN 10 AND 60"), equalTo(false));
		assertThat(eval("category LIKE 'p_r%'"), equalTo(true));
		assertThat(eval("category ILIKE 'PARK'"), equalTo(true));
		assertThat(eval("features.category = 'park'"), equalTo(true));
	}

	@Test
	public void shouldApplyThreeValuedLogic() throws ExpressionSyntaxException {
		assertThat(eval("name = 'x'"), is(nullValue()));
		assertThat(eval("name = 'x' OR category = 'park'"), equalTo(true));
		assertThat(eval("name = 'x' AND category = 'park'"), is(nullValue()));
		assertThat(eval("name = 'x' AND category = 'water'"), equalTo(false));
		assertThat(eval("NOT (name = 'x')"), is(nullValue()));
		assertThat(eval("fid IN (1, NULL)"), is(nullValue()));
		assertThat(eval("name IS NULL"), equalTo(true));
		assertFalse(ExpressionParser.parse("name = 'x'").test(EvaluationContext.forRow(ROW)));
	}

	@Test
	public void shouldEvaluateSpatialFunctions() throws ExpressionSyntaxException {
		assertThat(eval("ST_Intersects(geom, ST_GeomFromText('POLYGON((0 0, 10 0, 10 10, 0 10, 0 0))'))"),
				equalTo(true));
		assertThat(eval("ST_Within(geom, ST_Buffer(ST_GeomFromText('POINT(0 0)'), 5))"), equalTo(false));
		assertThat(eval("ST_DWithin(geom, ST_GeomFromText('POINT(0 0)'), 7.1)"), equalTo(true));
		assertThat(eval("geom && ST_MakeEnvelope(4, 4, 6, 6)"), equalTo(true));
		assertThat(eval("MbrIntersects(geom, BuildMbr(6, 6, 8, 8))"), equalTo(false));
		assertThat(eval("Intersects(geom, GeomFromText('POINT(5 5)', 4326))"), equalTo(true));
		assertThat(eval("UPPER(category) = 'PARK'"), equalTo(true));
	}

	@Test
	public void shouldResolveSubqueriesThroughTheTableResolver() throws ExpressionSyntaxException {
		List<FeatureRecord> sources = List.of(
				record(1, "POLYGON ((0 0, 4 0, 4 4, 0 4, 0 0))", attributes("kind", "main")),
				record(2, "POLYGON ((4 4, 6 4, 6 6, 4 6, 4 4))", attributes("kind", "side")));
		TableResolver resolver = name -> {
			assertThat(name, equalTo("filter_temp.sources"));
			return sources;
		};
		EvaluationContext context = EvaluationContext.forRow(ROW, resolver, "features");

		assertTrue(ExpressionParser.parse("EXISTS (SELECT 1 FROM \"filter_temp\".\"sources\" AS s "
				+ "WHERE s.kind = 'side' AND ST_Intersects(features.geom, s.geom))").test(context));
		assertFalse(ExpressionParser.parse("EXISTS (SELECT 1 FROM filter_temp.sources AS s "
				+ "WHERE s.kind = 'main' AND ST_Intersects(features.geom, s.geom))").test(context));
		assertFalse(ExpressionParser.parse("fid IN (SELECT pk FROM filter_temp.sources)").test(context));
		assertTrue(ExpressionParser.parse("EXISTS (SELECT 1 FROM (SELECT ST_Buffer(geom, 2) AS geom_buffered "
				+ "FROM filter_temp.sources WHERE kind = 'main') AS __src "
				+ "WHERE ST_Intersects(features.geom, __src.geom_buffered))").test(context));
	}

	@Test
	public void shouldReportEvaluationErrors() {
		assertThrows(ExpressionEvaluationException.class, () -> eval("NoSuchFunction(geom)"));
		assertThrows(ExpressionEvaluationException.class, () -> eval("other.category = 'park'"));
		assertThrows(ExpressionEvaluationException.class, () -> eval("ST_Intersects(geom, 'NOT WKT')"));
		assertThrows(ExpressionEvaluationException.class,
				() -> eval("ST_Contains(ST_GeomFromText('GEOMETRYCOLLECTION(POINT(0 0), POINT(5 5))'), geom)"));
		assertThrows(ExpressionEvaluationException.class, () -> eval("EXISTS (SELECT 1 FROM t)"));
	}
}
