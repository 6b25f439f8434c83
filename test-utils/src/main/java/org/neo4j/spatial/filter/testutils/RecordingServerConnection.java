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
package org.neo4j.spatial.filter.testutils;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.neo4j.spatial.filter.api.ServerConnection;

/**
 * Records every statement instead of executing it. Statements matching a failure rule throw an
 * {@link SQLException}.
 */
public class RecordingServerConnection implements ServerConnection {

	private final String backendId;
	private final List<String> statements = new ArrayList<>();
	private Predicate<String> failureRule = statement -> false;

	public RecordingServerConnection(String backendId) {
		this.backendId = backendId;
	}

	public RecordingServerConnection failWhen(Predicate<String> rule) {
		this.failureRule = rule;
		return this;
	}

	public RecordingServerConnection failOnPrefix(String prefix) {
		return failWhen(statement -> statement.startsWith(prefix));
	}

	public RecordingServerConnection succeedAlways() {
		return failWhen(statement -> false);
	}

	@Override
	public String getBackendId() {
		return backendId;
	}

	@Override
	public synchronized void execute(String statement) throws SQLException {
		statements.add(statement);
		if (failureRule.test(statement)) {
			throw new SQLException("Refused: " + statement);
		}
	}

	public synchronized List<String> getStatements() {
		return new ArrayList<>(statements);
	}

	public synchronized List<String> statementsStartingWith(String prefix) {
		List<String> matching = new ArrayList<>();
		for (String statement : statements) {
			if (statement.startsWith(prefix)) {
				matching.add(statement);
			}
		}
		return matching;
	}

	public synchronized void clear() {
		statements.clear();
	}
}
