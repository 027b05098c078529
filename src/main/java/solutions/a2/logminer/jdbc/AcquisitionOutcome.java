/**
 * Copyright (c) 2018-present, A2 Rešitve d.o.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except in
 * compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License is
 * distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See
 * the License for the specific language governing permissions and limitations under the License.
 */

package solutions.a2.logminer.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 *
 * Result of {@link ConnectionAcquirer#acquire(ConnectionParameters, RetryPolicy)}.
 * A {@link Connected} outcome transfers ownership of the connection to the caller.
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public sealed interface AcquisitionOutcome permits AcquisitionOutcome.Connected, AcquisitionOutcome.Unavailable {

	/**
	 * @return number of attempts made, including the successful one
	 */
	int attempts();

	default boolean isConnected() {
		return this instanceof Connected;
	}

	default Optional<Connection> optionalConnection() {
		if (this instanceof Connected connected) {
			return Optional.of(connected.connection());
		} else {
			return Optional.empty();
		}
	}

	record Connected(Connection connection, int attempts) implements AcquisitionOutcome {
		public Connected {
			Objects.requireNonNull(connection, "connection");
		}
	}

	/**
	 * @param attempts  attempts made before giving up
	 * @param lastError error from the last attempt, null when no attempt failed with SQLException
	 */
	record Unavailable(int attempts, SQLException lastError) implements AcquisitionOutcome {}

}
