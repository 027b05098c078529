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

import java.sql.SQLException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 *
 * Writes {@link ConnectionAcquirer} events to SLF4J, one line per event
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public class LoggingAcquisitionListener implements AcquisitionListener {

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingAcquisitionListener.class);

	@Override
	public void attemptFailed(final ConnectionParameters params, final int attempt,
			final SQLException error, final boolean willRetry) {
		LOGGER.error("Couldn't connect to database with url {} as {}. Attempt #{}. Error '{}', SQL Error Code = {}, SQL State = '{}'.",
				params.dbUri(), params.user(), attempt,
				error.getMessage(), error.getErrorCode(), error.getSQLState());
		if (!willRetry && LOGGER.isDebugEnabled()) {
			LOGGER.debug("Last connection error:", error);
		}
	}

	@Override
	public void backoff(final ConnectionParameters params, final int nextAttempt, final Duration backoff) {
		LOGGER.info("Waiting {} ms before attempt #{} to acquire a connection to {}",
				backoff.toMillis(), nextAttempt, params.dbUri());
	}

	@Override
	public void connected(final ConnectionParameters params, final int attempt, final long elapsedMs) {
		LOGGER.info("Connected to database at {} (attempt #{}, {} ms).",
				params.dbUri(), attempt, elapsedMs);
	}

	@Override
	public void exhausted(final ConnectionParameters params, final int attempts, final long elapsedMs) {
		LOGGER.error("Unable to connect to database at {} after {} attempts in {} ms.",
				params.dbUri(), attempts, elapsedMs);
	}

	@Override
	public void interrupted(final ConnectionParameters params, final int attempts) {
		LOGGER.warn("Interrupted while waiting to reconnect to {} after {} attempts.",
				params.dbUri(), attempts);
	}

}
