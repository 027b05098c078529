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

/**
 *
 * Opens database connection with bounded number of attempts and fixed backoff between them.
 * Runs on the calling thread, the backoff wait is blocking.
 * Every {@link SQLException} thrown by the {@link ConnectionOpener} is treated as retriable,
 * exhaustion is reported as {@link AcquisitionOutcome.Unavailable} and never thrown.
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public class ConnectionAcquirer {

	private final ConnectionOpener opener;
	private final Sleeper sleeper;
	private final AcquisitionListener listener;

	public ConnectionAcquirer() {
		this(new OracleConnectionOpener(), Sleeper.THREAD_SLEEP, new LoggingAcquisitionListener());
	}

	public ConnectionAcquirer(
			final ConnectionOpener opener, final Sleeper sleeper, final AcquisitionListener listener) {
		this.opener = Objects.requireNonNull(opener, "opener");
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
		this.listener = Objects.requireNonNull(listener, "listener");
	}

	public AcquisitionOutcome acquire(final ConnectionParameters params, final RetryPolicy policy) {
		Objects.requireNonNull(params, "params");
		Objects.requireNonNull(policy, "policy");
		final long started = System.currentTimeMillis();
		int attempt = 0;
		SQLException lastError = null;
		while (attempt < policy.maxAttempts()) {
			if (attempt > 0 && Thread.currentThread().isInterrupted()) {
				listener.interrupted(params, attempt);
				return new AcquisitionOutcome.Unavailable(attempt, lastError);
			}
			if (attempt > 0 && !policy.backoff().isZero()) {
				listener.backoff(params, attempt + 1, policy.backoff());
				try {
					sleeper.sleep(policy.backoff());
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					listener.interrupted(params, attempt);
					return new AcquisitionOutcome.Unavailable(attempt, lastError);
				}
			}
			attempt++;
			try {
				final Connection connection = opener.open(params);
				listener.connected(params, attempt, System.currentTimeMillis() - started);
				return new AcquisitionOutcome.Connected(connection, attempt);
			} catch (SQLException sqle) {
				lastError = sqle;
				listener.attemptFailed(params, attempt, sqle, attempt < policy.maxAttempts());
			}
		}
		listener.exhausted(params, attempt, System.currentTimeMillis() - started);
		return new AcquisitionOutcome.Unavailable(attempt, lastError);
	}

}
