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

/**
 *
 * Receives events of {@link ConnectionAcquirer}. Implementations must never output
 * {@link ConnectionParameters#password()}.
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public interface AcquisitionListener {

	/**
	 * @param params    connection target
	 * @param attempt   1-based number of failed attempt
	 * @param error     error from the driver
	 * @param willRetry true when another attempt follows
	 */
	void attemptFailed(final ConnectionParameters params, final int attempt,
			final SQLException error, final boolean willRetry);

	void backoff(final ConnectionParameters params, final int nextAttempt, final Duration backoff);

	void connected(final ConnectionParameters params, final int attempt, final long elapsedMs);

	void exhausted(final ConnectionParameters params, final int attempts, final long elapsedMs);

	void interrupted(final ConnectionParameters params, final int attempts);

}
