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

import java.time.Duration;

/**
 *
 * Bounded number of connection attempts with fixed wait between them.
 * maxAttempts includes the first attempt.
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public record RetryPolicy(int maxAttempts, Duration backoff) {

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException(
					"maxAttempts must be greater than or equal to 1, but was " + maxAttempts);
		}
		if (backoff == null || backoff.isNegative()) {
			throw new IllegalArgumentException(
					"backoff must be non-negative duration, but was " + backoff);
		}
	}

	public static RetryPolicy of(final int maxAttempts, final long backoffMs) {
		return new RetryPolicy(maxAttempts, Duration.ofMillis(backoffMs));
	}

}
