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

import java.util.Objects;

/**
 *
 * Oracle thin driver connection parameters
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public record ConnectionParameters(
		String host,
		int port,
		String sid,
		String user,
		String password) {

	private static final String THIN_PREFIX = "jdbc:oracle:thin:@";

	public ConnectionParameters {
		Objects.requireNonNull(host, "host");
		Objects.requireNonNull(sid, "sid");
		Objects.requireNonNull(user, "user");
		Objects.requireNonNull(password, "password");
	}

	/**
	 * @return address in host:port:SID form
	 */
	public String dbUri() {
		return host + ":" + port + ":" + sid;
	}

	public String jdbcUrl() {
		return THIN_PREFIX + dbUri();
	}

	@Override
	public String toString() {
		return "ConnectionParameters[" + user + "@" + dbUri() + "]";
	}

}
