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

package solutions.a2.logminer;

import static org.apache.kafka.common.config.ConfigDef.Importance.HIGH;
import static org.apache.kafka.common.config.ConfigDef.Importance.LOW;
import static org.apache.kafka.common.config.ConfigDef.Importance.MEDIUM;
import static org.apache.kafka.common.config.ConfigDef.Type.BOOLEAN;
import static org.apache.kafka.common.config.ConfigDef.Type.INT;
import static org.apache.kafka.common.config.ConfigDef.Type.LONG;
import static org.apache.kafka.common.config.ConfigDef.Type.PASSWORD;
import static org.apache.kafka.common.config.ConfigDef.Type.STRING;
import static solutions.a2.logminer.LogMinerParameters.*;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;

import solutions.a2.logminer.jdbc.AcquisitionOutcome;
import solutions.a2.logminer.jdbc.ConnectionAcquirer;
import solutions.a2.logminer.jdbc.ConnectionParameters;
import solutions.a2.logminer.jdbc.RetryPolicy;
import solutions.a2.logminer.utils.LogMinerSelectors;

/**
 *
 * LogMiner source connector configuration
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public class LogMinerSourceConnectorConfig extends AbstractConfig {

	private static final ConfigDef.Validator FETCH_SIZE_VALIDATOR = new ConfigDef.Validator() {
		@Override
		public void ensureValid(final String name, final Object value) {
			if (value != null && ((Integer) value) < 1) {
				throw new ConfigException(name, value, "Value must be at least 1");
			}
		}

		@Override
		public String toString() {
			return "[1,...] or not set";
		}
	};

	public static ConfigDef conf() {
		return new ConfigDef()
				.define(DB_NAME_PARAM, STRING, HIGH, DB_NAME_DOC)
				.define(DB_SID_PARAM, STRING, HIGH, DB_SID_DOC)
				.define(DB_HOST_PARAM, STRING, HIGH, DB_HOST_DOC)
				.define(DB_PORT_PARAM, INT, ConfigDef.NO_DEFAULT_VALUE,
						ConfigDef.Range.between(1, 65535), HIGH, DB_PORT_DOC)
				.define(DB_USERNAME_PARAM, STRING, HIGH, DB_USERNAME_DOC)
				.define(DB_PASSWORD_PARAM, PASSWORD, HIGH, DB_PASSWORD_DOC)
				.define(DB_LOGMINER_DICTIONARY_PARAM, STRING, LogMinerDictionarySource.ONLINE.name(),
						ConfigDef.ValidString.in(
								Arrays.stream(LogMinerDictionarySource.values())
									.map(Enum::name)
									.toArray(String[]::new)),
						LOW, DB_LOGMINER_DICTIONARY_DOC)
				.define(DB_TIMEZONE_PARAM, STRING, DB_TIMEZONE_DEFAULT,
						new ZoneIdValidator(), HIGH, DB_TIMEZONE_DOC)
				.define(MONITORED_TABLES_PARAM, STRING, "", HIGH, MONITORED_TABLES_DOC)
				.define(TOMBSTONES_ON_DELETE_PARAM, BOOLEAN, true, HIGH, TOMBSTONES_ON_DELETE_DOC)
				.define(BATCH_SIZE_PARAM, INT, BATCH_SIZE_DEFAULT,
						ConfigDef.Range.atLeast(1), HIGH, BATCH_SIZE_DOC)
				.define(DB_FETCH_SIZE_PARAM, INT, null,
						FETCH_SIZE_VALIDATOR, MEDIUM, DB_FETCH_SIZE_DOC)
				.define(START_SCN_PARAM, LONG, START_SCN_DEFAULT,
						ConfigDef.Range.atLeast(0), HIGH, START_SCN_DOC)
				.define(DB_ATTEMPTS_PARAM, INT, DB_ATTEMPTS_DEFAULT,
						ConfigDef.Range.atLeast(1), LOW, DB_ATTEMPTS_DOC)
				.define(DB_BACKOFF_MS_PARAM, LONG, DB_BACKOFF_MS_DEFAULT,
						ConfigDef.Range.atLeast(0), LOW, DB_BACKOFF_MS_DOC)
				.define(POLL_INTERVAL_MS_PARAM, LONG, POLL_INTERVAL_MS_DEFAULT,
						ConfigDef.Range.atLeast(0), LOW, POLL_INTERVAL_MS_DOC)
				;
	}

	public LogMinerSourceConnectorConfig(Map<?, ?> originals) {
		super(conf(), originals);
	}

	public String dbName() {
		return getString(DB_NAME_PARAM);
	}

	public String dbSid() {
		return getString(DB_SID_PARAM);
	}

	public String dbHostName() {
		return getString(DB_HOST_PARAM);
	}

	public int dbPort() {
		return getInt(DB_PORT_PARAM);
	}

	public String dbUser() {
		return getString(DB_USERNAME_PARAM);
	}

	public String dbPassword() {
		return getPassword(DB_PASSWORD_PARAM).value();
	}

	public ZoneId dbZoneId() {
		return ZoneId.of(getString(DB_TIMEZONE_PARAM));
	}

	public LogMinerDictionarySource logMinerDictionarySource() {
		return LogMinerDictionarySource.valueOf(getString(DB_LOGMINER_DICTIONARY_PARAM));
	}

	/**
	 * @return raw value of table.whitelist
	 */
	public String monitoredTables() {
		return StringUtils.trimToEmpty(getString(MONITORED_TABLES_PARAM));
	}

	public List<LogMinerSelector> logMinerSelectors() {
		return LogMinerSelectors.resolve(monitoredTables());
	}

	public int batchSize() {
		return getInt(BATCH_SIZE_PARAM);
	}

	/**
	 * @return db.fetch.size when set, batch.size otherwise
	 */
	public int dbFetchSize() {
		final Integer fetchSize = getInt(DB_FETCH_SIZE_PARAM);
		return fetchSize == null ? batchSize() : fetchSize;
	}

	public long startScn() {
		final Long startScn = getLong(START_SCN_PARAM);
		return startScn == null ? START_SCN_DEFAULT : startScn;
	}

	public boolean isInitialLoad() {
		return startScn() == 0L;
	}

	public Duration pollInterval() {
		return Duration.ofMillis(getLong(POLL_INTERVAL_MS_PARAM));
	}

	public Duration dbBackoff() {
		return Duration.ofMillis(getLong(DB_BACKOFF_MS_PARAM));
	}

	public int dbAttempts() {
		return getInt(DB_ATTEMPTS_PARAM);
	}

	public boolean isTombstonesOnDelete() {
		return getBoolean(TOMBSTONES_ON_DELETE_PARAM);
	}

	public ConnectionParameters connectionParameters() {
		return new ConnectionParameters(dbHostName(), dbPort(), dbSid(), dbUser(), dbPassword());
	}

	public RetryPolicy retryPolicy() {
		return new RetryPolicy(dbAttempts(), dbBackoff());
	}

	/**
	 * Opens connection using db.attempts and db.backoff.ms.
	 * The caller is responsible for closing the returned connection.
	 */
	public AcquisitionOutcome openConnection() {
		return openConnection(new ConnectionAcquirer());
	}

	public AcquisitionOutcome openConnection(final ConnectionAcquirer acquirer) {
		return acquirer.acquire(connectionParameters(), retryPolicy());
	}

}
