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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static solutions.a2.logminer.LogMinerParameters.*;

import java.time.Duration;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.kafka.common.config.ConfigException;
import org.junit.jupiter.api.Test;

import solutions.a2.logminer.LogMinerSelector.SchemaSelector;
import solutions.a2.logminer.LogMinerSelector.TableSelector;
import solutions.a2.logminer.jdbc.AcquisitionOutcome;
import solutions.a2.logminer.jdbc.ConnectionAcquirer;
import solutions.a2.logminer.jdbc.ConnectionParameters;
import solutions.a2.logminer.jdbc.FakeConnections;
import solutions.a2.logminer.jdbc.FakeConnections.RecordingListener;
import solutions.a2.logminer.jdbc.FakeConnections.RecordingSleeper;

/**
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public class LogMinerSourceConnectorConfigTest {

	private static Map<String, String> required() {
		final Map<String, String> props = new HashMap<>();
		props.put(DB_NAME_PARAM, "test-db");
		props.put(DB_SID_PARAM, "ORCL");
		props.put(DB_HOST_PARAM, "localhost");
		props.put(DB_PORT_PARAM, "1521");
		props.put(DB_USERNAME_PARAM, "LOGMINER");
		props.put(DB_PASSWORD_PARAM, "s3cr3t");
		return props;
	}

	@Test
	public void testDefaults() {
		final LogMinerSourceConnectorConfig config = new LogMinerSourceConnectorConfig(required());

		assertEquals("test-db", config.dbName());
		assertEquals(1000, config.batchSize());
		assertEquals(1000, config.dbFetchSize());
		assertEquals(0L, config.startScn());
		assertTrue(config.isInitialLoad());
		assertTrue(config.isTombstonesOnDelete());
		assertEquals(LogMinerDictionarySource.ONLINE, config.logMinerDictionarySource());
		assertEquals(ZoneId.of("UTC"), config.dbZoneId());
		assertEquals(3, config.dbAttempts());
		assertEquals(Duration.ofMillis(10_000), config.dbBackoff());
		assertEquals(Duration.ofMillis(2_000), config.pollInterval());
		assertEquals("", config.monitoredTables());
		assertEquals(List.of(new SchemaSelector("")), config.logMinerSelectors());
	}

	@Test
	public void testFetchSizeFollowsBatchSize() {
		final Map<String, String> props = required();
		props.put(BATCH_SIZE_PARAM, "250");
		assertEquals(250, new LogMinerSourceConnectorConfig(props).dbFetchSize());

		props.put(DB_FETCH_SIZE_PARAM, "5000");
		final LogMinerSourceConnectorConfig config = new LogMinerSourceConnectorConfig(props);
		assertEquals(5000, config.dbFetchSize());
		assertEquals(250, config.batchSize());
	}

	@Test
	public void testExplicitValues() {
		final Map<String, String> props = required();
		props.put(START_SCN_PARAM, "1234567890123");
		props.put(TOMBSTONES_ON_DELETE_PARAM, "false");
		props.put(DB_LOGMINER_DICTIONARY_PARAM, "REDO_LOG");
		props.put(DB_TIMEZONE_PARAM, "Europe/Ljubljana");
		props.put(DB_ATTEMPTS_PARAM, "5");
		props.put(DB_BACKOFF_MS_PARAM, "250");
		props.put(MONITORED_TABLES_PARAM, "SCOTT.DEPT, AP");

		final LogMinerSourceConnectorConfig config = new LogMinerSourceConnectorConfig(props);

		assertEquals(1234567890123L, config.startScn());
		assertFalse(config.isInitialLoad());
		assertFalse(config.isTombstonesOnDelete());
		assertEquals(LogMinerDictionarySource.REDO_LOG, config.logMinerDictionarySource());
		assertEquals(ZoneId.of("Europe/Ljubljana"), config.dbZoneId());
		assertEquals(5, config.retryPolicy().maxAttempts());
		assertEquals(Duration.ofMillis(250), config.retryPolicy().backoff());
		assertEquals(
				List.of(new TableSelector("SCOTT", "DEPT"), new SchemaSelector("AP")),
				config.logMinerSelectors());
		assertEquals(
				new ConnectionParameters("localhost", 1521, "ORCL", "LOGMINER", "s3cr3t"),
				config.connectionParameters());
	}

	@Test
	public void testInvalidConfiguration() {
		final Map<String, String> missingHost = required();
		missingHost.remove(DB_HOST_PARAM);
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(missingHost));

		final Map<String, String> badZone = required();
		badZone.put(DB_TIMEZONE_PARAM, "Mars/Olympus_Mons");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(badZone));

		final Map<String, String> badDictionary = required();
		badDictionary.put(DB_LOGMINER_DICTIONARY_PARAM, "online");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(badDictionary));

		final Map<String, String> noAttempts = required();
		noAttempts.put(DB_ATTEMPTS_PARAM, "0");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(noAttempts));

		final Map<String, String> negativeBackoff = required();
		negativeBackoff.put(DB_BACKOFF_MS_PARAM, "-1");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(negativeBackoff));

		final Map<String, String> portZero = required();
		portZero.put(DB_PORT_PARAM, "0");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(portZero));

		final Map<String, String> portTooBig = required();
		portTooBig.put(DB_PORT_PARAM, "65536");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(portTooBig));

		final Map<String, String> negativeScn = required();
		negativeScn.put(START_SCN_PARAM, "-1");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(negativeScn));

		final Map<String, String> negativePoll = required();
		negativePoll.put(POLL_INTERVAL_MS_PARAM, "-1");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(negativePoll));

		final Map<String, String> zeroFetch = required();
		zeroFetch.put(DB_FETCH_SIZE_PARAM, "0");
		assertThrows(ConfigException.class, () -> new LogMinerSourceConnectorConfig(zeroFetch));
	}

	@Test
	public void testPortBoundsAccepted() {
		final Map<String, String> props = required();
		props.put(DB_PORT_PARAM, "65535");
		assertEquals(65535, new LogMinerSourceConnectorConfig(props).dbPort());
		props.put(DB_PORT_PARAM, "1");
		assertEquals(1, new LogMinerSourceConnectorConfig(props).dbPort());
	}

	@Test
	public void testPasswordIsHidden() {
		final LogMinerSourceConnectorConfig config = new LogMinerSourceConnectorConfig(required());
		assertEquals("s3cr3t", config.dbPassword());
		assertFalse(config.values().toString().contains("s3cr3t"));
	}

	@Test
	public void testDictionarySourceNames() {
		for (LogMinerDictionarySource source : LogMinerDictionarySource.values()) {
			assertEquals(source, LogMinerDictionarySource.valueOf(source.name()));
		}
		assertEquals("ONLINE", LogMinerDictionarySource.ONLINE.name());
		assertEquals("REDO_LOG", LogMinerDictionarySource.REDO_LOG.name());
		assertEquals(2, LogMinerDictionarySource.values().length);
	}

	@Test
	public void testOpenConnectionUsesConfiguredPolicy() {
		final Map<String, String> props = required();
		props.put(DB_ATTEMPTS_PARAM, "2");
		props.put(DB_BACKOFF_MS_PARAM, "15");
		final LogMinerSourceConnectorConfig config = new LogMinerSourceConnectorConfig(props);

		final FakeConnections.FlakyOpener opener = new FakeConnections.FlakyOpener(1);
		final RecordingSleeper sleeper = new RecordingSleeper();
		final AcquisitionOutcome outcome = config.openConnection(
				new ConnectionAcquirer(opener, sleeper, new RecordingListener()));

		assertTrue(outcome.isConnected());
		assertEquals(2, outcome.attempts());
		assertEquals(List.of(Duration.ofMillis(15)), sleeper.sleeps());
	}

	@Test
	public void testDocumentation() {
		final String rst = LogMinerSourceConnectorConfig.conf().toEnrichedRst();
		assertTrue(rst.contains(MONITORED_TABLES_PARAM));
		assertTrue(rst.contains(DB_BACKOFF_MS_PARAM));
	}

}
