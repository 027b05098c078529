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

/**
 *
 * Connector parameter names, documentation and defaults
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public class LogMinerParameters {

	public static final String DB_NAME_PARAM = "db.name";
	public static final String DB_NAME_DOC = "Logical name of the database. This name will be used as a prefix for the topic. You can choose this name as you like.";

	public static final String DB_SID_PARAM = "db.sid";
	public static final String DB_SID_DOC = "Database SID";

	public static final String DB_HOST_PARAM = "db.hostname";
	public static final String DB_HOST_DOC = "Database hostname";

	public static final String DB_PORT_PARAM = "db.port";
	public static final String DB_PORT_DOC = "Database port (usually 1521)";

	public static final String DB_USERNAME_PARAM = "db.user";
	public static final String DB_USERNAME_DOC = "Database user";

	public static final String DB_PASSWORD_PARAM = "db.user.password";
	public static final String DB_PASSWORD_DOC = "Database password";

	public static final String DB_ATTEMPTS_PARAM = "db.attempts";
	public static final String DB_ATTEMPTS_DOC = "Maximum number of attempts to retrieve a valid JDBC connection. Default - 3";
	public static final int DB_ATTEMPTS_DEFAULT = 3;

	public static final String DB_BACKOFF_MS_PARAM = "db.backoff.ms";
	public static final String DB_BACKOFF_MS_DOC = "Backoff time in milliseconds between connection attempts. Default - 10000";
	public static final long DB_BACKOFF_MS_DEFAULT = 10_000L;

	public static final String DB_LOGMINER_DICTIONARY_PARAM = "db.logminer.dictionary";
	public static final String DB_LOGMINER_DICTIONARY_DOC = "Type of logminer dictionary that should be used. Valid values: ONLINE, REDO_LOG. Default - ONLINE";

	public static final String DB_TIMEZONE_PARAM = "db.timezone";
	public static final String DB_TIMEZONE_DOC = "The timezone in which TIMESTAMP columns (without any timezone information) should be interpreted as. " +
			"Valid values are all values that can be passed to java.time.ZoneId.of(String). Default - UTC";
	public static final String DB_TIMEZONE_DEFAULT = "UTC";

	public static final String MONITORED_TABLES_PARAM = "table.whitelist";
	public static final String MONITORED_TABLES_DOC = "Tables that should be monitored, separated by ','. Tables have to be specified with schema. " +
			"Table names are case-sensitive (e.g. if your table name is an unquoted identifier, you'll need to specify it in all caps). " +
			"You can also just specify a schema to indicate that all tables within that schema should be monitored. Examples: 'MY_USER.TABLE, OTHER_SCHEMA'.";

	public static final String DB_FETCH_SIZE_PARAM = "db.fetch.size";
	public static final String DB_FETCH_SIZE_DOC = "JDBC result set prefetch size. If not set, it will be defaulted to batch.size. " +
			"The fetch should not be smaller than the batch size.";

	public static final String START_SCN_PARAM = "start.scn";
	public static final String START_SCN_DOC = "Start SCN, if set to 0 an initial intake from the tables will be performed. Default - 0";
	public static final long START_SCN_DEFAULT = 0L;

	public static final String BATCH_SIZE_PARAM = "batch.size";
	public static final String BATCH_SIZE_DOC = "Batch size of rows that should be fetched in one batch. Default - 1000";
	public static final int BATCH_SIZE_DEFAULT = 1000;

	public static final String POLL_INTERVAL_MS_PARAM = "poll.interval.ms";
	public static final String POLL_INTERVAL_MS_DOC = "Positive integer value that specifies the number of milliseconds the connector should wait after a polling attempt didn't retrieve any results. Default - 2000";
	public static final long POLL_INTERVAL_MS_DEFAULT = 2_000L;

	public static final String TOMBSTONES_ON_DELETE_PARAM = "tombstones.on.delete";
	public static final String TOMBSTONES_ON_DELETE_DOC = "If set to false, no tombstone records will be emitted after a delete operation. Default - true";

}
