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

package solutions.a2.logminer.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.kafka.common.config.ConfigException;
import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import solutions.a2.logminer.LogMinerSelector;
import solutions.a2.logminer.LogMinerSourceConnectorConfig;
import solutions.a2.logminer.jdbc.AcquisitionOutcome;
import solutions.a2.logminer.jdbc.ConnectionAcquirer;

/**
 *
 * LogMiner connector setup check: resolves capture scope from connector properties
 * and tries to connect using configured db.attempts and db.backoff.ms.
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 */
public class LogMinerSetupCheck {

	private static final Logger LOGGER = LoggerFactory.getLogger(LogMinerSetupCheck.class);

	static final int EXIT_OK = 0;
	static final int EXIT_ERROR = 1;

	public static void main(String[] argv) {
		BasicConfigurator.configure();
		org.apache.log4j.Logger.getRootLogger().setLevel(Level.INFO);
		System.exit(run(argv, System.out, new ConnectionAcquirer()));
	}

	static int run(final String[] argv, final PrintStream out, final ConnectionAcquirer acquirer) {
		final Options options = new Options();
		setupCliOptions(options);

		final CommandLineParser parser = new DefaultParser();
		final HelpFormatter formatter = new HelpFormatter();
		final CommandLine cmd;
		try {
			cmd = parser.parse(options, argv);
		} catch (ParseException pe) {
			LOGGER.error(pe.getMessage());
			formatter.printHelp(LogMinerSetupCheck.class.getCanonicalName(), options);
			return EXIT_ERROR;
		}

		if (cmd.hasOption("doc")) {
			out.println(LogMinerSourceConnectorConfig.conf().toEnrichedRst());
			return EXIT_OK;
		}
		if (!cmd.hasOption("config")) {
			formatter.printHelp(LogMinerSetupCheck.class.getCanonicalName(), options);
			return EXIT_ERROR;
		}

		final LogMinerSourceConnectorConfig config;
		try {
			config = new LogMinerSourceConnectorConfig(loadProperties(Paths.get(cmd.getOptionValue("config"))));
		} catch (IOException ioe) {
			LOGGER.error("Unable to read connector properties from '{}'!", cmd.getOptionValue("config"), ioe);
			return EXIT_ERROR;
		} catch (ConfigException ce) {
			LOGGER.error(
					"""

					=====================
					Invalid connector configuration: {}
					=====================

					""", ce.getMessage());
			return EXIT_ERROR;
		}

		final List<LogMinerSelector> selectors = config.logMinerSelectors();
		out.println("Capture scope for " + config.dbName() + ":");
		selectors.forEach(s -> out.println("\t" +
				(s instanceof LogMinerSelector.TableSelector ? "TABLE  " : "SCHEMA ") + s));
		out.println("V$LOGMNR_CONTENTS predicate: " + LogMinerSelectors.wherePredicate(selectors));
		out.println("Dictionary: " + config.logMinerDictionarySource() +
				", time zone: " + config.dbZoneId() +
				", fetch size: " + config.dbFetchSize() +
				(config.isInitialLoad() ? ", initial load" : ", start SCN: " + config.startScn()));

		final AcquisitionOutcome outcome = config.openConnection(acquirer);
		if (outcome instanceof AcquisitionOutcome.Connected connected) {
			out.println("Connected to " + config.connectionParameters().dbUri() +
					" after " + connected.attempts() + " attempt(s).");
			try (Connection connection = connected.connection()) {
				LOGGER.debug("Closing connection {}", connection);
			} catch (SQLException sqle) {
				LOGGER.error("Error while closing connection to {}!",
						config.connectionParameters().dbUri(), sqle);
				return EXIT_ERROR;
			}
			return EXIT_OK;
		} else {
			out.println("Database " + config.connectionParameters().dbUri() +
					" is unavailable after " + outcome.attempts() + " attempt(s).");
			return EXIT_ERROR;
		}
	}

	static Properties loadProperties(final Path path) throws IOException {
		final Properties props = new Properties();
		try (InputStream is = Files.newInputStream(path)) {
			props.load(is);
		}
		return props;
	}

	private static void setupCliOptions(final Options options) {
		final Option config = new Option("c", "config", true,
				"Connector properties file");
		options.addOption(config);
		final Option doc = new Option("d", "doc", false,
				"Print connector parameters reference in reStructuredText format");
		options.addOption(doc);
	}

}
