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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Strings;

import solutions.a2.logminer.LogMinerSelector;
import solutions.a2.logminer.LogMinerSelector.SchemaSelector;
import solutions.a2.logminer.LogMinerSelector.TableSelector;

/**
 *
 * Whitelist parsing and V$LOGMNR_CONTENTS filtering for capture targets
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public class LogMinerSelectors {

	private static final Pattern COMMA = Pattern.compile(",");
	private static final Pattern DOT = Pattern.compile("\\.");
	private static final String SQL_OR = " or ";
	private static final String SEG_OWNER = "SEG_OWNER";
	private static final String TABLE_NAME = "TABLE_NAME";
	private static final String NOTHING_TO_MINE = "1=0";

	private LogMinerSelectors() {}

	/**
	 * Converts comma separated list of OWNER.TABLE and OWNER entries to capture targets.
	 * Order and duplicates are preserved, case is not changed.
	 * An empty string produces single {@link SchemaSelector} with empty owner.
	 *
	 * @param whitelist list from table.whitelist parameter
	 * @return selectors in order of appearance
	 */
	public static List<LogMinerSelector> resolve(final String whitelist) {
		Objects.requireNonNull(whitelist, "whitelist");
		final String[] segments = COMMA.split(whitelist, -1);
		final List<LogMinerSelector> selectors = new ArrayList<>(segments.length);
		for (final String segment : segments) {
			final String[] parts = DOT.split(strip(segment), -1);
			if (parts.length > 1) {
				selectors.add(new TableSelector(parts[0], parts[1]));
			} else {
				selectors.add(new SchemaSelector(parts[0]));
			}
		}
		return Collections.unmodifiableList(selectors);
	}

	public static boolean isInScope(final List<LogMinerSelector> selectors,
			final String owner, final String tableName) {
		for (final LogMinerSelector selector : selectors) {
			if (selector.matches(owner, tableName)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Builds predicate for V$LOGMNR_CONTENTS, i.e.
	 * (SEG_OWNER='SCOTT' and TABLE_NAME='DEPT') or (SEG_OWNER='AP')
	 *
	 * @param selectors capture targets
	 * @return SQL predicate without leading "where"/"and"
	 */
	public static String wherePredicate(final List<LogMinerSelector> selectors) {
		if (selectors.isEmpty()) {
			return NOTHING_TO_MINE;
		}
		final StringBuilder sb = new StringBuilder(512);
		for (int i = 0; i < selectors.size(); i++) {
			final LogMinerSelector selector = selectors.get(i);
			sb
				.append("(")
				.append(SEG_OWNER)
				.append("='")
				.append(quote(selector.owner()))
				.append("'");
			if (selector instanceof TableSelector table) {
				sb
					.append(" and ")
					.append(TABLE_NAME)
					.append("='")
					.append(quote(table.tableName()))
					.append("'");
			}
			sb.append(")");
			if (i < selectors.size() - 1) {
				sb.append(SQL_OR);
			}
		}
		return sb.toString();
	}

	/**
	 * Removes leading and trailing whitespace including Unicode space separators (U+00A0, U+3000, ...)
	 */
	static String strip(final String segment) {
		int start = 0;
		int end = segment.length();
		while (start < end && isSpace(segment.charAt(start))) {
			start++;
		}
		while (end > start && isSpace(segment.charAt(end - 1))) {
			end--;
		}
		return StringUtils.substring(segment, start, end);
	}

	private static boolean isSpace(final char ch) {
		return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
	}

	private static String quote(final String identifier) {
		return Strings.CS.replace(identifier, "'", "''");
	}

}
