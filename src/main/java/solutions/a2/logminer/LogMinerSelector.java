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

import java.util.Objects;

import org.apache.commons.lang3.Strings;

/**
 *
 * Capture target for LogMiner: either a single table of an owner or all tables of an owner.
 * Owner and table names are case-sensitive and must match the case stored in the data dictionary.
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public sealed interface LogMinerSelector permits LogMinerSelector.TableSelector, LogMinerSelector.SchemaSelector {

	String owner();

	/**
	 * @param owner     SEG_OWNER of the mined row
	 * @param tableName TABLE_NAME of the mined row
	 * @return true when the row belongs to this capture target
	 */
	boolean matches(final String owner, final String tableName);

	record TableSelector(String owner, String tableName) implements LogMinerSelector {

		public TableSelector {
			Objects.requireNonNull(owner, "owner");
			Objects.requireNonNull(tableName, "tableName");
		}

		@Override
		public boolean matches(final String owner, final String tableName) {
			return Strings.CS.equals(this.owner, owner) &&
					Strings.CS.equals(this.tableName, tableName);
		}

		@Override
		public String toString() {
			return owner + "." + tableName;
		}
	}

	record SchemaSelector(String owner) implements LogMinerSelector {

		public SchemaSelector {
			Objects.requireNonNull(owner, "owner");
		}

		@Override
		public boolean matches(final String owner, final String tableName) {
			return Strings.CS.equals(this.owner, owner);
		}

		@Override
		public String toString() {
			return owner;
		}
	}

}
