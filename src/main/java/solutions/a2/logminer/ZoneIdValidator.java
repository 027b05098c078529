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

import java.time.DateTimeException;
import java.time.ZoneId;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;

/**
 *
 * @author <a href="mailto:averemee@a2.solutions">Aleksei Veremeev</a>
 *
 */
public class ZoneIdValidator implements ConfigDef.Validator {

	@Override
	public void ensureValid(final String name, final Object value) {
		if (value == null) {
			throw new ConfigException(name, null, "Time zone identifier must be set");
		}
		try {
			ZoneId.of((String) value);
		} catch (DateTimeException dte) {
			throw new ConfigException(name, value, "Invalid time zone identifier: " + dte.getMessage());
		}
	}

	@Override
	public String toString() {
		return "Any value accepted by java.time.ZoneId.of(String)";
	}

}
